package de.codesourcery.rebecca.graph;

import de.codesourcery.rebecca.lexer.GrammarRole;

/**
 * Color of a node in a debug graph, derived from the token's grammar role.
 */
public enum NodeColor
{
	YELLOW("yellow"),
	CYAN("cyan"),
	RED("red"),
	GREEN("green"),
	BLACK("black");

	public final String dotName;

	private NodeColor(String dotName) {
		this.dotName = dotName;
	}

	public static NodeColor of(GrammarRole role)
	{
		switch( role )
		{
			case VAR_NAME:            return YELLOW;
			case RULE_NAME:           return CYAN;
			case RULE_NAME_REFERENCE: return RED;
			case VAR_NAME_REFERENCE:  return GREEN;
			default:
				return BLACK;
		}
	}
}
