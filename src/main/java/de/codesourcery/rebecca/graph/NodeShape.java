package de.codesourcery.rebecca.graph;

import de.codesourcery.rebecca.lexer.TokenType;

/**
 * Border shape of a node in a debug graph.
 */
public enum NodeShape
{
	NONE("none"),
	RECTANGLE("rectangle"),
	DIAMOND("diamond");

	public final String dotName;

	private NodeShape(String dotName) {
		this.dotName = dotName;
	}

	public static NodeShape of(TokenType type)
	{
		switch( type )
		{
			case COLON:
			case SEMICOLON:
			case DOUBLE_QUOTE:
			case SINGLE_QUOTE:
			case EOF:
			case EQ:
				return NONE;
			case NAME:
				return RECTANGLE;
			default:
				return DIAMOND;
		}
	}
}
