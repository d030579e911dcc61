package de.codesourcery.rebecca.lexer;

/**
 * Syntactic role of a token inside a grammar description,
 * only used to color debug graphs.
 */
public enum GrammarRole
{
	VAR_NAME,
	RULE_NAME,
	RULE_NAME_REFERENCE,
	VAR_NAME_REFERENCE,
	OTHER;
}
