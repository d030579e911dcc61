package de.codesourcery.rebecca.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Logically different token categories.
 *
 * <p>Every category carries its canonical spelling, the text a node
 * gets when it is created from a category alone.</p>
 *
 * <p>Note that for example '|' and '||' are different categories with different meanings.</p>
 */
public enum TokenType
{
	UNKNOWN("UNKNOWN"),
	// single character tokens
	LEFT_PARENTHESIS("("),
	RIGHT_PARENTHESIS(")"),
	LEFT_BRACKET("["),
	RIGHT_BRACKET("]"),
	LEFT_BRACE("{"),
	RIGHT_BRACE("}"),
	COLON(":"),
	SEMICOLON(";"),
	DOT("."),
	COMMA(","),
	STAR("*"),
	SLASH("/"),
	BACK_SLASH("\\"),
	PERCENT("%"),
	HASHTAG("#"),
	PLUS("+"),
	MINUS("-"),
	PIPE("|"),
	CARET("^"),
	TILDE("~"),
	QUESTION("?"),
	EXCLAMATION("!"),
	EQ("="),
	L("<"),
	G(">"),
	SINGLE_QUOTE("'"),
	DOUBLE_QUOTE("\""),
	// multi-character operators
	PLUSPLUS("++"),
	PIPEPIPE("||"),
	LL("<<"),
	GG(">>"),
	LEQ("<="),
	GEQ(">="),
	EQEQ("=="),
	EXCLAMATION_EQ("!="),
	COMP("<=>"),
	// keywords
	BREAK("break"),
	CONTINUE("continue"),
	CLASS("class"),
	STRUCT("struct"),
	ELSE("_else"),
	FALSE("false"),
	CYCLE("cycle"),
	IF("if"),
	LOAD("load"),
	NULL("null"),
	RETURN("ret"),
	STATIC("static"),
	THIS("this"),
	TRUE("true"),
	PRIVATE("private"),
	PUBLIC("public"),
	UNDERLINE("_"),
	// multi-character tokens
	NAME("NAME"),
	NUMBER("NUMBER"),
	EOF("EOF"),
	// never produced by the lexer, used for roots created by a driver
	PROGRAM("PROGRAM");

	private static final Map<String,TokenType> KEYWORDS;
	private static final List<TokenType> OPERATORS;

	static
	{
		final Map<String,TokenType> keywords = new HashMap<>();
		for ( final TokenType t : values() ) {
			if ( t.isKeyword() ) {
				keywords.put( t.canonicalText , t );
			}
		}
		keywords.put( "return" , RETURN );
		KEYWORDS = Collections.unmodifiableMap( keywords );

		final List<TokenType> operators = new ArrayList<>();
		for ( final TokenType t : values() ) {
			if ( t.isOperator() ) {
				operators.add( t );
			}
		}
		// longest match first
		operators.sort( Comparator.comparingInt( (TokenType t) -> t.canonicalText.length() ).reversed() );
		OPERATORS = Collections.unmodifiableList( operators );
	}

	private final String canonicalText;

	private TokenType(String canonicalText) {
		this.canonicalText = canonicalText;
	}

	public String canonicalText() {
		return canonicalText;
	}

	public boolean isKeyword() {
		return ordinal() >= BREAK.ordinal() && ordinal() <= UNDERLINE.ordinal();
	}

	/**
	 * Returns whether this is a punctuation or operator category,
	 * quotes included.
	 */
	public boolean isOperator() {
		return ordinal() >= LEFT_PARENTHESIS.ordinal() && ordinal() <= COMP.ordinal();
	}

	public boolean isOpeningBracket() {
		return this == LEFT_PARENTHESIS || this == LEFT_BRACKET || this == LEFT_BRACE;
	}

	public boolean isClosingBracket() {
		return this == RIGHT_PARENTHESIS || this == RIGHT_BRACKET || this == RIGHT_BRACE;
	}

	/**
	 * Returns the closing counterpart of an opening bracket.
	 *
	 * @throws UnsupportedOperationException if this is no opening bracket
	 */
	public TokenType closingBracket()
	{
		switch( this )
		{
			case LEFT_PARENTHESIS: return RIGHT_PARENTHESIS;
			case LEFT_BRACKET:     return RIGHT_BRACKET;
			case LEFT_BRACE:       return RIGHT_BRACE;
			default:
				throw new UnsupportedOperationException("Not an opening bracket: "+this);
		}
	}

	/**
	 * Looks up the keyword spelled by a word.
	 *
	 * @return keyword category or <code>null</code>
	 */
	public static TokenType getKeyword(String word) {
		return KEYWORDS.get( word );
	}

	/**
	 * Operator and punctuation categories, longest spelling first.
	 */
	public static List<TokenType> getOperators() {
		return OPERATORS;
	}
}
