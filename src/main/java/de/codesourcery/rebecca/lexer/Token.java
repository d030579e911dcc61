package de.codesourcery.rebecca.lexer;

import java.util.Objects;

public final class Token {

	public final TokenType type;
	public final String text;
	public final int offset;
	private final Integer value;
	public final GrammarRole role;

	public Token(TokenType type, String text, int offset)
	{
		this(type,text,offset,null,GrammarRole.OTHER);
	}

	public Token(TokenType type, String text, int offset, Integer value, GrammarRole role)
	{
		if ( type == null ) {
			throw new IllegalArgumentException("type must not be NULL");
		}
		if ( text == null ) {
			throw new IllegalArgumentException("text must not be NULL");
		}
		if ( role == null ) {
			throw new IllegalArgumentException("role must not be NULL");
		}
		this.type = type;
		this.text = text;
		this.offset = offset;
		this.value = value;
		this.role = role;
	}

	/**
	 * Creates a token that is spelled the canonical way and does not originate from source.
	 */
	public static Token ofType(TokenType type) {
		return new Token( type , type.canonicalText() , -1 );
	}

	public boolean hasType(TokenType t) {
		return t.equals( this.type );
	}

	public boolean hasValue() {
		return value != null;
	}

	/**
	 * Returns the literal value.
	 *
	 * @throws IllegalStateException if this token carries no literal value
	 */
	public int value()
	{
		if ( value == null ) {
			throw new IllegalStateException("Token has no literal value: "+this);
		}
		return value.intValue();
	}

	/**
	 * Returns whether this token's text differs from its category's canonical spelling.
	 */
	public boolean hasCustomText() {
		return ! text.equals( type.canonicalText() );
	}

	public Token withRole(GrammarRole newRole) {
		return new Token( type , text , offset , value , newRole );
	}

	@Override
	public boolean equals(Object obj)
	{
		if ( obj instanceof Token )
		{
			final Token other = (Token) obj;
			return type == other.type && offset == other.offset && role == other.role &&
					text.equals( other.text ) && Objects.equals( value , other.value );
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash( type , text , Integer.valueOf( offset ) , value , role );
	}

	@Override
	public String toString() {
		return "Token[ "+type+" , text: >"+text+"< , offset: "+offset+( value != null ? " , value: "+value : "" )+" ]";
	}
}
