package de.codesourcery.rebecca.lexer;

public class ParseException extends RuntimeException {

	public final int offset;

	public ParseException(String message,Token token)
	{
		this( message , token.offset );
	}

	public ParseException(String message,int offset)
	{
		this(message,offset,null);
	}

	public ParseException(String message,int offset,Throwable t)
	{
		super(message,t);
		this.offset = offset;
	}
}
