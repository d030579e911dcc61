package de.codesourcery.rebecca.lexer;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Lexer {

	private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

	/**
	 * Maximum length of a single word in characters.
	 */
	public static final int MAX_TOKEN_LENGTH = 256;

	private static final String SPLIT_SYMBOLS = "()[]{}:;.,*/\\%#+-<>|^~?!='\"";

	private final Scanner scanner;

	private final List<Token> tokens = new ArrayList<>();

	private final StringBuilder buffer = new StringBuilder();

	private boolean eof;

	public Lexer(Scanner scanner) {
		Validate.notNull(scanner, "scanner must not be NULL");
		this.scanner = scanner;
	}

	public int currentOffset() {
		if ( eof() ) {
			return scanner.currentOffset();
		}
		return tokens.get(0).offset;
	}

	public boolean eof()
	{
		if ( ! tokens.isEmpty() ) {
			return false;
		}
		if ( eof ) {
			return true;
		}
		parse();
		return tokens.isEmpty();
	}

	public Token peek()
	{
		if ( eof() ) {
			throw new IllegalStateException("Already at EOF");
		}
		return tokens.get(0);
	}

	public boolean peek(TokenType expected)
	{
		if ( eof() ) {
			return false;
		}
		return tokens.get(0).hasType(expected);
	}

	public Token next()
	{
		if ( eof() ) {
			throw new IllegalStateException("Already at EOF");
		}
		return tokens.remove(0);
	}

	public Token next(TokenType expected)
	{
		if ( ! peek().hasType( expected ) ) {
			throw new ParseException("Expected token type "+expected+" but got "+peek(), currentOffset() );
		}
		return next();
	}

	/**
	 * Consumes all remaining tokens, the trailing EOF token included.
	 */
	public List<Token> tokenize()
	{
		final List<Token> result = new ArrayList<>();
		while ( ! eof() ) {
			result.add( next() );
		}
		return result;
	}

	private void parse()
	{
		// consume whitespace
		while( ! scanner.eof() && isWhitespace( scanner.peek() ) ) {
			scanner.next();
		}

		buffer.setLength(0);
		final int start = scanner.currentOffset();
		while( ! scanner.eof() )
		{
			final char c = scanner.peek();
			if ( isWhitespace( c ) ) {
				break;
			}
			if ( SPLIT_SYMBOLS.indexOf( c ) != -1 )
			{
				if ( buffer.length() == 0 ) {
					parseOperator();
					return;
				}
				break;
			}
			if ( buffer.length() == MAX_TOKEN_LENGTH ) {
				throw new ParseException("Token exceeds maximum length of "+MAX_TOKEN_LENGTH+" characters", start );
			}
			buffer.append( scanner.next() );
		}

		parseBuffer(start);

		if ( scanner.eof() && tokens.isEmpty() )
		{
			eof = true;
			addToken( new Token( TokenType.EOF , TokenType.EOF.canonicalText() , scanner.currentOffset() ) );
		}
	}

	private void parseOperator()
	{
		final int start = scanner.currentOffset();
		for ( final TokenType candidate : TokenType.getOperators() )
		{
			final String spelling = candidate.canonicalText();
			if ( scanner.lookingAt( spelling ) )
			{
				scanner.consume( spelling );
				addToken( new Token( candidate , spelling , start ) );
				return;
			}
		}
		throw new ParseException("Unrecognized character '"+scanner.peek()+"'", start );
	}

	private void parseBuffer(int bufferStartOffset) {

		final String s = buffer.toString();
		if ( s.length() == 0 ) {
			return;
		}
		boolean isNumber = true;
		for ( int i = 0 , len = s.length() ; i < len ; i++ ) {
			if ( ! Character.isDigit( s.charAt(i) ) )
			{
				isNumber = false;
				break;
			}
		}
		if ( isNumber )
		{
			final int value;
			try {
				value = Integer.parseInt( s );
			}
			catch(NumberFormatException e) {
				throw new ParseException("Number out of range: "+s, bufferStartOffset , e );
			}
			addToken( new Token( TokenType.NUMBER , s , bufferStartOffset , Integer.valueOf( value ) , GrammarRole.OTHER ) );
			return;
		}
		final TokenType keyword = TokenType.getKeyword( s );
		addToken( new Token( keyword != null ? keyword : TokenType.NAME , s , bufferStartOffset ) );
	}

	private static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r';
	}

	private void addToken(Token token)
	{
		if ( LOG.isTraceEnabled() ) {
			LOG.trace("Lexed {}", token);
		}
		this.tokens.add( token );
	}

	@Override
	public String toString()
	{
		return tokens.isEmpty() ? "<no token>" : tokens.get(0).toString();
	}

	public void push(Token tok) {
		if (tok == null) {
			throw new IllegalArgumentException("token must not be NULL");
		}
		tokens.add( 0 , tok );
	}
}
