package de.codesourcery.rebecca.lexer;

import org.apache.commons.lang.Validate;

/**
 * Character cursor over a Rebecca source text.
 */
public final class Scanner {

	private final String source;
	private int offset;

	public Scanner(String source) {
		Validate.notNull(source, "source must not be NULL");
		this.source = source;
	}

	public boolean eof() {
		return offset >= source.length();
	}

	public int currentOffset() {
		return offset;
	}

	public char peek() {
		if ( eof() ) {
			throw new IllegalStateException("Already at EOF");
		}
		return source.charAt(offset);
	}

	public char next() {
		final char c = peek();
		offset++;
		return c;
	}

	/**
	 * Returns whether the remaining input starts with the given text.
	 */
	public boolean lookingAt(String text) {
		return source.startsWith( text , offset );
	}

	/**
	 * Consumes the given text.
	 *
	 * @throws IllegalStateException if the remaining input does not start with <code>text</code>
	 */
	public void consume(String text)
	{
		if ( ! lookingAt( text ) ) {
			throw new IllegalStateException("Expected '"+text+"' at offset "+offset);
		}
		offset += text.length();
	}
}
