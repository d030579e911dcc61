package de.codesourcery.rebecca.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.commons.lang.Validate;

import de.codesourcery.rebecca.lexer.Token;

/**
 * Maps character offsets of a source text to line and column numbers.
 */
public class SourceHelper
{
	/**
	 * 1-based line and column of a character offset.
	 */
	public static final class TextLocation
	{
		public final int line;
		public final int column;
		public final int offset;

		public TextLocation(int line,int column,int offset)
		{
			this.line = line;
			this.column = column;
			this.offset = offset;
		}

		@Override
		public boolean equals(Object obj)
		{
			if ( obj instanceof TextLocation )
			{
				final TextLocation other = (TextLocation) obj;
				return line == other.line && column == other.column && offset == other.offset;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash( Integer.valueOf( line ) , Integer.valueOf( column ) , Integer.valueOf( offset ) );
		}

		@Override
		public String toString() {
			return "line "+line+", column "+column;
		}
	}

	// index 0 holds the start of line 1
	private final List<Integer> lineStartOffsets = new ArrayList<>();

	private final String source;

	public SourceHelper(String source)
	{
		Validate.notNull(source, "source must not be NULL");
		this.source = source;
		lineStartOffsets.add( 0 );
		for ( int i = 0 , len = source.length() ; i < len ; i++ ) {
			if ( source.charAt( i ) == '\n' ) {
				lineStartOffsets.add( i + 1 );
			}
		}
	}

	public int getLineCount() {
		return lineStartOffsets.size();
	}

	/**
	 * @param lineNo 1-based line number
	 * @return starting offset or <code>null</code> if there is no such line
	 */
	public Integer getLineStartingOffset(int lineNo)
	{
		if ( lineNo < 1 || lineNo > lineStartOffsets.size() ) {
			return null;
		}
		return lineStartOffsets.get( lineNo - 1 );
	}

	public TextLocation getLocation(Token token)
	{
		return getLocation(token.offset);
	}

	/**
	 * @return location or <code>null</code> if the offset is negative or beyond the end of the source
	 */
	public TextLocation getLocation(final int offset)
	{
		if ( offset < 0 || offset > source.length() ) {
			return null;
		}
		int line = 0;
		while ( line + 1 < lineStartOffsets.size() && lineStartOffsets.get( line + 1 ) <= offset ) {
			line++;
		}
		final int column = offset - lineStartOffsets.get( line );
		return new TextLocation( line + 1 , column + 1 , offset ); // line and column numbers are 1-based
	}

	public String getLineText(int lineNo)
	{
		final Integer startingOffset = getLineStartingOffset( lineNo );
		if ( startingOffset == null ) {
			return null;
		}
		int end = startingOffset;
		while ( end < source.length() && source.charAt(end) != '\n' ) {
			end++;
		}
		if ( end > startingOffset && source.charAt( end - 1 ) == '\r' ) {
			end--;
		}
		return source.substring( startingOffset , end );
	}

	public String getLineText(TextLocation location) {
		return getLineText(location.line);
	}
}
