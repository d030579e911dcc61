package de.codesourcery.rebecca.lexer;

import junit.framework.TestCase;

public class ScannerTest extends TestCase
{
	public void testEmptyInput()
	{
		final Scanner scanner = new Scanner( "" );
		assertTrue( scanner.eof() );
		assertEquals( 0 , scanner.currentOffset() );
		try {
			scanner.peek();
			fail("Should've failed");
		} catch(IllegalStateException e) {
			// ok
		}
	}

	public void testNextAdvances()
	{
		final Scanner scanner = new Scanner( "ab" );
		assertEquals( 'a' , scanner.peek() );
		assertEquals( 'a' , scanner.next() );
		assertEquals( 1 , scanner.currentOffset() );
		assertEquals( 'b' , scanner.next() );
		assertTrue( scanner.eof() );
	}

	public void testLookingAt()
	{
		final Scanner scanner = new Scanner( "x==y" );
		assertFalse( scanner.lookingAt( "==" ) );
		scanner.next();
		assertTrue( scanner.lookingAt( "=" ) );
		assertTrue( scanner.lookingAt( "==" ) );
		assertFalse( scanner.lookingAt( "==y!" ) );
	}

	public void testConsume()
	{
		final Scanner scanner = new Scanner( "<=>" );
		scanner.consume( "<=" );
		assertEquals( 2 , scanner.currentOffset() );
		try {
			scanner.consume( ">>" );
			fail("Should've failed");
		} catch(IllegalStateException e) {
			// ok
		}
		assertEquals( 2 , scanner.currentOffset() );
		scanner.consume( ">" );
		assertTrue( scanner.eof() );
	}
}
