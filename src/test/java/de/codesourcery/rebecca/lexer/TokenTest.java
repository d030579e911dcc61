package de.codesourcery.rebecca.lexer;

import junit.framework.TestCase;

public class TokenTest extends TestCase
{
	public void testOfTypeUsesCanonicalText() {
		final Token token = Token.ofType( TokenType.LEFT_BRACE );
		assertEquals( "{" , token.text );
		assertEquals( GrammarRole.OTHER , token.role );
		assertFalse( token.hasCustomText() );
	}

	public void testCustomText() {
		assertTrue( new Token( TokenType.NAME , "foo" , 0 ).hasCustomText() );
		assertTrue( new Token( TokenType.RETURN , "return" , 0 ).hasCustomText() );
		assertFalse( new Token( TokenType.RETURN , "ret" , 0 ).hasCustomText() );
	}

	public void testWithRoleKeepsEverythingElse() {
		final Token token = new Token( TokenType.NUMBER , "7" , 3 , Integer.valueOf( 7 ) , GrammarRole.OTHER );
		final Token copy = token.withRole( GrammarRole.VAR_NAME );
		assertEquals( GrammarRole.VAR_NAME , copy.role );
		assertEquals( GrammarRole.OTHER , token.role );
		assertEquals( TokenType.NUMBER , copy.type );
		assertEquals( "7" , copy.text );
		assertEquals( 3 , copy.offset );
		assertEquals( 7 , copy.value() );
		assertFalse( token.equals( copy ) );
		assertEquals( token , copy.withRole( GrammarRole.OTHER ) );
	}

	public void testNullTextRejected() {
		try {
			new Token( TokenType.NAME , null , 0 );
			fail("Should've failed");
		} catch(IllegalArgumentException e) {
			// ok
		}
	}

	public void testKeywordLookup() {
		assertEquals( TokenType.RETURN , TokenType.getKeyword( "return" ) );
		assertEquals( TokenType.RETURN , TokenType.getKeyword( "ret" ) );
		assertEquals( TokenType.ELSE , TokenType.getKeyword( "_else" ) );
		assertNull( TokenType.getKeyword( "else" ) );
		assertNull( TokenType.getKeyword( "(" ) );
	}

	public void testOperatorsLongestFirst() {
		int previous = Integer.MAX_VALUE;
		for ( final TokenType t : TokenType.getOperators() ) {
			assertTrue( t.isOperator() );
			assertTrue( t.canonicalText().length() <= previous );
			previous = t.canonicalText().length();
		}
		assertEquals( TokenType.COMP , TokenType.getOperators().get(0) );
	}

	public void testClosingBracket() {
		assertEquals( TokenType.RIGHT_PARENTHESIS , TokenType.LEFT_PARENTHESIS.closingBracket() );
		assertEquals( TokenType.RIGHT_BRACKET , TokenType.LEFT_BRACKET.closingBracket() );
		assertEquals( TokenType.RIGHT_BRACE , TokenType.LEFT_BRACE.closingBracket() );
		try {
			TokenType.NAME.closingBracket();
			fail("Should've failed");
		} catch(UnsupportedOperationException e) {
			// ok
		}
	}
}
