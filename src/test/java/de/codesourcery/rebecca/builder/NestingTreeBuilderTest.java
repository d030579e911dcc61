package de.codesourcery.rebecca.builder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang.StringUtils;

import de.codesourcery.rebecca.ast.Node;
import de.codesourcery.rebecca.ast.NodeStore;
import de.codesourcery.rebecca.ast.Tree;
import de.codesourcery.rebecca.lexer.Lexer;
import de.codesourcery.rebecca.lexer.ParseException;
import de.codesourcery.rebecca.lexer.Scanner;
import de.codesourcery.rebecca.lexer.TokenType;
import junit.framework.TestCase;

public class NestingTreeBuilderTest extends TestCase
{
	private NodeStore store;
	private Tree tree;

	@Override
	protected void setUp() throws Exception {
		store = new NodeStore();
	}

	@Override
	protected void tearDown() throws Exception {
		store.close();
	}

	public void testEmptySource()
	{
		build("");
		assertEquals( TokenType.PROGRAM , tree.getRoot().type() );
		assertEquals( 0 , tree.getRoot().getChildCount() );
		assertEquals( 1 , tree.size() );
	}

	public void testFlatTokensAreSiblings()
	{
		build("a = 1 ;");
		assertEquals( Arrays.asList( "a" , "=" , "1" , ";" ) , texts( tree.getRoot() ) );
		tree.verify();
	}

	public void testGroupsBecomeParents()
	{
		build("f ( x , [ y ] ) ;");
		final Node root = tree.getRoot();
		assertEquals( Arrays.asList( "f" , "(" , ";" ) , texts( root ) );

		final Node parens = root.child(1);
		assertEquals( Arrays.asList( "x" , "," , "[" , ")" ) , texts( parens ) );
		assertEquals( Arrays.asList( "y" , "]" ) , texts( parens.child(2) ) );

		assertEquals( tree.size() , tree.countReachableNodes() );
		assertEquals( 10 , tree.size() );
		tree.verify();
	}

	public void testUnbalancedCloser()
	{
		try {
			build("a )");
			fail("Should've failed");
		} catch(ParseException e) {
			assertEquals( 2 , e.offset );
		}
	}

	public void testMismatchedCloser()
	{
		try {
			build("( ]");
			fail("Should've failed");
		} catch(ParseException e) {
			assertEquals( 2 , e.offset );
		}
	}

	public void testUnclosedGroup()
	{
		try {
			build("{ a");
			fail("Should've failed");
		} catch(ParseException e) {
			assertEquals( 3 , e.offset );
		}
	}

	public void testDeeplyNestedGroups()
	{
		final int depth = 50000;
		build( StringUtils.repeat( "(" , depth )+StringUtils.repeat( ")" , depth ) );

		assertEquals( 2 * depth + 1 , tree.size() );
		assertEquals( tree.size() , tree.countReachableNodes() );
		tree.verify();

		final int[] depthFirstOrder = { 0 };
		tree.getRoot().visitDepthFirst( n -> depthFirstOrder[0]++ );
		assertEquals( tree.size() , depthFirstOrder[0] );
	}

	private void build(String source) {
		tree = new NestingTreeBuilder( store ).build( new Lexer( new Scanner( source ) ) );
	}

	private static List<String> texts(Node node)
	{
		final List<String> result = new ArrayList<>();
		for ( final Node child : node ) {
			result.add( child.text() );
		}
		return result;
	}
}
