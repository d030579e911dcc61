package de.codesourcery.rebecca.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import de.codesourcery.rebecca.lexer.Token;
import de.codesourcery.rebecca.lexer.TokenType;
import junit.framework.TestCase;

public class TreeEditorTest extends TestCase
{
	private NodeStore store;
	private Tree tree;
	private TreeEditor editor;

	@Override
	protected void setUp() throws Exception
	{
		store = new NodeStore();
		tree = Tree.create( store , TokenType.PROGRAM );
		editor = new TreeEditor( tree );
	}

	@Override
	protected void tearDown() throws Exception {
		store.close();
	}

	public void testCreateInstallsRootAsCursor()
	{
		final Node root = tree.getRoot();
		assertNotNull( root );
		assertEquals( TokenType.PROGRAM , root.type() );
		assertSame( root , editor.current() );
		assertFalse( root.hasParent() );
		assertEquals( 1 , tree.size() );
		tree.verify();
	}

	public void testCreateWithOwnStore()
	{
		final Tree standalone = Tree.create( TokenType.EOF );
		try
		{
			assertNotSame( store , standalone.getStore() );
			assertEquals( "EOF" , standalone.getRoot().text() );
			assertEquals( 0 , standalone.getRoot().id() );
		}
		finally {
			standalone.getStore().close();
		}
	}

	public void testFirstChildOfEmptyTreeBecomesRoot()
	{
		final Tree empty = Tree.empty( store );
		final TreeEditor e = new TreeEditor( empty );
		assertFalse( empty.hasRoot() );
		assertNull( e.current() );

		final Node a = empty.createNode( name("a") );
		assertSame( a , e.addChild( a ) );
		assertSame( a , empty.getRoot() );
		assertSame( a , e.current() );
		empty.verify();
	}

	public void testAddChildMovesCursorDown()
	{
		final Node b = node("b");
		assertSame( b , editor.addChild( b ) );
		assertSame( b , editor.current() );
		assertSame( tree.getRoot() , b.getParent() );

		final Node c = node("c");
		editor.addChild( c );
		assertSame( c , editor.current() );
		assertSame( b , c.getParent() );
		tree.verify();
	}

	public void testSiblingsViaParent()
	{
		final Node a = tree.getRoot();
		final Node b = node("b");
		editor.addChild( b );
		assertSame( a , editor.parent() );
		assertSame( a , editor.current() );
		final Node c = node("c");
		editor.addChild( c );
		assertSame( c , editor.current() );

		assertEquals( Arrays.asList( b , c ) , a.getChildren() );
		assertSame( b , editor.getChild( a , 0 ) );
		assertSame( c , editor.getChild( a , 1 ) );
		assertEquals( 3 , tree.size() );
		assertEquals( 3 , tree.countReachableNodes() );
		tree.verify();
	}

	public void testGetChildOutOfRange()
	{
		editor.addChild( node("b") );
		try {
			editor.getChild( tree.getRoot() , 1 );
			fail("Should've failed");
		} catch(IndexOutOfBoundsException e) {
			// ok
		}
		try {
			editor.getChild( editor.current() , 0 );
			fail("Should've failed");
		} catch(IndexOutOfBoundsException e) {
			// ok
		}
	}

	public void testParentOnRootFails()
	{
		try {
			editor.parent();
			fail("Should've failed");
		} catch(NoParentException e) {
			assertEquals( tree.getRoot().id() , e.nodeId );
		}
		assertSame( tree.getRoot() , editor.current() );
	}

	public void testNodeCountMatchesCreatedNodes()
	{
		// root, 3 children with 3 children each
		int created = 1;
		for ( int i = 0 ; i < 3 ; i++ )
		{
			editor.addChild( node("x"+i) );
			created++;
			for ( int j = 0 ; j < 3 ; j++ ) {
				editor.addChild( node("y"+j) );
				created++;
				editor.parent();
			}
			editor.parent();
		}
		assertEquals( created , tree.size() );
		assertEquals( created , tree.countReachableNodes() );
		assertSame( tree.getRoot() , editor.current() );
		tree.verify();
	}

	public void testAddChildRejectsAttachedNode()
	{
		final Node b = node("b");
		editor.addChild( b );
		editor.parent();
		try {
			editor.addChild( b );
			fail("Should've failed");
		} catch(IllegalArgumentException e) {
			// ok
		}
		try {
			editor.addChild( tree.getRoot() );
			fail("Should've failed");
		} catch(IllegalArgumentException e) {
			// ok
		}
		tree.verify();
	}

	public void testAddChildRejectsNodeOfOtherTree()
	{
		final Tree other = Tree.create( store , TokenType.PROGRAM );
		try {
			editor.addChild( other.createNode( name("foreign") ) );
			fail("Should've failed");
		} catch(IllegalArgumentException e) {
			// ok
		}
	}

	public void testAddChildRejectsNull()
	{
		try {
			editor.addChild( null );
			fail("Should've failed");
		} catch(IllegalArgumentException e) {
			// ok
		}
	}

	public void testInsertParentAboveLastChild()
	{
		final Node a = tree.getRoot();
		final Node b = node("b");
		editor.addChild( b );
		editor.parent();
		final Node c = node("c");
		editor.addChild( c );

		final Node p = node("p");
		assertSame( p , editor.insertParent( p ) );

		assertSame( p , editor.current() );
		assertEquals( Arrays.asList( b , p ) , a.getChildren() );
		assertEquals( Arrays.asList( c ) , p.getChildren() );
		assertSame( a , p.getParent() );
		assertSame( p , c.getParent() );
		assertEquals( 5 , tree.size() );
		tree.verify();
	}

	public void testInsertParentAboveRoot()
	{
		final Node a = tree.getRoot();
		editor.addChild( node("b") );
		editor.parent();

		final Node p = node("p");
		editor.insertParent( p );

		assertSame( p , tree.getRoot() );
		assertFalse( p.hasParent() );
		assertEquals( Arrays.asList( a ) , p.getChildren() );
		assertSame( p , a.getParent() );
		assertSame( p , editor.current() );
		tree.verify();
	}

	public void testInsertParentAboveFirstOfSeveralChildren()
	{
		final Node a = tree.getRoot();
		final Node b = node("b");
		final Node c = node("c");
		final Node d = node("d");
		editor.addChild( b );
		editor.parent();
		editor.addChild( c );
		editor.parent();
		editor.addChild( d );

		final Node p = node("p");
		editor.insertParent( b , p );

		assertEquals( Arrays.asList( p , c , d ) , a.getChildren() );
		assertEquals( Arrays.asList( b ) , p.getChildren() );
		assertSame( p , editor.current() );
		tree.verify();
	}

	public void testInsertParentKeepsSubtree()
	{
		final Node b = node("b");
		editor.addChild( b );
		final Node x = node("x");
		editor.addChild( x );
		editor.parent();

		editor.insertParent( node("p") );

		assertSame( b , x.getParent() );
		assertEquals( 1 , b.getChildCount() );
		tree.verify();
	}

	public void testInsertParentRejectsAttachedAncestor()
	{
		final Node b = node("b");
		editor.addChild( b );
		try {
			editor.insertParent( tree.getRoot() );
			fail("Should've failed");
		} catch(IllegalArgumentException e) {
			// ok
		}
		assertSame( b , editor.current() );
		assertEquals( Arrays.asList( b ) , tree.getRoot().getChildren() );
		tree.verify();
	}

	public void testInsertParentRejectsDetachedTarget()
	{
		final Node loose = node("loose");
		try {
			editor.insertParent( loose , node("p") );
			fail("Should've failed");
		} catch(IllegalArgumentException e) {
			// ok
		}
	}

	public void testMoveTo()
	{
		final Node b = node("b");
		editor.addChild( b );
		editor.addChild( node("c") );
		assertSame( b , editor.moveTo( b ) );
		assertSame( b , editor.current() );
		try {
			editor.moveTo( node("detached") );
			fail("Should've failed");
		} catch(IllegalArgumentException e) {
			// ok
		}
	}

	public void testIndependentCursors()
	{
		final TreeEditor second = new TreeEditor( tree );
		editor.addChild( node("b") );
		assertSame( tree.getRoot() , second.current() );
		second.addChild( node("c") );
		assertEquals( "b" , editor.current().text() );
		assertEquals( 2 , tree.getRoot().getChildCount() );
		tree.verify();
	}

	public void testVisitOrder()
	{
		editor.addChild( node("b") );
		editor.addChild( node("d") );
		editor.parent();
		editor.parent();
		editor.addChild( node("c") );

		final List<String> parentFirst = new ArrayList<>();
		tree.visitParentFirst( n -> parentFirst.add( n.text() ) );
		assertEquals( Arrays.asList( "PROGRAM" , "b" , "d" , "c" ) , parentFirst );

		final List<String> depthFirst = new ArrayList<>();
		tree.getRoot().visitDepthFirst( n -> depthFirst.add( n.text() ) );
		assertEquals( Arrays.asList( "d" , "b" , "c" , "PROGRAM" ) , depthFirst );
	}

	public void testVerifyAcceptsPendingDetachedNodes()
	{
		node("pending");
		assertEquals( 2 , tree.size() );
		assertEquals( 1 , tree.countReachableNodes() );
		tree.verify();
	}

	public void testEditorFailsAfterStoreClosed()
	{
		store.close();
		try {
			editor.current();
			fail("Should've failed");
		} catch(IllegalStateException e) {
			// ok
		}
	}

	private Node node(String text) {
		return tree.createNode( name( text ) );
	}

	private static Token name(String text) {
		return new Token( TokenType.NAME , text , 0 );
	}
}
