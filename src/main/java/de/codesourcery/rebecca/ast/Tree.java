package de.codesourcery.rebecca.ast;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.function.Consumer;

import org.apache.commons.lang.Validate;

import de.codesourcery.rebecca.lexer.Token;
import de.codesourcery.rebecca.lexer.TokenType;

/**
 * Ownership record of a syntax tree.
 *
 * <p>A tree knows its root and how many nodes it owns. It has no cursor,
 * all structural edits go through a {@link TreeEditor}.</p>
 */
public final class Tree
{
	private final NodeStore store;
	private final int id;

	private int root = Node.NO_NODE;
	private int size;

	private Tree(NodeStore store)
	{
		Validate.notNull(store, "store must not be NULL");
		this.store = store;
		this.id = store.newTreeId();
	}

	/**
	 * Creates a tree without any nodes, the first node added
	 * through a {@link TreeEditor} becomes the root.
	 */
	public static Tree empty(NodeStore store) {
		return new Tree( store );
	}

	/**
	 * Creates a tree with a root node of the given type.
	 */
	public static Tree create(NodeStore store,TokenType rootType)
	{
		final Tree tree = new Tree( store );
		new TreeEditor( tree ).addChild( tree.createNodeByType( rootType ) );
		return tree;
	}

	/**
	 * Creates a tree with a root node of the given type, backed by a new store.
	 */
	public static Tree create(TokenType rootType) {
		return create( new NodeStore() , rootType );
	}

	/**
	 * Creates a detached node for this tree, spelled the canonical way for its type.
	 */
	public Node createNodeByType(TokenType type)
	{
		Validate.notNull(type, "type must not be NULL");
		return createNode( Token.ofType( type ) );
	}

	/**
	 * Creates a detached node for this tree wrapping the given token.
	 */
	public Node createNode(Token token)
	{
		final Node node = store.create( this , token );
		size++;
		return node;
	}

	int id() {
		return id;
	}

	public NodeStore getStore() {
		return store;
	}

	public boolean hasRoot() {
		store.assertOpen();
		return root != Node.NO_NODE;
	}

	/**
	 * @return root node or <code>null</code> if this tree is still empty
	 */
	public Node getRoot() {
		return hasRoot() ? store.get( root ) : null;
	}

	void setRoot(Node node) {
		this.root = node.id();
	}

	/**
	 * Returns the number of nodes this tree owns, including
	 * nodes that have been created but not linked yet.
	 */
	public int size() {
		store.assertOpen();
		return size;
	}

	void adjustSize(int delta) {
		this.size += delta;
	}

	public boolean owns(Node node) {
		store.assertOpen();
		return node.getStore() == store && node.owner == id;
	}

	public Node getChild(Node node,int index)
	{
		Validate.notNull(node, "node must not be NULL");
		Validate.isTrue( owns( node ) , "node is not part of this tree: "+node );
		return node.child( index );
	}

	public void visitParentFirst(Consumer<Node> visitor)
	{
		Validate.notNull(visitor, "visitor must not be NULL");
		if ( hasRoot() ) {
			getRoot().visitParentFirst( visitor );
		}
	}

	public int countReachableNodes()
	{
		final int[] count = { 0 };
		visitParentFirst( n -> count[0]++ );
		return count[0];
	}

	/**
	 * Checks the structural invariants of this tree.
	 *
	 * @throws TreeException describing the first violation found
	 */
	public void verify()
	{
		store.assertOpen();
		final BitSet reachable = new BitSet();
		if ( hasRoot() )
		{
			final Node rootNode = getRoot();
			if ( rootNode.hasParent() ) {
				throw new TreeException("Root "+rootNode+" has a parent");
			}
			verify( rootNode , reachable );
		}

		int owned = 0;
		for ( final Node n : store.nodes() )
		{
			if ( n.owner != id ) {
				if ( reachable.get( n.id() ) ) {
					throw new TreeException("Reachable node "+n+" is owned by another tree");
				}
				continue;
			}
			owned++;
			if ( n.attached && ! reachable.get( n.id() ) ) {
				throw new TreeException("Node "+n+" is attached but not reachable from the root");
			}
			if ( ! n.attached && reachable.get( n.id() ) ) {
				throw new TreeException("Node "+n+" is reachable but not marked as attached");
			}
		}
		if ( owned != size ) {
			throw new TreeException("Tree owns "+owned+" nodes but its size is "+size);
		}
	}

	private static void verify(Node subtreeRoot,BitSet reachable)
	{
		final Deque<Node> stack = new ArrayDeque<>();
		stack.push( subtreeRoot );
		while ( ! stack.isEmpty() )
		{
			final Node node = stack.pop();
			if ( reachable.get( node.id() ) ) {
				throw new TreeException("Node "+node+" is reachable more than once");
			}
			reachable.set( node.id() );
			for ( final Node child : node )
			{
				if ( child.parentId() != node.id() ) {
					throw new TreeException("Child "+child+" of "+node+" has parent #"+child.parentId());
				}
			}
			Node.pushChildrenReversed( node , stack );
		}
	}

	@Override
	public String toString() {
		return "Tree[ root: "+( root == Node.NO_NODE ? "<none>" : "#"+root )+" , size: "+size+" ]";
	}
}
