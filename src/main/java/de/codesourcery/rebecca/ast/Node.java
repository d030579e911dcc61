package de.codesourcery.rebecca.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;

import de.codesourcery.rebecca.lexer.GrammarRole;
import de.codesourcery.rebecca.lexer.Token;
import de.codesourcery.rebecca.lexer.TokenType;

/**
 * A syntax tree node living inside a {@link NodeStore}.
 *
 * <p>Parent and children are kept as node ids, never as direct references.
 * Nodes can only be created through {@link Tree#createNode(Token)} or {@link Tree#createNodeByType(TokenType)}
 * and only be linked through a {@link TreeEditor}.</p>
 *
 * @see NodeStore#close()
 */
public final class Node implements Iterable<Node>
{
	public static final int NO_NODE = -1;

	private final NodeStore store;
	private final int id;
	private final Token token;

	// id of the tree this node belongs to
	int owner;
	int parent = NO_NODE;
	// true once linked into its tree, either as root or as somebody's child
	boolean attached;
	// allocated on first child
	ChildArray children;

	Node(NodeStore store,int id,int owner,Token token)
	{
		this.store = store;
		this.id = id;
		this.owner = owner;
		this.token = token;
	}

	public int id() {
		return id;
	}

	public Token token() {
		store.assertOpen();
		return token;
	}

	public TokenType type() {
		return token().type;
	}

	public String text() {
		return token().text;
	}

	public GrammarRole role() {
		return token().role;
	}

	public NodeStore getStore() {
		return store;
	}

	public boolean isAttached() {
		store.assertOpen();
		return attached;
	}

	public boolean hasParent() {
		store.assertOpen();
		return parent != NO_NODE;
	}

	/**
	 * @return parent id or {@link #NO_NODE}
	 */
	public int parentId() {
		store.assertOpen();
		return parent;
	}

	/**
	 * @return parent node or <code>null</code>
	 */
	public Node getParent() {
		return hasParent() ? store.get( parent ) : null;
	}

	public int getChildCount() {
		store.assertOpen();
		return children == null ? 0 : children.size();
	}

	public boolean hasChildren() {
		return getChildCount() > 0;
	}

	public boolean hasNoChildren() {
		return getChildCount() == 0;
	}

	/**
	 * Returns the child at a given position in insertion order.
	 *
	 * @throws IndexOutOfBoundsException if <code>idx</code> is out of range
	 */
	public Node child(int idx)
	{
		store.assertOpen();
		if ( children == null ) {
			throw new IndexOutOfBoundsException("Node #"+id+" has no children, requested index "+idx);
		}
		return store.get( children.get( idx ) );
	}

	public int indexOf(Node child)
	{
		store.assertOpen();
		return children == null ? -1 : children.indexOf( child.id );
	}

	public List<Node> getChildren()
	{
		final int count = getChildCount();
		if ( count == 0 ) {
			return Collections.emptyList();
		}
		final List<Node> result = new ArrayList<>( count );
		for ( int i = 0 ; i < count ; i++ ) {
			result.add( store.get( children.get( i ) ) );
		}
		return result;
	}

	@Override
	public Iterator<Node> iterator() {
		return getChildren().iterator();
	}

	/**
	 * Visits this node and all its descendants, every node before its children.
	 *
	 * <p>Walks with an explicit stack, so arbitrarily deep trees are fine.</p>
	 */
	public void visitParentFirst(Consumer<Node> visitor)
	{
		final Deque<Node> stack = new ArrayDeque<>();
		stack.push( this );
		while ( ! stack.isEmpty() )
		{
			final Node node = stack.pop();
			visitor.accept( node );
			pushChildrenReversed( node , stack );
		}
	}

	/**
	 * Visits all descendants of this node and then the node itself, every node after its children.
	 */
	public void visitDepthFirst(Consumer<Node> visitor)
	{
		// node-last order is the reverse of a node-first walk that takes children right to left
		final Deque<Node> stack = new ArrayDeque<>();
		final Deque<Node> result = new ArrayDeque<>();
		stack.push( this );
		while ( ! stack.isEmpty() )
		{
			final Node node = stack.pop();
			result.push( node );
			for ( final Node child : node ) {
				stack.push( child );
			}
		}
		for ( final Node node : result ) {
			visitor.accept( node );
		}
	}

	static void pushChildrenReversed(Node node,Deque<Node> stack)
	{
		if ( node.hasChildren() )
		{
			final List<Node> children = node.getChildren();
			for ( int i = children.size() - 1 ; i >= 0 ; i-- ) {
				stack.push( children.get( i ) );
			}
		}
	}

	@Override
	public String toString() {
		return "#"+id+" "+token.type+" '"+token.text+"'";
	}
}
