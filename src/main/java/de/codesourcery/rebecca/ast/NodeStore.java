package de.codesourcery.rebecca.ast;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.rebecca.lexer.Token;

/**
 * Arena holding all nodes of one or more trees.
 *
 * <p>Node ids are handed out sequentially starting at 0 and double as the node's
 * index in this store, ids are never reused. Trees that want to exchange subtrees
 * must share a store.</p>
 *
 * <p>Closing the store releases all nodes at once, every later access
 * through a node, tree or editor fails with an {@link IllegalStateException}.</p>
 */
public final class NodeStore implements AutoCloseable
{
	private static final Logger LOG = LoggerFactory.getLogger(NodeStore.class);

	private final List<Node> nodes = new ArrayList<>();

	private int nextTreeId;
	private boolean closed;

	Node create(Tree owner,Token token)
	{
		assertOpen();
		Validate.notNull(token, "token must not be NULL");
		Validate.notNull(token.text, "token text must not be NULL");

		final Node node = new Node( this , nodes.size() , owner.id() , token );
		nodes.add( node );
		return node;
	}

	int newTreeId() {
		assertOpen();
		return nextTreeId++;
	}

	/**
	 * Looks up a node by id.
	 *
	 * @throws IllegalArgumentException if no node with this id exists
	 */
	public Node get(int id)
	{
		assertOpen();
		if ( id < 0 || id >= nodes.size() ) {
			throw new IllegalArgumentException("Unknown node id: "+id);
		}
		return nodes.get( id );
	}

	/**
	 * Returns the number of nodes allocated so far, across all trees.
	 */
	public int size() {
		assertOpen();
		return nodes.size();
	}

	List<Node> nodes() {
		assertOpen();
		return nodes;
	}

	public boolean isClosed() {
		return closed;
	}

	void assertOpen() {
		if ( closed ) {
			throw new IllegalStateException("Node store has already been closed");
		}
	}

	@Override
	public void close()
	{
		if ( closed ) {
			return;
		}
		LOG.debug("Releasing {} nodes", nodes.size());
		for ( final Node n : nodes ) {
			n.children = null;
		}
		nodes.clear();
		closed = true;
	}
}
