package de.codesourcery.rebecca.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.apache.commons.lang.Validate;

import de.codesourcery.rebecca.ast.Node;
import de.codesourcery.rebecca.ast.Tree;
import de.codesourcery.rebecca.lexer.Token;

/**
 * Read-only traversal turning a tree into a {@link GraphDescription}.
 *
 * <p>Node records are emitted parent-first, edges are emitted in a second
 * parent-first pass, all edges of a node before descending into its children.</p>
 */
public class TreeVisualizer
{
	public GraphDescription describe(Tree tree)
	{
		Validate.notNull(tree, "tree must not be NULL");

		final List<NodeRecord> nodes = new ArrayList<>();
		final List<EdgeRecord> edges = new ArrayList<>();
		if ( tree.hasRoot() )
		{
			tree.visitParentFirst( n -> nodes.add( toRecord( n ) ) );
			connect( tree.getRoot() , edges );
		}
		return new GraphDescription( nodes , edges );
	}

	public static NodeRecord toRecord(Node node)
	{
		final Token token = node.token();
		final String secondary = token.hasCustomText() ? token.type.canonicalText() : null;
		return new NodeRecord( node.id() , NodeShape.of( token.type ) , NodeColor.of( token.role ) , token.text , secondary );
	}

	private static void connect(Node subtreeRoot,List<EdgeRecord> edges)
	{
		final Deque<Node> stack = new ArrayDeque<>();
		stack.push( subtreeRoot );
		while ( ! stack.isEmpty() )
		{
			final Node node = stack.pop();
			if ( node.hasNoChildren() ) {
				continue;
			}
			final List<Node> children = node.getChildren();
			for ( final Node child : children ) {
				edges.add( new EdgeRecord( node.id() , child.id() ) );
			}
			for ( int i = children.size() - 1 ; i >= 0 ; i-- ) {
				stack.push( children.get( i ) );
			}
		}
	}
}
