package de.codesourcery.rebecca.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of a tree as node and edge records, ready
 * to be serialized for an external graph renderer.
 */
public final class GraphDescription
{
	public final List<NodeRecord> nodes;
	public final List<EdgeRecord> edges;

	public GraphDescription(List<NodeRecord> nodes, List<EdgeRecord> edges)
	{
		this.nodes = Collections.unmodifiableList( new ArrayList<>( nodes ) );
		this.edges = Collections.unmodifiableList( new ArrayList<>( edges ) );
	}

	@Override
	public String toString() {
		return "GraphDescription[ "+nodes.size()+" nodes , "+edges.size()+" edges ]";
	}
}
