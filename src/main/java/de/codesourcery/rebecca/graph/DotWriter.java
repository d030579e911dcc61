package de.codesourcery.rebecca.graph;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

/**
 * Serializes a {@link GraphDescription} as Graphviz DOT text.
 */
public class DotWriter
{
	public String toDot(GraphDescription graph)
	{
		Validate.notNull(graph, "graph must not be NULL");

		final StringBuilder buffer = new StringBuilder();
		buffer.append("digraph G{\n");
		buffer.append("\tgraph [dpi=50];\n\n");
		for ( final NodeRecord node : graph.nodes ) {
			buffer.append( "\t" ).append( nodeName( node.id ) )
				.append( " [shape=" ).append( node.shape.dotName )
				.append( ", color=" ).append( node.color.dotName )
				.append( ", label=\"" ).append( label( node ) ).append( "\"];\n" );
		}
		buffer.append("\n");
		for ( final EdgeRecord edge : graph.edges ) {
			buffer.append( "\t" ).append( nodeName( edge.parentId ) ).append( " -> " ).append( nodeName( edge.childId ) ).append( "\n" );
		}
		buffer.append("}\n");
		return buffer.toString();
	}

	public void write(GraphDescription graph,File file) throws IOException
	{
		Validate.notNull(file, "file must not be NULL");
		FileUtils.writeStringToFile( file , toDot( graph ) , StandardCharsets.UTF_8 );
	}

	private static String nodeName(int id) {
		return "n"+id;
	}

	private static String label(NodeRecord node)
	{
		if ( node.hasSecondaryText() ) {
			return escape( node.text )+"\\n"+escape( node.secondaryText );
		}
		return escape( node.text );
	}

	static String escape(String s)
	{
		return StringUtils.replaceEach( s ,
				new String[] { "\\" , "\"" , "\n" } ,
				new String[] { "\\\\" , "\\\"" , "\\n" } );
	}
}
