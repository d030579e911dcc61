package de.codesourcery.rebecca;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Callable;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.rebecca.ast.NodeStore;
import de.codesourcery.rebecca.ast.Tree;
import de.codesourcery.rebecca.builder.NestingTreeBuilder;
import de.codesourcery.rebecca.graph.DotWriter;
import de.codesourcery.rebecca.graph.GraphDescription;
import de.codesourcery.rebecca.graph.GraphvizRenderer;
import de.codesourcery.rebecca.graph.TreeVisualizer;
import de.codesourcery.rebecca.lexer.Lexer;
import de.codesourcery.rebecca.lexer.ParseException;
import de.codesourcery.rebecca.lexer.Scanner;
import de.codesourcery.rebecca.lexer.Token;
import de.codesourcery.rebecca.utils.SourceHelper;
import de.codesourcery.rebecca.utils.SourceHelper.TextLocation;
import picocli.CommandLine;

@CommandLine.Command(
	name = "rebecca",
	description = "Tokenizes a Rebecca source file and writes its syntax tree as a Graphviz graph",
	version = "1.0",
	mixinStandardHelpOptions = true)
public final class Main implements Callable<Integer>
{
	private static final Logger LOG = LoggerFactory.getLogger(Main.class);

	public static final int EXIT_OK = 0;
	public static final int EXIT_SYNTAX_ERROR = 1;
	public static final int EXIT_IO_ERROR = 2;

	@CommandLine.Parameters(index = "0", description = "Source file to process")
	private File source;

	@CommandLine.Option(names = {"-t", "--tokens"}, description = "Log the token stream")
	private boolean printTokens;

	@CommandLine.Option(names = "--dot", description = "Write the syntax tree as DOT to this file")
	private File dotFile;

	@CommandLine.Option(names = "--png", description = "Render the syntax tree to this PNG file (needs Graphviz)")
	private File pngFile;

	@CommandLine.Option(names = "--dot-executable", description = "Graphviz executable to use, default: ${DEFAULT-VALUE}")
	private String dotExecutable = GraphvizRenderer.DEFAULT_EXECUTABLE;

	public static void main(String[] args)
	{
		final int exitCode = new CommandLine( new Main() ).execute( args );
		System.exit( exitCode );
	}

	@Override
	public Integer call()
	{
		final String text;
		try {
			text = FileUtils.readFileToString( source , StandardCharsets.UTF_8 );
		}
		catch(IOException e) {
			LOG.error("Failed to read "+source, e);
			return EXIT_IO_ERROR;
		}

		try ( NodeStore store = new NodeStore() )
		{
			if ( printTokens ) {
				logTokens( new Lexer( new Scanner( text ) ).tokenize() );
			}

			final Tree tree = new NestingTreeBuilder( store ).build( new Lexer( new Scanner( text ) ) );
			LOG.info("Built syntax tree with {} nodes from {}", tree.size(), source);

			File dot = dotFile;
			if ( dot == null && pngFile != null ) {
				dot = new File( pngFile.getParentFile() , FilenameUtils.getBaseName( pngFile.getName() )+".dot" );
			}
			if ( dot != null )
			{
				final GraphDescription graph = new TreeVisualizer().describe( tree );
				new DotWriter().write( graph , dot );
				LOG.info("Wrote {} to {}", graph, dot);
				if ( pngFile != null ) {
					new GraphvizRenderer( dotExecutable ).render( dot , pngFile , "png" );
				}
			}
			return EXIT_OK;
		}
		catch(ParseException e)
		{
			reportError( text , e );
			return EXIT_SYNTAX_ERROR;
		}
		catch(IOException e)
		{
			LOG.error("I/O error: "+e.getMessage(), e);
			return EXIT_IO_ERROR;
		}
	}

	private static void logTokens(List<Token> tokens)
	{
		LOG.info("Output of tokenizer:");
		for ( int i = 0 ; i < tokens.size() ; i++ ) {
			LOG.info( formatToken( i , tokens.get( i ) ) );
		}
	}

	static String formatToken(int index,Token tok) {
		return "t("+index+")|"+tok.text+" -- "+tok.type.canonicalText();
	}

	private void reportError(String text,ParseException e)
	{
		final SourceHelper helper = new SourceHelper( text );
		final TextLocation location = helper.getLocation( e.offset );
		if ( location == null ) {
			LOG.error("{}: {}", source, e.getMessage());
			return;
		}
		LOG.error("{}: {} at {}", source, e.getMessage(), location);
		LOG.error(helper.getLineText( location ));
		LOG.error(StringUtils.repeat(" ", location.column - 1 )+"^");
	}
}
