package de.codesourcery.rebecca.graph;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders DOT files by invoking the Graphviz <code>dot</code> executable.
 */
public class GraphvizRenderer
{
	private static final Logger LOG = LoggerFactory.getLogger(GraphvizRenderer.class);

	public static final String DEFAULT_EXECUTABLE = "dot";

	private final String executable;

	public GraphvizRenderer() {
		this(DEFAULT_EXECUTABLE);
	}

	public GraphvizRenderer(String executable)
	{
		Validate.isTrue( StringUtils.isNotBlank( executable ) , "executable must not be blank");
		this.executable = executable;
	}

	/**
	 * Renders a DOT file.
	 *
	 * @param format Graphviz output format, for example <code>png</code>
	 * @throws IOException if the executable cannot be started or reports a failure
	 */
	public void render(File dotFile,File outputFile,String format) throws IOException
	{
		Validate.notNull(dotFile, "dotFile must not be NULL");
		Validate.notNull(outputFile, "outputFile must not be NULL");
		Validate.isTrue( StringUtils.isAlphanumeric( format ) && StringUtils.isNotEmpty( format ) , "invalid format: "+format);

		final ProcessBuilder builder = new ProcessBuilder( executable , "-T"+format , dotFile.getAbsolutePath() , "-o" , outputFile.getAbsolutePath() );
		builder.redirectErrorStream( true );

		LOG.debug("Running {}", builder.command());
		final Process process = builder.start();
		final String output = IOUtils.toString( process.getInputStream() , StandardCharsets.UTF_8 );
		final int exitCode;
		try {
			exitCode = process.waitFor();
		}
		catch(InterruptedException e) {
			Thread.currentThread().interrupt();
			process.destroy();
			throw new IOException("Interrupted while waiting for "+executable, e);
		}
		if ( exitCode != 0 ) {
			throw new IOException(executable+" failed with exit code "+exitCode+": "+output.trim());
		}
		LOG.info("Rendered {} to {}", dotFile, outputFile);
	}
}
