package org.janelia.multiccd;

import java.io.IOException;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Command line arguments parser for preprocessing a folder of tile catalogs.
 */
public class PreprocessingArguments implements Serializable
{
	private static final long serialVersionUID = -4325318426471830772L;

	@Option(name = "-i", aliases = { "--input" }, required = true,
			usage = "Path to the folder containing tile catalogs named as <pattern><sep><exposureId><sep><tileId>.json")
	private String inputFolder;

	@Option(name = "-p", aliases = { "--pattern" }, required = false,
			usage = "Glob pattern of the catalog file names within the input folder")
	private String pattern = "*.json";

	@Option(name = "-c", aliases = { "--config" }, required = false,
			usage = "Path to a JSON file with preprocessing parameters. Command line values take precedence.")
	private String configPath = null;

	@Option(name = "-s", aliases = { "--sigma" }, required = false,
			usage = "Outlier rejection threshold in terms of standard deviations of the star shapes")
	private Double outlierSigma = null;

	@Option(name = "--separator", required = false,
			usage = "String separating the pattern, exposure id and tile id in the catalog file names")
	private String separator = null;

	@Option(name = "--maskThreshold", required = false,
			usage = "Stamp values below this threshold are considered masked")
	private Double maskThreshold = null;

	@Option(name = "-d", aliases = { "--degree" }, required = false,
			usage = "Maximum degree of the global polynomial position model")
	private Integer polynomialDegree = null;

	@Option(name = "-t", aliases = { "--threads" }, required = false,
			usage = "Number of exposures processed in parallel")
	private int numThreads = 1;

	private boolean parsedSuccessfully = false;

	public PreprocessingArguments( final String... args )
	{
		final CmdLineParser parser = new CmdLineParser( this );
		try
		{
			parser.parseArgument( args );
			parsedSuccessfully = true;
		}
		catch ( final CmdLineException e )
		{
			System.err.println( e.getMessage() );
			parser.printUsage( System.err );
		}

		if ( parsedSuccessfully && numThreads < 1 )
			throw new IllegalArgumentException( "Number of threads should be positive, got " + numThreads );
	}

	public boolean parsedSuccessfully() { return parsedSuccessfully; }

	public String inputFolder() { return inputFolder; }
	public String pattern() { return pattern; }
	public String configPath() { return configPath; }
	public int numThreads() { return numThreads; }

	/**
	 * Loads the configuration file if specified, and overrides it with the values given on the command line.
	 */
	public PreprocessingParameters toParameters() throws IOException
	{
		final PreprocessingParameters parameters;
		if ( configPath != null )
			parameters = PreprocessingParametersJSONProvider.loadParameters( Files.newBufferedReader( Paths.get( configPath ), StandardCharsets.UTF_8 ) );
		else
			parameters = new PreprocessingParameters();

		if ( outlierSigma != null )
			parameters.setOutlierSigma( outlierSigma );
		if ( separator != null )
			parameters.setSeparator( separator );
		if ( maskThreshold != null )
			parameters.setMaskThreshold( maskThreshold );
		if ( polynomialDegree != null )
			parameters.setPolynomialDegree( polynomialDegree );

		return parameters;
	}
}
