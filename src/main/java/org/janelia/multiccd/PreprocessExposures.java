package org.janelia.multiccd;

import java.nio.file.Paths;
import java.util.List;

import org.apache.log4j.Logger;
import org.janelia.multiccd.catalog.ExposureDataset;
import org.janelia.multiccd.concurrent.ExposureOutcome;
import org.janelia.multiccd.shape.OutlierRejectionResult;

/**
 * Preprocesses every exposure found in a folder of tile catalogs and logs per-exposure star counts.
 */
public class PreprocessExposures
{
	private static final Logger LOG = Logger.getLogger( PreprocessExposures.class );

	public static void main( final String[] args ) throws Exception
	{
		final PreprocessingArguments parsedArgs = new PreprocessingArguments( args );
		if ( !parsedArgs.parsedSuccessfully() )
			throw new IllegalArgumentException( "argument format mismatch" );

		final ExposurePreprocessor preprocessor = new ExposurePreprocessor( parsedArgs.toParameters() );
		final List< String > exposureIds = preprocessor.batchFolder( Paths.get( parsedArgs.inputFolder() ), parsedArgs.pattern() );
		LOG.info( "Found " + exposureIds.size() + " exposures in " + parsedArgs.inputFolder() );

		int failed = 0;
		for ( final ExposureOutcome< OutlierRejectionResult > outcome : preprocessor.processAll( parsedArgs.numThreads() ) )
		{
			if ( !outcome.isSuccessful() )
			{
				++failed;
				continue;
			}

			final ExposureDataset dataset = outcome.getResult().getCleanDataset();
			LOG.info( String.format( "Exposure %s: %d tiles, %d stars kept, %d outliers removed",
					outcome.getExposureId(),
					dataset.numTiles(),
					dataset.numObservations(),
					outcome.getResult().getRejected().size() ) );
		}

		if ( failed != 0 )
			LOG.warn( failed + " out of " + exposureIds.size() + " exposures could not be processed" );
	}
}
