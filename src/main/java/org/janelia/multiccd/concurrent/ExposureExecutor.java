package org.janelia.multiccd.concurrent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;

/**
 * Runs independent per-exposure tasks on a fixed thread pool.
 * Every exposure is processed as a whole by one worker; a failure of one exposure is captured in its outcome
 * and does not affect the others.
 */
public class ExposureExecutor implements AutoCloseable
{
	private static final Logger LOG = Logger.getLogger( ExposureExecutor.class );

	@FunctionalInterface
	public interface ExposureTask< R >
	{
		R process( String exposureId ) throws Exception;
	}

	private final ExecutorService threadPool;
	private final int numThreads;

	public ExposureExecutor()
	{
		// reserve one thread for the OS
		this( Math.max( Runtime.getRuntime().availableProcessors() - 1, 1 ) );
	}

	public ExposureExecutor( final int numThreads )
	{
		this( Executors.newFixedThreadPool( numThreads ), numThreads );
	}

	public ExposureExecutor( final ExecutorService threadPool, final int numThreads )
	{
		this.threadPool = threadPool;
		this.numThreads = numThreads;
	}

	@Override
	public void close()
	{
		threadPool.shutdown();
	}

	public int getNumThreads()
	{
		return numThreads;
	}

	/**
	 * Processes all exposures and returns their outcomes in the order of {@code exposureIds}.
	 *
	 * @throws InterruptedException if interrupted while waiting for the workers, in which case the outstanding exposures are cancelled
	 */
	public < R > List< ExposureOutcome< R > > run( final List< String > exposureIds, final ExposureTask< R > task ) throws InterruptedException
	{
		final List< Future< R > > futures = new ArrayList<>();
		for ( final String exposureId : exposureIds )
			futures.add( threadPool.submit( () -> task.process( exposureId ) ) );

		final List< ExposureOutcome< R > > outcomes = new ArrayList<>();
		try
		{
			for ( int i = 0; i < futures.size(); ++i )
			{
				final String exposureId = exposureIds.get( i );
				try
				{
					outcomes.add( ExposureOutcome.success( exposureId, futures.get( i ).get() ) );
				}
				catch ( final ExecutionException e )
				{
					LOG.error( "Exposure " + exposureId + " failed: " + e.getCause().getMessage(), e.getCause() );
					outcomes.add( ExposureOutcome.failure( exposureId, e.getCause() ) );
				}
			}
		}
		finally
		{
			// stop the exposures nobody is waiting for anymore
			if ( outcomes.size() != futures.size() )
				for ( final Future< R > future : futures )
					future.cancel( true );
		}
		return outcomes;
	}
}
