package org.janelia.multiccd.shape;

import org.apache.log4j.Logger;

/**
 * Receives every observation removed by the {@link OutlierRejector}.
 */
@FunctionalInterface
public interface OutlierReporter
{
	void report( RejectedObservation rejected );

	static OutlierReporter logging( final Logger logger )
	{
		return rejected -> logger.info( rejected.toString() );
	}
}
