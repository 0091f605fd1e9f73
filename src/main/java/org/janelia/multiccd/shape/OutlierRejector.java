package org.janelia.multiccd.shape;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;
import org.janelia.multiccd.catalog.ExposureDataset;
import org.janelia.multiccd.catalog.MaskBuilder;
import org.janelia.multiccd.catalog.Observation;
import org.janelia.multiccd.catalog.TileObservations;

import net.imglib2.util.RealSum;

/**
 * Removes stars with aberrant shapes from an exposure.
 *
 * Shapes (g1, g2, R2) of all stars of the exposure are measured, and a star is an outlier if for any of the three quantities
 * {@code |q| > mean(q) + sigma * std(q)}. The statistics are computed once over the whole exposure, before anything is removed.
 */
public class OutlierRejector
{
	private static final Logger LOG = Logger.getLogger( OutlierRejector.class );

	public static final double DEFAULT_SIGMA = 5;

	private static final int NUM_QUANTITIES = 3;

	private final ShapeMeasurer shapeMeasurer;
	private final OutlierReporter reporter;

	public OutlierRejector( final ShapeMeasurer shapeMeasurer )
	{
		this( shapeMeasurer, OutlierReporter.logging( LOG ) );
	}

	public OutlierRejector( final ShapeMeasurer shapeMeasurer, final OutlierReporter reporter )
	{
		this.shapeMeasurer = shapeMeasurer;
		this.reporter = reporter;
	}

	public OutlierRejectionResult reject( final ExposureDataset dataset )
	{
		return reject( dataset, DEFAULT_SIGMA );
	}

	public OutlierRejectionResult reject( final ExposureDataset dataset, final double sigma )
	{
		final List< TileObservations > tiles = dataset.getTiles();

		final List< ShapeMeasurement > shapes = new ArrayList<>();
		for ( final TileObservations tile : tiles )
			for ( final Observation observation : tile.getObservations() )
				shapes.add( shapeMeasurer.measureShape( observation.getStamp(), MaskBuilder.invert( observation.getMask() ) ) );

		final double[] thresholds = computeThresholds( shapes, sigma );

		final List< boolean[] > eraseMasks = new ArrayList<>();
		final List< RejectedObservation > rejected = new ArrayList<>();
		int globalIndex = 0;
		for ( int tileIndex = 0; tileIndex < tiles.size(); ++tileIndex )
		{
			final TileObservations tile = tiles.get( tileIndex );
			final boolean[] eraseMask = new boolean[ tile.size() ];
			for ( int i = 0; i < tile.size(); ++i, ++globalIndex )
			{
				final ShapeMeasurement shape = shapes.get( globalIndex );
				if ( isOutlier( shape, thresholds ) )
				{
					eraseMask[ i ] = true;
					rejected.add( new RejectedObservation( globalIndex, i, tileIndex, tile.getTileId(), shape ) );
				}
			}
			eraseMasks.add( eraseMask );
		}

		LOG.info( "Exposure " + dataset.getExposureId() + ": " + rejected.size() + " outliers out of " + shapes.size() + " stars" );
		for ( final RejectedObservation rejectedObservation : rejected )
			report( rejectedObservation );

		if ( rejected.isEmpty() )
			return new OutlierRejectionResult( dataset, rejected, eraseMasks, thresholds );

		final List< TileObservations > keptTiles = new ArrayList<>();
		for ( int tileIndex = 0; tileIndex < tiles.size(); ++tileIndex )
		{
			final boolean[] eraseMask = eraseMasks.get( tileIndex );
			final boolean[] keep = new boolean[ eraseMask.length ];
			for ( int i = 0; i < keep.length; ++i )
				keep[ i ] = !eraseMask[ i ];
			keptTiles.add( tiles.get( tileIndex ).filter( keep ) );
		}

		return new OutlierRejectionResult( dataset.withTiles( keptTiles ), rejected, eraseMasks, thresholds );
	}

	/**
	 * @return {@code mean + sigma * std} for g1, g2 and R2 (population standard deviation)
	 */
	static double[] computeThresholds( final List< ShapeMeasurement > shapes, final double sigma )
	{
		final double[] thresholds = new double[ NUM_QUANTITIES ];
		if ( shapes.isEmpty() )
		{
			Arrays.fill( thresholds, Double.POSITIVE_INFINITY );
			return thresholds;
		}

		final double[][] quantities = new double[ shapes.size() ][];
		for ( int i = 0; i < quantities.length; ++i )
			quantities[ i ] = shapes.get( i ).getShapeQuantities();

		for ( int q = 0; q < NUM_QUANTITIES; ++q )
		{
			final RealSum sum = new RealSum();
			for ( final double[] values : quantities )
				sum.add( values[ q ] );
			final double mean = sum.getSum() / quantities.length;

			final RealSum squaredDeviations = new RealSum();
			for ( final double[] values : quantities )
				squaredDeviations.add( ( values[ q ] - mean ) * ( values[ q ] - mean ) );
			final double std = Math.sqrt( squaredDeviations.getSum() / quantities.length );

			thresholds[ q ] = mean + sigma * std;
		}
		return thresholds;
	}

	static boolean isOutlier( final ShapeMeasurement shape, final double[] thresholds )
	{
		final double[] quantities = shape.getShapeQuantities();
		for ( int q = 0; q < NUM_QUANTITIES; ++q )
			if ( Math.abs( quantities[ q ] ) > thresholds[ q ] )
				return true;
		return false;
	}

	private void report( final RejectedObservation rejectedObservation )
	{
		try
		{
			reporter.report( rejectedObservation );
		}
		catch ( final RuntimeException e )
		{
			LOG.warn( "Failed to report " + rejectedObservation + ": " + e.getMessage(), e );
		}
	}
}
