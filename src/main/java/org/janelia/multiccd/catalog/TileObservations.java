package org.janelia.multiccd.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Observations of one tile in the order they appear in the tile catalog.
 * Provides the parallel per-tile lists consumed by the model fitting stage.
 */
public class TileObservations
{
	private final int tileId;
	private final List< Observation > observations;

	public TileObservations( final int tileId, final List< Observation > observations )
	{
		for ( final Observation observation : observations )
			if ( observation.getTileId() != tileId )
				throw new IllegalArgumentException( "observation of tile " + observation.getTileId() + " cannot be added to tile " + tileId );

		this.tileId = tileId;
		this.observations = Collections.unmodifiableList( new ArrayList<>( observations ) );
	}

	public int getTileId()
	{
		return tileId;
	}

	public int size()
	{
		return observations.size();
	}

	public List< Observation > getObservations()
	{
		return observations;
	}

	public Observation get( final int index )
	{
		return observations.get( index );
	}

	public List< RandomAccessibleInterval< DoubleType > > getStamps()
	{
		final List< RandomAccessibleInterval< DoubleType > > stamps = new ArrayList<>();
		for ( final Observation observation : observations )
			stamps.add( observation.getStamp() );
		return stamps;
	}

	public List< RandomAccessibleInterval< DoubleType > > getMasks()
	{
		final List< RandomAccessibleInterval< DoubleType > > masks = new ArrayList<>();
		for ( final Observation observation : observations )
			masks.add( observation.getMask() );
		return masks;
	}

	/**
	 * @return global positions as {@code [n][2]}
	 */
	public double[][] getGlobalPositions()
	{
		final double[][] positions = new double[ observations.size() ][];
		for ( int i = 0; i < positions.length; ++i )
			positions[ i ] = observations.get( i ).getGlobalPosition().clone();
		return positions;
	}

	/**
	 * @return local positions as {@code [n][2]}
	 */
	public double[][] getLocalPositions()
	{
		final double[][] positions = new double[ observations.size() ][];
		for ( int i = 0; i < positions.length; ++i )
			positions[ i ] = observations.get( i ).getLocalPosition().clone();
		return positions;
	}

	double[] getSnr()
	{
		final double[] snr = new double[ observations.size() ];
		for ( int i = 0; i < snr.length; ++i )
			snr[ i ] = observations.get( i ).getSnr();
		return snr;
	}

	double[] getSkyCoordinate( final int d )
	{
		final double[] sky = new double[ observations.size() ];
		for ( int i = 0; i < sky.length; ++i )
			sky[ i ] = observations.get( i ).getSkyPosition()[ d ];
		return sky;
	}

	/**
	 * Keeps observations with {@code keep[i] == true} preserving their relative order.
	 */
	public TileObservations filter( final boolean[] keep )
	{
		if ( keep.length != observations.size() )
			throw new IllegalArgumentException( "filter size " + keep.length + " does not match number of observations " + observations.size() );

		final List< Observation > kept = new ArrayList<>();
		for ( int i = 0; i < keep.length; ++i )
			if ( keep[ i ] )
				kept.add( observations.get( i ) );
		return new TileObservations( tileId, kept );
	}
}
