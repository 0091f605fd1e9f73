package org.janelia.multiccd.neighborsearch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exhaustive k-nearest neighbor search over observation positions, either within a single tile
 * or across all tiles of an exposure. Equally distant observations keep their original order.
 * If fewer than {@code k} observations are available, all of them are returned.
 */
public class NeighborSearch
{
	/**
	 * @param query position (x, y)
	 * @param positions positions of the tile observations, one row per observation
	 * @param values values of the tile observations, one row per observation
	 * @param k number of neighbors
	 */
	public static NeighborSearchResult localNearest(
			final double[] query,
			final double[][] positions,
			final double[][] values,
			final int k )
	{
		return globalNearest( query, Collections.singletonList( positions ), Collections.singletonList( values ), k );
	}

	/**
	 * @param query position (x, y)
	 * @param positionLists per-tile positions, one row per observation
	 * @param valueLists per-tile values, one row per observation
	 * @param k number of neighbors
	 */
	public static NeighborSearchResult globalNearest(
			final double[] query,
			final List< double[][] > positionLists,
			final List< double[][] > valueLists,
			final int k )
	{
		if ( positionLists.size() != valueLists.size() )
			throw new IllegalArgumentException( "number of position lists " + positionLists.size() + " does not match number of value lists " + valueLists.size() );
		if ( k < 0 )
			throw new IllegalArgumentException( "number of neighbors should be non-negative, got " + k );

		final List< NeighborCandidate > candidates = new ArrayList<>();
		for ( int tileIndex = 0; tileIndex < positionLists.size(); ++tileIndex )
		{
			final double[][] positions = positionLists.get( tileIndex );
			if ( positions.length != valueLists.get( tileIndex ).length )
				throw new IllegalArgumentException( "tile " + tileIndex + " has " + positions.length + " positions but " + valueLists.get( tileIndex ).length + " values" );

			for ( int i = 0; i < positions.length; ++i )
				candidates.add( new NeighborCandidate( distance( query, positions[ i ] ), tileIndex, i ) );
		}
		Collections.sort( candidates );

		final List< NeighborCandidate > nearest = new ArrayList<>( candidates.subList( 0, Math.min( k, candidates.size() ) ) );
		final double[][] values = new double[ nearest.size() ][];
		final double[][] positions = new double[ nearest.size() ][];
		for ( int i = 0; i < nearest.size(); ++i )
		{
			final NeighborCandidate neighbor = nearest.get( i );
			values[ i ] = valueLists.get( neighbor.getTileIndex() )[ neighbor.getIntraTileIndex() ].clone();
			positions[ i ] = positionLists.get( neighbor.getTileIndex() )[ neighbor.getIntraTileIndex() ].clone();
		}
		return new NeighborSearchResult( nearest, values, positions );
	}

	static double distance( final double[] a, final double[] b )
	{
		double sum = 0;
		for ( int d = 0; d < a.length; ++d )
			sum += ( a[ d ] - b[ d ] ) * ( a[ d ] - b[ d ] );
		return Math.sqrt( sum );
	}
}
