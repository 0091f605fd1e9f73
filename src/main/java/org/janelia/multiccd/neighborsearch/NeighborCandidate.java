package org.janelia.multiccd.neighborsearch;

/**
 * Distance from the query point to an observation identified by its tile index and its index within the tile.
 * Defines the ascending sorting order by distance, and by the concatenated observation order for equal distances.
 */
public class NeighborCandidate implements Comparable< NeighborCandidate >
{
	private final double distance;
	private final int tileIndex;
	private final int intraTileIndex;

	public NeighborCandidate( final double distance, final int tileIndex, final int intraTileIndex )
	{
		this.distance = distance;
		this.tileIndex = tileIndex;
		this.intraTileIndex = intraTileIndex;
	}

	public double getDistance()
	{
		return distance;
	}

	public int getTileIndex()
	{
		return tileIndex;
	}

	public int getIntraTileIndex()
	{
		return intraTileIndex;
	}

	@Override
	public int compareTo( final NeighborCandidate other )
	{
		final int compareDistance = Double.compare( distance, other.distance );
		if ( compareDistance != 0 )
			return compareDistance;

		final int compareTile = Integer.compare( tileIndex, other.tileIndex );
		if ( compareTile != 0 )
			return compareTile;

		return Integer.compare( intraTileIndex, other.intraTileIndex );
	}

	@Override
	public String toString()
	{
		return String.format( "(%s,%d,%d)", distance, tileIndex, intraTileIndex );
	}
}
