package org.janelia.multiccd.neighborsearch;

import java.util.Collections;
import java.util.List;

/**
 * Nearest observations sorted by ascending distance to the query point.
 */
public class NeighborSearchResult
{
	private final List< NeighborCandidate > neighbors;
	private final double[][] values;
	private final double[][] positions;

	public NeighborSearchResult( final List< NeighborCandidate > neighbors, final double[][] values, final double[][] positions )
	{
		this.neighbors = Collections.unmodifiableList( neighbors );
		this.values = values;
		this.positions = positions;
	}

	public int size()
	{
		return neighbors.size();
	}

	public List< NeighborCandidate > getNeighbors()
	{
		return neighbors;
	}

	/**
	 * @return values of the nearest observations, one row per neighbor
	 */
	public double[][] getValues()
	{
		return values;
	}

	/**
	 * @return positions of the nearest observations, one row per neighbor
	 */
	public double[][] getPositions()
	{
		return positions;
	}
}
