package org.janelia.multiccd.interpolation;

import java.util.ArrayList;
import java.util.List;

import org.janelia.multiccd.geometry.CoordinateMapper;
import org.janelia.multiccd.math.RadialBasisFunction;
import org.janelia.multiccd.math.RadialBasisKernel;

import net.imglib2.KDTree;
import net.imglib2.RealLocalizable;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.KNearestNeighborSearchOnKDTree;

/**
 * Interpolates a per-tile statistic grid (for example, mean star moments binned over every tile) at arbitrary global positions.
 *
 * For every query, the {@code numNeighbors} grid cells closest to the query are fetched from a KD-tree built over the global cell centers,
 * and a radial basis function fitted through them is evaluated at the query position.
 * The interpolant is not reused between queries.
 *
 * Instances are read-only after construction and can be queried from multiple threads.
 */
public class GridInterpolator
{
	public static final int DEFAULT_NUM_NEIGHBORS = 1000;
	public static final RadialBasisKernel DEFAULT_KERNEL = RadialBasisKernel.THIN_PLATE;

	private final GridMap gridMap;
	private final int numNeighbors;
	private final RadialBasisKernel kernel;

	private final KDTree< Integer > tree;

	public GridInterpolator( final double[][][] tileGrids )
	{
		this( tileGrids, new CoordinateMapper(), DEFAULT_NUM_NEIGHBORS, DEFAULT_KERNEL );
	}

	public GridInterpolator(
			final double[][][] tileGrids,
			final CoordinateMapper coordinateMapper,
			final int numNeighbors,
			final RadialBasisKernel kernel )
	{
		this( new GridMap( tileGrids, coordinateMapper ), numNeighbors, kernel );
	}

	public GridInterpolator( final GridMap gridMap, final int numNeighbors, final RadialBasisKernel kernel )
	{
		if ( numNeighbors < 1 )
			throw new IllegalArgumentException( "number of neighbors should be positive, got " + numNeighbors );

		this.gridMap = gridMap;
		this.numNeighbors = numNeighbors;
		this.kernel = kernel;

		final List< Integer > cellIndexes = new ArrayList<>();
		final List< RealLocalizable > cellPositions = new ArrayList<>();
		for ( int i = 0; i < gridMap.numCells(); ++i )
		{
			cellIndexes.add( i );
			cellPositions.add( new RealPoint( gridMap.getGlobalPosition( i ) ) );
		}
		tree = new KDTree<>( cellIndexes, cellPositions );
	}

	public GridMap getGridMap()
	{
		return gridMap;
	}

	public int getNumNeighbors()
	{
		return numNeighbors;
	}

	public RadialBasisKernel getKernel()
	{
		return kernel;
	}

	public double interpolate( final double x, final double y )
	{
		final int[] neighbors = findNearestCells( x, y );

		if ( neighbors.length == 1 )
			return gridMap.getValue( neighbors[ 0 ] );

		final double[][] nodes = new double[ neighbors.length ][];
		final double[] values = new double[ neighbors.length ];
		for ( int i = 0; i < neighbors.length; ++i )
		{
			nodes[ i ] = gridMap.getGlobalPosition( neighbors[ i ] );
			values[ i ] = gridMap.getValue( neighbors[ i ] );
		}

		return RadialBasisFunction.fit( nodes, values, kernel ).evaluate( x, y );
	}

	/**
	 * @return flat indexes of the closest grid cells sorted by ascending distance
	 */
	int[] findNearestCells( final double x, final double y )
	{
		final int k = Math.min( numNeighbors, gridMap.numCells() );
		final KNearestNeighborSearchOnKDTree< Integer > neighborsSearch = new KNearestNeighborSearchOnKDTree<>( tree, k );
		neighborsSearch.search( new RealPoint( x, y ) );

		final int[] neighbors = new int[ k ];
		for ( int i = 0; i < k; ++i )
			neighbors[ i ] = neighborsSearch.getSampler( i ).get();
		return neighbors;
	}
}
