package org.janelia.multiccd.interpolation;

import org.janelia.multiccd.geometry.CoordinateMapper;
import org.janelia.multiccd.geometry.TileLayout;

/**
 * Per-tile statistic sampled on a regular grid of {@code numCellsX x numCellsY} cells, indexed as {@code [tile][ix][iy]},
 * together with the global positions of the cell centers.
 *
 * Input grids of flipped tiles are stored with their local origin convention and are kept as is;
 * grids of the other tiles are reversed along both axes so that all grids share the same origin corner.
 * Cell centers are placed uniformly at {@code (i + 1/2) * extent / numCells} and mapped into the global frame.
 */
public class GridMap
{
	private final int numTiles, numCellsX, numCellsY;
	private final double[][][] values;
	private final double[][][] globalX, globalY;

	public GridMap( final double[][][] tileGrids, final CoordinateMapper coordinateMapper )
	{
		final TileLayout layout = coordinateMapper.getLayout();
		numTiles = tileGrids.length;
		if ( numTiles == 0 || tileGrids[ 0 ].length == 0 || tileGrids[ 0 ][ 0 ].length == 0 )
			throw new IllegalArgumentException( "statistic grid should not be empty" );
		if ( numTiles > layout.numTiles() )
			throw new IllegalArgumentException( "statistic grid has " + numTiles + " tiles but the layout has only " + layout.numTiles() );

		numCellsX = tileGrids[ 0 ].length;
		numCellsY = tileGrids[ 0 ][ 0 ].length;

		final double binX = ( double ) layout.getXExtent() / numCellsX;
		final double binY = ( double ) layout.getYExtent() / numCellsY;
		final double[] cellCentersX = new double[ numCellsX ];
		for ( int ix = 0; ix < numCellsX; ++ix )
			cellCentersX[ ix ] = binX / 2 + ix * binX;
		final double[] cellCentersY = new double[ numCellsY ];
		for ( int iy = 0; iy < numCellsY; ++iy )
			cellCentersY[ iy ] = binY / 2 + iy * binY;

		values = new double[ numTiles ][ numCellsX ][ numCellsY ];
		globalX = new double[ numTiles ][ numCellsX ][ numCellsY ];
		globalY = new double[ numTiles ][ numCellsX ][ numCellsY ];

		for ( int tile = 0; tile < numTiles; ++tile )
		{
			if ( tileGrids[ tile ].length != numCellsX )
				throw new IllegalArgumentException( "tile " + tile + " grid has " + tileGrids[ tile ].length + " columns, expected " + numCellsX );

			final boolean flipped = coordinateMapper.isFlipped( tile );
			for ( int ix = 0; ix < numCellsX; ++ix )
			{
				if ( tileGrids[ tile ][ ix ].length != numCellsY )
					throw new IllegalArgumentException( "tile " + tile + " grid has " + tileGrids[ tile ][ ix ].length + " rows, expected " + numCellsY );

				for ( int iy = 0; iy < numCellsY; ++iy )
				{
					values[ tile ][ reorient( ix, numCellsX, flipped ) ][ reorient( iy, numCellsY, flipped ) ] = tileGrids[ tile ][ ix ][ iy ];

					final double[] global = coordinateMapper.toGlobal( tile, cellCentersX[ ix ], cellCentersY[ iy ] );
					globalX[ tile ][ ix ][ iy ] = global[ 0 ];
					globalY[ tile ][ ix ][ iy ] = global[ 1 ];
				}
			}
		}
	}

	/**
	 * Index remapping applied to the input grid: identity for flipped tiles, reversal for the others.
	 */
	static int reorient( final int index, final int numCells, final boolean flipped )
	{
		return flipped ? index : numCells - index - 1;
	}

	public int numTiles()
	{
		return numTiles;
	}

	public int numCellsX()
	{
		return numCellsX;
	}

	public int numCellsY()
	{
		return numCellsY;
	}

	public int numCells()
	{
		return numTiles * numCellsX * numCellsY;
	}

	public double getValue( final int tile, final int ix, final int iy )
	{
		return values[ tile ][ ix ][ iy ];
	}

	public double[] getGlobalPosition( final int tile, final int ix, final int iy )
	{
		return new double[] { globalX[ tile ][ ix ][ iy ], globalY[ tile ][ ix ][ iy ] };
	}

	/**
	 * Flat index of a cell in the {@code [tile][ix][iy]} order.
	 */
	public int flatIndex( final int tile, final int ix, final int iy )
	{
		return ( tile * numCellsX + ix ) * numCellsY + iy;
	}

	public double getValue( final int flatIndex )
	{
		final int iy = flatIndex % numCellsY;
		final int ix = ( flatIndex / numCellsY ) % numCellsX;
		final int tile = flatIndex / ( numCellsY * numCellsX );
		return values[ tile ][ ix ][ iy ];
	}

	public double[] getGlobalPosition( final int flatIndex )
	{
		final int iy = flatIndex % numCellsY;
		final int ix = ( flatIndex / numCellsY ) % numCellsX;
		final int tile = flatIndex / ( numCellsY * numCellsX );
		return getGlobalPosition( tile, ix, iy );
	}
}
