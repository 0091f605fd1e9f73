package org.janelia.multiccd.geometry;

import java.io.Serializable;

/**
 * Converts local (per-tile) pixel coordinates into the global mosaic frame.
 * The global frame has its origin in the south-west corner convention: x grows from West to East, y from South to North.
 *
 * The mapping first brings the local axes of flipped tiles into the global orientation
 * ({@code x' = xExtent - x + 1}, {@code y' = yExtent - y + 1}), then shifts by the tile offset
 * ({@code columnOffset * (xGap + xExtent)}, {@code rowOffset * (yGap + yExtent)}).
 */
public class CoordinateMapper implements Serializable
{
	private static final long serialVersionUID = 2907733447640016466L;

	private final TileLayout layout;

	public CoordinateMapper()
	{
		this( TileLayout.megaCam() );
	}

	public CoordinateMapper( final TileLayout layout )
	{
		this.layout = layout;
	}

	public TileLayout getLayout()
	{
		return layout;
	}

	public double[] toGlobal( final int tileId, final double x, final double y )
	{
		final TilePlacement placement = layout.getPlacement( tileId );
		final double[] flipped = flip( placement, x, y );
		return new double[] {
				flipped[ 0 ] + getXShift( placement ),
				flipped[ 1 ] + getYShift( placement )
			};
	}

	/**
	 * Maps a set of local positions of the same tile.
	 *
	 * @return global positions as {@code [n][2]}
	 */
	public double[][] toGlobal( final int tileId, final double[] xs, final double[] ys )
	{
		if ( xs.length != ys.length )
			throw new IllegalArgumentException( "different number of x and y coordinates: " + xs.length + " vs " + ys.length );

		final TilePlacement placement = layout.getPlacement( tileId );
		final double xShift = getXShift( placement ), yShift = getYShift( placement );

		final double[][] global = new double[ xs.length ][];
		for ( int i = 0; i < xs.length; ++i )
		{
			final double[] flipped = flip( placement, xs[ i ], ys[ i ] );
			global[ i ] = new double[] { flipped[ 0 ] + xShift, flipped[ 1 ] + yShift };
		}
		return global;
	}

	public double[] getShift( final int tileId )
	{
		final TilePlacement placement = layout.getPlacement( tileId );
		return new double[] { getXShift( placement ), getYShift( placement ) };
	}

	public boolean isFlipped( final int tileId )
	{
		return layout.getPlacement( tileId ).isFlipped();
	}

	private double[] flip( final TilePlacement placement, final double x, final double y )
	{
		if ( placement.isFlipped() )
			return new double[] { layout.getXExtent() - x + 1, layout.getYExtent() - y + 1 };
		else
			return new double[] { x, y };
	}

	private double getXShift( final TilePlacement placement )
	{
		return ( double ) placement.getColumnOffset() * layout.getXStep();
	}

	private double getYShift( final TilePlacement placement )
	{
		return ( double ) placement.getRowOffset() * layout.getYStep();
	}
}
