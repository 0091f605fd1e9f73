package org.janelia.multiccd.geometry;

import java.io.Serializable;

/**
 * Immutable geometry of a tiled detector mosaic: gaps between adjacent tiles, pixel extent of a single tile,
 * and the placement of every tile id.
 */
public class TileLayout implements Serializable
{
	private static final long serialVersionUID = -3036786283417931880L;

	public static final int DEFAULT_X_GAP = 70;
	public static final int DEFAULT_Y_GAP = 425;
	public static final int DEFAULT_X_EXTENT = 2048;
	public static final int DEFAULT_Y_EXTENT = 4612;

	private final int xGap, yGap;
	private final int xExtent, yExtent;
	private final TilePlacement[] placements;

	public TileLayout( final int xGap, final int yGap, final int xExtent, final int yExtent, final TilePlacement[] placements )
	{
		if ( xExtent <= 0 || yExtent <= 0 )
			throw new IllegalArgumentException( "tile extent should be positive, got " + xExtent + "x" + yExtent );

		this.xGap = xGap;
		this.yGap = yGap;
		this.xExtent = xExtent;
		this.yExtent = yExtent;
		this.placements = placements.clone();
	}

	public static TileLayout megaCam()
	{
		return megaCam( DEFAULT_X_GAP, DEFAULT_Y_GAP, DEFAULT_X_EXTENT, DEFAULT_Y_EXTENT );
	}

	public static TileLayout megaCam( final int xGap, final int yGap, final int xExtent, final int yExtent )
	{
		return new TileLayout( xGap, yGap, xExtent, yExtent, MegaCamTiles.placements() );
	}

	public int getXGap()
	{
		return xGap;
	}

	public int getYGap()
	{
		return yGap;
	}

	public int getXExtent()
	{
		return xExtent;
	}

	public int getYExtent()
	{
		return yExtent;
	}

	public int numTiles()
	{
		return placements.length;
	}

	public boolean isValidTileId( final int tileId )
	{
		return tileId >= 0 && tileId < placements.length;
	}

	/**
	 * @throws InvalidTileIdException if the layout has no tile with the given id
	 */
	public TilePlacement getPlacement( final int tileId )
	{
		if ( !isValidTileId( tileId ) )
			throw new InvalidTileIdException( tileId, placements.length );
		return placements[ tileId ];
	}

	/**
	 * Distance between origins of horizontally adjacent tiles.
	 */
	public int getXStep()
	{
		return xGap + xExtent;
	}

	/**
	 * Distance between origins of vertically adjacent tiles.
	 */
	public int getYStep()
	{
		return yGap + yExtent;
	}
}
