package org.janelia.multiccd.geometry;

public class InvalidTileIdException extends IllegalArgumentException
{
	private static final long serialVersionUID = -6263818904514717523L;

	private final int tileId;

	public InvalidTileIdException( final int tileId, final int numTiles )
	{
		super( "tile id " + tileId + " is outside of the valid range [0, " + ( numTiles - 1 ) + "]" );
		this.tileId = tileId;
	}

	public int getTileId()
	{
		return tileId;
	}
}
