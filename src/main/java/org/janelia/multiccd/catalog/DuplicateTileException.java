package org.janelia.multiccd.catalog;

public class DuplicateTileException extends IllegalArgumentException
{
	private static final long serialVersionUID = 3470569190447014311L;

	private final String exposureId;
	private final int tileId;

	public DuplicateTileException( final String exposureId, final int tileId )
	{
		super( "tile " + tileId + " occurs more than once in exposure " + exposureId );
		this.exposureId = exposureId;
		this.tileId = tileId;
	}

	public String getExposureId()
	{
		return exposureId;
	}

	public int getTileId()
	{
		return tileId;
	}
}
