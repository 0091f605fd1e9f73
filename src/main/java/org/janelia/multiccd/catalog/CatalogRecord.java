package org.janelia.multiccd.catalog;

import java.io.Serializable;

/**
 * Reference to the catalog of one tile within one exposure. The payload itself is not loaded.
 */
public class CatalogRecord implements Serializable
{
	private static final long serialVersionUID = -1846237208785361307L;

	private final String exposureId;
	private final int tileId;
	private final String path;

	public CatalogRecord( final String exposureId, final int tileId, final String path )
	{
		this.exposureId = exposureId;
		this.tileId = tileId;
		this.path = path;
	}

	public String getExposureId()
	{
		return exposureId;
	}

	public int getTileId()
	{
		return tileId;
	}

	public String getPath()
	{
		return path;
	}

	@Override
	public String toString()
	{
		return "(" + exposureId + ", " + tileId + ", " + path + ")";
	}
}
