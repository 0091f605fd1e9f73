package org.janelia.multiccd.catalog;

import java.util.Collections;
import java.util.List;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Contents of one tile catalog: star stamps with their local positions and optional per-star quantities.
 * Optional columns are {@code null} when the catalog does not provide them.
 */
public class CatalogPayload
{
	private final List< RandomAccessibleInterval< DoubleType > > stamps;
	private final double[] localX, localY;
	private final double[] snr;
	private final double[] skyX, skyY;

	public CatalogPayload(
			final List< RandomAccessibleInterval< DoubleType > > stamps,
			final double[] localX,
			final double[] localY )
	{
		this( stamps, localX, localY, null, null, null );
	}

	public CatalogPayload(
			final List< RandomAccessibleInterval< DoubleType > > stamps,
			final double[] localX,
			final double[] localY,
			final double[] snr,
			final double[] skyX,
			final double[] skyY )
	{
		final int size = stamps.size();
		if ( localX.length != size || localY.length != size )
			throw new IllegalArgumentException( "positions do not match the number of stamps: " + localX.length + ", " + localY.length + " vs " + size );
		if ( snr != null && snr.length != size )
			throw new IllegalArgumentException( "SNR values do not match the number of stamps: " + snr.length + " vs " + size );
		if ( ( skyX == null ) != ( skyY == null ) )
			throw new IllegalArgumentException( "sky coordinates should be either both present or both absent" );
		if ( skyX != null && ( skyX.length != size || skyY.length != size ) )
			throw new IllegalArgumentException( "sky coordinates do not match the number of stamps" );

		this.stamps = Collections.unmodifiableList( stamps );
		this.localX = localX;
		this.localY = localY;
		this.snr = snr;
		this.skyX = skyX;
		this.skyY = skyY;
	}

	public int size()
	{
		return stamps.size();
	}

	public List< RandomAccessibleInterval< DoubleType > > getStamps()
	{
		return stamps;
	}

	public double[] getLocalX()
	{
		return localX;
	}

	public double[] getLocalY()
	{
		return localY;
	}

	public boolean hasSnr()
	{
		return snr != null;
	}

	public double[] getSnr()
	{
		return snr;
	}

	public boolean hasSkyCoordinates()
	{
		return skyX != null;
	}

	public double[] getSkyX()
	{
		return skyX;
	}

	public double[] getSkyY()
	{
		return skyY;
	}
}
