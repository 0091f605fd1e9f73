package org.janelia.multiccd.catalog;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * A single detected star: its stamp and mask, local and global positions, owning tile,
 * and optionally its signal-to-noise ratio and sky coordinates.
 */
public class Observation
{
	private final int tileId;
	private final RandomAccessibleInterval< DoubleType > stamp;
	private final RandomAccessibleInterval< DoubleType > mask;
	private final double[] localPosition;
	private final double[] globalPosition;
	private final Double snr;
	private final double[] skyPosition;

	public Observation(
			final int tileId,
			final RandomAccessibleInterval< DoubleType > stamp,
			final RandomAccessibleInterval< DoubleType > mask,
			final double[] localPosition,
			final double[] globalPosition,
			final Double snr,
			final double[] skyPosition )
	{
		this.tileId = tileId;
		this.stamp = stamp;
		this.mask = mask;
		this.localPosition = localPosition;
		this.globalPosition = globalPosition;
		this.snr = snr;
		this.skyPosition = skyPosition;
	}

	public int getTileId()
	{
		return tileId;
	}

	public RandomAccessibleInterval< DoubleType > getStamp()
	{
		return stamp;
	}

	public RandomAccessibleInterval< DoubleType > getMask()
	{
		return mask;
	}

	public double[] getLocalPosition()
	{
		return localPosition;
	}

	public double[] getGlobalPosition()
	{
		return globalPosition;
	}

	/**
	 * @return SNR value or {@code null} if it is not available for the exposure
	 */
	public Double getSnr()
	{
		return snr;
	}

	/**
	 * @return (x, y) sky coordinates or {@code null} if they are not available for the exposure
	 */
	public double[] getSkyPosition()
	{
		return skyPosition;
	}
}
