package org.janelia.multiccd.shape;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Measures the shape of a star stamp. Implementations never throw on bad input,
 * they report it through {@link ShapeMeasurement#isFailed()} instead.
 */
@FunctionalInterface
public interface ShapeMeasurer
{
	/**
	 * @param stamp star image
	 * @param badPixelMask map of the same size where non-zero values mark pixels to be ignored
	 */
	ShapeMeasurement measureShape( RandomAccessibleInterval< DoubleType > stamp, RandomAccessibleInterval< DoubleType > badPixelMask );
}
