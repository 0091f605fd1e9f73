package org.janelia.multiccd.catalog;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Builds binary weights for star stamps. SExtractor marks pixels outside of the detection area
 * with a huge negative value (-1e30), so everything below the threshold is treated as masked.
 */
public class MaskBuilder
{
	public static final double DEFAULT_THRESHOLD = -1e5;

	/**
	 * Creates a mask that is 0 where the stamp value is below {@code threshold} and 1 elsewhere.
	 * If {@code applyToStamp} is set, the masked stamp pixels are replaced with 0 in place
	 * to keep them from corrupting later convolutions.
	 */
	public static RandomAccessibleInterval< DoubleType > handleMask(
			final RandomAccessibleInterval< DoubleType > stamp,
			final double threshold,
			final boolean applyToStamp )
	{
		final RandomAccessibleInterval< DoubleType > mask = ArrayImgs.doubles( Intervals.dimensionsAsLongArray( stamp ) );

		final Cursor< DoubleType > stampCursor = Views.flatIterable( stamp ).cursor();
		final Cursor< DoubleType > maskCursor = Views.flatIterable( mask ).cursor();
		while ( stampCursor.hasNext() )
		{
			final DoubleType value = stampCursor.next();
			final DoubleType weight = maskCursor.next();
			if ( value.get() < threshold )
			{
				weight.setZero();
				if ( applyToStamp )
					value.setZero();
			}
			else
			{
				weight.setOne();
			}
		}
		return mask;
	}

	/**
	 * Converts a mask with 1 for good pixels into a bad pixel map with 1 for bad pixels.
	 */
	public static RandomAccessibleInterval< DoubleType > invert( final RandomAccessibleInterval< DoubleType > mask )
	{
		final RandomAccessibleInterval< DoubleType > inverted = ArrayImgs.doubles( Intervals.dimensionsAsLongArray( mask ) );

		final Cursor< DoubleType > maskCursor = Views.flatIterable( mask ).cursor();
		final Cursor< DoubleType > invertedCursor = Views.flatIterable( inverted ).cursor();
		while ( maskCursor.hasNext() )
			invertedCursor.next().set( Math.rint( Math.abs( maskCursor.next().get() - 1 ) ) );
		return inverted;
	}
}
