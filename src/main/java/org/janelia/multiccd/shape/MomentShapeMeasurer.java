package org.janelia.multiccd.shape;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.util.RealSum;
import net.imglib2.view.Views;

/**
 * Estimates the star shape from unweighted second-order moments of the good pixels.
 *
 * For the moment matrix {@code Q} the reduced shear is {@code g = (Qxx - Qyy + 2iQxy) / (Qxx + Qyy + 2 sqrt(det Q))}
 * and the size is {@code sigma = det(Q)^(1/4)}, which equals the standard deviation for a round Gaussian profile.
 */
public class MomentShapeMeasurer implements ShapeMeasurer
{
	@Override
	public ShapeMeasurement measureShape( final RandomAccessibleInterval< DoubleType > stamp, final RandomAccessibleInterval< DoubleType > badPixelMask )
	{
		if ( !Intervals.equalDimensions( stamp, badPixelMask ) )
			return ShapeMeasurement.failure();

		final RealSum flux = new RealSum(), xSum = new RealSum(), ySum = new RealSum();
		final Cursor< DoubleType > stampCursor = Views.flatIterable( stamp ).localizingCursor();
		final Cursor< DoubleType > badPixelCursor = Views.flatIterable( badPixelMask ).cursor();
		while ( stampCursor.hasNext() )
		{
			final double value = stampCursor.next().get();
			if ( badPixelCursor.next().get() != 0 || Double.isNaN( value ) )
				continue;

			flux.add( value );
			xSum.add( value * stampCursor.getDoublePosition( 0 ) );
			ySum.add( value * stampCursor.getDoublePosition( 1 ) );
		}

		if ( !( flux.getSum() > 0 ) )
			return ShapeMeasurement.failure();

		final double cx = xSum.getSum() / flux.getSum(), cy = ySum.getSum() / flux.getSum();

		final RealSum xx = new RealSum(), yy = new RealSum(), xy = new RealSum();
		stampCursor.reset();
		badPixelCursor.reset();
		while ( stampCursor.hasNext() )
		{
			final double value = stampCursor.next().get();
			if ( badPixelCursor.next().get() != 0 || Double.isNaN( value ) )
				continue;

			final double dx = stampCursor.getDoublePosition( 0 ) - cx;
			final double dy = stampCursor.getDoublePosition( 1 ) - cy;
			xx.add( value * dx * dx );
			yy.add( value * dy * dy );
			xy.add( value * dx * dy );
		}

		final double qxx = xx.getSum() / flux.getSum();
		final double qyy = yy.getSum() / flux.getSum();
		final double qxy = xy.getSum() / flux.getSum();
		final double det = qxx * qyy - qxy * qxy;
		if ( !( det > 0 ) || qxx <= 0 || qyy <= 0 )
			return ShapeMeasurement.failure();

		final double denominator = qxx + qyy + 2 * Math.sqrt( det );
		return new ShapeMeasurement(
				( qxx - qyy ) / denominator,
				2 * qxy / denominator,
				Math.pow( det, 0.25 ),
				false );
	}
}
