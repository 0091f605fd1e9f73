package org.janelia.multiccd.shape;

/**
 * Second-order moment shape of a star: reduced shear components g1 and g2, moment size sigma,
 * and a flag telling whether the measurement failed.
 * A failed measurement still carries values and is treated like any other one by the outlier rejection.
 */
public class ShapeMeasurement
{
	private final double g1, g2;
	private final double sigma;
	private final boolean failed;

	public ShapeMeasurement( final double g1, final double g2, final double sigma, final boolean failed )
	{
		this.g1 = g1;
		this.g2 = g2;
		this.sigma = sigma;
		this.failed = failed;
	}

	public static ShapeMeasurement failure()
	{
		return new ShapeMeasurement( 0, 0, -1, true );
	}

	public double getG1()
	{
		return g1;
	}

	public double getG2()
	{
		return g2;
	}

	public double getSigma()
	{
		return sigma;
	}

	/**
	 * Squared size {@code R2 = 2 * sigma^2}.
	 */
	public double getR2()
	{
		return 2 * sigma * sigma;
	}

	public boolean isFailed()
	{
		return failed;
	}

	/**
	 * @return (g1, g2, R2)
	 */
	public double[] getShapeQuantities()
	{
		return new double[] { g1, g2, getR2() };
	}

	@Override
	public String toString()
	{
		return "g1=" + g1 + ", g2=" + g2 + ", sigma=" + sigma + ( failed ? " (failed)" : "" );
	}
}
