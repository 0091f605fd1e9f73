package org.janelia.multiccd.math;

import java.util.Collections;
import java.util.List;

/**
 * Normalized monomial design matrices of a global positional model, one per tile,
 * together with the normalization that was applied to them.
 */
public class PolynomialBasis
{
	private final int maxDegree;
	private final List< double[][] > matrices;
	private final double[] monomialNorms;
	private final double constantScale;

	public PolynomialBasis( final int maxDegree, final List< double[][] > matrices, final double[] monomialNorms, final double constantScale )
	{
		this.maxDegree = maxDegree;
		this.matrices = Collections.unmodifiableList( matrices );
		this.monomialNorms = monomialNorms;
		this.constantScale = constantScale;
	}

	public int getMaxDegree()
	{
		return maxDegree;
	}

	public int numMonomials()
	{
		return monomialNorms.length;
	}

	/**
	 * @return per-tile matrices of size {@code [numMonomials][numObservations]}
	 */
	public List< double[][] > getMatrices()
	{
		return matrices;
	}

	/**
	 * @return global L2 norm of every monomial row over all tiles
	 */
	public double[] getMonomialNorms()
	{
		return monomialNorms;
	}

	/**
	 * @return constant entry of the first tile after the per-monomial normalization
	 */
	public double getConstantScale()
	{
		return constantScale;
	}

	/**
	 * Evaluates the normalized basis at an arbitrary global position.
	 */
	public double[] evaluate( final double x, final double y )
	{
		final double[] monomials = PolynomialBasisBuilder.monomials( x, y, maxDegree );
		for ( int m = 0; m < monomials.length; ++m )
			monomials[ m ] = monomials[ m ] / monomialNorms[ m ] / constantScale;
		return monomials;
	}
}
