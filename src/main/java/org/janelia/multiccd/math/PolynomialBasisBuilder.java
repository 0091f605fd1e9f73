package org.janelia.multiccd.math;

import java.util.ArrayList;
import java.util.List;

import net.imglib2.util.RealSum;

/**
 * Builds the design matrices of a global polynomial model of the star positions.
 *
 * Monomials of total degree up to {@code maxDegree} are ordered by degree, and within a degree {@code t}
 * as {@code x^t, x^(t-1) y, ..., y^t}, so there are {@code (maxDegree + 1)(maxDegree + 2) / 2} rows.
 *
 * The matrices are not centered or normalized per tile. Instead every monomial row is divided by its L2 norm
 * computed over the observations of all tiles together, and then every matrix is rescaled
 * so that the constant monomial of the first tile equals 1.
 */
public class PolynomialBasisBuilder
{
	public static int numMonomials( final int maxDegree )
	{
		return ( maxDegree + 1 ) * ( maxDegree + 2 ) / 2;
	}

	/**
	 * @param positionLists per-tile positions, one row (x, y) per observation
	 * @param maxDegree maximum total degree of the monomials
	 */
	public static PolynomialBasis buildPi( final List< double[][] > positionLists, final int maxDegree )
	{
		if ( maxDegree < 0 )
			throw new IllegalArgumentException( "polynomial degree should be non-negative, got " + maxDegree );
		if ( positionLists.isEmpty() || positionLists.get( 0 ).length == 0 )
			throw new IllegalArgumentException( "the first tile should contain at least one position" );

		final int numMonomials = numMonomials( maxDegree );

		final List< double[][] > rawMatrices = new ArrayList<>();
		for ( final double[][] positions : positionLists )
			rawMatrices.add( buildRawMatrix( positions, maxDegree ) );

		final double[] monomialNorms = new double[ numMonomials ];
		for ( int m = 0; m < numMonomials; ++m )
		{
			final RealSum squaredSum = new RealSum();
			for ( final double[][] rawMatrix : rawMatrices )
				for ( final double value : rawMatrix[ m ] )
					squaredSum.add( value * value );
			monomialNorms[ m ] = Math.sqrt( squaredSum.getSum() );
		}

		final List< double[][] > normalizedMatrices = new ArrayList<>();
		for ( final double[][] rawMatrix : rawMatrices )
		{
			final double[][] normalizedMatrix = new double[ numMonomials ][ rawMatrix[ 0 ].length ];
			for ( int m = 0; m < numMonomials; ++m )
				for ( int i = 0; i < rawMatrix[ m ].length; ++i )
					normalizedMatrix[ m ][ i ] = rawMatrix[ m ][ i ] / monomialNorms[ m ];
			normalizedMatrices.add( normalizedMatrix );
		}

		final double constantScale = normalizedMatrices.get( 0 )[ 0 ][ 0 ];

		final List< double[][] > matrices = new ArrayList<>();
		for ( final double[][] normalizedMatrix : normalizedMatrices )
		{
			final double[][] matrix = new double[ numMonomials ][ normalizedMatrix[ 0 ].length ];
			for ( int m = 0; m < numMonomials; ++m )
				for ( int i = 0; i < normalizedMatrix[ m ].length; ++i )
					matrix[ m ][ i ] = normalizedMatrix[ m ][ i ] / constantScale;
			matrices.add( matrix );
		}

		return new PolynomialBasis( maxDegree, matrices, monomialNorms, constantScale );
	}

	/**
	 * @return matrix of size {@code [numMonomials][numObservations]}
	 */
	static double[][] buildRawMatrix( final double[][] positions, final int maxDegree )
	{
		final double[][] matrix = new double[ numMonomials( maxDegree ) ][ positions.length ];
		for ( int i = 0; i < positions.length; ++i )
		{
			final double[] monomials = monomials( positions[ i ][ 0 ], positions[ i ][ 1 ], maxDegree );
			for ( int m = 0; m < monomials.length; ++m )
				matrix[ m ][ i ] = monomials[ m ];
		}
		return matrix;
	}

	static double[] monomials( final double x, final double y, final int maxDegree )
	{
		final double[] monomials = new double[ numMonomials( maxDegree ) ];
		for ( int degree = 0; degree <= maxDegree; ++degree )
		{
			final int rowOffset = degree * ( degree + 1 ) / 2;
			for ( int p = 0; p <= degree; ++p )
				monomials[ rowOffset + p ] = Math.pow( x, degree - p ) * Math.pow( y, p );
		}
		return monomials;
	}
}
