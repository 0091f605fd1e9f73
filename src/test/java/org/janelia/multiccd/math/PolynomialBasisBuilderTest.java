package org.janelia.multiccd.math;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class PolynomialBasisBuilderTest
{
	private static final double EPSILON = 1e-12;

	@Test
	public void testNumMonomials()
	{
		Assert.assertEquals( 1, PolynomialBasisBuilder.numMonomials( 0 ) );
		Assert.assertEquals( 3, PolynomialBasisBuilder.numMonomials( 1 ) );
		Assert.assertEquals( 6, PolynomialBasisBuilder.numMonomials( 2 ) );
		Assert.assertEquals( 10, PolynomialBasisBuilder.numMonomials( 3 ) );
	}

	@Test
	public void testMonomialOrder()
	{
		// 1, x, y, x^2, xy, y^2, x^3, x^2 y, x y^2, y^3
		Assert.assertArrayEquals(
				new double[] { 1, 2, 3, 4, 6, 9, 8, 12, 18, 27 },
				PolynomialBasisBuilder.monomials( 2, 3, 3 ),
				EPSILON );
	}

	@Test
	public void testBuildPi()
	{
		final List< double[][] > positions = Arrays.asList(
				new double[][] { { 1, 2 }, { 3, 4 } },
				new double[][] { { 2, 0 } } );

		final PolynomialBasis basis = PolynomialBasisBuilder.buildPi( positions, 1 );
		Assert.assertEquals( 3, basis.numMonomials() );
		Assert.assertArrayEquals( new double[] { Math.sqrt( 3 ), Math.sqrt( 14 ), Math.sqrt( 20 ) }, basis.getMonomialNorms(), EPSILON );
		Assert.assertEquals( 1 / Math.sqrt( 3 ), basis.getConstantScale(), EPSILON );

		final double[][] first = basis.getMatrices().get( 0 );
		final double[][] second = basis.getMatrices().get( 1 );
		Assert.assertEquals( 3, first.length );
		Assert.assertEquals( 2, first[ 0 ].length );
		Assert.assertEquals( 1, second[ 0 ].length );

		// the constant row becomes exactly one everywhere
		Assert.assertEquals( 1, first[ 0 ][ 0 ], 0 );
		Assert.assertArrayEquals( new double[] { 1, 1 }, first[ 0 ], EPSILON );
		Assert.assertArrayEquals( new double[] { 1 }, second[ 0 ], EPSILON );

		final double xScale = Math.sqrt( 3 ) / Math.sqrt( 14 );
		final double yScale = Math.sqrt( 3 ) / Math.sqrt( 20 );
		Assert.assertArrayEquals( new double[] { 1 * xScale, 3 * xScale }, first[ 1 ], EPSILON );
		Assert.assertArrayEquals( new double[] { 2 * yScale, 4 * yScale }, first[ 2 ], EPSILON );
		Assert.assertArrayEquals( new double[] { 2 * xScale }, second[ 1 ], EPSILON );
		Assert.assertArrayEquals( new double[] { 0 }, second[ 2 ], EPSILON );
	}

	@Test
	public void testEvaluateMatchesMatrices()
	{
		final List< double[][] > positions = Arrays.asList(
				new double[][] { { 1949, 9450 }, { 1049, 7650 }, { 49, 5650 } },
				new double[][] { { 100, -4837 }, { 500, -3537 }, { 1500, -2037 } } );

		final PolynomialBasis basis = PolynomialBasisBuilder.buildPi( positions, 3 );
		for ( int tile = 0; tile < positions.size(); ++tile )
		{
			final double[][] matrix = basis.getMatrices().get( tile );
			for ( int i = 0; i < positions.get( tile ).length; ++i )
			{
				final double[] column = basis.evaluate( positions.get( tile )[ i ][ 0 ], positions.get( tile )[ i ][ 1 ] );
				for ( int m = 0; m < column.length; ++m )
					Assert.assertEquals( matrix[ m ][ i ], column[ m ], 1e-9 * Math.max( 1, Math.abs( matrix[ m ][ i ] ) ) );
			}
		}
	}

	@Test
	public void testEmptyTileAfterTheFirst()
	{
		final PolynomialBasis basis = PolynomialBasisBuilder.buildPi(
				Arrays.asList( new double[][] { { 1, 1 } }, new double[][] {} ),
				2 );
		Assert.assertEquals( 6, basis.getMatrices().get( 1 ).length );
		Assert.assertEquals( 0, basis.getMatrices().get( 1 )[ 0 ].length );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testEmptyFirstTile()
	{
		PolynomialBasisBuilder.buildPi( Arrays.asList( new double[][] {}, new double[][] { { 1, 1 } } ), 2 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testNegativeDegree()
	{
		PolynomialBasisBuilder.buildPi( Collections.singletonList( new double[][] { { 1, 1 } } ), -1 );
	}
}
