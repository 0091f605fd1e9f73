package org.janelia.multiccd.math;

import org.ojalgo.matrix.decomposition.LU;
import org.ojalgo.matrix.store.MatrixStore;
import org.ojalgo.matrix.store.PhysicalStore;
import org.ojalgo.matrix.store.PrimitiveDenseStore;

/**
 * Scalar radial basis function interpolant {@code f(p) = sum_i w_i phi(|p - p_i|)} passing through the given samples.
 * The weights are obtained by solving the dense interpolation system with an LU decomposition.
 */
public class RadialBasisFunction
{
	private final RadialBasisKernel kernel;
	private final double epsilon;
	private final double[][] nodes;
	private final double[] weights;

	private RadialBasisFunction( final RadialBasisKernel kernel, final double epsilon, final double[][] nodes, final double[] weights )
	{
		this.kernel = kernel;
		this.epsilon = epsilon;
		this.nodes = nodes;
		this.weights = weights;
	}

	/**
	 * Fits the interpolant using the default shape parameter (see {@link #defaultEpsilon(double[][])}).
	 */
	public static RadialBasisFunction fit( final double[][] nodes, final double[] values, final RadialBasisKernel kernel )
	{
		return fit( nodes, values, kernel, defaultEpsilon( nodes ) );
	}

	/**
	 * @throws IllegalStateException if the interpolation system is singular (e.g. duplicate nodes)
	 */
	public static RadialBasisFunction fit( final double[][] nodes, final double[] values, final RadialBasisKernel kernel, final double epsilon )
	{
		if ( nodes.length != values.length )
			throw new IllegalArgumentException( "number of nodes " + nodes.length + " does not match number of values " + values.length );
		if ( nodes.length == 0 )
			throw new IllegalArgumentException( "at least one node is required" );

		final int n = nodes.length;
		final PhysicalStore.Factory< Double, PrimitiveDenseStore > storeFactory = PrimitiveDenseStore.FACTORY;
		final PrimitiveDenseStore system = storeFactory.makeZero( n, n );
		final PrimitiveDenseStore rhs = storeFactory.makeZero( n, 1 );
		for ( int row = 0; row < n; ++row )
		{
			for ( int col = 0; col < n; ++col )
				system.set( row, col, kernel.apply( distance( nodes[ row ], nodes[ col ] ), epsilon ) );
			rhs.set( row, 0, values[ row ] );
		}

		final LU< Double > lu = LU.PRIMITIVE.make( system );
		if ( !lu.decompose( system ) || !lu.isSolvable() )
			throw new IllegalStateException( "radial basis function system with " + n + " nodes is singular" );

		final MatrixStore< Double > solution = lu.getSolution( rhs );
		final double[] weights = new double[ n ];
		for ( int i = 0; i < n; ++i )
			weights[ i ] = solution.doubleValue( i, 0 );

		final double[][] nodesCopy = new double[ n ][];
		for ( int i = 0; i < n; ++i )
			nodesCopy[ i ] = nodes[ i ].clone();

		return new RadialBasisFunction( kernel, epsilon, nodesCopy, weights );
	}

	public double evaluate( final double... position )
	{
		double value = 0;
		for ( int i = 0; i < nodes.length; ++i )
			value += weights[ i ] * kernel.apply( distance( position, nodes[ i ] ), epsilon );
		return value;
	}

	public RadialBasisKernel getKernel()
	{
		return kernel;
	}

	public double getEpsilon()
	{
		return epsilon;
	}

	public double[] getWeights()
	{
		return weights;
	}

	/**
	 * Average spacing of the nodes: the geometric mean of the non-degenerate bounding box edges
	 * divided by the number of nodes, i.e. {@code (prod(edges) / n)^(1 / numEdges)}.
	 * Falls back to 1 if all nodes coincide.
	 */
	public static double defaultEpsilon( final double[][] nodes )
	{
		final int dim = nodes[ 0 ].length;
		double edgesProduct = 1;
		int numEdges = 0;
		for ( int d = 0; d < dim; ++d )
		{
			double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
			for ( final double[] node : nodes )
			{
				min = Math.min( node[ d ], min );
				max = Math.max( node[ d ], max );
			}
			if ( max - min != 0 )
			{
				edgesProduct *= max - min;
				++numEdges;
			}
		}
		return numEdges == 0 ? 1 : Math.pow( edgesProduct / nodes.length, 1.0 / numEdges );
	}

	static double distance( final double[] a, final double[] b )
	{
		double sum = 0;
		for ( int d = 0; d < a.length; ++d )
			sum += ( a[ d ] - b[ d ] ) * ( a[ d ] - b[ d ] );
		return Math.sqrt( sum );
	}
}
