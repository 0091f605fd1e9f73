package org.janelia.multiccd.math;

/**
 * Radial kernels {@code phi(r)} for scattered data interpolation.
 * Kernels that depend on a shape parameter use {@code epsilon} as the length scale.
 */
public enum RadialBasisKernel
{
	MULTIQUADRIC( "multiquadric" )
	{
		@Override
		public double apply( final double r, final double epsilon )
		{
			return Math.sqrt( ( r / epsilon ) * ( r / epsilon ) + 1 );
		}
	},
	INVERSE_MULTIQUADRIC( "inverse" )
	{
		@Override
		public double apply( final double r, final double epsilon )
		{
			return 1.0 / Math.sqrt( ( r / epsilon ) * ( r / epsilon ) + 1 );
		}
	},
	GAUSSIAN( "gaussian" )
	{
		@Override
		public double apply( final double r, final double epsilon )
		{
			return Math.exp( -( r / epsilon ) * ( r / epsilon ) );
		}
	},
	LINEAR( "linear" )
	{
		@Override
		public double apply( final double r, final double epsilon )
		{
			return r;
		}
	},
	CUBIC( "cubic" )
	{
		@Override
		public double apply( final double r, final double epsilon )
		{
			return r * r * r;
		}
	},
	QUINTIC( "quintic" )
	{
		@Override
		public double apply( final double r, final double epsilon )
		{
			return r * r * r * r * r;
		}
	},
	THIN_PLATE( "thin-plate" )
	{
		@Override
		public double apply( final double r, final double epsilon )
		{
			// r^2 log(r) with the limit value at r = 0
			return r == 0 ? 0 : r * r * Math.log( r );
		}
	};

	private final String name;

	private RadialBasisKernel( final String name )
	{
		this.name = name;
	}

	public abstract double apply( double r, double epsilon );

	public String getName()
	{
		return name;
	}

	/**
	 * Parses a kernel name such as {@code thin-plate}, {@code thin_plate} or {@code THIN_PLATE}.
	 */
	public static RadialBasisKernel fromName( final String name )
	{
		final String normalized = name.trim().toLowerCase().replace( '_', '-' );
		for ( final RadialBasisKernel kernel : values() )
			if ( kernel.name.equals( normalized ) || kernel.name().toLowerCase().replace( '_', '-' ).equals( normalized ) )
				return kernel;
		throw new IllegalArgumentException( "unknown radial basis function: " + name );
	}

	@Override
	public String toString()
	{
		return name;
	}
}
