package org.janelia.multiccd.catalog;

public class PayloadReadException extends Exception
{
	private static final long serialVersionUID = 8127764960211582014L;

	public PayloadReadException()
	{
		super();
	}

	public PayloadReadException( final String message )
	{
		super( message );
	}

	public PayloadReadException( final String message, final Throwable cause )
	{
		super( message, cause );
	}

	public PayloadReadException( final Throwable cause )
	{
		super( cause );
	}
}
