package org.janelia.multiccd.concurrent;

/**
 * Result of processing one exposure: either a value or the error that stopped it.
 */
public class ExposureOutcome< R >
{
	private final String exposureId;
	private final R result;
	private final Throwable error;

	private ExposureOutcome( final String exposureId, final R result, final Throwable error )
	{
		this.exposureId = exposureId;
		this.result = result;
		this.error = error;
	}

	public static < R > ExposureOutcome< R > success( final String exposureId, final R result )
	{
		return new ExposureOutcome<>( exposureId, result, null );
	}

	public static < R > ExposureOutcome< R > failure( final String exposureId, final Throwable error )
	{
		return new ExposureOutcome<>( exposureId, null, error );
	}

	public String getExposureId()
	{
		return exposureId;
	}

	public boolean isSuccessful()
	{
		return error == null;
	}

	public R getResult()
	{
		return result;
	}

	public Throwable getError()
	{
		return error;
	}
}
