package org.janelia.multiccd.shape;

import java.util.Collections;
import java.util.List;

import org.janelia.multiccd.catalog.ExposureDataset;

public class OutlierRejectionResult
{
	private final ExposureDataset cleanDataset;
	private final List< RejectedObservation > rejected;
	private final List< boolean[] > eraseMasks;
	private final double[] thresholds;

	public OutlierRejectionResult(
			final ExposureDataset cleanDataset,
			final List< RejectedObservation > rejected,
			final List< boolean[] > eraseMasks,
			final double[] thresholds )
	{
		this.cleanDataset = cleanDataset;
		this.rejected = Collections.unmodifiableList( rejected );
		this.eraseMasks = Collections.unmodifiableList( eraseMasks );
		this.thresholds = thresholds;
	}

	public ExposureDataset getCleanDataset()
	{
		return cleanDataset;
	}

	public List< RejectedObservation > getRejected()
	{
		return rejected;
	}

	/**
	 * @return per-tile flags where {@code true} marks a removed observation, indexed as in the input dataset
	 */
	public List< boolean[] > getEraseMasks()
	{
		return eraseMasks;
	}

	/**
	 * @return thresholds for |g1|, |g2| and |R2|
	 */
	public double[] getThresholds()
	{
		return thresholds;
	}
}
