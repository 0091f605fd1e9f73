package org.janelia.multiccd.shape;

/**
 * Diagnostic record of an observation removed by the outlier rejection.
 */
public class RejectedObservation
{
	private final int globalIndex;
	private final int intraTileIndex;
	private final int tileIndex;
	private final int tileId;
	private final ShapeMeasurement shape;

	public RejectedObservation( final int globalIndex, final int intraTileIndex, final int tileIndex, final int tileId, final ShapeMeasurement shape )
	{
		this.globalIndex = globalIndex;
		this.intraTileIndex = intraTileIndex;
		this.tileIndex = tileIndex;
		this.tileId = tileId;
		this.shape = shape;
	}

	/**
	 * @return index of the observation among all observations of the exposure
	 */
	public int getGlobalIndex()
	{
		return globalIndex;
	}

	/**
	 * @return index of the observation within its tile
	 */
	public int getIntraTileIndex()
	{
		return intraTileIndex;
	}

	/**
	 * @return position of the tile within the exposure dataset
	 */
	public int getTileIndex()
	{
		return tileIndex;
	}

	public int getTileId()
	{
		return tileId;
	}

	public ShapeMeasurement getShape()
	{
		return shape;
	}

	@Override
	public String toString()
	{
		return "Outlier: globalIndex=" + globalIndex + ", intraTileIndex=" + intraTileIndex + ", tileId=" + tileId + " [" + shape + "]";
	}
}
