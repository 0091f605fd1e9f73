package org.janelia.multiccd.geometry;

import java.io.Serializable;

/**
 * Position of one tile within the mosaic, expressed in whole tile steps relative to the central tile,
 * and the orientation of its local pixel grid.
 *
 * A flipped tile has its local origin in the opposite corner with respect to the global frame,
 * i.e. its local coordinate system is rotated by 180 degrees.
 */
public class TilePlacement implements Serializable
{
	private static final long serialVersionUID = 4186623310596153032L;

	private final int columnOffset;
	private final int rowOffset;
	private final boolean flipped;

	public TilePlacement( final int columnOffset, final int rowOffset, final boolean flipped )
	{
		this.columnOffset = columnOffset;
		this.rowOffset = rowOffset;
		this.flipped = flipped;
	}

	public int getColumnOffset()
	{
		return columnOffset;
	}

	public int getRowOffset()
	{
		return rowOffset;
	}

	public boolean isFlipped()
	{
		return flipped;
	}

	@Override
	public String toString()
	{
		return "(" + columnOffset + ", " + rowOffset + ( flipped ? ", flipped)" : ")" );
	}
}
