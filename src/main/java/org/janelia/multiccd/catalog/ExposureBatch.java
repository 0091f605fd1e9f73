package org.janelia.multiccd.catalog;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Catalog records of all tiles that belong to the same exposure, in discovery order.
 */
public class ExposureBatch implements Serializable
{
	private static final long serialVersionUID = 6602471549919426106L;

	private final String exposureId;
	private final List< CatalogRecord > records;

	/**
	 * @throws DuplicateTileException if the same tile id occurs more than once
	 * @throws IllegalArgumentException if any of the records belongs to a different exposure
	 */
	public ExposureBatch( final String exposureId, final List< CatalogRecord > records )
	{
		final Set< Integer > tileIds = new HashSet<>();
		for ( final CatalogRecord record : records )
		{
			if ( !exposureId.equals( record.getExposureId() ) )
				throw new IllegalArgumentException( "record " + record + " does not belong to exposure " + exposureId );

			if ( !tileIds.add( record.getTileId() ) )
				throw new DuplicateTileException( exposureId, record.getTileId() );
		}

		this.exposureId = exposureId;
		this.records = Collections.unmodifiableList( new ArrayList<>( records ) );
	}

	public String getExposureId()
	{
		return exposureId;
	}

	public List< CatalogRecord > getRecords()
	{
		return records;
	}

	public int size()
	{
		return records.size();
	}

	public int[] getTileIds()
	{
		final int[] tileIds = new int[ records.size() ];
		for ( int i = 0; i < tileIds.length; ++i )
			tileIds[ i ] = records.get( i ).getTileId();
		return tileIds;
	}
}
