package org.janelia.multiccd.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Assembled observations of one exposure grouped per tile.
 *
 * Availability of the SNR values and of the sky coordinates is decided for the whole exposure:
 * if any tile catalog lacks them, they are absent for every tile.
 * If they are marked as available, every observation has to carry them.
 */
public class ExposureDataset
{
	private final String exposureId;
	private final List< TileObservations > tiles;
	private final boolean snrAvailable;
	private final boolean skyAvailable;

	public ExposureDataset(
			final String exposureId,
			final List< TileObservations > tiles,
			final boolean snrAvailable,
			final boolean skyAvailable )
	{
		for ( final TileObservations tile : tiles )
		{
			for ( final Observation observation : tile.getObservations() )
			{
				if ( snrAvailable && observation.getSnr() == null )
					throw new IllegalArgumentException( "SNR is marked as available but missing for a star of tile " + tile.getTileId() );
				if ( skyAvailable && observation.getSkyPosition() == null )
					throw new IllegalArgumentException( "sky coordinates are marked as available but missing for a star of tile " + tile.getTileId() );
			}
		}

		this.exposureId = exposureId;
		this.tiles = Collections.unmodifiableList( new ArrayList<>( tiles ) );
		this.snrAvailable = snrAvailable;
		this.skyAvailable = skyAvailable;
	}

	public String getExposureId()
	{
		return exposureId;
	}

	public List< TileObservations > getTiles()
	{
		return tiles;
	}

	public int numTiles()
	{
		return tiles.size();
	}

	public int numObservations()
	{
		int count = 0;
		for ( final TileObservations tile : tiles )
			count += tile.size();
		return count;
	}

	public int[] getTileIds()
	{
		final int[] tileIds = new int[ tiles.size() ];
		for ( int i = 0; i < tileIds.length; ++i )
			tileIds[ i ] = tiles.get( i ).getTileId();
		return tileIds;
	}

	public List< List< RandomAccessibleInterval< DoubleType > > > getStamps()
	{
		final List< List< RandomAccessibleInterval< DoubleType > > > stamps = new ArrayList<>();
		for ( final TileObservations tile : tiles )
			stamps.add( tile.getStamps() );
		return stamps;
	}

	public List< List< RandomAccessibleInterval< DoubleType > > > getMasks()
	{
		final List< List< RandomAccessibleInterval< DoubleType > > > masks = new ArrayList<>();
		for ( final TileObservations tile : tiles )
			masks.add( tile.getMasks() );
		return masks;
	}

	public List< double[][] > getGlobalPositions()
	{
		final List< double[][] > positions = new ArrayList<>();
		for ( final TileObservations tile : tiles )
			positions.add( tile.getGlobalPositions() );
		return positions;
	}

	public boolean isSnrAvailable()
	{
		return snrAvailable;
	}

	public boolean isSkyAvailable()
	{
		return skyAvailable;
	}

	public Optional< List< double[] > > getSnr()
	{
		if ( !snrAvailable )
			return Optional.empty();

		final List< double[] > snr = new ArrayList<>();
		for ( final TileObservations tile : tiles )
			snr.add( tile.getSnr() );
		return Optional.of( snr );
	}

	public Optional< List< double[] > > getSkyX()
	{
		return getSkyCoordinate( 0 );
	}

	public Optional< List< double[] > > getSkyY()
	{
		return getSkyCoordinate( 1 );
	}

	/**
	 * Creates a dataset of the same exposure with replaced per-tile observations.
	 */
	public ExposureDataset withTiles( final List< TileObservations > newTiles )
	{
		return new ExposureDataset( exposureId, newTiles, snrAvailable, skyAvailable );
	}

	private Optional< List< double[] > > getSkyCoordinate( final int d )
	{
		if ( !skyAvailable )
			return Optional.empty();

		final List< double[] > sky = new ArrayList<>();
		for ( final TileObservations tile : tiles )
			sky.add( tile.getSkyCoordinate( d ) );
		return Optional.of( sky );
	}
}
