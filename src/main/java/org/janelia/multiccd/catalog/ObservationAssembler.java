package org.janelia.multiccd.catalog;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;
import org.janelia.multiccd.geometry.CoordinateMapper;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Assembles the observations of one exposure from its tile catalogs:
 * converts local star positions into the global frame, builds stamp masks and collects optional per-star quantities.
 */
public class ObservationAssembler
{
	private static final Logger LOG = Logger.getLogger( ObservationAssembler.class );

	private final CoordinateMapper coordinateMapper;
	private final CatalogPayloadReader payloadReader;
	private final double maskThreshold;
	private final boolean applyMaskToStamps;

	public ObservationAssembler( final CoordinateMapper coordinateMapper, final CatalogPayloadReader payloadReader )
	{
		this( coordinateMapper, payloadReader, MaskBuilder.DEFAULT_THRESHOLD, true );
	}

	public ObservationAssembler(
			final CoordinateMapper coordinateMapper,
			final CatalogPayloadReader payloadReader,
			final double maskThreshold,
			final boolean applyMaskToStamps )
	{
		this.coordinateMapper = coordinateMapper;
		this.payloadReader = payloadReader;
		this.maskThreshold = maskThreshold;
		this.applyMaskToStamps = applyMaskToStamps;
	}

	/**
	 * Reads every tile catalog of the batch and assembles the exposure dataset.
	 * Nothing is returned if any of the catalogs cannot be read.
	 *
	 * @throws PayloadReadException if a tile catalog cannot be read
	 */
	public ExposureDataset assemble( final ExposureBatch batch ) throws PayloadReadException
	{
		LOG.info( "Extracting exposure " + batch.getExposureId() + " from " + batch.size() + " tile catalogs" );

		final List< CatalogPayload > payloads = new ArrayList<>();
		for ( final CatalogRecord record : batch.getRecords() )
		{
			final CatalogPayload payload = payloadReader.readPayload( record.getPath() );
			if ( payload == null )
				throw new PayloadReadException( "no payload was returned for " + record.getPath() );
			payloads.add( payload );
		}

		boolean snrAvailable = true, skyAvailable = true;
		for ( final CatalogPayload payload : payloads )
		{
			snrAvailable &= payload.hasSnr();
			skyAvailable &= payload.hasSkyCoordinates();
		}
		if ( !snrAvailable )
			LOG.info( "SNR values are not available for all tiles of exposure " + batch.getExposureId() + ", omitting them" );
		if ( !skyAvailable )
			LOG.info( "Sky coordinates are not available for all tiles of exposure " + batch.getExposureId() + ", omitting them" );

		final List< TileObservations > tiles = new ArrayList<>();
		for ( int i = 0; i < payloads.size(); ++i )
			tiles.add( assembleTile( batch.getRecords().get( i ).getTileId(), payloads.get( i ), snrAvailable, skyAvailable ) );

		return new ExposureDataset( batch.getExposureId(), tiles, snrAvailable, skyAvailable );
	}

	private TileObservations assembleTile(
			final int tileId,
			final CatalogPayload payload,
			final boolean withSnr,
			final boolean withSky )
	{
		final double[][] globalPositions = coordinateMapper.toGlobal( tileId, payload.getLocalX(), payload.getLocalY() );

		final List< Observation > observations = new ArrayList<>();
		for ( int i = 0; i < payload.size(); ++i )
		{
			final RandomAccessibleInterval< DoubleType > stamp = payload.getStamps().get( i );
			final RandomAccessibleInterval< DoubleType > mask = MaskBuilder.handleMask( stamp, maskThreshold, applyMaskToStamps );

			observations.add( new Observation(
					tileId,
					stamp,
					mask,
					new double[] { payload.getLocalX()[ i ], payload.getLocalY()[ i ] },
					globalPositions[ i ],
					withSnr ? payload.getSnr()[ i ] : null,
					withSky ? new double[] { payload.getSkyX()[ i ], payload.getSkyY()[ i ] } : null ) );
		}
		return new TileObservations( tileId, observations );
	}
}
