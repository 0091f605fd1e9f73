package org.janelia.multiccd.catalog;

import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import net.imglib2.img.array.ArrayImgs;

public class ExposureDatasetTest
{
	private static Observation observation( final Double snr, final double[] skyPosition )
	{
		return new Observation(
				4,
				ArrayImgs.doubles( 1, 1 ),
				ArrayImgs.doubles( new double[] { 1 }, 1, 1 ),
				new double[] { 100, 200 },
				new double[] { 1949, 9450 },
				snr,
				skyPosition );
	}

	private static List< TileObservations > tiles( final Observation... observations )
	{
		return Arrays.asList( new TileObservations( 4, Arrays.asList( observations ) ) );
	}

	@Test
	public void testOptionalColumns()
	{
		final ExposureDataset dataset = new ExposureDataset(
				"1",
				tiles( observation( 10.0, new double[] { 210, 54 } ), observation( 20.0, new double[] { 211, 55 } ) ),
				true,
				true );
		Assert.assertArrayEquals( new double[] { 10, 20 }, dataset.getSnr().get().get( 0 ), 0 );
		Assert.assertArrayEquals( new double[] { 210, 211 }, dataset.getSkyX().get().get( 0 ), 0 );
		Assert.assertArrayEquals( new double[] { 54, 55 }, dataset.getSkyY().get().get( 0 ), 0 );

		// values carried by the observations are ignored when marked as unavailable
		final ExposureDataset withoutOptional = new ExposureDataset( "1", dataset.getTiles(), false, false );
		Assert.assertFalse( withoutOptional.getSnr().isPresent() );
		Assert.assertFalse( withoutOptional.getSkyX().isPresent() );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testMissingSnrMarkedAvailable()
	{
		new ExposureDataset( "1", tiles( observation( 10.0, null ), observation( null, null ) ), true, false );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testMissingSkyMarkedAvailable()
	{
		new ExposureDataset( "1", tiles( observation( null, new double[] { 210, 54 } ), observation( null, null ) ), false, true );
	}
}
