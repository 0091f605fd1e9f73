package org.janelia.multiccd;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.janelia.multiccd.catalog.CatalogPayload;
import org.janelia.multiccd.catalog.CatalogPayloadReader;
import org.janelia.multiccd.catalog.ExposureDataset;
import org.janelia.multiccd.catalog.PayloadReadException;
import org.janelia.multiccd.concurrent.ExposureOutcome;
import org.janelia.multiccd.interpolation.GridInterpolator;
import org.janelia.multiccd.math.PolynomialBasis;
import org.janelia.multiccd.math.RadialBasisKernel;
import org.janelia.multiccd.shape.OutlierRejectionResult;
import org.janelia.multiccd.shape.RejectedObservation;
import org.janelia.multiccd.shape.ShapeMeasurement;
import org.janelia.multiccd.shape.ShapeMeasurer;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;

public class ExposurePreprocessorTest
{
	private static final double EPSILON = 1e-9;

	@Rule
	public TemporaryFolder tempFolder = new TemporaryFolder();

	/**
	 * Uses the first stamp pixel as g1 of the star.
	 */
	private static final ShapeMeasurer FIRST_PIXEL_MEASURER = ( stamp, badPixelMask ) -> {
		final RandomAccess< DoubleType > access = stamp.randomAccess();
		access.setPosition( new long[] { 0, 0 } );
		return new ShapeMeasurement( access.get().get(), 0, 1.5, false );
	};

	private static CatalogPayload createPayload( final double[] x, final double[] y, final double[] g1 )
	{
		final List< RandomAccessibleInterval< DoubleType > > stamps = new ArrayList<>();
		for ( final double value : g1 )
			stamps.add( ArrayImgs.doubles( new double[] { value, 1, 1, -1e30 }, 2, 2 ) );
		return new CatalogPayload( stamps, x, y, x.clone(), null, null );
	}

	/**
	 * Two tiles of one exposure, three stars each; the third star of tile 22 has an aberrant shape.
	 */
	private static Map< String, CatalogPayload > createExposure()
	{
		final Map< String, CatalogPayload > payloads = new HashMap<>();
		payloads.put( "/data/star_selection-2079614-04.fits", createPayload(
				new double[] { 100, 1000, 2000 },
				new double[] { 200, 2000, 4000 },
				new double[] { 0.05, 0.05, 0.05 } ) );
		payloads.put( "/data/star_selection-2079614-22.fits", createPayload(
				new double[] { 100, 500, 1500 },
				new double[] { 200, 1500, 3000 },
				new double[] { 0.05, 0.05, 0.9 } ) );
		return payloads;
	}

	private static ExposurePreprocessor createPreprocessor( final Map< String, CatalogPayload > payloads, final PreprocessingParameters parameters )
	{
		final CatalogPayloadReader reader = path -> {
			if ( !payloads.containsKey( path ) )
				throw new PayloadReadException( "no such catalog: " + path );
			return payloads.get( path );
		};
		return new ExposurePreprocessor( parameters, reader, FIRST_PIXEL_MEASURER );
	}

	@Test
	public void testTwoTileExposure() throws PayloadReadException
	{
		final Map< String, CatalogPayload > payloads = createExposure();
		final ExposurePreprocessor preprocessor = createPreprocessor( payloads, new PreprocessingParameters() );

		final List< String > exposureIds = preprocessor.batchExposures( Arrays.asList(
				"/data/star_selection-2079614-04.fits",
				"/data/star_selection-2079614-22.fits" ) );
		Assert.assertEquals( Arrays.asList( "2079614" ), exposureIds );
		Assert.assertEquals( exposureIds, preprocessor.getExposureIds() );

		final ExposureDataset dataset = preprocessor.getInputs( "2079614" );
		Assert.assertArrayEquals( new int[] { 4, 22 }, dataset.getTileIds() );
		Assert.assertEquals( 6, dataset.numObservations() );

		final double[][] tile4 = dataset.getGlobalPositions().get( 0 );
		Assert.assertArrayEquals( new double[] { 1949, 9450 }, tile4[ 0 ], EPSILON );
		Assert.assertArrayEquals( new double[] { 1049, 7650 }, tile4[ 1 ], EPSILON );
		Assert.assertArrayEquals( new double[] { 49, 5650 }, tile4[ 2 ], EPSILON );

		final double[][] tile22 = dataset.getGlobalPositions().get( 1 );
		Assert.assertArrayEquals( new double[] { 100, -4837 }, tile22[ 0 ], EPSILON );
		Assert.assertArrayEquals( new double[] { 500, -3537 }, tile22[ 1 ], EPSILON );
		Assert.assertArrayEquals( new double[] { 1500, -2037 }, tile22[ 2 ], EPSILON );

		Assert.assertTrue( dataset.getSnr().isPresent() );
		Assert.assertFalse( dataset.getSkyX().isPresent() );

		// with only six stars a deviation of five sigma cannot be reached
		Assert.assertTrue( preprocessor.rejectOutliers( dataset ).getRejected().isEmpty() );

		final OutlierRejectionResult result = preprocessor.rejectOutliers( dataset, 2 );
		Assert.assertEquals( 1, result.getRejected().size() );
		final RejectedObservation rejected = result.getRejected().get( 0 );
		Assert.assertEquals( 5, rejected.getGlobalIndex() );
		Assert.assertEquals( 2, rejected.getIntraTileIndex() );
		Assert.assertEquals( 22, rejected.getTileId() );

		final ExposureDataset clean = result.getCleanDataset();
		Assert.assertEquals( 5, clean.numObservations() );
		Assert.assertEquals( 3, clean.getGlobalPositions().get( 0 ).length );
		Assert.assertEquals( 2, clean.getGlobalPositions().get( 1 ).length );
		Assert.assertArrayEquals( new double[] { 100, 500 }, clean.getSnr().get().get( 1 ), EPSILON );

		final PolynomialBasis basis = preprocessor.buildGlobalBasis( clean.getGlobalPositions() );
		Assert.assertEquals( 3, basis.getMaxDegree() );
		Assert.assertEquals( 10, basis.getMatrices().get( 0 ).length );
		Assert.assertEquals( 1, basis.getMatrices().get( 0 )[ 0 ][ 0 ], 0 );
		Assert.assertEquals( 2, basis.getMatrices().get( 1 )[ 0 ].length );
	}

	@Test
	public void testMaskAppliedToStamps() throws PayloadReadException
	{
		final ExposurePreprocessor preprocessor = createPreprocessor( createExposure(), new PreprocessingParameters() );
		preprocessor.batchExposures( new ArrayList<>( createExposure().keySet() ) );

		final ExposureDataset dataset = preprocessor.getInputs( "2079614" );
		final RandomAccess< DoubleType > stampAccess = dataset.getStamps().get( 0 ).get( 0 ).randomAccess();
		final RandomAccess< DoubleType > maskAccess = dataset.getMasks().get( 0 ).get( 0 ).randomAccess();
		stampAccess.setPosition( new long[] { 1, 1 } );
		maskAccess.setPosition( new long[] { 1, 1 } );
		Assert.assertEquals( 0, stampAccess.get().get(), 0 );
		Assert.assertEquals( 0, maskAccess.get().get(), 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testUnknownExposure() throws PayloadReadException
	{
		final ExposurePreprocessor preprocessor = createPreprocessor( createExposure(), new PreprocessingParameters() );
		preprocessor.batchExposures( Arrays.asList( "/data/star_selection-2079614-04.fits" ) );
		preprocessor.getInputs( "1234567" );
	}

	@Test
	public void testBatchTuples()
	{
		final ExposurePreprocessor preprocessor = createPreprocessor( createExposure(), new PreprocessingParameters() );
		final List< String > exposureIds = preprocessor.batchExposures( Arrays.asList(
				Arrays.asList( "train-200-04.fits", "test-200-04.fits" ),
				Arrays.asList( "train-100-04.fits", "test-100-04.fits" ) ), 0 );
		Assert.assertEquals( Arrays.asList( "100", "200" ), exposureIds );
	}

	@Test
	public void testProcessAllIsolatesFailures() throws InterruptedException
	{
		final ExposurePreprocessor preprocessor = createPreprocessor( createExposure(), new PreprocessingParameters() );
		preprocessor.batchExposures( Arrays.asList(
				"/data/star_selection-2079614-04.fits",
				"/data/star_selection-2079614-22.fits",
				"/data/star_selection-1000000-04.fits" ) );

		final List< ExposureOutcome< OutlierRejectionResult > > outcomes = preprocessor.processAll( 2 );
		Assert.assertEquals( 2, outcomes.size() );

		Assert.assertEquals( "1000000", outcomes.get( 0 ).getExposureId() );
		Assert.assertFalse( outcomes.get( 0 ).isSuccessful() );
		Assert.assertTrue( outcomes.get( 0 ).getError() instanceof PayloadReadException );

		Assert.assertEquals( "2079614", outcomes.get( 1 ).getExposureId() );
		Assert.assertTrue( outcomes.get( 1 ).isSuccessful() );
		Assert.assertEquals( 6, outcomes.get( 1 ).getResult().getCleanDataset().numObservations() );
	}

	@Test
	public void testInterpolator()
	{
		final PreprocessingParameters parameters = new PreprocessingParameters();
		parameters.setInterpolationNeighbors( 4 );
		parameters.setRbfKernel( RadialBasisKernel.GAUSSIAN );
		final ExposurePreprocessor preprocessor = createPreprocessor( createExposure(), parameters );

		final double[][][] grids = new double[ 40 ][ 2 ][ 2 ];
		for ( int tile = 0; tile < grids.length; ++tile )
			for ( int ix = 0; ix < 2; ++ix )
				for ( int iy = 0; iy < 2; ++iy )
					grids[ tile ][ ix ][ iy ] = tile + ix + 2 * iy;

		final GridInterpolator interpolator = preprocessor.createInterpolator( grids );
		Assert.assertEquals( 4, interpolator.getNumNeighbors() );
		Assert.assertEquals( RadialBasisKernel.GAUSSIAN, interpolator.getKernel() );

		final double[] position = interpolator.getGridMap().getGlobalPosition( 39, 1, 0 );
		Assert.assertEquals(
				interpolator.getGridMap().getValue( 39, 1, 0 ),
				ExposurePreprocessor.queryInterpolator( interpolator, position[ 0 ], position[ 1 ] ),
				1e-8 );
	}

	@Test
	public void testFolderWithJsonCatalogs() throws Exception
	{
		final String[] names = new String[] { "star_selection-555-09.json", "star_selection-555-27.json" };
		for ( final String name : names )
		{
			final File file = tempFolder.newFile( name );
			Files.write( file.toPath(), createJsonCatalog().getBytes( StandardCharsets.UTF_8 ) );
		}
		tempFolder.newFile( "readme.txt" );

		final ExposurePreprocessor preprocessor = new ExposurePreprocessor( new PreprocessingParameters() );
		Assert.assertEquals( Arrays.asList( "555" ), preprocessor.batchFolder( tempFolder.getRoot().toPath(), "star_selection*.json" ) );

		final List< ExposureOutcome< OutlierRejectionResult > > outcomes = preprocessor.processAll( 1 );
		Assert.assertTrue( outcomes.get( 0 ).isSuccessful() );

		final ExposureDataset dataset = outcomes.get( 0 ).getResult().getCleanDataset();
		Assert.assertArrayEquals( new int[] { 9, 27 }, dataset.getTileIds() );
		Assert.assertEquals( 4, dataset.numObservations() );
		Assert.assertFalse( dataset.getSnr().isPresent() );
	}

	/**
	 * Two identical elongated stars on 15x15 stamps with one masked corner pixel.
	 */
	private static String createJsonCatalog()
	{
		final double cxx = 3, cyy = 2, cxy = 0.5, det = cxx * cyy - cxy * cxy;
		final StringBuilder vignet = new StringBuilder( "[" );
		for ( int star = 0; star < 2; ++star )
		{
			vignet.append( star == 0 ? "[" : ",[" );
			for ( int y = 0; y < 15; ++y )
			{
				vignet.append( y == 0 ? "[" : ",[" );
				for ( int x = 0; x < 15; ++x )
				{
					final double dx = x - 7, dy = y - 7;
					final double r = ( cyy * dx * dx - 2 * cxy * dx * dy + cxx * dy * dy ) / det;
					final double value = x == 0 && y == 0 ? -1e30 : 100 * Math.exp( -0.5 * r );
					vignet.append( x == 0 ? "" : "," ).append( value );
				}
				vignet.append( "]" );
			}
			vignet.append( "]" );
		}
		vignet.append( "]" );

		return "{ \"XWIN_IMAGE\": [ 10, 20 ], \"YWIN_IMAGE\": [ 30, 40 ], \"VIGNET\": " + vignet + " }";
	}
}
