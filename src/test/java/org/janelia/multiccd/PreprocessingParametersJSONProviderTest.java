package org.janelia.multiccd;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

import org.janelia.multiccd.geometry.TileLayout;
import org.janelia.multiccd.math.RadialBasisKernel;
import org.junit.Assert;
import org.junit.Test;

public class PreprocessingParametersJSONProviderTest
{
	@Test
	public void testDefaults() throws IOException
	{
		final PreprocessingParameters parameters = PreprocessingParametersJSONProvider.loadParameters( new StringReader( "{}" ) );
		Assert.assertEquals( "-", parameters.getSeparator() );
		Assert.assertEquals( "XWIN_IMAGE", parameters.getCoordXDescriptor() );
		Assert.assertEquals( -1e5, parameters.getMaskThreshold(), 0 );
		Assert.assertTrue( parameters.getApplyMaskToStamps() );
		Assert.assertEquals( 5, parameters.getOutlierSigma(), 0 );
		Assert.assertEquals( 3, parameters.getPolynomialDegree() );
		Assert.assertEquals( 1000, parameters.getInterpolationNeighbors() );
		Assert.assertEquals( RadialBasisKernel.THIN_PLATE, parameters.getRbfKernel() );

		final TileLayout layout = parameters.getTileLayout();
		Assert.assertEquals( 2118, layout.getXStep() );
		Assert.assertEquals( 5037, layout.getYStep() );

		Assert.assertNotNull( PreprocessingParametersJSONProvider.loadParameters( new StringReader( "" ) ) );
	}

	@Test
	public void testPartialOverride() throws IOException
	{
		final PreprocessingParameters parameters = PreprocessingParametersJSONProvider.loadParameters( new StringReader(
				"{ \"outlierSigma\": 3.5, \"rbfKernel\": \"gaussian\", \"xGap\": 100, \"applyMaskToStamps\": false }" ) );

		Assert.assertEquals( 3.5, parameters.getOutlierSigma(), 0 );
		Assert.assertEquals( RadialBasisKernel.GAUSSIAN, parameters.getRbfKernel() );
		Assert.assertFalse( parameters.getApplyMaskToStamps() );
		Assert.assertEquals( 2148, parameters.getTileLayout().getXStep() );
		Assert.assertEquals( 3, parameters.getPolynomialDegree() );
	}

	@Test
	public void testSaveAndLoad() throws IOException
	{
		final PreprocessingParameters parameters = new PreprocessingParameters();
		parameters.setSeparator( "_" );
		parameters.setPolynomialDegree( 5 );
		parameters.setRbfKernel( RadialBasisKernel.INVERSE_MULTIQUADRIC );
		parameters.setTileGeometry( 10, 20, 100, 200 );

		final StringWriter writer = new StringWriter();
		PreprocessingParametersJSONProvider.saveParameters( parameters, writer );
		Assert.assertTrue( writer.toString().contains( "\"rbfKernel\": \"inverse\"" ) );

		final PreprocessingParameters loaded = PreprocessingParametersJSONProvider.loadParameters( new StringReader( writer.toString() ) );
		Assert.assertEquals( "_", loaded.getSeparator() );
		Assert.assertEquals( 5, loaded.getPolynomialDegree() );
		Assert.assertEquals( RadialBasisKernel.INVERSE_MULTIQUADRIC, loaded.getRbfKernel() );
		Assert.assertEquals( 110, loaded.getTileLayout().getXStep() );
		Assert.assertEquals( 220, loaded.getTileLayout().getYStep() );
	}
}
