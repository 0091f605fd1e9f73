package org.janelia.multiccd;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.janelia.multiccd.catalog.CatalogBatcher;
import org.janelia.multiccd.catalog.CatalogPayloadReader;
import org.janelia.multiccd.catalog.ExposureBatch;
import org.janelia.multiccd.catalog.ExposureDataset;
import org.janelia.multiccd.catalog.JsonCatalogPayloadReader;
import org.janelia.multiccd.catalog.ObservationAssembler;
import org.janelia.multiccd.catalog.PayloadReadException;
import org.janelia.multiccd.concurrent.ExposureExecutor;
import org.janelia.multiccd.concurrent.ExposureOutcome;
import org.janelia.multiccd.geometry.CoordinateMapper;
import org.janelia.multiccd.interpolation.GridInterpolator;
import org.janelia.multiccd.math.PolynomialBasis;
import org.janelia.multiccd.math.PolynomialBasisBuilder;
import org.janelia.multiccd.shape.MomentShapeMeasurer;
import org.janelia.multiccd.shape.OutlierRejectionResult;
import org.janelia.multiccd.shape.OutlierRejector;
import org.janelia.multiccd.shape.ShapeMeasurer;

/**
 * Entry point of the preprocessing for the surrounding pipeline.
 *
 * Typical usage: {@link #batchExposures(List)} to discover the exposures, then for every exposure
 * {@link #getInputs(String)}, {@link #rejectOutliers(ExposureDataset, double)} and {@link #buildGlobalBasis(List, int)}.
 * Exposures are independent of each other; {@link #processAll(int)} runs the first two stages for all of them in parallel.
 */
public class ExposurePreprocessor
{
	private static final Logger LOG = Logger.getLogger( ExposurePreprocessor.class );

	private final PreprocessingParameters parameters;
	private final CoordinateMapper coordinateMapper;
	private final CatalogBatcher batcher;
	private final ObservationAssembler assembler;
	private final OutlierRejector outlierRejector;

	private final Map< String, ExposureBatch > exposureBatches = new LinkedHashMap<>();

	public ExposurePreprocessor( final PreprocessingParameters parameters )
	{
		this(
				parameters,
				new JsonCatalogPayloadReader( parameters.getCoordXDescriptor(), parameters.getCoordYDescriptor() ),
				new MomentShapeMeasurer() );
	}

	public ExposurePreprocessor(
			final PreprocessingParameters parameters,
			final CatalogPayloadReader payloadReader,
			final ShapeMeasurer shapeMeasurer )
	{
		this.parameters = parameters;
		coordinateMapper = new CoordinateMapper( parameters.getTileLayout() );
		batcher = new CatalogBatcher( parameters.getSeparator(), coordinateMapper.getLayout() );
		assembler = new ObservationAssembler( coordinateMapper, payloadReader, parameters.getMaskThreshold(), parameters.getApplyMaskToStamps() );
		outlierRejector = new OutlierRejector( shapeMeasurer );
	}

	public PreprocessingParameters getParameters()
	{
		return parameters;
	}

	public CoordinateMapper getCoordinateMapper()
	{
		return coordinateMapper;
	}

	/**
	 * Groups the catalog files by exposure and remembers the groups for {@link #getInputs(String)}.
	 *
	 * @return sorted exposure ids
	 */
	public List< String > batchExposures( final List< String > fileList )
	{
		return setBatches( batcher.batch( fileList ) );
	}

	/**
	 * Same as {@link #batchExposures(List)} for a pipeline input list of file tuples.
	 */
	public List< String > batchExposures( final List< ? extends List< String > > inputTuples, final int elementPosition )
	{
		return setBatches( batcher.batchTuples( inputTuples, elementPosition ) );
	}

	/**
	 * Same as {@link #batchExposures(List)} for all files in a folder matching the glob pattern.
	 */
	public List< String > batchFolder( final Path folder, final String globPattern ) throws IOException
	{
		return setBatches( batcher.batchFolder( folder, globPattern ) );
	}

	public List< String > getExposureIds()
	{
		synchronized ( exposureBatches )
		{
			return Collections.unmodifiableList( new ArrayList<>( exposureBatches.keySet() ) );
		}
	}

	/**
	 * Assembles the observations of the exposure. Outliers are not removed yet.
	 *
	 * @throws IllegalArgumentException if the exposure id is unknown
	 * @throws PayloadReadException if a tile catalog of the exposure cannot be read
	 */
	public ExposureDataset getInputs( final String exposureId ) throws PayloadReadException
	{
		final ExposureBatch batch;
		synchronized ( exposureBatches )
		{
			batch = exposureBatches.get( exposureId );
		}
		if ( batch == null )
			throw new IllegalArgumentException( "unknown exposure id: " + exposureId );

		return assembler.assemble( batch );
	}

	public OutlierRejectionResult rejectOutliers( final ExposureDataset dataset )
	{
		return rejectOutliers( dataset, parameters.getOutlierSigma() );
	}

	public OutlierRejectionResult rejectOutliers( final ExposureDataset dataset, final double sigma )
	{
		return outlierRejector.reject( dataset, sigma );
	}

	public PolynomialBasis buildGlobalBasis( final List< double[][] > positions )
	{
		return buildGlobalBasis( positions, parameters.getPolynomialDegree() );
	}

	public PolynomialBasis buildGlobalBasis( final List< double[][] > positions, final int degree )
	{
		return PolynomialBasisBuilder.buildPi( positions, degree );
	}

	/**
	 * Creates an interpolator over a {@code [tile][ix][iy]} statistic grid using the configured layout, neighbors and kernel.
	 */
	public GridInterpolator createInterpolator( final double[][][] tileGrids )
	{
		return new GridInterpolator( tileGrids, coordinateMapper, parameters.getInterpolationNeighbors(), parameters.getRbfKernel() );
	}

	public static double queryInterpolator( final GridInterpolator interpolator, final double x, final double y )
	{
		return interpolator.interpolate( x, y );
	}

	/**
	 * Assembles every batched exposure and removes its outliers, processing up to {@code numThreads} exposures at once.
	 * A failing exposure is reported in its outcome and does not stop the others.
	 */
	public List< ExposureOutcome< OutlierRejectionResult > > processAll( final int numThreads ) throws InterruptedException
	{
		final List< String > exposureIds = getExposureIds();
		LOG.info( "Processing " + exposureIds.size() + " exposures using " + numThreads + " threads" );

		try ( final ExposureExecutor executor = new ExposureExecutor( numThreads ) )
		{
			return executor.run( exposureIds, exposureId -> rejectOutliers( getInputs( exposureId ) ) );
		}
	}

	private List< String > setBatches( final List< ExposureBatch > batches )
	{
		synchronized ( exposureBatches )
		{
			exposureBatches.clear();
			for ( final ExposureBatch batch : batches )
				exposureBatches.put( batch.getExposureId(), batch );
		}
		return CatalogBatcher.getExposureIds( batches );
	}
}
