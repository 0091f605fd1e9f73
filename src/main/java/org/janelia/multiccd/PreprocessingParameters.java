package org.janelia.multiccd;

import java.io.Serializable;

import org.janelia.multiccd.catalog.CatalogBatcher;
import org.janelia.multiccd.catalog.JsonCatalogPayloadReader;
import org.janelia.multiccd.catalog.MaskBuilder;
import org.janelia.multiccd.geometry.TileLayout;
import org.janelia.multiccd.interpolation.GridInterpolator;
import org.janelia.multiccd.math.RadialBasisKernel;
import org.janelia.multiccd.shape.OutlierRejector;

/**
 * Settings of the exposure preprocessing. Every field has a default matching the CFIS/MegaCam setup,
 * so a JSON configuration only needs to list the values it overrides.
 */
public class PreprocessingParameters implements Serializable
{
	private static final long serialVersionUID = 5121793512908305424L;

	private String separator = CatalogBatcher.DEFAULT_SEPARATOR;
	private String coordXDescriptor = JsonCatalogPayloadReader.DEFAULT_X_DESCRIPTOR;
	private String coordYDescriptor = JsonCatalogPayloadReader.DEFAULT_Y_DESCRIPTOR;

	private double maskThreshold = MaskBuilder.DEFAULT_THRESHOLD;
	private boolean applyMaskToStamps = true;

	private double outlierSigma = OutlierRejector.DEFAULT_SIGMA;
	private int polynomialDegree = 3;

	private int interpolationNeighbors = GridInterpolator.DEFAULT_NUM_NEIGHBORS;
	private String rbfKernel = GridInterpolator.DEFAULT_KERNEL.getName();

	private int xGap = TileLayout.DEFAULT_X_GAP;
	private int yGap = TileLayout.DEFAULT_Y_GAP;
	private int xExtent = TileLayout.DEFAULT_X_EXTENT;
	private int yExtent = TileLayout.DEFAULT_Y_EXTENT;

	public String getSeparator() { return separator; }
	public void setSeparator( final String separator ) { this.separator = separator; }

	public String getCoordXDescriptor() { return coordXDescriptor; }
	public void setCoordXDescriptor( final String coordXDescriptor ) { this.coordXDescriptor = coordXDescriptor; }

	public String getCoordYDescriptor() { return coordYDescriptor; }
	public void setCoordYDescriptor( final String coordYDescriptor ) { this.coordYDescriptor = coordYDescriptor; }

	public double getMaskThreshold() { return maskThreshold; }
	public void setMaskThreshold( final double maskThreshold ) { this.maskThreshold = maskThreshold; }

	public boolean getApplyMaskToStamps() { return applyMaskToStamps; }
	public void setApplyMaskToStamps( final boolean applyMaskToStamps ) { this.applyMaskToStamps = applyMaskToStamps; }

	public double getOutlierSigma() { return outlierSigma; }
	public void setOutlierSigma( final double outlierSigma ) { this.outlierSigma = outlierSigma; }

	public int getPolynomialDegree() { return polynomialDegree; }
	public void setPolynomialDegree( final int polynomialDegree ) { this.polynomialDegree = polynomialDegree; }

	public int getInterpolationNeighbors() { return interpolationNeighbors; }
	public void setInterpolationNeighbors( final int interpolationNeighbors ) { this.interpolationNeighbors = interpolationNeighbors; }

	public RadialBasisKernel getRbfKernel() { return RadialBasisKernel.fromName( rbfKernel ); }
	public void setRbfKernel( final RadialBasisKernel rbfKernel ) { this.rbfKernel = rbfKernel.getName(); }

	public TileLayout getTileLayout()
	{
		return TileLayout.megaCam( xGap, yGap, xExtent, yExtent );
	}

	public void setTileGeometry( final int xGap, final int yGap, final int xExtent, final int yExtent )
	{
		this.xGap = xGap;
		this.yGap = yGap;
		this.xExtent = xExtent;
		this.yExtent = yExtent;
	}
}
