package org.janelia.multiccd.catalog;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Reads column-oriented star catalogs stored as JSON objects, where every key is a column name
 * (SExtractor naming by default) and every value is the array of per-star values:
 *
 * <pre>
 * {
 *   "XWIN_IMAGE": [ ... ],
 *   "YWIN_IMAGE": [ ... ],
 *   "VIGNET": [ [ [ row0 ], [ row1 ], ... ], ... ],
 *   "SNR_WIN": [ ... ],
 *   "XWIN_WORLD": [ ... ],
 *   "YWIN_WORLD": [ ... ]
 * }
 * </pre>
 *
 * The stamp, x and y columns are required, the rest are optional.
 */
public class JsonCatalogPayloadReader implements CatalogPayloadReader
{
	public static final String DEFAULT_X_DESCRIPTOR = "XWIN_IMAGE";
	public static final String DEFAULT_Y_DESCRIPTOR = "YWIN_IMAGE";
	public static final String DEFAULT_STAMP_DESCRIPTOR = "VIGNET";
	public static final String DEFAULT_SNR_DESCRIPTOR = "SNR_WIN";
	public static final String DEFAULT_SKY_X_DESCRIPTOR = "XWIN_WORLD";
	public static final String DEFAULT_SKY_Y_DESCRIPTOR = "YWIN_WORLD";

	private final String xDescriptor, yDescriptor;
	private final Gson gson = new Gson();

	public JsonCatalogPayloadReader()
	{
		this( DEFAULT_X_DESCRIPTOR, DEFAULT_Y_DESCRIPTOR );
	}

	public JsonCatalogPayloadReader( final String xDescriptor, final String yDescriptor )
	{
		this.xDescriptor = xDescriptor;
		this.yDescriptor = yDescriptor;
	}

	@Override
	public CatalogPayload readPayload( final String path ) throws PayloadReadException
	{
		try ( final Reader reader = Files.newBufferedReader( Paths.get( path ), StandardCharsets.UTF_8 ) )
		{
			return parse( reader );
		}
		catch ( final IOException | JsonParseException | IllegalStateException e )
		{
			throw new PayloadReadException( "cannot read catalog " + path + ": " + e.getMessage(), e );
		}
	}

	public CatalogPayload parse( final Reader reader ) throws PayloadReadException
	{
		final JsonObject columns = JsonParser.parseReader( reader ).getAsJsonObject();

		final double[] localX = getRequiredColumn( columns, xDescriptor, double[].class );
		final double[] localY = getRequiredColumn( columns, yDescriptor, double[].class );
		final double[][][] vignets = getRequiredColumn( columns, DEFAULT_STAMP_DESCRIPTOR, double[][][].class );

		final double[] snr = getOptionalColumn( columns, DEFAULT_SNR_DESCRIPTOR, double[].class );
		final double[] skyX = getOptionalColumn( columns, DEFAULT_SKY_X_DESCRIPTOR, double[].class );
		final double[] skyY = getOptionalColumn( columns, DEFAULT_SKY_Y_DESCRIPTOR, double[].class );
		final boolean hasSky = skyX != null && skyY != null;

		final List< RandomAccessibleInterval< DoubleType > > stamps = new ArrayList<>();
		for ( final double[][] vignet : vignets )
			stamps.add( toStamp( vignet ) );

		try
		{
			return new CatalogPayload(
					stamps,
					localX,
					localY,
					snr,
					hasSky ? skyX : null,
					hasSky ? skyY : null );
		}
		catch ( final IllegalArgumentException e )
		{
			throw new PayloadReadException( "inconsistent catalog columns: " + e.getMessage(), e );
		}
	}

	/**
	 * Converts a row-major stamp into an image where dimension 0 runs along the columns (x)
	 * and dimension 1 along the rows (y).
	 */
	static RandomAccessibleInterval< DoubleType > toStamp( final double[][] vignet ) throws PayloadReadException
	{
		final int height = vignet.length;
		final int width = height == 0 ? 0 : vignet[ 0 ].length;
		if ( width == 0 )
			throw new PayloadReadException( "empty stamp" );

		final double[] data = new double[ width * height ];
		for ( int row = 0; row < height; ++row )
		{
			if ( vignet[ row ].length != width )
				throw new PayloadReadException( "stamp rows have different lengths" );
			System.arraycopy( vignet[ row ], 0, data, row * width, width );
		}
		return ArrayImgs.doubles( data, width, height );
	}

	private < T > T getRequiredColumn( final JsonObject columns, final String name, final Class< T > type ) throws PayloadReadException
	{
		final T column = getOptionalColumn( columns, name, type );
		if ( column == null )
			throw new PayloadReadException( "missing required column " + name );
		return column;
	}

	private < T > T getOptionalColumn( final JsonObject columns, final String name, final Class< T > type )
	{
		final JsonElement element = columns.get( name );
		if ( element == null || element.isJsonNull() )
			return null;
		return gson.fromJson( element, type );
	}
}
