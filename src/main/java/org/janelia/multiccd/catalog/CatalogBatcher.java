package org.janelia.multiccd.catalog;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map.Entry;
import java.util.TreeMap;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;
import org.janelia.multiccd.geometry.InvalidTileIdException;
import org.janelia.multiccd.geometry.TileLayout;

import net.imglib2.util.Pair;
import net.imglib2.util.ValuePair;

/**
 * Groups per-tile catalog files into per-exposure batches.
 *
 * Catalog files are expected to be named as {@code <pattern><sep><exposureId><sep><tileId>.<extension>},
 * for example {@code star_selection-1234567-04.fits} where the exposure id is {@code 1234567} and the tile id is {@code 04}.
 */
public class CatalogBatcher
{
	private static final Logger LOG = Logger.getLogger( CatalogBatcher.class );

	public static final String DEFAULT_SEPARATOR = "-";

	private final String separator;
	private final TileLayout layout;

	public CatalogBatcher()
	{
		this( DEFAULT_SEPARATOR, TileLayout.megaCam() );
	}

	public CatalogBatcher( final String separator, final TileLayout layout )
	{
		if ( separator == null || separator.isEmpty() )
			throw new IllegalArgumentException( "separator should not be empty" );

		this.separator = separator;
		this.layout = layout;
	}

	public String getSeparator()
	{
		return separator;
	}

	/**
	 * Extracts exposure id and tile id from the last two separator-delimited tokens of the path (without extension).
	 *
	 * @throws IllegalArgumentException if the path does not follow the naming convention
	 * @throws InvalidTileIdException if the parsed tile id is not part of the layout
	 */
	public Pair< String, Integer > parsePath( final String path )
	{
		final String[] tokens = removeExtension( path ).split( Pattern.quote( separator ) );
		if ( tokens.length < 2 || tokens[ tokens.length - 2 ].isEmpty() )
			throw new IllegalArgumentException( "cannot parse exposure id and tile id from " + path );

		final String exposureId = tokens[ tokens.length - 2 ];
		final String tileToken = tokens[ tokens.length - 1 ];

		final int tileId;
		try
		{
			tileId = Integer.parseInt( tileToken );
		}
		catch ( final NumberFormatException e )
		{
			throw new IllegalArgumentException( "cannot parse tile id '" + tileToken + "' from " + path, e );
		}

		if ( !layout.isValidTileId( tileId ) )
			throw new InvalidTileIdException( tileId, layout.numTiles() );

		return new ValuePair<>( exposureId, tileId );
	}

	/**
	 * Groups the given catalog paths by exposure id.
	 * Batches are sorted by exposure id, records within a batch keep the order of the input list.
	 * An exposure that contains the same tile twice is logged and left out, the other exposures are still batched.
	 */
	public List< ExposureBatch > batch( final List< String > paths )
	{
		return batch( paths, new ArrayList<>() );
	}

	/**
	 * Same as {@link #batch(List)}, additionally collecting the errors of the exposures that were left out.
	 */
	public List< ExposureBatch > batch( final List< String > paths, final List< DuplicateTileException > rejectedExposures )
	{
		final TreeMap< String, List< CatalogRecord > > exposures = new TreeMap<>();
		for ( final String path : paths )
		{
			final Pair< String, Integer > ids = parsePath( path );
			if ( !exposures.containsKey( ids.getA() ) )
				exposures.put( ids.getA(), new ArrayList<>() );
			exposures.get( ids.getA() ).add( new CatalogRecord( ids.getA(), ids.getB(), path ) );
		}

		final List< ExposureBatch > batches = new ArrayList<>();
		for ( final Entry< String, List< CatalogRecord > > entry : exposures.entrySet() )
		{
			try
			{
				batches.add( new ExposureBatch( entry.getKey(), entry.getValue() ) );
			}
			catch ( final DuplicateTileException e )
			{
				LOG.error( "Skipping exposure " + entry.getKey() + ": " + e.getMessage() );
				rejectedExposures.add( e );
			}
		}

		LOG.info( "Grouped " + paths.size() + " catalogs into " + batches.size() + " exposures" );
		return batches;
	}

	/**
	 * Groups a pipeline input list where every entry is a tuple of related files (for example, train and test catalogs
	 * of the same tile). Only the element at {@code elementPosition} of every tuple is considered.
	 */
	public List< ExposureBatch > batchTuples( final List< ? extends List< String > > inputTuples, final int elementPosition )
	{
		final List< String > paths = new ArrayList<>();
		for ( final List< String > tuple : inputTuples )
		{
			if ( elementPosition < 0 || elementPosition >= tuple.size() )
				throw new IllegalArgumentException( "element position " + elementPosition + " is out of bounds for input " + tuple );
			paths.add( tuple.get( elementPosition ) );
		}
		return batch( paths );
	}

	/**
	 * Groups all files in the folder whose names match the glob pattern (e.g. {@code star_selection*.fits}).
	 * File paths are sorted before grouping.
	 */
	public List< ExposureBatch > batchFolder( final Path folder, final String globPattern ) throws IOException
	{
		final List< String > paths = new ArrayList<>();
		try ( final DirectoryStream< Path > stream = Files.newDirectoryStream( folder, globPattern ) )
		{
			for ( final Path path : stream )
				if ( Files.isRegularFile( path ) )
					paths.add( path.toString() );
		}
		Collections.sort( paths );
		return batch( paths );
	}

	public static List< String > getExposureIds( final List< ExposureBatch > batches )
	{
		final List< String > exposureIds = new ArrayList<>();
		for ( final ExposureBatch batch : batches )
			exposureIds.add( batch.getExposureId() );
		return exposureIds;
	}

	static String removeExtension( final String path )
	{
		final int fileNameStart = Math.max( path.lastIndexOf( '/' ), path.lastIndexOf( '\\' ) ) + 1;
		final int extensionStart = path.indexOf( '.', fileNameStart );
		return extensionStart == -1 ? path : path.substring( 0, extensionStart );
	}
}
