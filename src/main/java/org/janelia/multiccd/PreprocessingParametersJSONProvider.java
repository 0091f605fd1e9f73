package org.janelia.multiccd;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Loads and stores {@link PreprocessingParameters} in JSON format.
 * Fields missing from the JSON keep their default values.
 */
public class PreprocessingParametersJSONProvider
{
	public static PreprocessingParameters loadParameters( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			final PreprocessingParameters parameters = createGson().fromJson( closeableReader, PreprocessingParameters.class );
			return parameters != null ? parameters : new PreprocessingParameters();
		}
	}

	public static void saveParameters( final PreprocessingParameters parameters, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( parameters ) );
		}
	}

	private static Gson createGson()
	{
		return new GsonBuilder().setPrettyPrinting().create();
	}
}
