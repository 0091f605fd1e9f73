package org.janelia.multiccd.catalog;

/**
 * Loads the contents of a tile catalog referenced by a {@link CatalogRecord}.
 */
@FunctionalInterface
public interface CatalogPayloadReader
{
	CatalogPayload readPayload( String path ) throws PayloadReadException;
}
