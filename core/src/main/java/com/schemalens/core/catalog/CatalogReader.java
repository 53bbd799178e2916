package com.schemalens.core.catalog;

/**
 * Source of raw catalog rows for one database. Implementations issue the engine-specific
 * queries; they do not interpret the rows.
 */
public interface CatalogReader {
    DatabaseInfo describe() throws QueryFailureException;

    CatalogRows list(CatalogKind kind) throws QueryFailureException;
}
