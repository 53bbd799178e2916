package com.schemalens.core.catalog;

/**
 * A catalog read failed, for example on a permission or transport error.
 */
public class QueryFailureException extends Exception {
    private final CatalogKind kind;
    private final String schema;

    public QueryFailureException(CatalogKind kind, String schema, Throwable cause) {
        super("Failed to read " + kind + (schema == null ? "" : " in schema " + schema)
                + (cause == null ? "" : ": " + cause.getMessage()), cause);
        this.kind = kind;
        this.schema = schema;
    }

    public QueryFailureException(CatalogKind kind, Throwable cause) {
        this(kind, null, cause);
    }

    public CatalogKind kind() {
        return kind;
    }

    public String schema() {
        return schema;
    }
}
