package com.schemalens.core.catalog;

import java.util.List;

/**
 * The answer to one capability: either rows (possibly none) or the marker that the
 * engine has no such catalog at all.
 */
public final class CatalogRows {
    private static final CatalogRows NOT_APPLICABLE = new CatalogRows(false, List.of());

    private final boolean applicable;
    private final List<RawRow> rows;

    private CatalogRows(boolean applicable, List<RawRow> rows) {
        this.applicable = applicable;
        this.rows = rows;
    }

    public static CatalogRows notApplicable() {
        return NOT_APPLICABLE;
    }

    public static CatalogRows of(List<RawRow> rows) {
        return new CatalogRows(true, List.copyOf(rows));
    }

    public boolean applicable() {
        return applicable;
    }

    public List<RawRow> rows() {
        return rows;
    }

    @Override
    public String toString() {
        return applicable ? rows.size() + " rows" : "not applicable";
    }
}
