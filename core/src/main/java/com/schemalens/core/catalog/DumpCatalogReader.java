package com.schemalens.core.catalog;

import java.util.List;

/**
 * Replays a {@link CatalogDump}. Kinds missing from the dump read as empty.
 */
public class DumpCatalogReader implements CatalogReader {
    private final CatalogDump dump;

    public DumpCatalogReader(CatalogDump dump) {
        this.dump = dump;
    }

    @Override
    public DatabaseInfo describe() {
        return dump.database();
    }

    @Override
    public CatalogRows list(CatalogKind kind) {
        if (dump.notApplicable().contains(kind)) {
            return CatalogRows.notApplicable();
        }
        return CatalogRows.of(dump.catalog().getOrDefault(kind, List.of()));
    }
}
