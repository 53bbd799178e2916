package com.schemalens.core.catalog;

import com.schemalens.core.model.Engine;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Passes reads through to another reader and keeps what came back, so a run against a live
 * database can be saved as a {@link CatalogDump}.
 */
public class RecordingCatalogReader implements CatalogReader {
    private final CatalogReader delegate;
    private final Map<CatalogKind, List<RawRow>> recorded = new EnumMap<>(CatalogKind.class);
    private final Set<CatalogKind> notApplicable = EnumSet.noneOf(CatalogKind.class);
    private DatabaseInfo info;

    public RecordingCatalogReader(CatalogReader delegate) {
        this.delegate = delegate;
    }

    @Override
    public DatabaseInfo describe() throws QueryFailureException {
        info = delegate.describe();
        return info;
    }

    @Override
    public CatalogRows list(CatalogKind kind) throws QueryFailureException {
        CatalogRows rows = delegate.list(kind);
        if (rows.applicable()) {
            recorded.put(kind, rows.rows());
        } else {
            notApplicable.add(kind);
        }
        return rows;
    }

    public CatalogDump dump(Engine engine) {
        return new CatalogDump(engine, info, recorded, notApplicable);
    }
}
