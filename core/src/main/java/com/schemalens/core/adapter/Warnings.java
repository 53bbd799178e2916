package com.schemalens.core.adapter;

import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.QueryFailureException;
import com.schemalens.core.model.ExtractionWarning;
import com.schemalens.core.model.UnresolvedReference;
import com.schemalens.core.model.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the non-fatal problems of one extraction run and logs each as it is recorded.
 * Not thread-safe; each run owns its own instance.
 */
public final class Warnings {
    private static final Logger logger = LoggerFactory.getLogger(Warnings.class);

    private final List<ExtractionWarning> items = new ArrayList<>();

    public void queryFailed(CatalogKind kind, QueryFailureException e) {
        logger.warn("Skipping {}: {}", kind, e.getMessage());
        items.add(new ExtractionWarning(WarningKind.QUERY_FAILURE, kind.name(), e.getMessage()));
    }

    public void skipped(String subject, RuntimeException e) {
        logger.warn("Skipping {}: {}", subject, e.getMessage());
        items.add(new ExtractionWarning(WarningKind.SKIPPED_OBJECT, subject, e.getMessage()));
    }

    public void unresolved(UnresolvedReference reference) {
        logger.warn("Unresolved {} reference from {} to {}", reference.kind(), reference.source(), reference.target());
        items.add(new ExtractionWarning(WarningKind.UNRESOLVED_REFERENCE, reference.source().qualifiedName(),
                "references " + reference.target().qualifiedName() + " which is not in the snapshot"));
    }

    public List<ExtractionWarning> list() {
        return List.copyOf(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
