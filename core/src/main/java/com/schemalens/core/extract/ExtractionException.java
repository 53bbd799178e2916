package com.schemalens.core.extract;

import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.model.Engine;

/**
 * Extraction could not produce a snapshot at all, because a required capability failed.
 */
public class ExtractionException extends Exception {
    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    public ExtractionException(Engine engine, CatalogKind kind, Throwable cause) {
        super("Cannot extract " + engine.displayName() + " schema: listing " + kind + " failed"
                + (cause == null ? "" : ": " + cause.getMessage()), cause);
    }
}
