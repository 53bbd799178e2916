package com.schemalens.core.model;

/**
 * A reference whose target is not part of the retained object set, either because a filter
 * removed it or because it lives in another database.
 */
public record UnresolvedReference(Identifier source, Identifier target, ReferenceKind kind, String via) {
}
