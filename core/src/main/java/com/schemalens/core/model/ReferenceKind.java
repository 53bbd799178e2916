package com.schemalens.core.model;

/**
 * What produced a cross-object reference.
 */
public enum ReferenceKind {
    FOREIGN_KEY,
    SYNONYM,
    TRIGGER_PARENT,
    VIEW_DEPENDENCY
}
