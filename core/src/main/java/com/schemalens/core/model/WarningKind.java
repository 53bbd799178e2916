package com.schemalens.core.model;

public enum WarningKind {
    QUERY_FAILURE,
    SKIPPED_OBJECT,
    UNRESOLVED_REFERENCE
}
