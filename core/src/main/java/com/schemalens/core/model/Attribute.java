package com.schemalens.core.model;

/**
 * A named, typed member: a view column, a composite or table type member, or a routine
 * result column.
 */
public record Attribute(String name, DataType type, Boolean nullable, int ordinal) {
    public Attribute {
        if (name == null || name.isBlank()) {
            throw new ModelIntegrityException("attribute", "name is required");
        }
    }
}
