package com.schemalens.core.model;

import java.util.List;

/**
 * What a routine returns: nothing, a single scalar type, or an ordered list of result columns.
 */
public record ReturnShape(DataType scalar, List<Attribute> columns) {
    private static final ReturnShape NONE = new ReturnShape(null, List.of());

    public ReturnShape {
        columns = columns == null ? List.of() : List.copyOf(columns);
        if (scalar != null && !columns.isEmpty()) {
            throw new ModelIntegrityException("return shape", "cannot be both scalar and tabular");
        }
    }

    public static ReturnShape none() {
        return NONE;
    }

    public static ReturnShape scalar(DataType type) {
        return type == null ? NONE : new ReturnShape(type, List.of());
    }

    public static ReturnShape table(List<Attribute> columns) {
        return new ReturnShape(null, columns);
    }

    public boolean tabular() {
        return !columns.isEmpty();
    }

    public boolean empty() {
        return scalar == null && columns.isEmpty();
    }
}
