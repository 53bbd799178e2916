package com.schemalens.core.model;

/**
 * A routine parameter. Unnamed positional parameters keep a null name.
 */
public record Parameter(String name, DataType type, ParameterMode mode, String defaultValue, int ordinal) {
    public Parameter {
        if (type == null) {
            throw new ModelIntegrityException("parameter " + name, "type is required");
        }
        if (mode == null) {
            mode = ParameterMode.IN;
        }
    }
}
