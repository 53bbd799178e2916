package com.schemalens.core.model;

import java.util.Objects;

/**
 * A column or parameter type. The native string is kept for display, the family and
 * the separate length/precision/scale fields for comparison across dialects.
 */
public record DataType(
        String nativeType,
        TypeFamily family,
        Integer length,
        Integer precision,
        Integer scale
) {
    public DataType {
        Objects.requireNonNull(nativeType, "nativeType");
        Objects.requireNonNull(family, "family");
    }

    public String normalizedName() {
        return family.label();
    }

    @Override
    public String toString() {
        return nativeType;
    }
}
