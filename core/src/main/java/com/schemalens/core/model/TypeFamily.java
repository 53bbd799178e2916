package com.schemalens.core.model;

import java.util.Locale;

/**
 * Comparable buckets that dialect-native type names normalize into.
 */
public enum TypeFamily {
    STRING,
    INTEGER,
    DECIMAL,
    FLOAT,
    BOOLEAN,
    DATE,
    TIME,
    TIMESTAMP,
    INTERVAL,
    BINARY,
    UUID,
    JSON,
    XML,
    ENUM,
    SPATIAL,
    ARRAY,
    USER_DEFINED,
    OTHER;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
