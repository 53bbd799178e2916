package com.schemalens.core.model;

import java.util.Locale;

public enum ParameterMode {
    IN,
    OUT,
    INOUT;

    /** Accepts {@code IN}, {@code OUT}, {@code INOUT}, {@code IN/OUT} and {@code IN OUT}; null means IN. */
    public static ParameterMode parse(String text) {
        if (text == null || text.isBlank()) {
            return IN;
        }
        String key = text.trim().toUpperCase(Locale.ROOT).replace("/", "").replace(" ", "");
        return switch (key) {
            case "IN" -> IN;
            case "OUT" -> OUT;
            case "INOUT" -> INOUT;
            default -> throw new ModelIntegrityException("parameter", "unknown mode '" + text + "'");
        };
    }
}
