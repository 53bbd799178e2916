package com.schemalens.core.model;

import java.util.Locale;

public enum TriggerTiming {
    BEFORE,
    AFTER,
    INSTEAD_OF;

    public String sql() {
        return this == INSTEAD_OF ? "INSTEAD OF" : name();
    }

    public static TriggerTiming parse(String text) {
        String key = text.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        if (key.startsWith("BEFORE")) return BEFORE;
        if (key.startsWith("AFTER")) return AFTER;
        if (key.startsWith("INSTEAD")) return INSTEAD_OF;
        throw new ModelIntegrityException("trigger", "unknown timing '" + text + "'");
    }
}
