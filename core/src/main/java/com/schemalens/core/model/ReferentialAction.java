package com.schemalens.core.model;

import java.util.Locale;

public enum ReferentialAction {
    NO_ACTION("NO ACTION"),
    CASCADE("CASCADE"),
    RESTRICT("RESTRICT"),
    SET_NULL("SET NULL"),
    SET_DEFAULT("SET DEFAULT");

    private final String sql;

    ReferentialAction(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }

    /**
     * Parses the textual forms catalogs report ({@code NO ACTION}, {@code SET_NULL},
     * {@code cascade}). Returns null for null or blank input.
     */
    public static ReferentialAction parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String key = text.trim().toUpperCase(Locale.ROOT).replace('_', ' ');
        for (ReferentialAction action : values()) {
            if (action.sql.equals(key)) {
                return action;
            }
        }
        throw new ModelIntegrityException("referential action", "unknown action '" + text + "'");
    }
}
