package com.schemalens.core.model;

import java.util.Locale;

/**
 * Selectable object categories. Each category renders into its own directory.
 */
public enum ObjectType {
    TABLES("Tables"),
    VIEWS("Views"),
    PROCEDURES("Procedures"),
    FUNCTIONS("Functions"),
    TRIGGERS("Triggers"),
    TYPES("Types"),
    SEQUENCES("Sequences"),
    SYNONYMS("Synonyms"),
    SECURITY("Security");

    private final String title;

    ObjectType(String title) {
        this.title = title;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String title() {
        return title;
    }

    public static ObjectType fromId(String id) {
        String wanted = id.trim().toLowerCase(Locale.ROOT);
        for (ObjectType type : values()) {
            if (type.id().equals(wanted)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown object type: " + id);
    }
}
