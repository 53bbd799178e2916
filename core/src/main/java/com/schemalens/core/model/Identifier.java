package com.schemalens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * A schema-qualified object name. Equality and ordering use a case-folded key with
 * quoting removed, so {@code "Sales"."Orders"}, {@code [sales].[orders]} and
 * {@code sales.orders} all link to the same object while keeping their display casing.
 */
public final class Identifier implements Comparable<Identifier> {
    private static final Comparator<Identifier> ORDER = Comparator
            .comparing(Identifier::key)
            .thenComparing(Identifier::qualifiedName);

    private final String schema;
    private final String name;
    private final String key;

    private Identifier(String schema, String name) {
        this.schema = schema == null || schema.isBlank() ? null : unquote(schema);
        this.name = unquote(Objects.requireNonNull(name, "name"));
        this.key = this.schema == null ? fold(this.name) : fold(this.schema) + "." + fold(this.name);
    }

    public static Identifier of(String schema, String name) {
        return new Identifier(schema, name);
    }

    /**
     * Parses a dotted name such as {@code sales.orders} or {@code [dbo].[Orders]}.
     * A name without a schema part takes {@code defaultSchema}.
     */
    public static Identifier parse(String dotted, String defaultSchema) {
        String text = Objects.requireNonNull(dotted, "dotted").trim();
        int dot = lastUnquotedDot(text);
        if (dot < 0) {
            return new Identifier(defaultSchema, text);
        }
        return new Identifier(text.substring(0, dot), text.substring(dot + 1));
    }

    public static String fold(String part) {
        return unquote(part).toLowerCase(Locale.ROOT);
    }

    static String unquote(String part) {
        String p = part.trim();
        if (p.length() >= 2) {
            char first = p.charAt(0);
            char last = p.charAt(p.length() - 1);
            if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
                return p.substring(1, p.length() - 1);
            }
        }
        return p;
    }

    private static int lastUnquotedDot(String text) {
        boolean quoted = false;
        for (int i = text.length() - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == '"' || c == '`') {
                quoted = !quoted;
            } else if (c == ']') {
                quoted = true;
            } else if (c == '[') {
                quoted = false;
            } else if (c == '.' && !quoted) {
                return i;
            }
        }
        return -1;
    }

    public String schema() {
        return schema;
    }

    public String name() {
        return name;
    }

    public String key() {
        return key;
    }

    @JsonValue
    public String qualifiedName() {
        return schema == null ? name : schema + "." + name;
    }

    @Override
    public int compareTo(Identifier other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identifier)) return false;
        return key.equals(((Identifier) o).key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
