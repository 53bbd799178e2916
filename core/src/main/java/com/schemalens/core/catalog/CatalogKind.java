package com.schemalens.core.catalog;

import com.schemalens.core.model.ObjectType;

import java.util.EnumSet;
import java.util.Set;

/**
 * The catalog capabilities every dialect answers. A capability serves the object types
 * listed with it; {@link #SCHEMAS} and {@link #TABLES} are always read because nothing
 * else can be assembled without them.
 */
public enum CatalogKind {
    SCHEMAS(Set.of()),
    TABLES(Set.of()),
    COLUMNS(Set.of(ObjectType.TABLES)),
    PRIMARY_KEYS(Set.of(ObjectType.TABLES)),
    INDEXES(Set.of(ObjectType.TABLES)),
    FOREIGN_KEYS(Set.of(ObjectType.TABLES)),
    CHECKS(Set.of(ObjectType.TABLES)),
    VIEWS(Set.of(ObjectType.VIEWS)),
    ROUTINES(Set.of(ObjectType.PROCEDURES, ObjectType.FUNCTIONS)),
    TRIGGERS(Set.of(ObjectType.TRIGGERS)),
    TYPES(Set.of(ObjectType.TYPES)),
    SEQUENCES(Set.of(ObjectType.SEQUENCES)),
    SYNONYMS(Set.of(ObjectType.SYNONYMS)),
    SECURITY(Set.of(ObjectType.SECURITY));

    private final Set<ObjectType> serves;

    CatalogKind(Set<ObjectType> serves) {
        this.serves = serves;
    }

    public boolean required() {
        return this == SCHEMAS || this == TABLES;
    }

    public Set<ObjectType> serves() {
        return serves;
    }

    /** Whether this capability has to be read for the given selection. */
    public boolean neededFor(Set<ObjectType> selection) {
        if (required()) {
            return true;
        }
        for (ObjectType type : serves) {
            if (selection.contains(type)) {
                return true;
            }
        }
        return false;
    }

    /** The capability that produces objects of {@code type}. */
    public static CatalogKind producing(ObjectType type) {
        return switch (type) {
            case TABLES -> TABLES;
            case VIEWS -> VIEWS;
            case PROCEDURES, FUNCTIONS -> ROUTINES;
            case TRIGGERS -> TRIGGERS;
            case TYPES -> TYPES;
            case SEQUENCES -> SEQUENCES;
            case SYNONYMS -> SYNONYMS;
            case SECURITY -> SECURITY;
        };
    }

    public static Set<CatalogKind> all() {
        return EnumSet.allOf(CatalogKind.class);
    }
}
