package com.schemalens.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Everything retained from one schema, each list ordered by identifier.
 * Categories that were not selected or not supported are empty, never null.
 */
public record SchemaObjects(
        String schema,
        List<Table> tables,
        List<View> views,
        List<Routine> procedures,
        List<Routine> functions,
        List<Trigger> triggers,
        List<UserDefinedType> types,
        List<Sequence> sequences,
        List<Synonym> synonyms
) {
    public SchemaObjects {
        tables = sorted(tables, Table::id);
        views = sorted(views, View::id);
        procedures = sorted(procedures, Routine::id);
        functions = sorted(functions, Routine::id);
        triggers = sorted(triggers, Trigger::id);
        types = sorted(types, UserDefinedType::id);
        sequences = sorted(sequences, Sequence::id);
        synonyms = sorted(synonyms, Synonym::id);
    }

    public static SchemaObjects empty(String schema) {
        return new SchemaObjects(schema, null, null, null, null, null, null, null, null);
    }

    private static <T> List<T> sorted(List<T> items, Function<T, Identifier> id) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        List<T> copy = new ArrayList<>(items);
        copy.sort(Comparator.comparing(id));
        return List.copyOf(copy);
    }

    public int count(ObjectType type) {
        return switch (type) {
            case TABLES -> tables.size();
            case VIEWS -> views.size();
            case PROCEDURES -> procedures.size();
            case FUNCTIONS -> functions.size();
            case TRIGGERS -> triggers.size();
            case TYPES -> types.size();
            case SEQUENCES -> sequences.size();
            case SYNONYMS -> synonyms.size();
            case SECURITY -> 0;
        };
    }

    public boolean isEmpty() {
        for (ObjectType type : ObjectType.values()) {
            if (count(type) > 0) {
                return false;
            }
        }
        return true;
    }
}
