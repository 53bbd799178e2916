package com.schemalens.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The extracted and linked description of one database. Built once per extraction run
 * and never modified afterwards.
 *
 * <p>{@code selected} holds the object types that were requested; {@code notApplicable}
 * those among them the engine has no catalog for. Security principals are database-wide
 * and so live here rather than on a schema.
 */
public record SchemaSnapshot(
        String database,
        Engine engine,
        String engineVersion,
        Instant extractedAt,
        List<SchemaObjects> schemas,
        List<SecurityPrincipal> principals,
        Set<ObjectType> selected,
        Set<ObjectType> notApplicable,
        RelationshipGraph graph,
        List<ExtractionWarning> warnings
) {
    public SchemaSnapshot {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(extractedAt, "extractedAt");
        List<SchemaObjects> ordered = new ArrayList<>(schemas);
        ordered.sort(Comparator.comparing((SchemaObjects s) -> Identifier.fold(s.schema()))
                .thenComparing(SchemaObjects::schema));
        schemas = List.copyOf(ordered);
        principals = principals == null ? List.of() : principals.stream()
                .sorted(Comparator.comparing(SecurityPrincipal::name))
                .toList();
        selected = Collections.unmodifiableSet(selected == null || selected.isEmpty()
                ? EnumSet.noneOf(ObjectType.class) : EnumSet.copyOf(selected));
        notApplicable = Collections.unmodifiableSet(notApplicable == null || notApplicable.isEmpty()
                ? EnumSet.noneOf(ObjectType.class) : EnumSet.copyOf(notApplicable));
        graph = graph == null ? RelationshipGraph.empty() : graph;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public SchemaObjects schema(String name) {
        String key = Identifier.fold(name);
        for (SchemaObjects objects : schemas) {
            if (Identifier.fold(objects.schema()).equals(key)) {
                return objects;
            }
        }
        return null;
    }

    public int count(ObjectType type) {
        if (type == ObjectType.SECURITY) {
            return principals.size();
        }
        return schemas.stream().mapToInt(s -> s.count(type)).sum();
    }

    /** Selected types the engine supports, in display order. */
    public List<ObjectType> presentTypes() {
        List<ObjectType> present = new ArrayList<>();
        for (ObjectType type : ObjectType.values()) {
            if (selected.contains(type) && !notApplicable.contains(type)) {
                present.add(type);
            }
        }
        return present;
    }

    public List<Table> tables() {
        return schemas.stream().flatMap(s -> s.tables().stream()).toList();
    }

    public List<Trigger> triggersOn(Identifier table) {
        return schemas.stream()
                .flatMap(s -> s.triggers().stream())
                .filter(t -> t.table().equals(table))
                .toList();
    }
}
