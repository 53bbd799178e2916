package com.schemalens.render;

import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.ObjectType;
import com.schemalens.core.model.RelationshipGraph;
import com.schemalens.core.model.SchemaObjects;
import com.schemalens.core.model.SchemaSnapshot;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Assigns every retained object its document path, {@code {type}/{schema}.{name}.md}, and
 * turns identifiers into links between documents. Names that differ only in characters
 * replaced for the file system get a numeric suffix, assigned in identifier order; schema
 * overviews under {@code schemas/} get the same treatment in schema order.
 */
final class DocumentPaths {
    static final String ROOT = "README.md";
    static final String SCHEMAS = "schemas/README.md";
    static final String UNRESOLVED = "_(unresolved)_";

    private final RelationshipGraph graph;
    private final Map<ObjectType, Map<Identifier, String>> paths = new EnumMap<>(ObjectType.class);
    private final Map<String, String> schemaPaths = new HashMap<>();

    DocumentPaths(SchemaSnapshot snapshot) {
        this.graph = snapshot.graph();
        Set<String> used = reserved();
        for (SchemaObjects schema : snapshot.schemas()) {
            schemaPaths.putIfAbsent(Identifier.fold(schema.schema()),
                    "schemas/" + unique(Markdown.fileName(schema.schema()), used));
        }
        assign(snapshot, ObjectType.TABLES, s -> ids(s.tables(), t -> t.id()));
        assign(snapshot, ObjectType.VIEWS, s -> ids(s.views(), v -> v.id()));
        assign(snapshot, ObjectType.PROCEDURES, s -> ids(s.procedures(), r -> r.id()));
        assign(snapshot, ObjectType.FUNCTIONS, s -> ids(s.functions(), r -> r.id()));
        assign(snapshot, ObjectType.TRIGGERS, s -> ids(s.triggers(), t -> t.id()));
        assign(snapshot, ObjectType.TYPES, s -> ids(s.types(), t -> t.id()));
        assign(snapshot, ObjectType.SEQUENCES, s -> ids(s.sequences(), q -> q.id()));
        assign(snapshot, ObjectType.SYNONYMS, s -> ids(s.synonyms(), y -> y.id()));
    }

    private static <T> List<Identifier> ids(List<T> items, Function<T, Identifier> id) {
        return items.stream().map(id).toList();
    }

    private void assign(SchemaSnapshot snapshot, ObjectType type, Function<SchemaObjects, List<Identifier>> members) {
        List<Identifier> all = new ArrayList<>();
        for (SchemaObjects schema : snapshot.schemas()) {
            all.addAll(members.apply(schema));
        }
        all.sort(null);
        Set<String> used = reserved();
        Map<Identifier, String> byId = new HashMap<>();
        for (Identifier id : all) {
            String base = id.schema() == null
                    ? Markdown.fileName(id.name())
                    : Markdown.fileName(id.schema()) + "." + Markdown.fileName(id.name());
            byId.putIfAbsent(id, type.id() + "/" + unique(base, used));
        }
        paths.put(type, byId);
    }

    /** Each directory already holds its index document. */
    private static Set<String> reserved() {
        Set<String> used = new HashSet<>();
        used.add("readme.md");
        return used;
    }

    /** {@code base.md}, or {@code base-N.md} when that name is already taken in the directory, ignoring case. */
    private static String unique(String base, Set<String> used) {
        String file = base + ".md";
        for (int n = 2; !used.add(file.toLowerCase(Locale.ROOT)); n++) {
            file = base + "-" + n + ".md";
        }
        return file;
    }

    static String index(ObjectType type) {
        return type.id() + "/README.md";
    }

    String schema(String name) {
        String path = schemaPaths.get(Identifier.fold(name));
        return path != null ? path : "schemas/" + Markdown.fileName(name) + ".md";
    }

    String path(ObjectType type, Identifier id) {
        Map<Identifier, String> byId = paths.get(type);
        return byId == null ? null : byId.get(id);
    }

    /** Path of whatever retained object {@code id} names, or null when it is not in the snapshot. */
    String pathOf(Identifier id) {
        ObjectType type = graph.typeOf(id);
        return type == null ? null : path(type, id);
    }

    /** A link to {@code id}'s document, or its name with the unresolved marker when it has none. */
    String reference(String from, Identifier id) {
        return reference(from, id, id.qualifiedName());
    }

    String reference(String from, Identifier id, String label) {
        String target = pathOf(id);
        if (target == null) {
            return unresolved(label);
        }
        return Markdown.link(Markdown.cell(label), Markdown.relative(from, target));
    }

    static String unresolved(String label) {
        return Markdown.code(Markdown.cell(label)) + " " + UNRESOLVED;
    }

    String link(String from, String to, String label) {
        return Markdown.link(label, Markdown.relative(from, to));
    }
}
