package com.schemalens.render;

import com.schemalens.core.model.Attribute;
import com.schemalens.core.model.CheckConstraint;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.DataType;
import com.schemalens.core.model.ForeignKey;
import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.Index;
import com.schemalens.core.model.ObjectType;
import com.schemalens.core.model.Parameter;
import com.schemalens.core.model.ParameterMode;
import com.schemalens.core.model.ReferenceKind;
import com.schemalens.core.model.ReferentialAction;
import com.schemalens.core.model.RelationshipEdge;
import com.schemalens.core.model.RelationshipGraph;
import com.schemalens.core.model.Routine;
import com.schemalens.core.model.RoutineKind;
import com.schemalens.core.model.SchemaSnapshot;
import com.schemalens.core.model.Sequence;
import com.schemalens.core.model.Synonym;
import com.schemalens.core.model.Table;
import com.schemalens.core.model.Trigger;
import com.schemalens.core.model.TriggerEvent;
import com.schemalens.core.model.TypeCategory;
import com.schemalens.core.model.UserDefinedType;
import com.schemalens.core.model.View;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the template context of each per-object document. Every value a template prints is
 * either ready-made Markdown or raw text the template escapes itself; nothing is null.
 */
final class ObjectPages {
    private final SchemaSnapshot snapshot;
    private final RelationshipGraph graph;
    private final DocumentPaths paths;

    ObjectPages(SchemaSnapshot snapshot, DocumentPaths paths) {
        this.snapshot = snapshot;
        this.graph = snapshot.graph();
        this.paths = paths;
    }

    Map<String, Object> table(Table table, String from) {
        Map<String, Object> context = page("Table", table.id(), table.description());
        List<Map<String, Object>> properties = properties(from, table.id());
        if (table.rowCount() != null) {
            properties.add(property("Rows", String.valueOf(table.rowCount())));
        }
        if (table.sizeKb() != null) {
            properties.add(property("Size", table.sizeKb() + " KB"));
        }
        context.put("properties", properties);

        List<Map<String, Object>> columns = new ArrayList<>();
        for (Column column : table.columns()) {
            Map<String, Object> row = new LinkedHashMap<>();
            String name = Markdown.cell(column.name());
            row.put("name", table.inPrimaryKey(column.name()) ? "**" + name + "**" : name);
            row.put("type", column.type().nativeType());
            row.put("nullable", column.nullable() ? "YES" : "NO");
            row.put("default", defaultCell(column));
            row.put("description", text(column.description()));
            columns.add(row);
        }
        context.put("columns", columns);

        if (table.primaryKey() != null) {
            Map<String, Object> pk = new LinkedHashMap<>();
            pk.put("name", table.primaryKey().name() == null ? "(unnamed)" : Markdown.cell(table.primaryKey().name()));
            pk.put("columns", cells(table.primaryKey().columns()));
            pk.put("clustered", flag(table.primaryKey().clustered()));
            context.put("primaryKey", pk);
        }

        List<Map<String, Object>> foreignKeys = new ArrayList<>();
        for (ForeignKey fk : table.foreignKeys()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", fk.name() == null ? "(unnamed)" : Markdown.cell(fk.name()));
            row.put("columns", cells(fk.columns()));
            row.put("references", foreignKeyTarget(from, table.id(), fk));
            row.put("onDelete", action(fk.onDelete()));
            row.put("onUpdate", action(fk.onUpdate()));
            foreignKeys.add(row);
        }
        context.put("foreignKeys", foreignKeys);

        List<Map<String, Object>> indexes = new ArrayList<>();
        for (Index index : table.indexes()) {
            if (index.primaryKey()) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", Markdown.cell(index.name()));
            row.put("columns", cells(index.columns()));
            row.put("unique", index.unique() ? "YES" : "NO");
            row.put("clustered", flag(index.clustered()));
            row.put("method", Markdown.cell(index.method()));
            row.put("included", cells(index.includedColumns()));
            row.put("filter", Markdown.code(Markdown.cell(index.filter())));
            indexes.add(row);
        }
        context.put("indexes", indexes);

        List<Map<String, Object>> checks = new ArrayList<>();
        for (CheckConstraint check : table.checks()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", check.name() == null ? "(unnamed)" : Markdown.cell(check.name()));
            row.put("expression", Markdown.code(Markdown.cell(check.expression())));
            checks.add(row);
        }
        context.put("checks", checks);

        context.put("triggers", snapshot.triggersOn(table.id()).stream()
                .map(t -> paths.reference(from, t.id()))
                .toList());
        context.putAll(relationships(from, table.id()));
        return context;
    }

    Map<String, Object> view(View view, String from) {
        Map<String, Object> context = page(view.materialized() ? "Materialized View" : "View", view.id(),
                view.description());
        List<Map<String, Object>> properties = properties(from, view.id());
        properties.add(property("Materialized", view.materialized() ? "YES" : "NO"));
        context.put("properties", properties);
        context.put("columns", attributes(view.columns()));
        context.put("baseTables", view.baseTables().stream().map(t -> paths.reference(from, t)).toList());
        definition(context, view.definition());
        context.putAll(relationships(from, view.id()));
        return context;
    }

    Map<String, Object> routine(Routine routine, String from) {
        String kind = routine.kind() == RoutineKind.PROCEDURE ? "Procedure" : "Function";
        Map<String, Object> context = page(kind, routine.id(), routine.description());
        List<Map<String, Object>> properties = properties(from, routine.id());
        if (routine.language() != null) {
            properties.add(property("Language", Markdown.cell(routine.language())));
        }
        context.put("properties", properties);

        List<Map<String, Object>> parameters = new ArrayList<>();
        for (Parameter parameter : routine.parameters()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("ordinal", parameter.ordinal());
            row.put("name", parameter.name() == null ? "" : Markdown.cell(parameter.name()));
            row.put("type", parameter.type().nativeType());
            row.put("mode", parameter.mode().name());
            row.put("default", Markdown.code(Markdown.cell(parameter.defaultValue())));
            parameters.add(row);
        }
        context.put("parameters", parameters);
        if (routine.returns().scalar() != null) {
            context.put("returnType", routine.returns().scalar().nativeType());
        }
        context.put("resultColumns", attributes(routine.returns().columns()));
        definition(context, routine.definition());
        context.putAll(relationships(from, routine.id()));
        return context;
    }

    Map<String, Object> trigger(Trigger trigger, String from) {
        Map<String, Object> context = page("Trigger", trigger.id(), null);
        List<Map<String, Object>> properties = properties(from, trigger.id());
        properties.add(property("Table", paths.reference(from, trigger.table())));
        properties.add(property("Timing", trigger.timing().sql()));
        properties.add(property("Events", events(trigger)));
        properties.add(property("Enabled", trigger.enabled() ? "YES" : "NO"));
        context.put("properties", properties);
        definition(context, trigger.definition());
        context.putAll(relationships(from, trigger.id()));
        return context;
    }

    Map<String, Object> type(UserDefinedType type, String from) {
        Map<String, Object> context = page("Type", type.id(), type.description());
        List<Map<String, Object>> properties = properties(from, type.id());
        properties.add(property("Category", category(type.category())));
        if (type.baseType() != null) {
            properties.add(property("Base Type", Markdown.code(type.baseType().nativeType())));
        }
        context.put("properties", properties);
        context.put("attributes", attributes(type.attributes()));
        context.put("enumValues", type.enumValues().stream().map(Markdown::code).toList());
        context.put("checkExpression", text(type.checkExpression()));
        context.putAll(relationships(from, type.id()));
        return context;
    }

    Map<String, Object> sequence(Sequence sequence, String from) {
        Map<String, Object> context = page("Sequence", sequence.id(), null);
        List<Map<String, Object>> properties = properties(from, sequence.id());
        if (sequence.dataType() != null) {
            properties.add(property("Data Type", Markdown.code(sequence.dataType().nativeType())));
        }
        addIfPresent(properties, "Start", sequence.start());
        addIfPresent(properties, "Minimum", sequence.minValue());
        addIfPresent(properties, "Maximum", sequence.maxValue());
        addIfPresent(properties, "Increment", sequence.increment());
        properties.add(property("Cycle", sequence.cycle() ? "YES" : "NO"));
        addIfPresent(properties, "Cache", sequence.cacheSize());
        addIfPresent(properties, "Current Value", sequence.currentValue());
        context.put("properties", properties);
        context.putAll(relationships(from, sequence.id()));
        return context;
    }

    Map<String, Object> synonym(Synonym synonym, String from) {
        Map<String, Object> context = page("Synonym", synonym.id(), null);
        List<Map<String, Object>> properties = properties(from, synonym.id());
        RelationshipEdge edge = graph.outgoing(synonym.id()).stream()
                .filter(e -> e.kind() == ReferenceKind.SYNONYM)
                .findFirst()
                .orElse(null);
        String target = edge != null && edge.resolved()
                ? paths.reference(from, synonym.target(), synonym.targetName())
                : DocumentPaths.unresolved(synonym.targetName());
        properties.add(property("Target", target));
        if (synonym.server() != null) {
            properties.add(property("Server", Markdown.cell(synonym.server())));
        }
        if (synonym.database() != null) {
            properties.add(property("Database", Markdown.cell(synonym.database())));
        }
        context.put("properties", properties);
        context.putAll(relationships(from, synonym.id()));
        return context;
    }

    /** One-line description used on the category indexes. */
    String summary(ObjectType type, Object item) {
        return switch (type) {
            case TABLES -> {
                Table t = (Table) item;
                String s = t.columns().size() + " columns";
                yield t.rowCount() == null ? s : s + ", " + t.rowCount() + " rows";
            }
            case VIEWS -> {
                View v = (View) item;
                String s = v.columns().size() + " columns";
                yield v.materialized() ? s + ", materialized" : s;
            }
            case PROCEDURES, FUNCTIONS -> Markdown.cell(signature((Routine) item));
            case TRIGGERS -> {
                Trigger t = (Trigger) item;
                yield t.timing().sql() + " " + events(t) + " on " + Markdown.cell(t.table().qualifiedName());
            }
            case TYPES -> category(((UserDefinedType) item).category());
            case SEQUENCES -> {
                DataType dataType = ((Sequence) item).dataType();
                yield dataType == null ? "" : Markdown.cell(dataType.nativeType());
            }
            case SYNONYMS -> "→ " + Markdown.cell(((Synonym) item).targetName());
            case SECURITY -> "";
        };
    }

    static String signature(Routine routine) {
        String args = routine.parameters().stream()
                .map(p -> (p.mode() == ParameterMode.IN ? "" : p.mode().name() + " ")
                        + (p.name() == null ? "" : p.name() + " ") + p.type().nativeType())
                .collect(Collectors.joining(", "));
        String name = routine.id().name();
        // overloaded routines already carry their argument list in the name
        String call = name.endsWith(")") ? name : name + "(" + args + ")";
        if (routine.returns().scalar() != null) {
            return call + " → " + routine.returns().scalar().nativeType();
        }
        if (routine.returns().tabular()) {
            return call + " → table";
        }
        return call;
    }

    private Map<String, Object> page(String kind, Identifier id, String description) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("kind", kind);
        context.put("title", Markdown.cell(id.qualifiedName()));
        context.put("description", text(description));
        return context;
    }

    private List<Map<String, Object>> properties(String from, Identifier id) {
        List<Map<String, Object>> properties = new ArrayList<>();
        if (id.schema() != null) {
            properties.add(property("Schema", paths.link(from, paths.schema(id.schema()), id.schema())));
        }
        return properties;
    }

    private static Map<String, Object> property(String name, String value) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", name);
        row.put("value", value);
        return row;
    }

    private static void addIfPresent(List<Map<String, Object>> properties, String name, Object value) {
        if (value != null) {
            properties.add(property(name, value.toString()));
        }
    }

    private Map<String, Object> relationships(String from, Identifier id) {
        List<String> references = new ArrayList<>();
        for (RelationshipEdge edge : graph.outgoing(id)) {
            String target = edge.resolved()
                    ? paths.reference(from, edge.target())
                    : DocumentPaths.unresolved(edge.target().qualifiedName());
            references.add(target + describe(edge, true));
        }
        List<String> referencedBy = new ArrayList<>();
        for (RelationshipEdge edge : graph.incoming(id)) {
            referencedBy.add(paths.reference(from, edge.source()) + describe(edge, false));
        }
        List<String> usedBy = graph.dependents(id).stream().map(v -> paths.reference(from, v)).toList();

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("references", references);
        context.put("referencedBy", referencedBy);
        context.put("usedBy", usedBy);
        context.put("hasRelationships", !references.isEmpty() || !referencedBy.isEmpty() || !usedBy.isEmpty());
        return context;
    }

    private static String describe(RelationshipEdge edge, boolean outgoing) {
        if (edge.kind() == ReferenceKind.SYNONYM) {
            return outgoing ? " (synonym target)" : " (synonym)";
        }
        StringBuilder sb = new StringBuilder();
        if (edge.via() != null) {
            sb.append(" via ").append(Markdown.code(edge.via()));
        }
        String targets = edge.targetColumns().isEmpty() ? "primary key" : String.join(", ", edge.targetColumns());
        sb.append(" (").append(String.join(", ", edge.sourceColumns())).append(" → ").append(targets).append(')');
        if (outgoing) {
            if (edge.onDelete() != null) {
                sb.append(", on delete ").append(edge.onDelete().sql());
            }
            if (edge.onUpdate() != null) {
                sb.append(", on update ").append(edge.onUpdate().sql());
            }
        }
        return sb.toString();
    }

    private String foreignKeyTarget(String from, Identifier source, ForeignKey fk) {
        boolean resolved = graph.outgoing(source).stream()
                .anyMatch(e -> e.kind() == ReferenceKind.FOREIGN_KEY && e.resolved()
                        && e.target().equals(fk.target()) && Objects.equals(e.via(), fk.name()));
        String target = resolved
                ? paths.reference(from, fk.target())
                : DocumentPaths.unresolved(fk.target().qualifiedName());
        String columns = fk.targetColumns().isEmpty() ? "primary key" : cells(fk.targetColumns());
        return target + " (" + columns + ")";
    }

    private static List<Map<String, Object>> attributes(List<Attribute> attributes) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Attribute attribute : attributes) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", Markdown.cell(attribute.name()));
            row.put("type", attribute.type() == null ? "" : attribute.type().nativeType());
            row.put("nullable", flag(attribute.nullable()));
            rows.add(row);
        }
        return rows;
    }

    private static void definition(Map<String, Object> context, String definition) {
        context.put("definition", text(definition).strip());
        context.put("fence", Markdown.fence(definition));
    }

    private static String defaultCell(Column column) {
        List<String> parts = new ArrayList<>();
        if (column.defaultValue() != null) {
            parts.add(Markdown.code(Markdown.cell(column.defaultValue())));
        }
        if (column.identity()) {
            parts.add(column.identitySeed() == null
                    ? "identity"
                    : "identity(" + column.identitySeed() + ", "
                            + (column.identityIncrement() == null ? 1 : column.identityIncrement()) + ")");
        }
        if (column.computed()) {
            parts.add(column.computedExpression() == null
                    ? "computed"
                    : "computed " + Markdown.code(Markdown.cell(column.computedExpression())));
        }
        return String.join(" ", parts);
    }

    private static String events(Trigger trigger) {
        return trigger.events().stream().map(TriggerEvent::name).collect(Collectors.joining(", "));
    }

    private static String category(TypeCategory category) {
        return category.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    private static String action(ReferentialAction action) {
        return action == null ? "" : action.sql();
    }

    private static String flag(Boolean value) {
        return value == null ? "" : value ? "YES" : "NO";
    }

    private static String cells(List<String> names) {
        return Markdown.cell(String.join(", ", names));
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }
}
