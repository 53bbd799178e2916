package com.schemalens.core.adapter;

import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.RawRow;
import com.schemalens.core.model.Attribute;
import com.schemalens.core.model.CheckConstraint;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.DataType;
import com.schemalens.core.model.Engine;
import com.schemalens.core.model.ForeignKey;
import com.schemalens.core.model.Grant;
import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.Index;
import com.schemalens.core.model.ModelIntegrityException;
import com.schemalens.core.model.Parameter;
import com.schemalens.core.model.ParameterMode;
import com.schemalens.core.model.PrimaryKey;
import com.schemalens.core.model.PrincipalKind;
import com.schemalens.core.model.ReferentialAction;
import com.schemalens.core.model.ReturnShape;
import com.schemalens.core.model.Routine;
import com.schemalens.core.model.RoutineKind;
import com.schemalens.core.model.SecurityPrincipal;
import com.schemalens.core.model.Sequence;
import com.schemalens.core.model.Synonym;
import com.schemalens.core.model.Trigger;
import com.schemalens.core.model.TriggerEvent;
import com.schemalens.core.model.TriggerTiming;
import com.schemalens.core.model.TypeCategory;
import com.schemalens.core.model.TypeNormalizer;
import com.schemalens.core.model.UserDefinedType;
import com.schemalens.core.model.View;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Shared row mapping for all engines. Queries of every dialect return the same column labels
 * (see the dialect query classes), so grouping and assembly live here and engines override
 * the hooks where their catalogs differ: column metadata, referential action spellings,
 * trigger encoding and so on.
 */
public abstract class AbstractDialectAdapter implements DialectAdapter {
    private final Engine engine;
    private final Set<CatalogKind> supported;

    protected AbstractDialectAdapter(Engine engine, Set<CatalogKind> supported) {
        this.engine = engine;
        this.supported = supported.isEmpty() ? EnumSet.noneOf(CatalogKind.class) : EnumSet.copyOf(supported);
    }

    @Override
    public Engine engine() {
        return engine;
    }

    @Override
    public boolean supports(CatalogKind kind) {
        return supported.contains(kind);
    }

    @Override
    public String defaultSchema() {
        return null;
    }

    /** Builds one column from a {@code COLUMNS} row; the ordinal is the native position. */
    protected abstract Column column(RawRow row);

    protected DataType type(RawRow row, String label) {
        return TypeNormalizer.normalize(row.string(label));
    }

    protected ReferentialAction action(String raw) {
        return ReferentialAction.parse(raw);
    }

    /** Whether view dependencies must be parsed out of the definition text. */
    protected boolean parsesViewDefinitions() {
        return false;
    }

    // ---- row helpers ----

    protected static String required(RawRow row, String label) {
        String value = row.string(label);
        if (value == null || value.isBlank()) {
            throw new ModelIntegrityException(label, "missing in row " + row);
        }
        return value;
    }

    protected static int position(RawRow row, String label) {
        Integer value = row.integer(label);
        if (value == null) {
            throw new ModelIntegrityException(label, "missing in row " + row);
        }
        return value;
    }

    protected Identifier identifier(RawRow row, String schemaLabel, String nameLabel) {
        String schema = row.string(schemaLabel);
        return Identifier.of(schema != null ? schema : defaultSchema(), required(row, nameLabel));
    }

    protected Identifier tableId(RawRow row) {
        return identifier(row, "schema_name", "table_name");
    }

    /** Negative or missing statistics are unknown. */
    protected static Long statistic(Long value) {
        return value == null || value < 0 ? null : value;
    }

    protected static String subject(RawRow row, String... labels) {
        List<String> parts = new ArrayList<>();
        for (String label : labels) {
            String value = row.string(label);
            if (value != null) {
                parts.add(value);
            }
        }
        return parts.isEmpty() ? row.toString() : String.join(".", parts);
    }

    protected static String keyOf(RawRow row, String... labels) {
        StringBuilder sb = new StringBuilder();
        for (String label : labels) {
            String value = row.string(label);
            sb.append(value == null ? "" : Identifier.fold(value)).append('\u0000');
        }
        return sb.toString();
    }

    protected static Map<String, List<RawRow>> groupBy(List<RawRow> rows, Function<RawRow, String> key) {
        Map<String, List<RawRow>> groups = new LinkedHashMap<>();
        for (RawRow row : rows) {
            groups.computeIfAbsent(key.apply(row), k -> new ArrayList<>()).add(row);
        }
        return groups;
    }

    protected static List<RawRow> ofKind(List<RawRow> rows, String kind) {
        return rows.stream().filter(r -> r.kind().equals(kind)).toList();
    }

    protected static List<RawRow> byOrdinal(List<RawRow> rows, String label) {
        return rows.stream()
                .sorted(Comparator.comparing((RawRow r) -> r.integer(label),
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    protected <T> void collect(List<T> out, Warnings warnings, String subject, Supplier<T> factory) {
        try {
            out.add(factory.get());
        } catch (ModelIntegrityException | IllegalArgumentException e) {
            warnings.skipped(subject, e);
        }
    }

    // ---- capabilities ----

    @Override
    public List<String> schemas(List<RawRow> rows) {
        return rows.stream()
                .map(r -> r.string("schema_name"))
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }

    @Override
    public List<TableHeader> tables(List<RawRow> rows, Warnings warnings) {
        List<TableHeader> out = new ArrayList<>();
        for (RawRow row : rows) {
            collect(out, warnings, "table " + subject(row, "schema_name", "table_name"), () -> new TableHeader(
                    tableId(row),
                    statistic(row.longValue("row_count")),
                    statistic(row.longValue("size_kb")),
                    row.text("description")));
        }
        return out;
    }

    @Override
    public List<Owned<Column>> columns(List<RawRow> rows, Warnings warnings) {
        List<Owned<Column>> out = new ArrayList<>();
        for (RawRow row : rows) {
            collect(out, warnings, "column " + subject(row, "schema_name", "table_name", "column_name"),
                    () -> new Owned<>(tableId(row), column(row)));
        }
        return out;
    }

    @Override
    public List<Owned<PrimaryKey>> primaryKeys(List<RawRow> rows, Warnings warnings) {
        List<Owned<PrimaryKey>> out = new ArrayList<>();
        groupBy(rows, r -> keyOf(r, "schema_name", "table_name")).values().forEach(group -> {
            RawRow first = group.get(0);
            collect(out, warnings, "primary key of " + subject(first, "schema_name", "table_name"), () -> {
                List<String> columns = byOrdinal(group, "key_ordinal").stream()
                        .map(r -> required(r, "column_name"))
                        .toList();
                return new Owned<>(tableId(first),
                        new PrimaryKey(first.string("constraint_name"), columns, first.bool("clustered")));
            });
        });
        return out;
    }

    @Override
    public List<Owned<Index>> indexes(List<RawRow> rows, Warnings warnings) {
        List<Owned<Index>> out = new ArrayList<>();
        groupBy(rows, r -> keyOf(r, "schema_name", "table_name", "index_name")).values().forEach(group -> {
            RawRow first = group.get(0);
            collect(out, warnings, "index " + subject(first, "schema_name", "table_name", "index_name"), () -> {
                List<RawRow> ordered = byOrdinal(group, "key_ordinal");
                List<String> keys = ordered.stream().filter(r -> !r.flag("is_included")).map(this::indexColumn).toList();
                List<String> included = ordered.stream().filter(r -> r.flag("is_included")).map(this::indexColumn).toList();
                return new Owned<>(tableId(first), new Index(
                        first.string("index_name"),
                        first.flag("is_unique"),
                        first.flag("is_primary"),
                        keys,
                        included,
                        first.text("method"),
                        first.text("filter"),
                        first.bool("clustered")));
            });
        });
        return out;
    }

    /** Index key text: the column name, or the expression for expression indexes. */
    protected String indexColumn(RawRow row) {
        String column = row.string("column_name");
        return column != null ? column : required(row, "expression");
    }

    @Override
    public List<Owned<ForeignKey>> foreignKeys(List<RawRow> rows, Warnings warnings) {
        List<Owned<ForeignKey>> out = new ArrayList<>();
        groupBy(rows, r -> keyOf(r, "schema_name", "table_name", "constraint_name", "constraint_id"))
                .values().forEach(group -> {
                    RawRow first = group.get(0);
                    collect(out, warnings, "foreign key " + subject(first, "schema_name", "table_name", "constraint_name"),
                            () -> foreignKey(first, byOrdinal(group, "key_ordinal")));
                });
        return out;
    }

    private Owned<ForeignKey> foreignKey(RawRow first, List<RawRow> ordered) {
        Identifier owner = tableId(first);
        String refSchema = first.string("ref_schema");
        Identifier target = Identifier.of(refSchema != null ? refSchema : owner.schema(), required(first, "ref_table"));
        List<String> columns = ordered.stream().map(r -> required(r, "column_name")).toList();
        List<String> targetColumns = ordered.stream().anyMatch(r -> r.string("ref_column") == null)
                ? List.of()
                : ordered.stream().map(r -> r.string("ref_column")).toList();
        return new Owned<>(owner, new ForeignKey(
                first.string("constraint_name"),
                columns,
                target,
                targetColumns,
                action(first.string("on_delete")),
                action(first.string("on_update"))));
    }

    @Override
    public List<Owned<CheckConstraint>> checks(List<RawRow> rows, Warnings warnings) {
        List<Owned<CheckConstraint>> out = new ArrayList<>();
        for (RawRow row : rows) {
            collect(out, warnings, "check " + subject(row, "schema_name", "table_name", "constraint_name"),
                    () -> new Owned<>(tableId(row),
                            new CheckConstraint(row.string("constraint_name"), row.string("expression"))));
        }
        return out;
    }

    @Override
    public List<View> views(List<RawRow> rows, Warnings warnings) {
        Map<String, List<RawRow>> columns = groupBy(ofKind(rows, "COLUMN"), r -> keyOf(r, "schema_name", "view_name"));
        Map<String, List<RawRow>> dependencies = groupBy(ofKind(rows, "DEPENDENCY"),
                r -> keyOf(r, "schema_name", "view_name"));
        List<View> out = new ArrayList<>();
        for (RawRow row : rows) {
            if (!row.kind().isEmpty() && !row.kind().equals("VIEW")) {
                continue;
            }
            String key = keyOf(row, "schema_name", "view_name");
            collect(out, warnings, "view " + subject(row, "schema_name", "view_name"), () -> view(row,
                    columns.getOrDefault(key, List.of()), dependencies.getOrDefault(key, List.of())));
        }
        return out;
    }

    protected View view(RawRow row, List<RawRow> columnRows, List<RawRow> dependencyRows) {
        Identifier id = identifier(row, "schema_name", "view_name");
        String definition = row.string("definition");
        List<Attribute> attributes = byOrdinal(columnRows, "ordinal").stream()
                .map(this::attribute)
                .toList();
        List<Identifier> baseTables;
        if (!dependencyRows.isEmpty()) {
            baseTables = dependencyRows.stream()
                    .map(r -> Identifier.of(r.string("ref_schema") != null ? r.string("ref_schema") : id.schema(),
                            required(r, "ref_name")))
                    .filter(ref -> !ref.equals(id))
                    .toList();
        } else if (parsesViewDefinitions()) {
            baseTables = ViewDependencyParser.parse(definition, id.schema());
        } else {
            baseTables = List.of();
        }
        return new View(id, attributes, definition, baseTables, row.flag("materialized"), row.text("description"));
    }

    protected Attribute attribute(RawRow row) {
        String name = row.string("column_name") != null ? row.string("column_name") : row.string("attribute_name");
        Integer ordinal = row.integer("ordinal");
        return new Attribute(name, type(row, "data_type"), row.bool("nullable"), ordinal == null ? 0 : ordinal);
    }

    @Override
    public List<Routine> routines(List<RawRow> rows, Warnings warnings) {
        Map<String, List<RawRow>> parameters = groupBy(ofKind(rows, "PARAMETER"),
                r -> keyOf(r, "schema_name", "specific_name"));
        Map<String, List<RawRow>> results = groupBy(ofKind(rows, "RESULT_COLUMN"),
                r -> keyOf(r, "schema_name", "specific_name"));
        Map<String, List<RawRow>> lines = groupBy(ofKind(rows, "SOURCE_LINE"),
                r -> keyOf(r, "schema_name", "specific_name"));
        List<RawRow> heads = rows.stream().filter(r -> r.kind().isEmpty() || r.kind().equals("ROUTINE")).toList();
        Map<String, Long> overloads = heads.stream()
                .collect(Collectors.groupingBy(r -> keyOf(r, "schema_name", "routine_name", "routine_type"),
                        Collectors.counting()));

        List<Routine> out = new ArrayList<>();
        for (RawRow head : heads) {
            String key = keyOf(head, "schema_name", "specific_name");
            boolean overloaded = overloads.getOrDefault(keyOf(head, "schema_name", "routine_name", "routine_type"), 0L) > 1;
            collect(out, warnings, "routine " + subject(head, "schema_name", "routine_name"), () -> routine(head,
                    parameters.getOrDefault(key, List.of()),
                    results.getOrDefault(key, List.of()),
                    lines.getOrDefault(key, List.of()),
                    overloaded));
        }
        return out;
    }

    protected Routine routine(RawRow head, List<RawRow> parameterRows, List<RawRow> resultRows,
                              List<RawRow> sourceLines, boolean overloaded) {
        List<Parameter> parameters = new ArrayList<>();
        for (RawRow p : byOrdinal(parameterRows, "ordinal")) {
            Integer ordinal = p.integer("ordinal");
            parameters.add(new Parameter(p.text("parameter_name"), type(p, "data_type"),
                    ParameterMode.parse(p.string("mode")), p.text("default_value"),
                    ordinal == null ? parameters.size() + 1 : ordinal));
        }

        String name = required(head, "routine_name");
        if (overloaded) {
            String args = head.string("identity_args");
            if (args == null) {
                args = parameters.stream()
                        .filter(p -> p.mode() != ParameterMode.OUT)
                        .map(p -> p.type().nativeType())
                        .collect(Collectors.joining(", "));
            }
            name = name + "(" + args + ")";
        }
        String schema = head.string("schema_name");
        Identifier id = Identifier.of(schema != null ? schema : defaultSchema(), name);

        ReturnShape returns;
        if (!resultRows.isEmpty()) {
            returns = ReturnShape.table(byOrdinal(resultRows, "ordinal").stream().map(this::attribute).toList());
        } else if (head.text("return_type") != null) {
            returns = ReturnShape.scalar(type(head, "return_type"));
        } else {
            returns = ReturnShape.none();
        }

        String definition = head.string("definition");
        if (definition == null && !sourceLines.isEmpty()) {
            definition = byOrdinal(sourceLines, "line").stream()
                    .map(r -> r.string("text") == null ? "" : r.string("text"))
                    .collect(Collectors.joining());
        }
        return new Routine(id, routineKind(head.string("routine_type")), parameters, returns,
                head.text("language"), definition, head.text("description"));
    }

    protected RoutineKind routineKind(String raw) {
        if (raw == null) {
            throw new ModelIntegrityException("routine", "routine_type is missing");
        }
        return raw.toUpperCase(Locale.ROOT).contains("PROC") ? RoutineKind.PROCEDURE : RoutineKind.FUNCTION;
    }

    @Override
    public List<Trigger> triggers(List<RawRow> rows, Warnings warnings) {
        List<Trigger> out = new ArrayList<>();
        for (RawRow row : rows) {
            collect(out, warnings, "trigger " + subject(row, "schema_name", "trigger_name"), () -> trigger(row));
        }
        return out;
    }

    protected Trigger trigger(RawRow row) {
        Identifier table = identifier(row, row.string("table_schema") != null ? "table_schema" : "schema_name",
                "table_name");
        String schema = row.string("schema_name");
        Identifier id = Identifier.of(schema != null ? schema : table.schema(), required(row, "trigger_name"));
        Boolean enabled = row.bool("enabled");
        return new Trigger(id, table,
                TriggerTiming.parse(required(row, "timing")),
                TriggerEvent.parseAll(row.string("events")),
                enabled == null || enabled,
                row.string("definition"));
    }

    @Override
    public List<UserDefinedType> types(List<RawRow> rows, Warnings warnings) {
        Map<String, List<RawRow>> attributes = groupBy(ofKind(rows, "ATTRIBUTE"), r -> keyOf(r, "schema_name", "type_name"));
        Map<String, List<RawRow>> values = groupBy(ofKind(rows, "ENUM_VALUE"), r -> keyOf(r, "schema_name", "type_name"));
        List<UserDefinedType> out = new ArrayList<>();
        for (RawRow row : rows) {
            if (!row.kind().isEmpty() && !row.kind().equals("TYPE")) {
                continue;
            }
            String key = keyOf(row, "schema_name", "type_name");
            collect(out, warnings, "type " + subject(row, "schema_name", "type_name"), () -> new UserDefinedType(
                    identifier(row, "schema_name", "type_name"),
                    typeCategory(required(row, "category")),
                    row.text("base_type") == null ? null : type(row, "base_type"),
                    byOrdinal(attributes.getOrDefault(key, List.of()), "ordinal").stream().map(this::attribute).toList(),
                    byOrdinal(values.getOrDefault(key, List.of()), "ordinal").stream().map(r -> r.string("value")).toList(),
                    row.text("check_expression"),
                    row.text("description")));
        }
        return out;
    }

    protected TypeCategory typeCategory(String raw) {
        return TypeCategory.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace(' ', '_'));
    }

    @Override
    public List<Sequence> sequences(List<RawRow> rows, Warnings warnings) {
        List<Sequence> out = new ArrayList<>();
        for (RawRow row : rows) {
            collect(out, warnings, "sequence " + subject(row, "schema_name", "sequence_name"), () -> new Sequence(
                    identifier(row, "schema_name", "sequence_name"),
                    row.text("data_type") == null ? null : type(row, "data_type"),
                    row.bigInteger("start_value"),
                    row.bigInteger("min_value"),
                    row.bigInteger("max_value"),
                    row.bigInteger("increment"),
                    row.flag("cycle"),
                    row.bigInteger("cache_size"),
                    row.bigInteger("current_value")));
        }
        return out;
    }

    @Override
    public List<Synonym> synonyms(List<RawRow> rows, Warnings warnings) {
        List<Synonym> out = new ArrayList<>();
        for (RawRow row : rows) {
            collect(out, warnings, "synonym " + subject(row, "schema_name", "synonym_name"), () -> synonym(row));
        }
        return out;
    }

    protected Synonym synonym(RawRow row) {
        Identifier id = identifier(row, "schema_name", "synonym_name");
        String targetSchema = row.string("target_schema");
        Identifier target = Identifier.of(targetSchema != null ? targetSchema : id.schema(), required(row, "target_name"));
        return new Synonym(id, target, row.text("target_server"), row.text("target_database"));
    }

    @Override
    public List<SecurityPrincipal> security(List<RawRow> rows, Warnings warnings) {
        Map<String, List<RawRow>> grants = groupBy(ofKind(rows, "GRANT"), r -> r.string("principal_name"));
        Map<String, List<RawRow>> memberships = groupBy(ofKind(rows, "MEMBERSHIP"), r -> r.string("principal_name"));
        List<SecurityPrincipal> out = new ArrayList<>();
        for (RawRow row : ofKind(rows, "PRINCIPAL")) {
            String name = row.string("principal_name");
            collect(out, warnings, "principal " + name, () -> new SecurityPrincipal(
                    name,
                    PrincipalKind.valueOf(required(row, "principal_kind").trim().toUpperCase(Locale.ROOT)),
                    grants.getOrDefault(name, List.of()).stream().map(this::grant).toList(),
                    memberships.getOrDefault(name, List.of()).stream().map(r -> required(r, "role_name")).toList()));
        }
        return out;
    }

    protected Grant grant(RawRow row) {
        String object = row.string("object_name");
        return new Grant(required(row, "privilege"),
                object == null ? null : Identifier.of(row.string("object_schema"), object));
    }
}
