package com.schemalens.dialects.mssql;

import com.schemalens.core.adapter.AbstractDialectAdapter;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.RawRow;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.DataType;
import com.schemalens.core.model.Engine;
import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.ModelIntegrityException;
import com.schemalens.core.model.Synonym;
import com.schemalens.core.model.Trigger;
import com.schemalens.core.model.TriggerEvent;
import com.schemalens.core.model.TriggerTiming;
import com.schemalens.core.model.TypeFamily;
import com.schemalens.core.model.TypeNormalizer;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps {@code sys} catalog rows. SQL Server reports a bare type name with its byte length,
 * precision and scale, so the declared form ({@code nvarchar(50)}, {@code decimal(10,2)})
 * is rebuilt here. Synonym targets arrive as a bracketed multi-part name.
 */
public class MssqlAdapter extends AbstractDialectAdapter {
    static final Set<CatalogKind> SUPPORTED = EnumSet.allOf(CatalogKind.class);

    private static final Set<String> BYTE_LENGTH = Set.of("varchar", "char", "varbinary", "binary");
    private static final Set<String> CHAR_LENGTH = Set.of("nvarchar", "nchar");
    private static final Set<String> EXACT_NUMERIC = Set.of("decimal", "numeric");
    private static final Set<String> FRACTIONAL_SECONDS = Set.of("datetime2", "time", "datetimeoffset");

    public MssqlAdapter() {
        super(Engine.MSSQL, SUPPORTED);
    }

    @Override
    public String defaultSchema() {
        return "dbo";
    }

    /**
     * Rebuilds the declared type. Length, precision and scale sit next to the type label,
     * prefixed with {@code return_} for function return types.
     */
    @Override
    protected DataType type(RawRow row, String label) {
        String name = row.text(label);
        if (name == null) {
            return super.type(row, label);
        }
        String prefix = label.startsWith("return_") ? "return_" : "";
        String typeSchema = row.text(prefix + "type_schema");
        if (typeSchema != null) {
            return new DataType(typeSchema + "." + name, TypeFamily.USER_DEFINED, null, null, null);
        }
        Integer maxLength = row.integer(prefix + "max_length");
        Integer precision = row.integer(prefix + "precision");
        Integer scale = row.integer(prefix + "scale");
        String base = name.toLowerCase(Locale.ROOT);
        if (BYTE_LENGTH.contains(base) && maxLength != null) {
            return sized(name, maxLength == -1 ? null : maxLength);
        }
        if (CHAR_LENGTH.contains(base) && maxLength != null) {
            return sized(name, maxLength == -1 ? null : maxLength / 2);
        }
        if (EXACT_NUMERIC.contains(base) && precision != null) {
            return TypeNormalizer.normalize(name + "(" + precision + "," + (scale == null ? 0 : scale) + ")");
        }
        if (FRACTIONAL_SECONDS.contains(base) && scale != null) {
            return TypeNormalizer.normalize(name + "(" + scale + ")");
        }
        return TypeNormalizer.normalize(name);
    }

    private static DataType sized(String name, Integer length) {
        DataType type = TypeNormalizer.normalize(name + "(" + (length == null ? "max" : length) + ")");
        return new DataType(type.nativeType(), type.family(), length, null, null);
    }

    @Override
    protected Column column(RawRow row) {
        Column.Builder builder = Column.builder(required(row, "column_name"), type(row, "data_type"))
                .nullable(row.flag("nullable"))
                .ordinal(position(row, "ordinal"))
                .description(row.text("description"));
        String computed = row.text("computed_definition");
        if (computed != null) {
            builder.computed(computed);
        } else {
            builder.defaultValue(row.text("default_value"));
        }
        if (row.flag("is_identity")) {
            builder.identity(row.longValue("identity_seed"), row.longValue("identity_increment"));
        }
        return builder.build();
    }

    @Override
    protected Trigger trigger(RawRow row) {
        Identifier table = identifier(row, "table_schema", "table_name");
        Set<TriggerEvent> events = EnumSet.noneOf(TriggerEvent.class);
        if (row.flag("is_insert")) {
            events.add(TriggerEvent.INSERT);
        }
        if (row.flag("is_update")) {
            events.add(TriggerEvent.UPDATE);
        }
        if (row.flag("is_delete")) {
            events.add(TriggerEvent.DELETE);
        }
        return new Trigger(
                Identifier.of(table.schema(), required(row, "trigger_name")),
                table,
                TriggerTiming.parse(required(row, "timing")),
                events,
                !row.flag("is_disabled"),
                row.string("definition"));
    }

    /**
     * Splits {@code base_object_name}, at most {@code server.database.schema.object}.
     * An empty schema part ({@code db..obj}) means the default schema.
     */
    @Override
    protected Synonym synonym(RawRow row) {
        Identifier id = identifier(row, "schema_name", "synonym_name");
        String raw = required(row, "base_object_name");
        List<String> parts = splitName(raw);
        if (parts.size() > 4 || parts.get(parts.size() - 1).isEmpty()) {
            throw new ModelIntegrityException("synonym " + id, "cannot parse target '" + raw + "'");
        }
        int n = parts.size();
        String object = parts.get(n - 1);
        String schema = n >= 2 ? parts.get(n - 2) : "";
        String database = n >= 3 ? emptyToNull(parts.get(n - 3)) : null;
        String server = n == 4 ? emptyToNull(parts.get(0)) : null;
        if (schema.isEmpty()) {
            schema = database != null ? defaultSchema() : id.schema();
        }
        return new Synonym(id, Identifier.of(schema, object), server, database);
    }

    static List<String> splitName(String raw) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean bracketed = false;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (bracketed) {
                if (c == ']') {
                    if (i + 1 < raw.length() && raw.charAt(i + 1) == ']') {
                        current.append(']');
                        i++;
                    } else {
                        bracketed = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '[') {
                bracketed = true;
            } else if (c == '.') {
                parts.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString().trim());
        return parts;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
