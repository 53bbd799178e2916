package com.schemalens.dialects.oracle;

import com.schemalens.core.adapter.AbstractDialectAdapter;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.RawRow;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.DataType;
import com.schemalens.core.model.Engine;
import com.schemalens.core.model.TypeFamily;
import com.schemalens.core.model.TypeNormalizer;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps {@code ALL_*} dictionary rows. The dictionary stores the bare type name with length,
 * character length, precision and scale beside it; {@code NUMBER} with scale 0 is an
 * integer. Identity columns report their seed and step only inside the
 * {@code identity_options} text.
 */
public class OracleAdapter extends AbstractDialectAdapter {
    static final Set<CatalogKind> SUPPORTED = EnumSet.allOf(CatalogKind.class);

    private static final Set<String> CHARACTER = Set.of("VARCHAR2", "NVARCHAR2", "VARCHAR", "CHAR", "NCHAR");
    private static final Pattern START_WITH = Pattern.compile("START WITH:\\s*(-?\\d+)");
    private static final Pattern INCREMENT_BY = Pattern.compile("INCREMENT BY:\\s*(-?\\d+)");

    public OracleAdapter() {
        super(Engine.ORACLE, SUPPORTED);
    }

    /**
     * Rebuilds the declared type. Function return types use the same labels prefixed with
     * {@code return_}.
     */
    @Override
    protected DataType type(RawRow row, String label) {
        String name = row.text(label);
        if (name == null) {
            return super.type(row, label);
        }
        String prefix = label.startsWith("return_") ? "return_" : "";
        String owner = row.text(prefix + "type_owner");
        if (owner != null) {
            String typeName = row.text(prefix + "type_name");
            return new DataType(owner + "." + (typeName != null ? typeName : name), TypeFamily.USER_DEFINED,
                    null, null, null);
        }
        String upper = name.toUpperCase(Locale.ROOT);
        if (upper.startsWith("TABLE OF ") || upper.startsWith("VARRAY")) {
            return new DataType(name, TypeFamily.ARRAY, null, null, null);
        }
        Integer charLength = row.integer(prefix + "char_length");
        Integer maxLength = row.integer(prefix + "max_length");
        Integer precision = row.integer(prefix + "precision");
        Integer scale = row.integer(prefix + "scale");

        if (CHARACTER.contains(upper)) {
            Integer length = charLength != null && charLength > 0 ? charLength : maxLength;
            return length == null ? TypeNormalizer.normalize(name) : TypeNormalizer.normalize(name + "(" + length + ")");
        }
        if (upper.equals("RAW") && maxLength != null) {
            return TypeNormalizer.normalize(name + "(" + maxLength + ")");
        }
        if (upper.equals("NUMBER")) {
            return number(name, precision, scale);
        }
        if (upper.equals("FLOAT") && precision != null) {
            return TypeNormalizer.normalize(name + "(" + precision + ")");
        }
        return TypeNormalizer.normalize(name);
    }

    static DataType number(String name, Integer precision, Integer scale) {
        if (scale == null) {
            return precision == null
                    ? TypeNormalizer.normalize(name)
                    : TypeNormalizer.normalize(name + "(" + precision + ")");
        }
        if (scale == 0) {
            if (precision == null) {
                return new DataType("INTEGER", TypeFamily.INTEGER, null, null, 0);
            }
            return new DataType(name + "(" + precision + ")", TypeFamily.INTEGER, null, precision, 0);
        }
        String declared = name + "(" + (precision == null ? "*" : precision.toString()) + "," + scale + ")";
        return new DataType(declared, TypeFamily.DECIMAL, null, precision, scale);
    }

    @Override
    protected Column column(RawRow row) {
        String defaultValue = row.text("default_value");
        Column.Builder builder = Column.builder(required(row, "column_name"), type(row, "data_type"))
                .nullable(row.flag("nullable"))
                .ordinal(position(row, "ordinal"))
                .description(row.text("description"));
        if (row.flag("virtual_column")) {
            builder.computed(defaultValue);
        } else if (row.flag("identity_column")) {
            String options = row.text("identity_options");
            builder.identity(option(options, START_WITH), option(options, INCREMENT_BY));
        } else {
            builder.defaultValue(defaultValue);
        }
        return builder.build();
    }

    private static Long option(String options, Pattern pattern) {
        if (options == null) {
            return null;
        }
        Matcher m = pattern.matcher(options);
        return m.find() ? Long.valueOf(m.group(1)) : null;
    }

    /** Function-based index keys name a hidden column; the expression is what was declared. */
    @Override
    protected String indexColumn(RawRow row) {
        String expression = row.text("expression");
        return expression != null ? expression : required(row, "column_name");
    }
}
