package com.schemalens.dialects.mysql;

import com.schemalens.core.adapter.AbstractDialectAdapter;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.RawRow;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.DataType;
import com.schemalens.core.model.Engine;
import com.schemalens.core.model.TypeFamily;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Maps {@code information_schema} rows. Types are the full {@code column_type} strings,
 * so {@code int unsigned} or {@code enum('a','b')} are kept as declared.
 */
public class MysqlAdapter extends AbstractDialectAdapter {
    static final Set<CatalogKind> SUPPORTED = EnumSet.complementOf(
            EnumSet.of(CatalogKind.TYPES, CatalogKind.SEQUENCES, CatalogKind.SYNONYMS));

    public MysqlAdapter() {
        super(Engine.MYSQL, SUPPORTED);
    }

    /** {@code BOOLEAN} columns are stored as {@code tinyint(1)}. */
    @Override
    protected DataType type(RawRow row, String label) {
        String raw = row.string(label);
        if (raw != null && raw.trim().toLowerCase(Locale.ROOT).equals("tinyint(1)")) {
            return new DataType(raw.trim(), TypeFamily.BOOLEAN, null, null, null);
        }
        return super.type(row, label);
    }

    @Override
    protected Column column(RawRow row) {
        String extra = row.text("extra");
        String lowerExtra = extra == null ? "" : extra.toLowerCase(Locale.ROOT);
        Column.Builder builder = Column.builder(required(row, "column_name"), type(row, "data_type"))
                .nullable(row.flag("nullable"))
                .ordinal(position(row, "ordinal"))
                .description(row.text("description"));
        String generated = row.text("generation_expression");
        if (generated != null) {
            builder.computed(generated);
        } else {
            builder.defaultValue(row.string("default_value"));
        }
        if (lowerExtra.contains("auto_increment")) {
            builder.identity(true);
        }
        return builder.build();
    }
}
