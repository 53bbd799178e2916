package com.schemalens.dialects.sqlite;

import com.schemalens.core.adapter.AbstractDialectAdapter;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.RawRow;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.DataType;
import com.schemalens.core.model.Engine;
import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.ModelIntegrityException;
import com.schemalens.core.model.Trigger;
import com.schemalens.core.model.TriggerEvent;
import com.schemalens.core.model.TriggerTiming;
import com.schemalens.core.model.TypeNormalizer;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps SQLite catalog rows. SQLite names neither primary nor foreign keys, exposes no
 * clustering and keeps trigger timing and events only in the trigger's DDL.
 */
public class SqliteAdapter extends AbstractDialectAdapter {
    static final Set<CatalogKind> SUPPORTED = EnumSet.of(
            CatalogKind.SCHEMAS, CatalogKind.TABLES, CatalogKind.COLUMNS, CatalogKind.PRIMARY_KEYS,
            CatalogKind.INDEXES, CatalogKind.FOREIGN_KEYS, CatalogKind.VIEWS, CatalogKind.TRIGGERS);

    // CREATE [TEMP] TRIGGER [IF NOT EXISTS] name <timing and events> ON table
    private static final Pattern TRIGGER_HEADER = Pattern.compile(
            "^\\s*CREATE\\s+(?:TEMP(?:ORARY)?\\s+)?TRIGGER\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?"
                    + "(?:\"[^\"]*\"|\\[[^\\]]*]|`[^`]*`|\\S+)\\s+(.*?)\\s+ON\\s",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final int GENERATED_VIRTUAL = 2;
    private static final int GENERATED_STORED = 3;

    public SqliteAdapter() {
        super(Engine.SQLITE, SUPPORTED);
    }

    @Override
    public String defaultSchema() {
        return "main";
    }

    @Override
    protected boolean parsesViewDefinitions() {
        return true;
    }

    /** Columns declared without a type have no affinity name; they are shown as TEXT. */
    @Override
    protected DataType type(RawRow row, String label) {
        String declared = row.text(label);
        return TypeNormalizer.normalize(declared == null ? "TEXT" : declared);
    }

    @Override
    protected Column column(RawRow row) {
        Column.Builder builder = Column.builder(required(row, "column_name"), type(row, "data_type"))
                .nullable(!row.flag("not_null"))
                .defaultValue(row.text("default_value"))
                .ordinal(position(row, "ordinal"));
        Integer pk = row.integer("pk_ordinal");
        if (pk != null && pk > 0 && row.flag("autoincrement")) {
            builder.identity(true);
        }
        Integer hidden = row.integer("hidden");
        if (hidden != null && (hidden == GENERATED_VIRTUAL || hidden == GENERATED_STORED)) {
            builder.computed(null);
        }
        return builder.build();
    }

    @Override
    protected Trigger trigger(RawRow row) {
        Identifier id = Identifier.of("main", required(row, "trigger_name"));
        Identifier table = Identifier.of("main", required(row, "table_name"));
        String definition = row.string("definition");
        Matcher m = TRIGGER_HEADER.matcher(definition == null ? "" : definition);
        if (!m.find()) {
            throw new ModelIntegrityException("trigger " + id, "cannot read timing and events from its definition");
        }
        String header = m.group(1).trim().toUpperCase(Locale.ROOT);
        TriggerTiming timing = TriggerTiming.BEFORE;
        if (header.startsWith("BEFORE") || header.startsWith("AFTER") || header.startsWith("INSTEAD")) {
            timing = TriggerTiming.parse(header);
        }
        Set<TriggerEvent> events = TriggerEvent.parseAll(header.replaceFirst("\\bUPDATE\\s+OF\\b.*$", "UPDATE"));
        return new Trigger(id, table, timing, events, true, definition);
    }
}
