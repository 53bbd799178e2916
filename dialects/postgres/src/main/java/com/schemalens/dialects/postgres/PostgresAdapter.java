package com.schemalens.dialects.postgres;

import com.schemalens.core.adapter.AbstractDialectAdapter;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.RawRow;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.Engine;
import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.ModelIntegrityException;
import com.schemalens.core.model.ReferentialAction;
import com.schemalens.core.model.Trigger;
import com.schemalens.core.model.TriggerEvent;
import com.schemalens.core.model.TriggerTiming;

import java.util.EnumSet;
import java.util.Set;

/**
 * Maps {@code pg_catalog} rows. Referential actions arrive as the single-letter codes of
 * {@code pg_constraint}, trigger timing and events as the {@code tgtype} bit mask.
 */
public class PostgresAdapter extends AbstractDialectAdapter {
    static final Set<CatalogKind> SUPPORTED = EnumSet.complementOf(EnumSet.of(CatalogKind.SYNONYMS));

    // pg_trigger.tgtype bits
    static final int TRIGGER_BEFORE = 1 << 1;
    static final int TRIGGER_INSERT = 1 << 2;
    static final int TRIGGER_DELETE = 1 << 3;
    static final int TRIGGER_UPDATE = 1 << 4;
    static final int TRIGGER_INSTEAD = 1 << 6;

    public PostgresAdapter() {
        super(Engine.POSTGRES, SUPPORTED);
    }

    @Override
    public String defaultSchema() {
        return "public";
    }

    @Override
    protected Column column(RawRow row) {
        String defaultValue = row.text("default_value");
        Column.Builder builder = Column.builder(required(row, "column_name"), type(row, "data_type"))
                .nullable(row.flag("nullable"))
                .defaultValue(defaultValue)
                .ordinal(position(row, "ordinal"))
                .description(row.text("description"));
        String identityKind = row.text("identity_kind");
        boolean serial = defaultValue != null && defaultValue.startsWith("nextval(");
        if (identityKind != null || serial) {
            builder.identity(row.longValue("identity_seed"), row.longValue("identity_increment"));
        }
        String generated = row.text("generation_expression");
        if (generated != null) {
            builder.computed(generated);
        }
        return builder.build();
    }

    @Override
    protected ReferentialAction action(String raw) {
        if (raw == null || raw.length() != 1) {
            return super.action(raw);
        }
        return switch (raw.charAt(0)) {
            case 'a' -> ReferentialAction.NO_ACTION;
            case 'r' -> ReferentialAction.RESTRICT;
            case 'c' -> ReferentialAction.CASCADE;
            case 'n' -> ReferentialAction.SET_NULL;
            case 'd' -> ReferentialAction.SET_DEFAULT;
            default -> throw new ModelIntegrityException("referential action", "unknown action code '" + raw + "'");
        };
    }

    @Override
    protected Trigger trigger(RawRow row) {
        Integer type = row.integer("tgtype");
        if (type == null) {
            throw new ModelIntegrityException("trigger " + subject(row, "schema_name", "trigger_name"),
                    "tgtype is missing");
        }
        TriggerTiming timing;
        if ((type & TRIGGER_INSTEAD) != 0) {
            timing = TriggerTiming.INSTEAD_OF;
        } else if ((type & TRIGGER_BEFORE) != 0) {
            timing = TriggerTiming.BEFORE;
        } else {
            timing = TriggerTiming.AFTER;
        }
        Set<TriggerEvent> events = EnumSet.noneOf(TriggerEvent.class);
        if ((type & TRIGGER_INSERT) != 0) {
            events.add(TriggerEvent.INSERT);
        }
        if ((type & TRIGGER_UPDATE) != 0) {
            events.add(TriggerEvent.UPDATE);
        }
        if ((type & TRIGGER_DELETE) != 0) {
            events.add(TriggerEvent.DELETE);
        }
        Identifier table = identifier(row, "table_schema", "table_name");
        return new Trigger(
                Identifier.of(table.schema(), required(row, "trigger_name")),
                table,
                timing,
                events,
                !"D".equals(row.text("tgenabled")),
                row.string("definition"));
    }
}
