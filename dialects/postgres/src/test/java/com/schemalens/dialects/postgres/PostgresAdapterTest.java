package com.schemalens.dialects.postgres;

import com.schemalens.core.adapter.Owned;
import com.schemalens.core.adapter.Warnings;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.RawRow;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.ForeignKey;
import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.ParameterMode;
import com.schemalens.core.model.ReferentialAction;
import com.schemalens.core.model.Routine;
import com.schemalens.core.model.RoutineKind;
import com.schemalens.core.model.Trigger;
import com.schemalens.core.model.TriggerEvent;
import com.schemalens.core.model.TriggerTiming;
import com.schemalens.core.model.TypeCategory;
import com.schemalens.core.model.TypeFamily;
import com.schemalens.core.model.UserDefinedType;
import com.schemalens.core.model.WarningKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PostgresAdapterTest {

    private final PostgresAdapter adapter = new PostgresAdapter();
    private final Warnings warnings = new Warnings();

    @Test
    void synonymsAreNotSupported() {
        assertFalse(adapter.supports(CatalogKind.SYNONYMS));
        assertTrue(adapter.supports(CatalogKind.TYPES));
        assertTrue(adapter.supports(CatalogKind.SEQUENCES));
    }

    @Test
    void serialDefaultMarksIdentity() {
        Column column = column(RawRow.of(
                "schema_name", "sales", "table_name", "customers", "column_name", "customer_id", "ordinal", 1,
                "data_type", "integer", "nullable", false,
                "default_value", "nextval('sales.customers_customer_id_seq'::regclass)",
                "identity_seed", 1L, "identity_increment", 1L));

        assertTrue(column.identity());
        assertEquals(1L, column.identitySeed());
        assertEquals("nextval('sales.customers_customer_id_seq'::regclass)", column.defaultValue());
        assertEquals(TypeFamily.INTEGER, column.type().family());
    }

    @Test
    void identityColumnWithoutDefault() {
        Column column = column(RawRow.of(
                "schema_name", "sales", "table_name", "t", "column_name", "id", "ordinal", 1,
                "data_type", "bigint", "nullable", false, "identity_kind", "a",
                "identity_seed", 100L, "identity_increment", 5L));

        assertTrue(column.identity());
        assertEquals(100L, column.identitySeed());
        assertEquals(5L, column.identityIncrement());
        assertNull(column.defaultValue());
    }

    @Test
    void storedGeneratedColumnIsComputed() {
        Column column = column(RawRow.of(
                "schema_name", "sales", "table_name", "t", "column_name", "total", "ordinal", 3,
                "data_type", "numeric(12,2)", "nullable", true, "identity_kind", "",
                "generation_expression", "(quantity * unit_price)"));

        assertFalse(column.identity());
        assertTrue(column.computed());
        assertEquals("(quantity * unit_price)", column.computedExpression());
        assertEquals(12, column.type().precision());
    }

    @Test
    void actionCodesMapToTheClosedSet() {
        List<RawRow> rows = List.of(
                fk("fk_a", "a", "c"), fk("fk_r", "r", "n"), fk("fk_d", "d", "a"));

        List<ForeignKey> keys = adapter.foreignKeys(rows, warnings).stream().map(Owned::item).toList();

        assertEquals(ReferentialAction.NO_ACTION, keys.get(0).onDelete());
        assertEquals(ReferentialAction.CASCADE, keys.get(0).onUpdate());
        assertEquals(ReferentialAction.RESTRICT, keys.get(1).onDelete());
        assertEquals(ReferentialAction.SET_NULL, keys.get(1).onUpdate());
        assertEquals(ReferentialAction.SET_DEFAULT, keys.get(2).onDelete());
        assertEquals(Identifier.of("inventory", "products"), keys.get(0).target());
    }

    @Test
    void unknownActionCodeSkipsTheKey() {
        List<Owned<ForeignKey>> keys = adapter.foreignKeys(List.of(fk("fk_x", "z", "a")), warnings);

        assertTrue(keys.isEmpty());
        assertEquals(WarningKind.SKIPPED_OBJECT, warnings.list().get(0).kind());
    }

    @Test
    void triggerTypeBitsDecode() {
        // ROW | BEFORE | UPDATE
        Trigger before = trigger("trg_customers_update_timestamp", 1 | 2 | 16, "O");
        assertEquals(TriggerTiming.BEFORE, before.timing());
        assertEquals(Set.of(TriggerEvent.UPDATE), before.events());
        assertTrue(before.enabled());

        // ROW | INSERT | DELETE | UPDATE
        Trigger after = trigger("trg_order_items_update_total", 1 | 4 | 8 | 16, "D");
        assertEquals(TriggerTiming.AFTER, after.timing());
        assertEquals(Set.of(TriggerEvent.INSERT, TriggerEvent.UPDATE, TriggerEvent.DELETE), after.events());
        assertFalse(after.enabled());

        Trigger instead = trigger("trg_view_insert", 1 | 64 | 4, "O");
        assertEquals(TriggerTiming.INSTEAD_OF, instead.timing());
        assertEquals(Identifier.of("sales", "order_items"), instead.table());
    }

    @Test
    void overloadedRoutinesTakeTheirIdentityArguments() {
        List<RawRow> rows = List.of(
                RawRow.of("row_kind", "ROUTINE", "schema_name", "sales", "routine_name", "price",
                        "specific_name", "101", "routine_type", "FUNCTION", "language", "sql",
                        "return_type", "numeric", "identity_args", "p_id integer"),
                RawRow.of("row_kind", "ROUTINE", "schema_name", "sales", "routine_name", "price",
                        "specific_name", "102", "routine_type", "FUNCTION", "language", "sql",
                        "return_type", "numeric", "identity_args", "p_sku text"),
                RawRow.of("row_kind", "PARAMETER", "schema_name", "sales", "specific_name", "101",
                        "parameter_name", "p_id", "ordinal", 1, "data_type", "integer", "mode", "IN"));

        List<Routine> routines = adapter.routines(rows, warnings);

        assertEquals(List.of("price(p_id integer)", "price(p_sku text)"),
                routines.stream().map(r -> r.id().name()).toList());
        assertEquals(1, routines.get(0).parameters().size());
        assertTrue(routines.get(1).parameters().isEmpty());
    }

    @Test
    void tableFunctionReturnsItsColumns() {
        List<RawRow> rows = List.of(
                RawRow.of("row_kind", "ROUTINE", "schema_name", "inventory", "routine_name", "get_products_by_category",
                        "specific_name", "200", "routine_type", "FUNCTION", "language", "plpgsql"),
                RawRow.of("row_kind", "PARAMETER", "schema_name", "inventory", "specific_name", "200",
                        "parameter_name", "p_category", "ordinal", 1, "data_type", "character varying", "mode", "IN"),
                RawRow.of("row_kind", "RESULT_COLUMN", "schema_name", "inventory", "specific_name", "200",
                        "column_name", "sku", "ordinal", 3, "data_type", "character varying"),
                RawRow.of("row_kind", "RESULT_COLUMN", "schema_name", "inventory", "specific_name", "200",
                        "column_name", "product_id", "ordinal", 2, "data_type", "integer"));

        Routine routine = adapter.routines(rows, warnings).get(0);

        assertEquals(RoutineKind.FUNCTION, routine.kind());
        assertTrue(routine.returns().tabular());
        assertEquals(List.of("product_id", "sku"), routine.returns().columns().stream().map(a -> a.name()).toList());
        assertEquals(ParameterMode.IN, routine.parameters().get(0).mode());
    }

    @Test
    void enumCompositeAndDomainTypes() {
        List<RawRow> rows = List.of(
                RawRow.of("row_kind", "TYPE", "schema_name", "sales", "type_name", "order_status", "category", "ENUM"),
                RawRow.of("row_kind", "ENUM_VALUE", "schema_name", "sales", "type_name", "order_status",
                        "value", "shipped", "ordinal", 2),
                RawRow.of("row_kind", "ENUM_VALUE", "schema_name", "sales", "type_name", "order_status",
                        "value", "pending", "ordinal", 1),
                RawRow.of("row_kind", "TYPE", "schema_name", "sales", "type_name", "email_address", "category", "DOMAIN",
                        "base_type", "character varying(255)", "check_expression", "CHECK (VALUE ~ '@'::text)"),
                RawRow.of("row_kind", "TYPE", "schema_name", "sales", "type_name", "address_type", "category", "COMPOSITE"),
                RawRow.of("row_kind", "ATTRIBUTE", "schema_name", "sales", "type_name", "address_type",
                        "attribute_name", "street", "ordinal", 1, "data_type", "character varying(200)", "nullable", true));

        List<UserDefinedType> types = adapter.types(rows, warnings);

        UserDefinedType status = types.get(0);
        assertEquals(TypeCategory.ENUM, status.category());
        assertEquals(List.of("pending", "shipped"), status.enumValues());

        UserDefinedType email = types.get(1);
        assertEquals(TypeCategory.DOMAIN, email.category());
        assertEquals(255, email.baseType().length());
        assertEquals("CHECK (VALUE ~ '@'::text)", email.checkExpression());

        UserDefinedType address = types.get(2);
        assertEquals("street", address.attributes().get(0).name());
        assertTrue(warnings.isEmpty());
    }

    private Column column(RawRow row) {
        List<Owned<Column>> columns = adapter.columns(List.of(row), warnings);
        assertEquals(1, columns.size(), () -> "column skipped: " + warnings.list());
        return columns.get(0).item();
    }

    private static RawRow fk(String name, String onDelete, String onUpdate) {
        return RawRow.of("schema_name", "sales", "table_name", "order_items", "constraint_name", name,
                "column_name", "product_id", "key_ordinal", 1, "ref_schema", "inventory", "ref_table", "products",
                "ref_column", "product_id", "on_delete", onDelete, "on_update", onUpdate);
    }

    private Trigger trigger(String name, int tgtype, String enabled) {
        List<Trigger> triggers = adapter.triggers(List.of(RawRow.of(
                "schema_name", "sales", "trigger_name", name, "table_schema", "sales", "table_name", "order_items",
                "tgtype", tgtype, "tgenabled", enabled, "definition", "CREATE TRIGGER " + name)), warnings);
        assertEquals(1, triggers.size());
        return triggers.get(0);
    }
}
