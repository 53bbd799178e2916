package com.schemalens.core.extract;

import com.schemalens.core.catalog.CatalogDump;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.DatabaseInfo;
import com.schemalens.core.catalog.RawRow;
import com.schemalens.core.model.Engine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raw rows for a small two-schema shop: four tables and two views in {@code sales},
 * one table in {@code hr}, two procedures and a function.
 */
final class ShopCatalog {
    private final Map<CatalogKind, List<RawRow>> rows = new EnumMap<>(CatalogKind.class);

    ShopCatalog() {
        add(CatalogKind.SCHEMAS, RawRow.of("schema_name", "sales"), RawRow.of("schema_name", "hr"),
                RawRow.of("schema_name", "pg_catalog"));
        for (String table : List.of("customers", "orders", "order_items", "products")) {
            add(CatalogKind.TABLES, RawRow.of("schema_name", "sales", "table_name", table, "row_count", -1));
        }
        add(CatalogKind.TABLES, RawRow.of("schema_name", "hr", "table_name", "employees", "row_count", 12));
        add(CatalogKind.TABLES, RawRow.of("schema_name", "pg_catalog", "table_name", "pg_class"));

        column("customers", "id", 1, "integer");
        column("customers", "email", 2, "varchar(255)");
        column("orders", "id", 1, "integer");
        column("orders", "customer_id", 2, "integer");
        column("order_items", "id", 1, "integer");
        column("order_items", "order_id", 3, "integer");
        column("order_items", "product_id", 4, "integer");
        column("products", "id", 1, "integer");
        column("products", "quantity_in_stock", 2, "integer");
        column("products", "reorder_level", 3, "integer");
        add(CatalogKind.COLUMNS, RawRow.of("schema_name", "hr", "table_name", "employees",
                "column_name", "id", "ordinal", 1, "data_type", "integer"));

        for (String table : List.of("customers", "orders", "order_items", "products")) {
            add(CatalogKind.PRIMARY_KEYS, RawRow.of("schema_name", "sales", "table_name", table,
                    "constraint_name", table + "_pkey", "column_name", "id", "key_ordinal", 1));
        }
        fk("orders_customer_fk", "orders", "customer_id", "customers", "NO ACTION");
        fk("order_items_order_fk", "order_items", "order_id", "orders", "CASCADE");
        fk("order_items_product_fk", "order_items", "product_id", "products", "RESTRICT");
        add(CatalogKind.INDEXES, RawRow.of("schema_name", "sales", "table_name", "customers",
                "index_name", "customers_email_key", "is_unique", true, "column_name", "email", "key_ordinal", 1));

        view("customer_orders", "SELECT * FROM sales.customers c JOIN sales.orders o ON o.customer_id = c.id");
        view("low_stock_products", "SELECT * FROM sales.products WHERE quantity_in_stock < reorder_level");
        add(CatalogKind.VIEWS, RawRow.of("row_kind", "DEPENDENCY", "schema_name", "sales",
                "view_name", "low_stock_products", "ref_schema", "sales", "ref_name", "products"));

        routine("place_order", "PROCEDURE");
        routine("cancel_order", "PROCEDURE");
        routine("order_total", "FUNCTION");
        add(CatalogKind.ROUTINES, RawRow.of("row_kind", "PARAMETER", "schema_name", "sales",
                "specific_name", "order_total", "parameter_name", "p_order_id", "ordinal", 1,
                "data_type", "integer", "mode", "IN"));

        add(CatalogKind.TRIGGERS, RawRow.of("schema_name", "sales", "trigger_name", "trg_orders_audit",
                "table_name", "orders", "timing", "AFTER", "events", "INSERT OR UPDATE", "enabled", true));
        add(CatalogKind.TRIGGERS, RawRow.of("schema_name", "sales", "trigger_name", "trg_broken",
                "table_name", "orders", "timing", "SOMETIMES", "events", "INSERT"));

        add(CatalogKind.SEQUENCES, RawRow.of("schema_name", "sales", "sequence_name", "order_seq",
                "start_value", 1, "increment", 1, "max_value", new BigInteger("9223372036854775807")));
        add(CatalogKind.SECURITY, RawRow.of("row_kind", "PRINCIPAL", "principal_name", "reporting",
                "principal_kind", "ROLE"));
        add(CatalogKind.SECURITY, RawRow.of("row_kind", "GRANT", "principal_name", "reporting",
                "privilege", "SELECT", "object_schema", "sales", "object_name", "orders"));
    }

    private void add(CatalogKind kind, RawRow... row) {
        rows.computeIfAbsent(kind, k -> new ArrayList<>()).addAll(List.of(row));
    }

    private void column(String table, String name, int ordinal, String type) {
        add(CatalogKind.COLUMNS, RawRow.of("schema_name", "sales", "table_name", table, "column_name", name,
                "ordinal", ordinal, "data_type", type, "nullable", "NO"));
    }

    private void fk(String name, String table, String column, String target, String onDelete) {
        add(CatalogKind.FOREIGN_KEYS, RawRow.of("schema_name", "sales", "table_name", table,
                "constraint_name", name, "column_name", column, "key_ordinal", 1,
                "ref_schema", "sales", "ref_table", target, "ref_column", "id",
                "on_delete", onDelete, "on_update", "NO ACTION"));
    }

    private void view(String name, String definition) {
        add(CatalogKind.VIEWS, RawRow.of("row_kind", "VIEW", "schema_name", "sales", "view_name", name,
                "definition", definition));
    }

    private void routine(String name, String type) {
        add(CatalogKind.ROUTINES, RawRow.of("row_kind", "ROUTINE", "schema_name", "sales", "routine_name", name,
                "specific_name", name, "routine_type", type, "language", "plpgsql"));
    }

    Map<CatalogKind, List<RawRow>> rows() {
        return rows;
    }

    CatalogDump dump() {
        return new CatalogDump(Engine.POSTGRES, new DatabaseInfo("shop", "16.2", "public"), rows, Set.of());
    }
}
