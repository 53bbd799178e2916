package com.schemalens.render;

import com.schemalens.core.adapter.Warnings;
import com.schemalens.core.graph.GraphBuilder;
import com.schemalens.core.model.Attribute;
import com.schemalens.core.model.CheckConstraint;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.Engine;
import com.schemalens.core.model.ForeignKey;
import com.schemalens.core.model.Grant;
import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.Index;
import com.schemalens.core.model.ObjectType;
import com.schemalens.core.model.Parameter;
import com.schemalens.core.model.ParameterMode;
import com.schemalens.core.model.PrimaryKey;
import com.schemalens.core.model.PrincipalKind;
import com.schemalens.core.model.ReferentialAction;
import com.schemalens.core.model.RelationshipGraph;
import com.schemalens.core.model.ReturnShape;
import com.schemalens.core.model.Routine;
import com.schemalens.core.model.RoutineKind;
import com.schemalens.core.model.SchemaObjects;
import com.schemalens.core.model.SchemaSnapshot;
import com.schemalens.core.model.SecurityPrincipal;
import com.schemalens.core.model.Sequence;
import com.schemalens.core.model.Synonym;
import com.schemalens.core.model.Table;
import com.schemalens.core.model.Trigger;
import com.schemalens.core.model.TriggerEvent;
import com.schemalens.core.model.TriggerTiming;
import com.schemalens.core.model.TypeCategory;
import com.schemalens.core.model.TypeNormalizer;
import com.schemalens.core.model.UserDefinedType;
import com.schemalens.core.model.View;

import java.math.BigInteger;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A small two-schema shop built straight from model constructors. {@code sales.order_items}
 * references {@code marketing.promotions}, which is not part of the snapshot, and
 * {@code sales.remote_orders} is a synonym on a linked server.
 */
final class ShopSnapshot {
    static final Instant EXTRACTED_AT = Instant.parse("2024-05-01T12:00:00Z");

    static final Identifier CUSTOMERS = Identifier.of("sales", "customers");
    static final Identifier ORDERS = Identifier.of("sales", "orders");
    static final Identifier ORDER_ITEMS = Identifier.of("sales", "order_items");
    static final Identifier PRODUCTS = Identifier.of("inventory", "products");

    private ShopSnapshot() {}

    static SchemaSnapshot all() {
        return build(EnumSet.allOf(ObjectType.class), EnumSet.noneOf(ObjectType.class));
    }

    static SchemaSnapshot build(Set<ObjectType> selected, Set<ObjectType> notApplicable) {
        Set<ObjectType> kept = EnumSet.copyOf(selected);
        kept.removeAll(notApplicable);

        SchemaObjects sales = new SchemaObjects("sales",
                kept.contains(ObjectType.TABLES) ? List.of(customers(), orders(), orderItems()) : null,
                null,
                kept.contains(ObjectType.PROCEDURES) ? List.of(createOrder()) : null,
                kept.contains(ObjectType.FUNCTIONS) ? List.of(orderTotal()) : null,
                kept.contains(ObjectType.TRIGGERS) ? List.of(itemsTrigger()) : null,
                kept.contains(ObjectType.TYPES) ? List.of(orderStatus()) : null,
                kept.contains(ObjectType.SEQUENCES) ? List.of(orderSeq()) : null,
                kept.contains(ObjectType.SYNONYMS) ? List.of(
                        new Synonym(Identifier.of("sales", "prods"), PRODUCTS, null, null),
                        new Synonym(Identifier.of("sales", "remote_orders"), Identifier.of("archive", "orders"),
                                "LINKED", null)) : null);
        SchemaObjects inventory = new SchemaObjects("inventory",
                kept.contains(ObjectType.TABLES) ? List.of(products()) : null,
                kept.contains(ObjectType.VIEWS) ? List.of(lowStock()) : null,
                null, null, null, null, null, null);

        List<SecurityPrincipal> principals = kept.contains(ObjectType.SECURITY) ? List.of(
                new SecurityPrincipal("reporting", PrincipalKind.ROLE,
                        List.of(new Grant("SELECT", PRODUCTS)), null),
                new SecurityPrincipal("app_user", PrincipalKind.USER,
                        List.of(new Grant("SELECT", ORDERS), new Grant("CONNECT", null)),
                        List.of("reporting"))) : List.of();

        List<SchemaObjects> schemas = List.of(sales, inventory);
        Warnings warnings = new Warnings();
        RelationshipGraph graph = GraphBuilder.build(schemas, "shop", warnings);
        return new SchemaSnapshot("shop", Engine.POSTGRES, "PostgreSQL 16.2", EXTRACTED_AT, schemas, principals,
                selected, notApplicable, graph, warnings.list());
    }

    private static Column column(String name, String type, int ordinal) {
        return Column.builder(name, TypeNormalizer.normalize(type)).ordinal(ordinal).nullable(false).build();
    }

    private static Table customers() {
        List<Column> columns = List.of(
                Column.builder("id", TypeNormalizer.normalize("integer")).ordinal(1).nullable(false)
                        .identity(1L, 1L).build(),
                column("email", "varchar(255)", 2),
                column("last_name", "varchar(50)", 3),
                column("first_name", "varchar(50)", 4),
                Column.builder("notes", TypeNormalizer.normalize("text")).ordinal(5)
                        .description("free text | may span\nlines").build());
        return new Table(CUSTOMERS, columns, new PrimaryKey("customers_pkey", List.of("id"), false), null,
                List.of(new Index("customers_pkey", true, true, List.of("id"), null, "btree", null, false),
                        new Index("customers_email_key", true, false, List.of("email"), null, "btree", null, false),
                        new Index("idx_customers_name", false, false, List.of("last_name", "first_name"), null,
                                "btree", null, false)),
                null, 2L, 16L, "Customer master table");
    }

    private static Table orders() {
        List<Column> columns = List.of(
                column("id", "integer", 1),
                column("customer_id", "integer", 2),
                Column.builder("status", TypeNormalizer.normalize("varchar(20)")).ordinal(3)
                        .defaultValue("'pending'::character varying").build(),
                column("total_amount", "numeric(12,2)", 4));
        return new Table(ORDERS, columns, new PrimaryKey("orders_pkey", List.of("id"), false),
                List.of(new ForeignKey("fk_orders_customer", List.of("customer_id"), CUSTOMERS, List.of("id"),
                        ReferentialAction.RESTRICT, ReferentialAction.CASCADE)),
                null,
                List.of(new CheckConstraint("chk_total_amount", "total_amount >= 0")),
                null, null, null);
    }

    private static Table orderItems() {
        List<Column> columns = List.of(
                column("id", "integer", 1),
                column("order_id", "integer", 2),
                column("product_id", "integer", 3),
                Column.builder("promo_id", TypeNormalizer.normalize("integer")).ordinal(4).build(),
                column("quantity", "integer", 5),
                Column.builder("line_total", TypeNormalizer.normalize("numeric(12,2)")).ordinal(6)
                        .computed("quantity * 2").build());
        return new Table(ORDER_ITEMS, columns, new PrimaryKey("order_items_pkey", List.of("id"), false),
                List.of(new ForeignKey("fk_items_order", List.of("order_id"), ORDERS, List.of("id"),
                                ReferentialAction.CASCADE, ReferentialAction.NO_ACTION),
                        new ForeignKey("fk_items_product", List.of("product_id"), PRODUCTS, List.of("id"),
                                ReferentialAction.RESTRICT, ReferentialAction.NO_ACTION),
                        new ForeignKey("fk_items_promo", List.of("promo_id"), Identifier.of("marketing", "promotions"),
                                List.of("id"), ReferentialAction.SET_NULL, ReferentialAction.NO_ACTION)),
                null, null, null, null, null);
    }

    private static Table products() {
        List<Column> columns = List.of(
                column("id", "integer", 1),
                column("sku", "varchar(50)", 2),
                column("quantity_in_stock", "integer", 3),
                column("reorder_level", "integer", 4));
        return new Table(PRODUCTS, columns, new PrimaryKey("products_pkey", List.of("id"), false), null,
                null, null, null, null, "Product catalog");
    }

    private static View lowStock() {
        return new View(Identifier.of("inventory", "low_stock_products"),
                List.of(new Attribute("id", TypeNormalizer.normalize("integer"), null, 1),
                        new Attribute("sku", TypeNormalizer.normalize("varchar(50)"), null, 2)),
                "SELECT id, sku FROM inventory.products WHERE quantity_in_stock < reorder_level",
                List.of(PRODUCTS), false, null);
    }

    private static Routine orderTotal() {
        return new Routine(Identifier.of("sales", "order_total"), RoutineKind.FUNCTION,
                List.of(new Parameter("p_order_id", TypeNormalizer.normalize("integer"), ParameterMode.IN, null, 1)),
                ReturnShape.scalar(TypeNormalizer.normalize("numeric(12,2)")), "plpgsql",
                "BEGIN\n  RETURN (SELECT sum(quantity) FROM sales.order_items WHERE order_id = p_order_id);\nEND",
                null);
    }

    private static Routine createOrder() {
        return new Routine(Identifier.of("sales", "create_order"), RoutineKind.PROCEDURE,
                List.of(new Parameter("p_customer_id", TypeNormalizer.normalize("integer"), ParameterMode.IN, null, 1),
                        new Parameter("p_order_id", TypeNormalizer.normalize("integer"), ParameterMode.INOUT, null, 2)),
                null, "plpgsql", "BEGIN\n  INSERT INTO sales.orders (customer_id) VALUES (p_customer_id);\nEND", null);
    }

    private static Trigger itemsTrigger() {
        return new Trigger(Identifier.of("sales", "trg_items_total"), ORDER_ITEMS, TriggerTiming.AFTER,
                EnumSet.of(TriggerEvent.DELETE, TriggerEvent.INSERT), true,
                "CREATE TRIGGER trg_items_total AFTER INSERT OR DELETE ON sales.order_items");
    }

    private static UserDefinedType orderStatus() {
        return new UserDefinedType(Identifier.of("sales", "order_status"), TypeCategory.ENUM, null, null,
                List.of("pending", "shipped"), null, null);
    }

    private static Sequence orderSeq() {
        return new Sequence(Identifier.of("sales", "order_seq"), TypeNormalizer.normalize("bigint"),
                BigInteger.valueOf(1000), BigInteger.ONE, new BigInteger("9223372036854775807"), BigInteger.ONE,
                false, BigInteger.ONE, null);
    }
}
