package com.schemalens.core.graph;

import com.schemalens.core.adapter.Warnings;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.ForeignKey;
import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.ObjectType;
import com.schemalens.core.model.PrimaryKey;
import com.schemalens.core.model.ReferenceKind;
import com.schemalens.core.model.ReferentialAction;
import com.schemalens.core.model.RelationshipEdge;
import com.schemalens.core.model.RelationshipGraph;
import com.schemalens.core.model.SchemaObjects;
import com.schemalens.core.model.Synonym;
import com.schemalens.core.model.Table;
import com.schemalens.core.model.Trigger;
import com.schemalens.core.model.TriggerEvent;
import com.schemalens.core.model.TriggerTiming;
import com.schemalens.core.model.TypeNormalizer;
import com.schemalens.core.model.View;
import com.schemalens.core.model.WarningKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphBuilderTest {

    private static final Identifier ORDERS = Identifier.of("main", "orders");
    private static final Identifier PRODUCTS = Identifier.of("main", "products");
    private static final Identifier ORDER_ITEMS = Identifier.of("main", "order_items");

    private static Table table(Identifier id, List<String> columns, ForeignKey... fks) {
        List<Column> cols = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            cols.add(Column.builder(columns.get(i), TypeNormalizer.normalize("INTEGER")).ordinal(i + 1).build());
        }
        return new Table(id, cols, new PrimaryKey(null, List.of(columns.get(0)), null),
                List.of(fks), null, null, null, null, null);
    }

    private static SchemaObjects shop() {
        Table orders = table(ORDERS, List.of("id", "customer_id"));
        Table products = table(PRODUCTS, List.of("id", "quantity_in_stock", "reorder_level"));
        Table items = table(ORDER_ITEMS, List.of("id", "order_id", "product_id"),
                new ForeignKey(null, List.of("order_id"), Identifier.of("main", "ORDERS"), List.of("id"),
                        ReferentialAction.CASCADE, ReferentialAction.NO_ACTION),
                new ForeignKey(null, List.of("product_id"), PRODUCTS, List.of("id"),
                        ReferentialAction.RESTRICT, ReferentialAction.NO_ACTION));
        View lowStock = new View(Identifier.of("main", "low_stock_products"), null,
                "SELECT * FROM products WHERE quantity_in_stock < reorder_level", List.of(PRODUCTS), false, null);
        return new SchemaObjects("main", List.of(orders, products, items), List.of(lowStock),
                null, null, null, null, null, null);
    }

    @Test
    void orderItemsScenario() {
        RelationshipGraph graph = GraphBuilder.build(List.of(shop()), "shop", new Warnings());

        List<RelationshipEdge> out = graph.outgoing(ORDER_ITEMS);
        assertEquals(2, out.size());
        assertEquals(ORDERS, out.get(0).target());
        assertEquals(ReferentialAction.CASCADE, out.get(0).onDelete());
        assertEquals(PRODUCTS, out.get(1).target());
        assertEquals(ReferentialAction.RESTRICT, out.get(1).onDelete());

        assertEquals(1, graph.incoming(ORDERS).size());
        assertEquals(1, graph.incoming(PRODUCTS).size());
        assertTrue(graph.incoming(ORDER_ITEMS).isEmpty());
    }

    @Test
    void everyResolvedEdgeAppearsOnBothEnds() {
        RelationshipGraph graph = GraphBuilder.build(List.of(shop()), "shop", new Warnings());
        for (RelationshipEdge edge : graph.edges()) {
            assertTrue(edge.resolved());
            assertTrue(graph.outgoing(edge.source()).contains(edge));
            assertTrue(graph.incoming(edge.target()).contains(edge));
        }
    }

    @Test
    void viewDependenciesAreNotEdges() {
        RelationshipGraph graph = GraphBuilder.build(List.of(shop()), "shop", new Warnings());
        assertEquals(List.of(Identifier.of("main", "low_stock_products")), graph.dependents(PRODUCTS));
        assertEquals(1, graph.incoming(PRODUCTS).size());
        assertEquals(ObjectType.VIEWS, graph.typeOf(Identifier.of("MAIN", "LOW_STOCK_PRODUCTS")));
    }

    @Test
    void filteredOutTargetBecomesUnresolved() {
        Table items = table(ORDER_ITEMS, List.of("id", "order_id"),
                new ForeignKey("fk_items_orders", List.of("order_id"), ORDERS, List.of("id"),
                        ReferentialAction.CASCADE, null));
        SchemaObjects schema = new SchemaObjects("main", List.of(items), null, null, null, null, null, null, null);
        Warnings warnings = new Warnings();

        RelationshipGraph graph = GraphBuilder.build(List.of(schema), "shop", warnings);

        RelationshipEdge edge = graph.outgoing(ORDER_ITEMS).get(0);
        assertFalse(edge.resolved());
        assertTrue(graph.incoming(ORDERS).isEmpty());
        assertEquals(1, graph.unresolved().size());
        assertEquals(ReferenceKind.FOREIGN_KEY, graph.unresolved().get(0).kind());
        assertEquals(WarningKind.UNRESOLVED_REFERENCE, warnings.list().get(0).kind());
    }

    @Test
    void synonymsToOtherServersAreExternal() {
        Synonym local = new Synonym(Identifier.of("dbo", "Clients"), Identifier.of("dbo", "customers"), null, null);
        Synonym remote = new Synonym(Identifier.of("dbo", "RemoteOrders"), Identifier.of("dbo", "orders"),
                "LINKED1", "erp");
        Synonym otherDb = new Synonym(Identifier.of("dbo", "Archive"), Identifier.of("dbo", "customers"),
                null, "archive_db");
        Table customers = table(Identifier.of("dbo", "customers"), List.of("id"));
        SchemaObjects schema = new SchemaObjects("dbo", List.of(customers), null, null, null, null, null, null,
                List.of(local, remote, otherDb));

        RelationshipGraph graph = GraphBuilder.build(List.of(schema), "shop", new Warnings());

        assertTrue(graph.outgoing(local.id()).get(0).resolved());
        assertFalse(graph.outgoing(remote.id()).get(0).resolved());
        assertFalse(graph.outgoing(otherDb.id()).get(0).resolved());
        assertEquals(1, graph.incoming(customers.id()).size());
    }

    @Test
    void triggerOnMissingTableIsRecorded() {
        Trigger trigger = new Trigger(Identifier.of("main", "trg_audit"), ORDERS, TriggerTiming.AFTER,
                EnumSet.of(TriggerEvent.INSERT), true, null);
        SchemaObjects schema = new SchemaObjects("main", null, null, null, null, List.of(trigger), null, null, null);

        RelationshipGraph graph = GraphBuilder.build(List.of(schema), "shop", new Warnings());

        assertTrue(graph.edges().isEmpty());
        assertEquals(ReferenceKind.TRIGGER_PARENT, graph.unresolved().get(0).kind());
    }

    @Test
    void edgesAreOrderedBySourceThenConstraint() {
        Table b = table(Identifier.of("s", "b"), List.of("id", "a_id", "c_id"),
                new ForeignKey("fk_z", List.of("a_id"), Identifier.of("s", "a"), List.of("id"), null, null),
                new ForeignKey("fk_a", List.of("c_id"), Identifier.of("s", "c"), List.of("id"), null, null));
        Table a = table(Identifier.of("s", "a"), List.of("id", "c_id"),
                new ForeignKey("fk_m", List.of("c_id"), Identifier.of("s", "c"), List.of("id"), null, null));
        Table c = table(Identifier.of("s", "c"), List.of("id"));
        SchemaObjects schema = new SchemaObjects("s", List.of(b, c, a), null, null, null, null, null, null, null);

        RelationshipGraph graph = GraphBuilder.build(List.of(schema), "db", new Warnings());

        assertEquals(List.of("fk_m", "fk_a", "fk_z"), graph.edges().stream().map(RelationshipEdge::via).toList());
    }
}
