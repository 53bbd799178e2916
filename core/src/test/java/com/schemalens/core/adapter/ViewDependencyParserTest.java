package com.schemalens.core.adapter;

import com.schemalens.core.model.Identifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ViewDependencyParserTest {

    @Test
    void findsFromAndJoinTargets() {
        String sql = """
                SELECT o.id, c.email
                FROM orders o
                JOIN customers AS c ON c.id = o.customer_id
                LEFT JOIN sales.regions r ON r.id = c.region_id
                WHERE o.status <> 'from nowhere'
                """;
        assertEquals(List.of(
                Identifier.of("main", "orders"),
                Identifier.of("main", "customers"),
                Identifier.of("sales", "regions")), ViewDependencyParser.parse(sql, "main"));
    }

    @Test
    void handlesCommaJoinsAndQuotedNames() {
        String sql = "SELECT * FROM `products` p, \"Order Items\" oi WHERE p.id = oi.product_id";
        assertEquals(List.of(
                Identifier.of("app", "products"),
                Identifier.of("app", "Order Items")), ViewDependencyParser.parse(sql, "app"));
    }

    @Test
    void skipsCommonTableExpressionsAndSubqueries() {
        String sql = """
                WITH recent AS (SELECT * FROM orders WHERE created_at > '2024-01-01')
                SELECT * FROM recent JOIN (SELECT id FROM customers) c ON c.id = recent.customer_id
                """;
        assertEquals(List.of(Identifier.of("main", "orders"), Identifier.of("main", "customers")),
                ViewDependencyParser.parse(sql, "main"));
    }

    @Test
    void blankDefinitionHasNoDependencies() {
        assertTrue(ViewDependencyParser.parse(null, "main").isEmpty());
        assertTrue(ViewDependencyParser.parse("  ", "main").isEmpty());
    }
}
