package com.schemalens.dialects.postgres;

import com.schemalens.core.extract.ExtractionConfig;
import com.schemalens.core.extract.SchemaExtractor;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.ObjectType;
import com.schemalens.core.model.ReferentialAction;
import com.schemalens.core.model.RelationshipEdge;
import com.schemalens.core.model.Routine;
import com.schemalens.core.model.SchemaSnapshot;
import com.schemalens.core.model.Sequence;
import com.schemalens.core.model.Table;
import com.schemalens.core.model.TypeCategory;
import com.schemalens.core.model.UserDefinedType;
import com.schemalens.core.model.View;
import com.schemalens.dialects.jdbc.CatalogDataSources;
import com.schemalens.dialects.jdbc.ConnectionSettings;
import com.schemalens.dialects.jdbc.JdbcCatalogReader;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers
@EnabledIfEnvironmentVariable(named = "TESTCONTAINERS", matches = "1")
class PostgresContainerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("shop")
            .withUsername("test")
            .withPassword("test");

    private static SchemaSnapshot snapshot;

    @BeforeAll
    static void loadSchemaAndExtract() throws Exception {
        String ddl = new String(
                PostgresContainerTest.class.getResourceAsStream("/fixtures/init.sql").readAllBytes(),
                StandardCharsets.UTF_8);
        try (Connection conn = DriverManager.getConnection(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
             Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
        }

        PostgresDialect dialect = new PostgresDialect();
        ConnectionSettings settings = ConnectionSettings.builder(dialect.engine())
                .host(postgres.getHost())
                .port(postgres.getMappedPort(5432))
                .database(postgres.getDatabaseName())
                .user(postgres.getUsername())
                .password(postgres.getPassword())
                .build();
        try (HikariDataSource dataSource = CatalogDataSources.open(dialect, settings, 1);
             Connection conn = dataSource.getConnection()) {
            snapshot = new SchemaExtractor().extract(dialect.adapter(), new JdbcCatalogReader(conn, dialect),
                    ExtractionConfig.builder().includeSchemas(List.of("sales", "inventory")).build());
        }
    }

    @Test
    void describesTheDatabase() {
        assertEquals("shop", snapshot.database());
        assertTrue(snapshot.engineVersion().startsWith("16"));
        assertEquals(List.of("inventory", "sales"), snapshot.schemas().stream().map(s -> s.schema()).toList());
    }

    @Test
    void crossSchemaForeignKeysResolve() {
        Identifier items = Identifier.of("sales", "order_items");
        List<RelationshipEdge> outgoing = snapshot.graph().outgoing(items);

        assertEquals(2, outgoing.size());
        assertTrue(outgoing.stream().allMatch(RelationshipEdge::resolved));
        RelationshipEdge toProducts = outgoing.stream()
                .filter(e -> e.target().equals(Identifier.of("inventory", "products"))).findFirst().orElseThrow();
        assertEquals(ReferentialAction.RESTRICT, toProducts.onDelete());
        RelationshipEdge toOrders = outgoing.stream()
                .filter(e -> e.target().equals(Identifier.of("sales", "orders"))).findFirst().orElseThrow();
        assertEquals(ReferentialAction.CASCADE, toOrders.onDelete());

        assertEquals(1, snapshot.graph().incoming(Identifier.of("inventory", "products")).size());
    }

    @Test
    void columnsKeepDescriptionsAndIdentity() {
        Table customers = table("sales", "customers");
        Column id = customers.column("customer_id");

        assertTrue(id.identity());
        assertEquals("Unique customer identifier", id.description());
        assertEquals("Customer master table containing contact and shipping information", customers.description());
        assertEquals("sales.email_address", customers.column("email").type().nativeType());
        assertTrue(table("sales", "orders").column("order_id").identity());
    }

    @Test
    void partialIndexKeepsItsPredicate() {
        Table orders = table("sales", "orders");
        assertTrue(orders.indexes().stream()
                .filter(i -> "idx_orders_status".equals(i.name()))
                .allMatch(i -> i.filter() != null && i.filter().contains("delivered")));
        assertFalse(orders.checks().isEmpty());
    }

    @Test
    void viewsAndMaterializedViewsWithDependencies() {
        View summary = snapshot.schema("sales").views().stream()
                .filter(v -> v.id().name().equals("monthly_sales_summary")).findFirst().orElseThrow();
        assertTrue(summary.materialized());
        assertEquals(List.of(Identifier.of("sales", "orders")), summary.baseTables());
    }

    @Test
    void routinesSplitIntoProceduresAndFunctions() {
        assertEquals(2, snapshot.count(ObjectType.PROCEDURES));
        Routine total = snapshot.schema("sales").functions().stream()
                .filter(r -> r.id().name().equals("calculate_order_total")).findFirst().orElseThrow();
        assertEquals("plpgsql", total.language());
        assertFalse(total.returns().tabular());

        Routine byCategory = snapshot.schema("inventory").functions().get(0);
        assertTrue(byCategory.returns().tabular());
        assertEquals(5, byCategory.returns().columns().size());
    }

    @Test
    void typesAndSequences() {
        List<UserDefinedType> types = snapshot.schema("sales").types();
        assertEquals(3, types.size());
        UserDefinedType status = types.stream().filter(t -> t.category() == TypeCategory.ENUM).findFirst().orElseThrow();
        assertEquals(List.of("pending", "processing", "shipped", "delivered", "cancelled"), status.enumValues());

        Sequence orderSeq = snapshot.schema("sales").sequences().stream()
                .filter(s -> s.id().name().equals("order_seq")).findFirst().orElseThrow();
        assertEquals(BigInteger.valueOf(1000), orderSeq.start());
        assertEquals(BigInteger.valueOf(9999999), orderSeq.maxValue());
    }

    @Test
    void triggersAttachToTheirTables() {
        assertEquals(1, snapshot.triggersOn(Identifier.of("sales", "order_items")).size());
        assertTrue(snapshot.warnings().stream().noneMatch(w -> w.subject().contains("customers")));
    }

    private static Table table(String schema, String name) {
        return snapshot.schema(schema).tables().stream()
                .filter(t -> t.id().name().equals(name)).findFirst().orElseThrow();
    }
}
