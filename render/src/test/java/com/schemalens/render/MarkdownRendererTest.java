package com.schemalens.render;

import com.schemalens.core.adapter.Warnings;
import com.schemalens.core.graph.GraphBuilder;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.Engine;
import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.ObjectType;
import com.schemalens.core.model.RelationshipGraph;
import com.schemalens.core.model.SchemaObjects;
import com.schemalens.core.model.SchemaSnapshot;
import com.schemalens.core.model.Table;
import com.schemalens.core.model.TypeNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownRendererTest {
    private static final Pattern LINK = Pattern.compile("\\]\\(([^)]+\\.md)\\)");

    private MarkdownRenderer renderer;
    private Map<String, String> docs;

    @BeforeEach
    void setUp() {
        renderer = new MarkdownRenderer();
        docs = byPath(renderer.render(ShopSnapshot.all()));
    }

    private static Map<String, String> byPath(List<Document> documents) {
        return documents.stream().collect(Collectors.toMap(Document::path, Document::content));
    }

    private static String line(String content, String fragment) {
        return content.lines().filter(l -> l.contains(fragment)).findFirst()
                .orElseThrow(() -> new AssertionError("no line containing " + fragment + " in:\n" + content));
    }

    @Test
    void renderingTheSameSnapshotTwiceIsByteIdentical() {
        SchemaSnapshot snapshot = ShopSnapshot.all();
        List<Document> first = renderer.render(snapshot);
        List<Document> second = new MarkdownRenderer().render(snapshot);
        assertEquals(first, second);
        assertEquals(first, renderer.render(ShopSnapshot.all()));
    }

    @Test
    void documentsFollowThePathConvention() {
        assertTrue(docs.containsKey("README.md"));
        assertTrue(docs.containsKey("schemas/README.md"));
        assertTrue(docs.containsKey("schemas/sales.md"));
        assertTrue(docs.containsKey("schemas/inventory.md"));
        assertTrue(docs.containsKey("tables/README.md"));
        assertTrue(docs.containsKey("tables/sales.orders.md"));
        assertTrue(docs.containsKey("tables/inventory.products.md"));
        assertTrue(docs.containsKey("views/inventory.low_stock_products.md"));
        assertTrue(docs.containsKey("functions/sales.order_total.md"));
        assertTrue(docs.containsKey("procedures/sales.create_order.md"));
        assertTrue(docs.containsKey("triggers/sales.trg_items_total.md"));
        assertTrue(docs.containsKey("types/sales.order_status.md"));
        assertTrue(docs.containsKey("sequences/sales.order_seq.md"));
        assertTrue(docs.containsKey("synonyms/sales.prods.md"));
        assertTrue(docs.containsKey("security/README.md"));
    }

    @Test
    void documentOrderStartsWithTheSummaries() {
        List<String> paths = renderer.render(ShopSnapshot.all()).stream().map(Document::path).toList();
        assertEquals(List.of("README.md", "schemas/README.md", "schemas/inventory.md", "schemas/sales.md",
                "tables/README.md", "tables/inventory.products.md"), paths.subList(0, 6));
    }

    @Test
    void columnsRenderAsATable() {
        String orders = docs.get("tables/sales.orders.md");
        assertTrue(orders.startsWith("# Table: sales.orders\n"));
        assertTrue(orders.contains("| Column | Type | Nullable | Default | Description |"));
        assertTrue(orders.contains("| **id** | `integer` | NO |"));
        assertTrue(line(orders, "| status |").contains("`'pending'::character varying`"));
        assertTrue(orders.contains("| chk_total_amount | `total_amount >= 0` |"));
    }

    @Test
    void identityStatisticsAndEscapedDescriptions() {
        String customers = docs.get("tables/sales.customers.md");
        assertTrue(customers.contains("> Customer master table"));
        assertTrue(customers.contains("| Rows | 2 |"));
        assertTrue(customers.contains("| Size | 16 KB |"));
        assertTrue(line(customers, "| **id** |").contains("identity(1, 1)"));
        assertTrue(line(customers, "| notes |").contains("free text \\| may span<br>lines"));
        assertTrue(customers.contains("| customers_pkey | id | NO |"));
    }

    @Test
    void primaryKeyIndexesAreNotRepeated() {
        String customers = docs.get("tables/sales.customers.md");
        String indexes = customers.substring(customers.indexOf("## Indexes"));
        assertTrue(indexes.contains("| idx_customers_name | last_name, first_name | NO | NO | btree |"));
        assertTrue(indexes.contains("| customers_email_key | email | YES |"));
        assertFalse(indexes.contains("| customers_pkey |"));
    }

    @Test
    void computedColumnShowsItsExpression() {
        String items = docs.get("tables/sales.order_items.md");
        assertTrue(line(items, "| line_total |").contains("computed `quantity * 2`"));
    }

    @Test
    void referencesAndReferencedByLinkBothWays() {
        String items = docs.get("tables/sales.order_items.md");
        assertTrue(items.contains("- [sales.orders](../tables/sales.orders.md) via `fk_items_order` "
                + "(order_id → id), on delete CASCADE, on update NO ACTION"));
        assertTrue(items.contains("- [inventory.products](../tables/inventory.products.md) via `fk_items_product` "
                + "(product_id → id), on delete RESTRICT"));

        String orders = docs.get("tables/sales.orders.md");
        String referencedBy = orders.substring(orders.indexOf("### Referenced By"));
        assertTrue(referencedBy.contains("- [sales.order_items](../tables/sales.order_items.md) via `fk_items_order` "
                + "(order_id → id)"));
    }

    @Test
    void unresolvedForeignKeyIsMarkedWithoutALink() {
        String items = docs.get("tables/sales.order_items.md");
        String reference = line(items, "- `marketing.promotions`");
        assertTrue(reference.contains("_(unresolved)_"));
        assertFalse(reference.contains("]("));
        String fkRow = line(items, "| fk_items_promo |");
        assertTrue(fkRow.contains("`marketing.promotions` _(unresolved)_ (id)"));
    }

    @Test
    void productsListsSynonymsAndDependentViews() {
        String products = docs.get("tables/inventory.products.md");
        assertTrue(products.contains("- [sales.prods](../synonyms/sales.prods.md) (synonym)"));
        assertTrue(products.contains("### Used By Views"));
        assertTrue(products.contains("- [inventory.low_stock_products](../views/inventory.low_stock_products.md)"));
    }

    @Test
    void synonymOnALinkedServerIsUnresolved() {
        String remote = docs.get("synonyms/sales.remote_orders.md");
        assertTrue(remote.contains("| Target | `LINKED.archive.orders` _(unresolved)_ |"));
        assertTrue(remote.contains("| Server | LINKED |"));
        assertTrue(remote.contains("- `archive.orders` _(unresolved)_ (synonym target)"));

        String prods = docs.get("synonyms/sales.prods.md");
        assertTrue(prods.contains("| Target | [inventory.products](../tables/inventory.products.md) |"));
    }

    @Test
    void routinesShowParametersReturnAndDefinition() {
        String total = docs.get("functions/sales.order_total.md");
        assertTrue(total.startsWith("# Function: sales.order_total"));
        assertTrue(total.contains("| 1 | p_order_id | `integer` | IN |"));
        assertTrue(total.contains("## Returns\n\n`numeric(12,2)`"));
        assertTrue(total.contains("```sql\nBEGIN\n"));
        assertTrue(total.contains("| Language | plpgsql |"));

        String create = docs.get("procedures/sales.create_order.md");
        assertTrue(create.contains("| 2 | p_order_id | `integer` | INOUT |"));
        assertFalse(create.contains("## Returns"));
    }

    @Test
    void triggerLinksToItsTable() {
        String trigger = docs.get("triggers/sales.trg_items_total.md");
        assertTrue(trigger.contains("| Table | [sales.order_items](../tables/sales.order_items.md) |"));
        assertTrue(trigger.contains("| Timing | AFTER |"));
        assertTrue(trigger.contains("| Events | INSERT, DELETE |"));
        assertTrue(trigger.contains("| Enabled | YES |"));
        assertTrue(docs.get("tables/sales.order_items.md")
                .contains("- [sales.trg_items_total](../triggers/sales.trg_items_total.md)"));
    }

    @Test
    void typesAndSequences() {
        String status = docs.get("types/sales.order_status.md");
        assertTrue(status.contains("| Category | enum |"));
        assertTrue(status.contains("- `pending`\n- `shipped`"));

        String seq = docs.get("sequences/sales.order_seq.md");
        assertTrue(seq.contains("| Start | 1000 |"));
        assertTrue(seq.contains("| Maximum | 9223372036854775807 |"));
        assertTrue(seq.contains("| Cycle | NO |"));
        assertFalse(seq.contains("Current Value"));
    }

    @Test
    void categoryIndexIsAlphabeticalAcrossSchemas() {
        String tables = docs.get("tables/README.md");
        int products = tables.indexOf("[inventory.products]");
        int customers = tables.indexOf("[sales.customers]");
        int items = tables.indexOf("[sales.order_items]");
        int orders = tables.indexOf("[sales.orders]");
        assertTrue(products > 0 && products < customers && customers < items && items < orders);
        assertTrue(tables.contains("| [sales.customers](../tables/sales.customers.md) | sales | 5 columns, 2 rows "
                + "| Customer master table |"));
    }

    @Test
    void schemaOverviewListsItsObjects() {
        String sales = docs.get("schemas/sales.md");
        assertTrue(sales.contains("## Tables (3)"));
        assertTrue(sales.contains("- [orders](../tables/sales.orders.md)"));
        assertFalse(sales.contains("## Views"));

        String index = docs.get("schemas/README.md");
        assertTrue(index.contains("| Schema | Tables | Views | Procedures | Functions | Triggers | Types | Sequences | Synonyms |"));
        assertTrue(index.contains("| [sales](../schemas/sales.md) | 3 | 0 | 1 | 1 | 1 | 1 | 1 | 2 |"));
    }

    @Test
    void rootSummaryCarriesEngineTimestampAndCounts() {
        String readme = docs.get("README.md");
        assertTrue(readme.startsWith("# Database: shop\n"));
        assertTrue(readme.contains("| Engine | PostgreSQL |"));
        assertTrue(readme.contains("| Version | PostgreSQL 16.2 |"));
        assertTrue(readme.contains("| Generated | 2024-05-01T12:00:00Z |"));
        assertTrue(readme.contains("| [Tables](tables/README.md) | 4 |"));
        assertTrue(readme.contains("| [Synonyms](synonyms/README.md) | 2 |"));
        assertTrue(readme.contains("| [Security](security/README.md) | 2 |"));
        assertTrue(readme.contains("- [sales](schemas/sales.md)"));
        assertTrue(readme.contains("## Extraction Warnings"));
        assertTrue(readme.contains("**UNRESOLVED_REFERENCE** `sales.order_items`"));
    }

    @Test
    void viewsOnlySelectionCountsOnlyViews() {
        Map<String, String> viewsOnly = byPath(renderer.render(
                ShopSnapshot.build(EnumSet.of(ObjectType.VIEWS), EnumSet.noneOf(ObjectType.class))));
        String readme = viewsOnly.get("README.md");
        assertTrue(readme.contains("| [Views](views/README.md) | 1 |"));
        assertFalse(readme.contains("[Tables]"));
        assertTrue(viewsOnly.keySet().stream().noneMatch(p -> p.startsWith("tables/")));

        // the base table was not selected, so the view cannot link to it
        String view = viewsOnly.get("views/inventory.low_stock_products.md");
        assertTrue(view.contains("- `inventory.products` _(unresolved)_"));
    }

    @Test
    void notApplicableCategoriesAreOmitted() {
        Map<String, String> rendered = byPath(renderer.render(ShopSnapshot.build(
                EnumSet.allOf(ObjectType.class), EnumSet.of(ObjectType.SEQUENCES, ObjectType.SYNONYMS))));
        assertFalse(rendered.containsKey("sequences/README.md"));
        assertFalse(rendered.containsKey("synonyms/README.md"));
        String readme = rendered.get("README.md");
        assertTrue(readme.contains("Not available for PostgreSQL: Sequences, Synonyms."));
        assertFalse(readme.contains("[Sequences]"));
    }

    @Test
    void emptySupportedCategoryStillGetsAnIndex() {
        SchemaSnapshot empty = new SchemaSnapshot("empty.db", Engine.SQLITE, null, ShopSnapshot.EXTRACTED_AT,
                List.of(SchemaObjects.empty("main")), List.of(), EnumSet.of(ObjectType.TABLES, ObjectType.VIEWS),
                null, null, null);
        Map<String, String> rendered = byPath(renderer.render(empty));
        assertTrue(rendered.get("views/README.md").contains("_No views found._"));
        assertTrue(rendered.get("schemas/main.md").contains("_No selected objects in this schema._"));
        assertTrue(rendered.get("README.md").contains("| [Views](views/README.md) | 0 |"));
        assertFalse(rendered.get("README.md").contains("| Version |"));
    }

    @Test
    void schemaNamesThatCollideOnDiskGetDistinctPaths() {
        List<SchemaObjects> schemas = new ArrayList<>();
        for (String name : List.of("README", "my schema", "my_schema", "public")) {
            Table table = new Table(Identifier.of(name, "t"),
                    List.of(Column.builder("id", TypeNormalizer.normalize("integer")).ordinal(1).build()),
                    null, null, null, null, null, null, null);
            schemas.add(new SchemaObjects(name, List.of(table), null, null, null, null, null, null, null));
        }
        RelationshipGraph graph = GraphBuilder.build(schemas, "odd", new Warnings());
        SchemaSnapshot snapshot = new SchemaSnapshot("odd", Engine.POSTGRES, null, ShopSnapshot.EXTRACTED_AT,
                schemas, List.of(), EnumSet.of(ObjectType.TABLES), null, graph, null);

        List<Document> documents = renderer.render(snapshot);
        Set<String> paths = documents.stream().map(Document::path).collect(Collectors.toSet());
        assertEquals(documents.size(), paths.size());

        Map<String, String> rendered = byPath(documents);
        assertTrue(rendered.get("schemas/README.md").startsWith("# Schemas"));
        assertTrue(rendered.get("schemas/README-2.md").startsWith("# Schema: README\n"));
        assertTrue(rendered.get("schemas/my_schema.md").startsWith("# Schema: my schema\n"));
        assertTrue(rendered.get("schemas/my_schema-2.md").startsWith("# Schema: my_schema\n"));
        assertTrue(rendered.get("README.md").contains("(schemas/README-2.md)"));
        assertTrue(rendered.get("tables/README.t.md").contains("(../schemas/README-2.md)"));
        assertTrue(paths.contains("tables/my_schema.t.md"));
        assertTrue(paths.contains("tables/my_schema.t-2.md"));
    }

    @Test
    void securityListsPrincipalsWithGrants() {
        String security = docs.get("security/README.md");
        assertTrue(security.contains("| app_user | USER | 2 | reporting |"));
        assertTrue(security.contains("## User: app_user"));
        assertTrue(security.contains("## Role: reporting"));
        assertTrue(security.contains("Member of: reporting"));
        assertTrue(security.contains("| SELECT | [sales.orders](../tables/sales.orders.md) |"));
        assertTrue(security.contains("| CONNECT | (database) |"));
        assertTrue(security.indexOf("## User: app_user") < security.indexOf("## Role: reporting"));
    }

    @Test
    void everyLinkPointsAtARenderedDocument() {
        Function<String, String> resolve = link -> link.startsWith("../") ? link.substring(3) : link;
        for (Map.Entry<String, String> doc : docs.entrySet()) {
            Matcher m = LINK.matcher(doc.getValue());
            while (m.find()) {
                String target = resolve.apply(m.group(1));
                assertTrue(docs.containsKey(target), doc.getKey() + " links to missing " + target);
            }
        }
    }
}
