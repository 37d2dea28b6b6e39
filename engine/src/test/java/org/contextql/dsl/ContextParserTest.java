package org.contextql.dsl;

import org.contextql.model.ColumnDef;
import org.contextql.model.ContextDocument;
import org.contextql.model.ContextStatus;
import org.contextql.model.ContextType;
import org.contextql.model.DatasetRef;
import org.contextql.model.JoinType;
import org.contextql.model.Relationship;
import org.contextql.model.SourceFormat;
import org.contextql.test.ContextFixtures;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Context document parser")
class ContextParserTest {

    @Nested
    @DisplayName("Structured documents")
    class StructuredDocuments {

        @Test
        @DisplayName("Parses header, datasets and elements")
        void parsesSalesContext() {
            // WHEN
            ContextDocument doc = ContextParser.parse(ContextFixtures.SALES);

            // THEN
            assertEquals("sales", doc.id());
            assertEquals("Sales Analysis", doc.name());
            assertEquals("1.0.0", doc.version());
            assertEquals(ContextStatus.DRAFT, doc.status());
            assertEquals(SourceFormat.STRUCTURED, doc.format());
            assertEquals(ContextType.MULTI_DATASET, doc.type());
            assertEquals(java.util.List.of("finance", "orders"), doc.tags());
            assertEquals(2, doc.datasets().size());
            assertEquals(2, doc.metrics().size());
            assertEquals(2, doc.filters().size());
            assertEquals(2, doc.rules().size());
            assertEquals(1, doc.glossary().size());
            assertEquals(600L, doc.settings().cacheTtlSeconds());
            assertEquals("Revenue is recognised when an order is placed.", doc.body());
        }

        @Test
        @DisplayName("Columns may be plain names or mappings")
        void columnsInBothForms() {
            ContextDocument doc = ContextParser.parse(ContextFixtures.SALES);

            DatasetRef orders = doc.findDataset("o1").orElseThrow();
            assertEquals("orders", orders.externalDatasetId());
            assertEquals(4, orders.columns().size());
            assertEquals("amount", orders.columns().get(2).name());

            ColumnDef customerId = doc.findDataset("c1").orElseThrow().findColumn("customer_id").orElseThrow();
            assertEquals("integer", customerId.dataType());
            assertFalse(customerId.nullable());
            assertEquals("Customer name",
                    doc.findDataset("c1").orElseThrow().findColumn("name").orElseThrow().businessName());
        }

        @Test
        @DisplayName("Relationship keeps its declared join type")
        void relationshipJoinType() {
            Relationship r = ContextParser.parse(ContextFixtures.SALES).findRelationship("order_customer")
                    .orElseThrow();

            assertEquals("o1.customer_id", r.from().toString());
            assertEquals("c1.customer_id", r.to().toString());
            assertEquals(JoinType.LEFT, r.effectiveJoinType());
        }

        @Test
        @DisplayName("Missing id is derived from the name")
        void idDerivedFromName() {
            String text = """
                    ---
                    name: Web Traffic & Sessions
                    version: 2.1.0
                    description: Page views per session
                    datasets:
                      - id: views
                        dataset_id: page_views
                        name: Page views
                    ---
                    """;

            ContextDocument doc = ContextParser.parse(text);

            assertEquals("web-traffic-sessions", doc.id());
            assertEquals(ContextType.SINGLE_DATASET, doc.type());
        }

        @Test
        @DisplayName("Byte order mark before the delimiter is accepted")
        void byteOrderMark() {
            ContextDocument doc = ContextParser.parse("\uFEFF" + ContextFixtures.SALES);

            assertEquals(SourceFormat.STRUCTURED, doc.format());
            assertEquals(ContextParser.parse(ContextFixtures.SALES).fingerprint(), doc.fingerprint());
        }
    }

    @Nested
    @DisplayName("Convention documents")
    class ConventionDocuments {

        @Test
        @DisplayName("Headings and lists declare datasets and relationships")
        void parsesConventionDocument() {
            // WHEN
            ContextDocument doc = ContextParser.parse(ContextFixtures.CONVENTION);

            // THEN
            assertEquals(SourceFormat.CONVENTION, doc.format());
            assertEquals("Retail Analytics", doc.name());
            assertEquals("Sales and customer data for the retail business.", doc.description());
            assertEquals("1.0.0", doc.version());
            assertEquals(2, doc.datasets().size());
            assertEquals("orders", doc.datasets().get(0).localId());
            assertEquals("customers", doc.datasets().get(1).externalDatasetId());

            Relationship r = doc.relationships().get(0);
            assertEquals("orders_customers", r.id());
            assertEquals("orders.customer_id", r.from().toString());
            assertEquals("customers.customer_id", r.to().toString());
            assertNull(r.joinType());
            assertEquals(JoinType.LEFT, r.effectiveJoinType());
        }

        @Test
        @DisplayName("Dataset heading form is recognised")
        void datasetHeading() {
            String text = """
                    # Inventory

                    ## Dataset: Stock Levels (id: stock)
                    Units on hand per warehouse.
                    """;

            ContextDocument doc = ContextParser.parse(text);

            assertEquals(1, doc.datasets().size());
            assertEquals("stock_levels", doc.datasets().get(0).localId());
            assertEquals("stock", doc.datasets().get(0).externalDatasetId());
        }

        @Test
        @DisplayName("Document without datasets uses the fallback dataset")
        void fallbackDataset() {
            ContextDocument doc = ContextParser.parse("# Notes\n\nJust prose.\n", "ds_42");

            assertEquals(1, doc.datasets().size());
            assertEquals("main", doc.datasets().get(0).localId());
            assertEquals("ds_42", doc.datasets().get(0).externalDatasetId());
        }

        @Test
        @DisplayName("Document without datasets and no fallback has zero datasets")
        void zeroDatasets() {
            ContextDocument doc = ContextParser.parse("Some prose with no structure at all.");

            assertTrue(doc.datasets().isEmpty());
            assertEquals("Dataset Context", doc.name());
        }
    }

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {

        @Test
        @DisplayName("Serialized structured document parses back to the same content")
        void structuredRoundTrip() {
            // GIVEN
            ContextDocument original = ContextParser.parse(ContextFixtures.SALES);

            // WHEN
            String rendered = ContextSerializer.serialize(original);
            ContextDocument reparsed = ContextParser.parse(rendered);

            // THEN
            assertEquals(original.fingerprint(), reparsed.fingerprint());
            assertEquals(original.datasets(), reparsed.datasets());
            assertEquals(original.relationships(), reparsed.relationships());
            assertEquals(original.metrics(), reparsed.metrics());
            assertEquals(original.rules(), reparsed.rules());
            assertEquals(original.body(), reparsed.body());
        }

        @Test
        @DisplayName("Convention document renders to an equivalent structured document")
        void conventionRoundTrip() {
            ContextDocument original = ContextParser.parse(ContextFixtures.CONVENTION);

            ContextDocument reparsed = ContextParser.parse(ContextSerializer.serialize(original));

            assertEquals(SourceFormat.STRUCTURED, reparsed.format());
            assertEquals(original.fingerprint(), reparsed.fingerprint());
        }

        @Test
        @DisplayName("Status changes do not change the fingerprint")
        void statusOutsideFingerprint() {
            ContextDocument doc = ContextParser.parse(ContextFixtures.SALES);

            assertEquals(doc.fingerprint(), ContentFingerprint.of(doc.withStatus(ContextStatus.ACTIVE)));
        }

        @Test
        @DisplayName("Editing a metric changes the fingerprint")
        void editChangesFingerprint() {
            ContextDocument original = ContextParser.parse(ContextFixtures.SALES);
            ContextDocument edited = ContextParser.parse(
                    ContextFixtures.SALES.replace("SUM(o1.amount)", "SUM(o1.amount) * 2"));

            assertNotEquals(original.fingerprint(), edited.fingerprint());
            assertEquals(64, edited.fingerprint().length());
        }
    }

    @Nested
    @DisplayName("Parse errors")
    class ParseErrors {

        @Test
        @DisplayName("Unterminated structured block is reported at line 1")
        void unterminatedBlock() {
            ContextParseException e = assertThrows(ContextParseException.class,
                    () -> ContextParser.parse("---\nname: Broken\nversion: 1.0.0\n"));

            assertTrue(e.hasLocation());
            assertEquals(1, e.getLine());
        }

        @Test
        @DisplayName("Invalid YAML reports a line inside the block")
        void invalidYaml() {
            ContextParseException e = assertThrows(ContextParseException.class,
                    () -> ContextParser.parse("---\nname: Broken\ndatasets: [unclosed\n---\n"));

            assertTrue(e.hasLocation(), "Expected a location but got: " + e.getMessage());
            assertTrue(e.getLine() >= 2, "Line should be inside the block, was " + e.getLine());
        }

        @Test
        @DisplayName("Missing required field reports its path")
        void missingDatasetId() {
            String text = """
                    ---
                    name: Broken
                    version: 1.0.0
                    description: Second dataset lacks an id
                    datasets:
                      - id: a
                        dataset_id: ds_a
                        name: A
                      - id: b
                        name: B
                    ---
                    """;

            ContextParseException e = assertThrows(ContextParseException.class, () -> ContextParser.parse(text));

            assertEquals("datasets[1].dataset_id", e.getPath());
        }

        @Test
        @DisplayName("Empty dataset list is rejected")
        void emptyDatasets() {
            String text = "---\nname: Empty\nversion: 1.0.0\ndescription: Nothing here\ndatasets: []\n---\n";

            ContextParseException e = assertThrows(ContextParseException.class, () -> ContextParser.parse(text));

            assertEquals("datasets", e.getPath());
        }

        @Test
        @DisplayName("Unknown status is rejected")
        void unknownStatus() {
            String text = ContextFixtures.SALES.replace("version: 1.0.0", "version: 1.0.0\nstatus: retired");

            ContextParseException e = assertThrows(ContextParseException.class, () -> ContextParser.parse(text));

            assertEquals("status", e.getPath());
        }

        @Test
        @DisplayName("Duplicate convention dataset reports the line of the duplicate")
        void duplicateConventionDataset() {
            String text = """
                    # Shop

                    ## Datasets
                    - Orders (id: orders)
                    - Orders (id: orders_v2)
                    """;

            ContextParseException e = assertThrows(ContextParseException.class, () -> ContextParser.parse(text));

            assertEquals(5, e.getLine());
            assertTrue(e.getReason().contains("line 4"), e.getReason());
        }

        @Test
        @DisplayName("Malformed relationship line is rejected")
        void malformedRelationship() {
            String text = """
                    # Shop

                    ## Relationships
                    - Orders to Customers
                    """;

            ContextParseException e = assertThrows(ContextParseException.class, () -> ContextParser.parse(text));

            assertEquals(4, e.getLine());
        }

        @Test
        @DisplayName("Null text is rejected")
        void nullText() {
            assertThrows(ContextParseException.class, () -> ContextParser.parse(null));
        }
    }
}
