package org.contextql.engine.plan;

import org.contextql.dsl.ContextParser;
import org.contextql.engine.graph.JoinPath;
import org.contextql.engine.graph.JoinPathResolver;
import org.contextql.engine.graph.NoPathException;
import org.contextql.engine.graph.RelationshipGraph;
import org.contextql.engine.validation.ContextValidator;
import org.contextql.engine.validation.ValidatedContext;
import org.contextql.model.ContextDocument;
import org.contextql.model.Severity;
import org.contextql.test.ContextFixtures;
import org.contextql.test.StubDatasetStore;
import org.junit.jupiter.api.*;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Query compiler")
class QueryCompilerTest {

    private ValidatedContext context;
    private RelationshipGraph graph;
    private final QueryCompiler compiler = new QueryCompiler();

    @BeforeEach
    void setUp() {
        ContextDocument doc = ContextParser.parse(ContextFixtures.SALES);
        context = new ContextValidator(StubDatasetStore.sales()).validate(doc, ContextFixtures.OWNER);
        graph = RelationshipGraph.build(context);
    }

    private CompiledPlan compile(QueryRequest request) {
        JoinPath path = new JoinPathResolver(graph)
                .findJoinPath(QueryCompiler.requiredDatasets(request, context), request.joinVia());
        return compiler.compile(request, context, path);
    }

    @Nested
    @DisplayName("Orders and customers")
    class OrdersCustomers {

        @Test
        @DisplayName("Revenue by customer name joins once and groups by the name")
        void revenueByCustomer() {
            // GIVEN
            QueryRequest request = QueryRequest.builder()
                    .metrics("total_revenue")
                    .groupBy("c1.name")
                    .build();

            // WHEN
            CompiledPlan plan = compile(request);

            // THEN
            assertEquals("""
                    SELECT c1.name, SUM(o1.amount) AS total_revenue
                    FROM "orders" AS o1
                    LEFT JOIN "customers" AS c1 ON o1.customer_id = c1.customer_id
                    WHERE (o1.amount > 0)
                    GROUP BY c1.name""", plan.sql());
            assertEquals(1, plan.joins().size());
            assertEquals(1, plan.sql().split("LEFT JOIN", -1).length - 1);
            assertEquals("o1", plan.root());
            assertEquals(List.of("positive_amount"), plan.appliedRules());
            assertEquals(List.of("total_revenue"), plan.appliedMetrics());
            assertTrue(plan.parameters().isEmpty());
        }

        @Test
        @DisplayName("Warning rules on joined datasets become advisories")
        void advisories() {
            CompiledPlan plan = compile(QueryRequest.builder().metrics("total_revenue").groupBy("c1.name").build());

            assertEquals(1, plan.advisories().size());
            Advisory advisory = plan.advisories().get(0);
            assertEquals("region_known", advisory.ruleId());
            assertEquals(Severity.WARNING, advisory.severity());
            assertFalse(plan.sql().contains("region"));
        }

        @Test
        @DisplayName("Output columns describe fields and formatted metrics")
        void outputColumns() {
            CompiledPlan plan = compile(QueryRequest.builder().metrics("total_revenue").groupBy("c1.name").build());

            assertEquals(List.of(OutputColumn.field("c1.name", "name"), OutputColumn.metric("total_revenue", "currency")),
                    plan.outputColumns());
        }
    }

    @Nested
    @DisplayName("Single dataset")
    class SingleDataset {

        @Test
        @DisplayName("Advisory rules on datasets outside the join are left out")
        void advisoriesScopedToJoin() {
            CompiledPlan plan = compile(QueryRequest.builder().metrics("order_count").build());

            assertEquals("""
                    SELECT COUNT(*) AS order_count
                    FROM "orders" AS o1
                    WHERE (o1.amount > 0)""", plan.sql());
            assertTrue(plan.joins().isEmpty());
            assertTrue(plan.advisories().isEmpty());
        }

        @Test
        @DisplayName("Nothing requested selects every column")
        void selectStar() {
            CompiledPlan plan = compile(QueryRequest.builder().datasets("o1").build());

            assertTrue(plan.sql().startsWith("SELECT *\nFROM \"orders\" AS o1"), plan.sql());
            assertEquals(List.of("positive_amount"), plan.appliedRules());
        }

        @Test
        @DisplayName("A query on customers alone still enforces the rule on orders")
        void mandatoryRulePullsInItsDataset() {
            CompiledPlan plan = compile(QueryRequest.builder().fields("c1.name").build());

            assertEquals("""
                    SELECT c1.name
                    FROM "orders" AS o1
                    LEFT JOIN "customers" AS c1 ON o1.customer_id = c1.customer_id
                    WHERE (o1.amount > 0)""", plan.sql());
            assertEquals(List.of("positive_amount"), plan.appliedRules());
        }

        @Test
        @DisplayName("Order and limit follow grouping")
        void orderAndLimit() {
            CompiledPlan plan = compile(QueryRequest.builder()
                    .fields("o1.status")
                    .metrics("order_count")
                    .groupBy("o1.status")
                    .orderBy(SortSpec.desc("order_count"))
                    .orderBy(SortSpec.asc("o1.status"))
                    .limit(5)
                    .build());

            assertTrue(plan.sql().startsWith("SELECT o1.status, COUNT(*) AS order_count\n"), plan.sql());
            assertTrue(plan.sql().endsWith("GROUP BY o1.status\nORDER BY order_count DESC, o1.status ASC\nLIMIT 5"),
                    plan.sql());
        }
    }

    @Nested
    @DisplayName("Filters")
    class Filters {

        @Test
        @DisplayName("User filters bind positional parameters")
        void userFilters() {
            CompiledPlan plan = compile(QueryRequest.builder()
                    .metrics("total_revenue")
                    .filter("c1.region", "=", "EU")
                    .filter("o1.status", "in", List.of("paid", "shipped"))
                    .filter("o1.amount", "between", List.of(10, 20))
                    .filter("o1.customer_id", "is not null", null)
                    .build());

            assertTrue(plan.sql().contains("WHERE c1.region = ? AND o1.status IN (?, ?) "
                    + "AND o1.amount BETWEEN ? AND ? AND o1.customer_id IS NOT NULL AND (o1.amount > 0)"), plan.sql());
            assertEquals(List.of("EU", "paid", "shipped", 10, 20), plan.parameters());
            assertEquals(1, plan.joins().size());
        }

        @Test
        @DisplayName("Named filter falls back to the parameter default")
        void namedFilterDefault() {
            CompiledPlan plan = compile(QueryRequest.builder().metrics("order_count").namedFilters("by_status").build());

            assertTrue(plan.sql().contains("WHERE (o1.status = ?) AND (o1.amount > 0)"), plan.sql());
            assertEquals(List.of("completed"), plan.parameters());
            assertEquals(List.of("by_status"), plan.appliedFilters());
        }

        @Test
        @DisplayName("Filter-qualified parameter wins over a plain one")
        void parameterPrecedence() {
            CompiledPlan plan = compile(QueryRequest.builder()
                    .metrics("order_count")
                    .namedFilters("by_status")
                    .parameter("status", "pending")
                    .parameter("by_status.status", "refunded")
                    .build());

            assertEquals(List.of("refunded"), plan.parameters());
        }

        @Test
        @DisplayName("Parameter without value or default is missing")
        void missingParameter() {
            MissingParameterException e = assertThrows(MissingParameterException.class,
                    () -> compile(QueryRequest.builder().metrics("order_count").namedFilters("min_amount").build()));

            assertEquals("min_amount", e.getFilterId());
            assertEquals("threshold", e.getParameter());
        }

        @Test
        void suppliedParameter() {
            CompiledPlan plan = compile(QueryRequest.builder()
                    .metrics("order_count")
                    .namedFilters("min_amount")
                    .parameter("threshold", new BigDecimal("99.50"))
                    .build());

            assertTrue(plan.sql().contains("(o1.amount >= ?)"), plan.sql());
            assertEquals(List.of(new BigDecimal("99.50")), plan.parameters());
        }

        @Test
        void emptyInList() {
            assertThrows(InvalidQueryException.class,
                    () -> compile(QueryRequest.builder().filter("o1.status", "in", List.of()).build()));
        }

        @Test
        void unknownOperator() {
            assertThrows(InvalidQueryException.class, () -> QueryRequest.builder().filter("o1.status", "~", "x"));
        }
    }

    @Nested
    @DisplayName("Rejected requests")
    class Rejected {

        @Test
        void undefinedMetric() {
            UndefinedMetricException e = assertThrows(UndefinedMetricException.class,
                    () -> compile(QueryRequest.builder().metrics("profit").build()));

            assertEquals("profit", e.getMetricId());
        }

        @Test
        void undefinedFilter() {
            assertThrows(UndefinedFilterException.class,
                    () -> compile(QueryRequest.builder().namedFilters("vip").build()));
        }

        @Test
        void unknownColumn() {
            assertThrows(UndefinedColumnException.class,
                    () -> compile(QueryRequest.builder().fields("o1.discount").build()));
        }

        @Test
        void undeclaredDataset() {
            assertThrows(UndefinedColumnException.class,
                    () -> compile(QueryRequest.builder().fields("x.name").build()));
        }

        @Test
        void unqualifiedField() {
            assertThrows(UndefinedColumnException.class,
                    () -> compile(QueryRequest.builder().fields("name").build()));
        }

        @Test
        void nonPositiveLimit() {
            assertThrows(InvalidQueryException.class,
                    () -> compile(QueryRequest.builder().metrics("order_count").limit(0).build()));
        }

        @Test
        void sortByUnrequestedMetric() {
            assertThrows(InvalidQueryException.class, () -> compile(QueryRequest.builder()
                    .metrics("order_count").orderBy(SortSpec.asc("total_revenue")).build()));
        }

        @Test
        @DisplayName("All compile failures share a base type")
        void commonBaseType() {
            assertInstanceOf(CompileException.class, new UndefinedMetricException("m"));
            assertInstanceOf(CompileException.class, new UndefinedFilterException("f"));
            assertInstanceOf(CompileException.class, new MissingParameterException("f", "p"));
        }
    }

    @Nested
    @DisplayName("Mandatory rules")
    class MandatoryRules {

        private static final String BLOCKED_RULE = """
                  - id: no_blocked_customers
                    name: No blocked customers
                    severity: error
                    condition: c1.region <> 'blocked'
                """;

        private ValidatedContext validated(String text) {
            return new ContextValidator(StubDatasetStore.sales())
                    .validate(ContextParser.parse(text), ContextFixtures.OWNER);
        }

        private CompiledPlan compileAgainst(ValidatedContext validated, QueryRequest request) {
            JoinPath path = new JoinPathResolver(RelationshipGraph.build(validated))
                    .findJoinPath(QueryCompiler.requiredDatasets(request, validated), request.joinVia());
            return compiler.compile(request, validated, path);
        }

        private String withRule(String rule) {
            return ContextFixtures.SALES.replace("business_rules:\n", "business_rules:\n" + rule);
        }

        @Test
        @DisplayName("An error rule on customers joins customers into a query on orders")
        void ruleOnUnrequestedDataset() {
            // GIVEN a mandatory rule that reads only customers
            ValidatedContext blocked = validated(withRule(BLOCKED_RULE));

            // WHEN revenue is asked for without touching customers
            CompiledPlan plan = compileAgainst(blocked, QueryRequest.builder().metrics("total_revenue").build());

            // THEN customers is joined and the rule is enforced
            assertEquals("""
                    SELECT SUM(o1.amount) AS total_revenue
                    FROM "orders" AS o1
                    LEFT JOIN "customers" AS c1 ON o1.customer_id = c1.customer_id
                    WHERE (c1.region <> 'blocked') AND (o1.amount > 0)""", plan.sql());
            assertEquals(List.of("no_blocked_customers", "positive_amount"), plan.appliedRules());
            assertEquals(List.of("region_known"), plan.advisories().stream().map(Advisory::ruleId).toList());
        }

        @Test
        @DisplayName("Unqualified rule columns join the dataset that owns them")
        void unqualifiedRuleColumn() {
            ValidatedContext voided = validated(withRule("""
                      - id: not_void
                        name: Not void
                        severity: error
                        condition: status <> 'void'
                    """));

            CompiledPlan plan = compileAgainst(voided, QueryRequest.builder().fields("c1.name").build());

            assertEquals("o1", plan.root());
            assertTrue(plan.sql().endsWith("WHERE (status <> 'void') AND (o1.amount > 0)"), plan.sql());
        }

        @Test
        @DisplayName("A rule dataset that cannot be joined fails the query")
        void unreachableRuleDataset() {
            String noRelationships = withRule(BLOCKED_RULE)
                    .replaceAll("(?s)relationships:\n.*?metrics:\n", "metrics:\n");
            ValidatedContext disconnected = validated(noRelationships);

            assertThrows(NoPathException.class, () -> compileAgainst(disconnected,
                    QueryRequest.builder().metrics("total_revenue").build()));
        }

        @Test
        @DisplayName("A join path missing a rule dataset is rejected, never compiled without the rule")
        void pathMissingRuleDataset() {
            ValidatedContext blocked = validated(withRule(BLOCKED_RULE));
            QueryRequest request = QueryRequest.builder().metrics("order_count").build();

            InvalidQueryException e = assertThrows(InvalidQueryException.class,
                    () -> compiler.compile(request, blocked, JoinPath.single("o1")));

            assertTrue(e.getMessage().contains("no_blocked_customers"), e.getMessage());
        }
    }

    @Nested
    @DisplayName("Purity")
    class Purity {

        @Test
        @DisplayName("Same inputs give equal plans and cache keys")
        void deterministic() {
            QueryRequest request = QueryRequest.builder()
                    .metrics("total_revenue")
                    .groupBy("c1.region")
                    .filter("o1.status", "=", "paid")
                    .build();

            CompiledPlan first = compile(request);
            CompiledPlan second = compile(request);

            assertEquals(first, second);
            assertEquals(64, first.cacheKey().length());
        }

        @Test
        @DisplayName("Parameter values and their types are part of the cache key")
        void cacheKeyCoversParameters() {
            CompiledPlan paid = compile(QueryRequest.builder().filter("o1.status", "=", "paid").build());
            CompiledPlan open = compile(QueryRequest.builder().filter("o1.status", "=", "open").build());
            CompiledPlan one = compile(QueryRequest.builder().filter("o1.order_id", "=", 1).build());
            CompiledPlan oneText = compile(QueryRequest.builder().filter("o1.order_id", "=", "1").build());

            assertEquals(paid.sql(), open.sql());
            assertNotEquals(paid.cacheKey(), open.cacheKey());
            assertNotEquals(one.cacheKey(), oneText.cacheKey());
        }

        @Test
        @DisplayName("Editing the context changes the cache key")
        void cacheKeyCoversFingerprint() {
            QueryRequest request = QueryRequest.builder().metrics("order_count").build();
            CompiledPlan before = compile(request);

            ContextDocument edited = ContextParser.parse(ContextFixtures.SALES.replace("Money earned", "Cash earned"));
            ValidatedContext editedContext = new ContextValidator(StubDatasetStore.sales())
                    .validate(edited, ContextFixtures.OWNER);
            CompiledPlan after = compiler.compile(request, editedContext, JoinPath.single("o1"));

            assertEquals(before.sql(), after.sql());
            assertNotEquals(before.cacheKey(), after.cacheKey());
        }
    }
}
