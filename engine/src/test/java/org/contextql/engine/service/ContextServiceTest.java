package org.contextql.engine.service;

import org.contextql.dsl.ContextParser;
import org.contextql.engine.cache.ResultCache;
import org.contextql.engine.execution.BufferedResult;
import org.contextql.engine.repository.ActiveContextConflictException;
import org.contextql.engine.repository.ContextNotFoundException;
import org.contextql.engine.repository.InMemoryContextRepository;
import org.contextql.engine.repository.StoredContext;
import org.contextql.engine.repository.VersionConflictException;
import org.contextql.engine.validation.ContextValidationException;
import org.contextql.engine.validation.ContextValidator;
import org.contextql.engine.validation.IssueCode;
import org.contextql.engine.validation.ValidationStatus;
import org.contextql.model.ContextStatus;
import org.contextql.test.ContextFixtures;
import org.contextql.test.MutableClock;
import org.contextql.test.StubDatasetStore;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Context service")
class ContextServiceTest {

    private static final String OWNER = ContextFixtures.OWNER;
    private static final String SALES_V2 = ContextFixtures.SALES.replace("version: 1.0.0", "version: 1.1.0");

    private static final String PAGE_VIEWS = """
            ---
            id: page_views
            name: Page Views
            version: 1.0.0
            description: Raw page view events from the website
            datasets:
              - id: pv
                dataset_id: page_views
                name: Page views
                columns: [url, viewed_at]
            metrics:
              - id: view_count
                expression: COUNT(*)
            ---
            """;

    private InMemoryContextRepository repository;
    private StubDatasetStore store;
    private ResultCache cache;
    private MutableClock clock;
    private ContextService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryContextRepository();
        store = StubDatasetStore.sales().dataset(OWNER, "page_views", 50L, "url", "viewed_at");
        clock = new MutableClock();
        cache = new ResultCache(clock, 100);
        service = new ContextService(repository, new ContextValidator(store), cache, clock);
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Created contexts are drafts with a validation result")
        void createIsDraft() {
            StoredContext created = service.create(OWNER, ContextFixtures.SALES);

            assertEquals(ContextStatus.DRAFT, created.status());
            assertNotNull(created.validation());
            assertFalse(created.validation().blocksActivation());
            assertEquals(OWNER, created.ownerId());
        }

        @Test
        @DisplayName("A status in the text is ignored on create")
        void statusInTextIgnored() {
            String text = ContextFixtures.SALES.replace("version: 1.0.0", "version: 1.0.0\nstatus: active");

            assertEquals(ContextStatus.DRAFT, service.create(OWNER, text).status());
            assertTrue(repository.active("sales").isEmpty());
        }

        @Test
        @DisplayName("Activation deprecates the previously active version")
        void activationDeprecatesPrevious() {
            // GIVEN version 1.0.0 is active
            service.create(OWNER, ContextFixtures.SALES);
            service.activate(OWNER, "sales", "1.0.0");

            // WHEN version 1.1.0 is saved and activated
            clock.advance(Duration.ofMinutes(5));
            service.update(OWNER, "sales", SALES_V2);
            StoredContext activated = service.activate(OWNER, "sales", "1.1.0");

            // THEN exactly one version is active
            assertEquals(ContextStatus.ACTIVE, activated.status());
            assertEquals(ContextStatus.DEPRECATED, service.get(OWNER, "sales", "1.0.0").status());
            assertEquals("1.1.0", repository.active("sales").orElseThrow().version());
            assertEquals(clock.instant(), activated.savedAt());
        }

        @Test
        @DisplayName("Deprecated versions cannot be reactivated")
        void deprecatedCannotBeActivated() {
            service.create(OWNER, ContextFixtures.SALES);
            service.activate(OWNER, "sales", "1.0.0");
            service.update(OWNER, "sales", SALES_V2);
            service.activate(OWNER, "sales", "1.1.0");

            assertThrows(IllegalStateException.class, () -> service.activate(OWNER, "sales", "1.0.0"));
        }

        @Test
        @DisplayName("A failed save keeps the previous version active")
        void failedSaveRestoresPrevious() {
            // GIVEN a repository that cannot store an active 1.1.0
            InMemoryContextRepository failing = new InMemoryContextRepository() {
                @Override
                public synchronized void save(StoredContext context) {
                    if (context.status() == ContextStatus.ACTIVE && context.version().equals("1.1.0")) {
                        throw new IllegalStateException("write rejected");
                    }
                    super.save(context);
                }
            };
            ContextService flaky = new ContextService(failing, new ContextValidator(store), cache, clock);
            flaky.create(OWNER, ContextFixtures.SALES);
            flaky.activate(OWNER, "sales", "1.0.0");
            flaky.update(OWNER, "sales", SALES_V2);

            // WHEN
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> flaky.activate(OWNER, "sales", "1.1.0"));

            // THEN
            assertEquals("write rejected", e.getMessage());
            assertEquals("1.0.0", failing.active("sales").orElseThrow().version());
            assertEquals(ContextStatus.DRAFT, flaky.get(OWNER, "sales", "1.1.0").status());
        }

        @Test
        @DisplayName("A context that fails validation stays a draft")
        void failedValidationStaysDraft() {
            // GIVEN the store no longer has the customers dataset
            StubDatasetStore ordersOnly = new StubDatasetStore()
                    .dataset(OWNER, "orders", 10L, "order_id", "customer_id", "amount", "status");
            ContextService strict = new ContextService(repository, new ContextValidator(ordersOnly), cache, clock);
            strict.create(OWNER, ContextFixtures.SALES);

            // WHEN
            ContextValidationException e = assertThrows(ContextValidationException.class,
                    () -> strict.activate(OWNER, "sales", "1.0.0"));

            // THEN
            assertTrue(e.getResult().hasIssue(IssueCode.MISSING_DATASET));
            StoredContext stored = strict.get(OWNER, "sales", "1.0.0");
            assertEquals(ContextStatus.DRAFT, stored.status());
            assertEquals(ValidationStatus.FAILED, stored.validation().status());
        }

        @Test
        @DisplayName("Another context cannot become active for the same dataset")
        void activeConflictAcrossContexts() {
            service.create(OWNER, ContextFixtures.SALES);
            service.activate(OWNER, "sales", "1.0.0");
            service.create(OWNER, ContextFixtures.SALES.replace("id: sales", "id: crm"));

            ActiveContextConflictException e = assertThrows(ActiveContextConflictException.class,
                    () -> service.activate(OWNER, "crm", "1.0.0"));

            assertEquals("sales", e.getActiveContextId());
            assertEquals(ContextStatus.DRAFT, service.get(OWNER, "crm").status());
        }

        @Test
        @DisplayName("Reusing a version number is rejected")
        void versionReuse() {
            service.create(OWNER, ContextFixtures.SALES);

            assertThrows(VersionConflictException.class, () -> service.create(OWNER, ContextFixtures.SALES));
            assertThrows(VersionConflictException.class,
                    () -> service.update(OWNER, "sales", ContextFixtures.SALES));
        }

        @Test
        @DisplayName("Update must keep the context id")
        void updateKeepsId() {
            service.create(OWNER, ContextFixtures.SALES);

            assertThrows(IllegalArgumentException.class, () -> service.update(OWNER, "sales",
                    SALES_V2.replace("id: sales", "id: other")));
        }

        @Test
        @DisplayName("Update and activation evict cached results")
        void cacheEviction() {
            service.create(OWNER, ContextFixtures.SALES);
            StoredContext active = service.activate(OWNER, "sales", "1.0.0");
            cache.put("k1", "sales", active.document().fingerprint(),
                    new BufferedResult(List.of(), List.of()), Duration.ofMinutes(10));

            service.update(OWNER, "sales", SALES_V2);

            assertEquals(0, cache.size());
        }
    }

    @Nested
    @DisplayName("Ownership")
    class Ownership {

        @Test
        @DisplayName("Other users cannot see a context")
        void otherUserNotFound() {
            service.create(OWNER, ContextFixtures.SALES);

            assertThrows(ContextNotFoundException.class, () -> service.get("bob", "sales"));
            assertThrows(ContextNotFoundException.class, () -> service.get("bob", "sales", "1.0.0"));
            assertThrows(ContextNotFoundException.class, () -> service.update("bob", "sales", SALES_V2));
            assertTrue(service.list("bob", null).isEmpty());
        }

        @Test
        @DisplayName("Other users cannot take over a context id")
        void otherUserCannotCreate() {
            service.create(OWNER, ContextFixtures.SALES);

            assertThrows(VersionConflictException.class, () -> service.create("bob", SALES_V2));
        }
    }

    @Nested
    @DisplayName("Catalog")
    class Catalog {

        @BeforeEach
        void seed() {
            service.create(OWNER, ContextFixtures.SALES);
            service.activate(OWNER, "sales", "1.0.0");
            service.create(OWNER, PAGE_VIEWS);
        }

        @Test
        @DisplayName("Glossary search matches synonyms case-insensitively")
        void glossaryBySynonym() {
            List<GlossaryMatch> matches = service.searchGlossary(OWNER, "Turnover");

            assertEquals(1, matches.size());
            assertEquals("sales", matches.get(0).contextId());
            assertEquals("Revenue", matches.get(0).entry().term());
            assertTrue(service.searchGlossary(OWNER, "churn").isEmpty());
            assertTrue(service.searchGlossary("bob", "revenue").isEmpty());
        }

        @Test
        @DisplayName("Metrics are listed for contexts that include the dataset")
        void metricsForDataset() {
            List<MetricMatch> matches = service.metricsForDataset(OWNER, "customers");

            assertEquals(List.of("total_revenue", "order_count"),
                    matches.stream().map(m -> m.metric().id()).toList());
            assertEquals("c1", matches.get(0).datasetLocalId());
            assertEquals(1, service.metricsForDataset(OWNER, "page_views").size());
            assertTrue(service.metricsForDataset(OWNER, "invoices").isEmpty());
        }

        @Test
        @DisplayName("Statistics count each context once")
        void statistics() {
            service.update(OWNER, "sales", SALES_V2);

            ContextStatistics stats = service.statistics(OWNER);

            assertEquals(2, stats.total());
            assertEquals(1, stats.multiDataset());
            assertEquals(1, stats.singleDataset());
            assertEquals(1, stats.active());
            assertEquals(0, stats.failedValidation());
        }

        @Test
        @DisplayName("Listing filters by status")
        void listByStatus() {
            assertEquals(2, service.list(OWNER, null).size());
            assertEquals(List.of("sales"),
                    service.list(OWNER, ContextStatus.ACTIVE).stream().map(StoredContext::contextId).toList());
        }

        @Test
        @DisplayName("Rendered source parses back to the same content")
        void renderSource() {
            String source = service.renderSource(OWNER, "sales", "1.0.0");

            StoredContext original = service.get(OWNER, "sales", "1.0.0");
            assertEquals(original.document().fingerprint(),
                    ContextParser.parse(source).fingerprint());
        }
    }
}
