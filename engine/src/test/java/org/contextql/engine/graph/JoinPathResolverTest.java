package org.contextql.engine.graph;

import org.contextql.dsl.ContextParser;
import org.contextql.model.ContextDocument;
import org.contextql.model.JoinType;
import org.contextql.model.Relationship;
import org.contextql.test.ContextFixtures;
import org.junit.jupiter.api.*;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Join path resolver")
class JoinPathResolverTest {

    /**
     * Builds a document with the given datasets and relationships written as
     * {@code id:from>to}; every relationship joins {@code from.ref} to {@code to.id}.
     */
    private static ContextDocument graphDocument(List<String> datasets, String... relationships) {
        StringBuilder sb = new StringBuilder("---\nname: Graph\nversion: 1.0.0\ndescription: Test graph\ndatasets:\n");
        for (String ds : datasets) {
            sb.append("  - id: ").append(ds).append("\n    dataset_id: ds_").append(ds)
                    .append("\n    name: ").append(ds).append('\n');
        }
        if (relationships.length > 0) {
            sb.append("relationships:\n");
        }
        for (String r : relationships) {
            String id = r.substring(0, r.indexOf(':'));
            String from = r.substring(r.indexOf(':') + 1, r.indexOf('>'));
            String to = r.substring(r.indexOf('>') + 1);
            sb.append("  - id: ").append(id)
                    .append("\n    from_dataset: ").append(from).append("\n    from_column: ref")
                    .append("\n    to_dataset: ").append(to).append("\n    to_column: id\n");
        }
        sb.append("---\n");
        return ContextParser.parse(sb.toString());
    }

    private static JoinPathResolver resolver(ContextDocument doc) {
        return new JoinPathResolver(RelationshipGraph.build(doc));
    }

    private static List<String> relationshipIds(JoinPath path) {
        return path.relationships().stream().map(Relationship::id).toList();
    }

    private static void assertSpanning(JoinPath path, Set<String> requested) {
        Set<String> joined = new HashSet<>();
        joined.add(path.root());
        for (JoinStep step : path.steps()) {
            assertTrue(joined.contains(step.source()), "Step source must already be joined: " + step);
            assertTrue(joined.add(step.target()), "Step target joined twice: " + step);
        }
        assertTrue(joined.containsAll(requested), "Path " + path.datasets() + " misses some of " + requested);
    }

    @Nested
    @DisplayName("Spanning")
    class Spanning {

        @Test
        @DisplayName("Orders and customers join with one left join")
        void ordersCustomers() {
            // GIVEN
            ContextDocument doc = ContextParser.parse(ContextFixtures.SALES);

            // WHEN
            JoinPath path = resolver(doc).findJoinPath(List.of("c1", "o1"));

            // THEN
            assertEquals("o1", path.root());
            assertEquals(1, path.steps().size());
            JoinStep step = path.steps().get(0);
            assertEquals("c1", step.target());
            assertEquals(JoinType.LEFT, step.joinType());
            assertFalse(step.reversed());
        }

        @Test
        @DisplayName("Single dataset needs no join")
        void singleDataset() {
            JoinPath path = resolver(ContextParser.parse(ContextFixtures.SALES)).findJoinPath(List.of("c1"));

            assertEquals("c1", path.root());
            assertTrue(path.isEmpty());
        }

        @Test
        @DisplayName("Empty request selects the first declared dataset")
        void emptyRequest() {
            JoinPath path = resolver(ContextParser.parse(ContextFixtures.SALES)).findJoinPath(List.of());

            assertEquals(JoinPath.single("o1"), path);
        }

        @Test
        @DisplayName("Intermediate datasets are pulled in to connect the request")
        void chain() {
            ContextDocument doc = graphDocument(List.of("a", "b", "c", "d"), "a_b:a>b", "b_c:b>c", "c_d:c>d");

            JoinPath path = resolver(doc).findJoinPath(List.of("a", "d"));

            assertEquals(List.of("a", "b", "c", "d"), path.datasets());
            assertEquals(List.of("a_b", "b_c", "c_d"), relationshipIds(path));
            assertSpanning(path, Set.of("a", "d"));
        }

        @Test
        @DisplayName("Walking a relationship backwards flips left to right")
        void reversedTraversal() {
            ContextDocument doc = graphDocument(List.of("a", "b"), "b_a:b>a");

            JoinPath path = resolver(doc).findJoinPath(List.of("a", "b"));

            JoinStep step = path.steps().get(0);
            assertEquals("a", step.source());
            assertTrue(step.reversed());
            assertEquals(JoinType.RIGHT, step.joinType());
        }

        @Test
        @DisplayName("Star of requested leaves shares the hub")
        void star() {
            ContextDocument doc = graphDocument(List.of("hub", "x", "y", "z"), "hx:x>hub", "hy:y>hub", "hz:z>hub");

            JoinPath path = resolver(doc).findJoinPath(List.of("x", "y", "z"));

            assertEquals(3, path.steps().size());
            assertSpanning(path, Set.of("x", "y", "z"));
            assertEquals("x", path.root());
        }
    }

    @Nested
    @DisplayName("Tie-breaking and weights")
    class TieBreaking {

        @Test
        @DisplayName("Equal-cost routes prefer the earlier declared relationship")
        void earlierRelationshipWins() {
            ContextDocument doc = graphDocument(List.of("a", "b", "c", "d"),
                    "a_b:a>b", "a_c:a>c", "b_d:b>d", "c_d:c>d");

            JoinPath path = resolver(doc).findJoinPath(List.of("a", "d"));

            assertEquals(List.of("a_b", "b_d"), relationshipIds(path));
        }

        @Test
        @DisplayName("Large datasets make a route more expensive")
        void rowCountsWeighRoutes() {
            ContextDocument doc = graphDocument(List.of("a", "b", "c", "d"),
                    "a_b:a>b", "a_c:a>c", "b_d:b>d", "c_d:c>d");
            RelationshipGraph graph = RelationshipGraph.build(doc, Map.of("b", 5_000_000L, "c", 10L));

            JoinPath path = new JoinPathResolver(graph).findJoinPath(List.of("a", "d"));

            assertEquals(List.of("a_c", "c_d"), relationshipIds(path));
        }

        @Test
        @DisplayName("Resolution is deterministic")
        void deterministic() {
            ContextDocument doc = graphDocument(List.of("a", "b", "c", "d", "e"),
                    "a_b:a>b", "a_c:a>c", "b_d:b>d", "c_d:c>d", "d_e:d>e", "c_e:c>e");

            JoinPath first = resolver(doc).findJoinPath(List.of("e", "a", "b"));
            JoinPath second = resolver(doc).findJoinPath(List.of("b", "e", "a"));

            assertEquals(first, second);
        }
    }

    @Nested
    @DisplayName("Cycles")
    class Cycles {

        @Test
        @DisplayName("Triangle joins through the tree edges only")
        void triangleAvoidsClosingEdge() {
            // GIVEN a -> b -> c -> a, where c_a closes the cycle
            ContextDocument doc = ContextParser.parse(ContextFixtures.TRIANGLE);
            RelationshipGraph graph = RelationshipGraph.build(doc);
            assertTrue(graph.hasCycles());
            assertTrue(graph.isCycleClosing(graph.indexOf("c_a")));

            // WHEN
            JoinPath path = new JoinPathResolver(graph).findJoinPath(List.of("a", "c"));

            // THEN
            assertEquals(List.of("a_b", "b_c"), relationshipIds(path));
            assertSpanning(path, Set.of("a", "c"));
        }

        @Test
        @DisplayName("Pinned closing edge is used when asked for")
        void pinnedClosingEdge() {
            ContextDocument doc = ContextParser.parse(ContextFixtures.TRIANGLE);

            JoinPath path = resolver(doc).findJoinPath(List.of("a", "c"), List.of("c_a"));

            assertEquals(List.of("c_a"), relationshipIds(path));
            assertEquals(JoinType.RIGHT, path.steps().get(0).joinType());
        }

        @Test
        @DisplayName("Pinning every edge of the cycle is circular")
        void pinnedCycle() {
            ContextDocument doc = ContextParser.parse(ContextFixtures.TRIANGLE);

            CircularPathException e = assertThrows(CircularPathException.class,
                    () -> resolver(doc).findJoinPath(List.of("a"), List.of("a_b", "b_c", "c_a")));

            assertEquals("c_a", e.getRelationshipId());
        }

        @Test
        @DisplayName("Pinned relationship away from the tree is rejected")
        void pinnedDisconnected() {
            ContextDocument doc = graphDocument(List.of("a", "b", "c", "d"), "a_b:a>b", "c_d:c>d");

            assertThrows(CircularPathException.class,
                    () -> resolver(doc).findJoinPath(List.of("a"), List.of("c_d")));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Disconnected dataset cannot be reached")
        void unreachable() {
            ContextDocument doc = graphDocument(List.of("a", "b", "c"), "a_b:a>b");

            NoPathException e = assertThrows(NoPathException.class,
                    () -> resolver(doc).findJoinPath(List.of("a", "c")));

            assertEquals(Set.of("c"), e.getUnreachable());
        }

        @Test
        void unknownDataset() {
            NoPathException e = assertThrows(NoPathException.class,
                    () -> resolver(ContextParser.parse(ContextFixtures.SALES)).findJoinPath(List.of("o1", "x9")));

            assertEquals(Set.of("x9"), e.getUnreachable());
        }

        @Test
        void unknownPinnedRelationship() {
            assertThrows(NoPathException.class,
                    () -> resolver(ContextParser.parse(ContextFixtures.SALES))
                            .findJoinPath(List.of("o1"), List.of("missing")));
        }

        @Test
        @DisplayName("Both resolution failures share a base type")
        void commonBaseType() {
            assertInstanceOf(JoinResolutionException.class, new NoPathException("x", Set.of()));
            assertInstanceOf(JoinResolutionException.class, new CircularPathException("x", "r"));
        }
    }
}
