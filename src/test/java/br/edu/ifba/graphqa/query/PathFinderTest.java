package br.edu.ifba.graphqa.query;

import br.edu.ifba.graphqa.GraphFixtures;
import br.edu.ifba.graphqa.core.Candidate;
import br.edu.ifba.graphqa.core.Entity;
import br.edu.ifba.graphqa.core.GraphPath;
import br.edu.ifba.graphqa.core.PathEdge;
import br.edu.ifba.graphqa.storage.PathRecord;
import br.edu.ifba.graphqa.storage.TraversalBudget;
import br.edu.ifba.graphqa.storage.impl.InMemoryGraphStorage;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static br.edu.ifba.graphqa.GraphFixtures.entity;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathFinderTest {

    private InMemoryGraphStorage storage;
    private PathFinder finder;

    @BeforeEach
    void setUp() {
        storage = new InMemoryGraphStorage();
        storage.initialize().join();
        finder = new PathFinder(storage, QueryOptions.defaults());
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    private static Candidate candidate(String id, String name, String type) {
        return new Candidate(id, name, type, name, 1.0);
    }

    private static QueryBudget budget() {
        return new QueryBudget(Duration.ofSeconds(5), 10_000);
    }

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        @DisplayName("should collect simple paths of every depth up to max hops")
        void shouldCollectSimplePaths() {
            GraphFixtures.seedCarterGraph(storage);

            PathSearchResult result = finder.findPaths(
                List.of(candidate("o1", "Carter Center", "ORGANIZATION")), 2, 10, budget()).join();

            assertEquals(5, result.paths().size());
            assertEquals(5, result.recordsExplored());
            assertFalse(result.truncated());
            for (GraphPath path : result.paths()) {
                assertEquals("o1", path.nodeIds().get(0));
                assertTrue(path.hasDistinctNodes(), path.render());
                assertTrue(path.hops() >= 1 && path.hops() <= 2);
                assertTrue(path.rawScore() > 0.0 && path.rawScore() <= 1.0);
            }
            assertEquals("Carter Center -[HEADQUARTERED_IN]-> Atlanta", result.paths().get(0).render());
            assertEquals("Carter Center <-[FOUNDED]- Jimmy Carter", result.paths().get(1).render());
        }

        @Test
        @DisplayName("should only reach a two-hop answer when max hops allows it")
        void shouldRespectMaxHops() {
            GraphFixtures.seedChainGraph(storage);
            List<Candidate> curie = List.of(candidate("c1", "Marie Curie", "PERSON"));

            PathSearchResult oneHop = finder.findPaths(curie, 1, 10, budget()).join();
            PathSearchResult twoHops = finder.findPaths(curie, 2, 10, budget()).join();

            assertTrue(oneHop.paths().stream().noneMatch(p -> p.answerId().equals("c3")));
            assertTrue(twoHops.paths().stream().anyMatch(p -> p.answerId().equals("c3") && p.hops() == 2));
        }

        @Test
        @DisplayName("should skip deeper levels once enough paths were found")
        void shouldExitEarly() {
            GraphFixtures.seedCarterGraph(storage);

            PathSearchResult result = finder.findPaths(
                List.of(candidate("o1", "Carter Center", "ORGANIZATION")), 3, 1, budget()).join();

            assertEquals(3, result.paths().size());
            assertTrue(result.paths().stream().allMatch(p -> p.hops() == 1));
        }

        @Test
        @DisplayName("should return an empty result without candidates")
        void shouldHandleNoCandidates() {
            PathSearchResult result = finder.findPaths(List.of(), 2, 10, budget()).join();

            assertTrue(result.paths().isEmpty());
            assertEquals(0, result.recordsExplored());
        }
    }

    @Nested
    @DisplayName("limits")
    class Limits {

        @Test
        @DisplayName("should flag truncation when the visit cap is hit")
        void shouldTruncateOnVisitCap() {
            GraphFixtures.seedCarterGraph(storage);
            QueryBudget tight = new QueryBudget(Duration.ofSeconds(5), 1);

            PathSearchResult result = finder.findPaths(
                List.of(candidate("o1", "Carter Center", "ORGANIZATION")), 2, 10, tight).join();

            assertTrue(result.truncated());
            assertEquals(3, result.paths().size());
            assertTrue(tight.isExhausted());
        }

        @Test
        @DisplayName("should return partial results when the deadline passes")
        void shouldTruncateOnTimeout() {
            InMemoryGraphStorage hanging = new InMemoryGraphStorage() {
                @Override
                public CompletableFuture<List<PathRecord>> traverse(@NotNull String startId, int hops, int limit,
                                                                    @NotNull TraversalBudget budget) {
                    return new CompletableFuture<>();
                }
            };
            hanging.initialize().join();
            QueryBudget shortBudget = new QueryBudget(Duration.ofMillis(100), 10_000);

            PathSearchResult result = new PathFinder(hanging, QueryOptions.defaults())
                .findPaths(List.of(candidate("x", "X", "THING")), 2, 10, shortBudget).join();

            assertTrue(result.truncated());
            assertTrue(result.paths().isEmpty());
            assertTrue(shortBudget.isCancelled());
        }

        @Test
        @DisplayName("should skip a candidate whose traversal fails")
        void shouldSkipFailedCandidate() {
            InMemoryGraphStorage flaky = new InMemoryGraphStorage() {
                @Override
                public CompletableFuture<List<PathRecord>> traverse(@NotNull String startId, int hops, int limit,
                                                                    @NotNull TraversalBudget budget) {
                    if (startId.equals("p1")) {
                        return CompletableFuture.failedFuture(new IllegalStateException("store hiccup"));
                    }
                    return super.traverse(startId, hops, limit, budget);
                }
            };
            flaky.initialize().join();
            GraphFixtures.seedCarterGraph(flaky);

            PathSearchResult result = new PathFinder(flaky, QueryOptions.defaults()).findPaths(List.of(
                candidate("p1", "Jimmy Carter", "PERSON"),
                candidate("o1", "Carter Center", "ORGANIZATION")), 1, 10, budget()).join();

            assertEquals(3, result.paths().size());
            assertTrue(result.paths().stream().allMatch(p -> p.nodeIds().get(0).equals("o1")));
            assertFalse(result.truncated());
        }
    }

    @Nested
    @DisplayName("toPath")
    class ToPath {

        private final Entity a = Entity.builder().id("a").canonicalName("A").entityType("PERSON")
            .centralityScore(0.5).build();
        private final Entity b = Entity.builder().id("b").canonicalName("B").entityType("PERSON")
            .centralityScore(0.5).build();

        @Test
        @DisplayName("should multiply node centralities and edge weights")
        void shouldScorePath() {
            GraphPath path = finder.toPath(new PathRecord(List.of(a, b),
                List.of(new PathEdge("KNOWS", 0.8, true))), "a", 1);

            assertNotNull(path);
            assertEquals(0.2, path.rawScore(), 1e-9);
        }

        @Test
        @DisplayName("should substitute defaults for missing centrality and weight")
        void shouldUseDefaults() {
            GraphPath path = finder.toPath(new PathRecord(List.of(entity("a", "A", "PERSON"), b),
                List.of(new PathEdge("KNOWS", Double.NaN, true))), "a", 1);

            assertNotNull(path);
            assertEquals(PathFinder.MISSING_CENTRALITY * 0.5 * PathFinder.MISSING_WEIGHT, path.rawScore(), 1e-12);
        }

        @Test
        @DisplayName("should cap the raw score at one")
        void shouldCapScore() {
            Entity big = Entity.builder().id("a").canonicalName("A").entityType("X").centralityScore(5.0).build();
            Entity other = Entity.builder().id("b").canonicalName("B").entityType("X").centralityScore(5.0).build();

            GraphPath path = finder.toPath(new PathRecord(List.of(big, other),
                List.of(new PathEdge("R", 1.0, true))), "a", 1);

            assertNotNull(path);
            assertEquals(1.0, path.rawScore());
        }

        @Test
        @DisplayName("should reject malformed records")
        void shouldRejectMalformed() {
            PathEdge edge = new PathEdge("KNOWS", 1.0, true);

            assertNull(finder.toPath(null, "a", 1));
            assertNull(finder.toPath(new PathRecord(null, List.of(edge)), "a", 1));
            assertNull(finder.toPath(new PathRecord(List.of(a), List.of(edge)), "a", 1));
            assertNull(finder.toPath(new PathRecord(Arrays.asList(a, null), List.of(edge)), "a", 1));
            assertNull(finder.toPath(new PathRecord(List.of(b, a), List.of(edge)), "a", 1));
            assertNull(finder.toPath(new PathRecord(List.of(a, b), List.of(new PathEdge("knows", 1.0, true))), "a", 1));
            assertNull(finder.toPath(new PathRecord(List.of(a, b), Arrays.asList((PathEdge) null)), "a", 1));
            assertNull(finder.toPath(new PathRecord(List.of(a, entity("b", " ", "X")), List.of(edge)), "a", 1));
        }

        @Test
        @DisplayName("should drop paths that revisit a node")
        void shouldDropRepeatedNodes() {
            PathEdge edge = new PathEdge("KNOWS", 1.0, true);

            assertNull(finder.toPath(new PathRecord(List.of(a, b, a), List.of(edge, edge)), "a", 2));
        }
    }
}
