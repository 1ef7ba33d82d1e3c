package br.edu.ifba.graphqa.query.pipeline;

import br.edu.ifba.graphqa.GraphFixtures;
import br.edu.ifba.graphqa.core.Candidate;
import br.edu.ifba.graphqa.core.ExpectedAnswerType;
import br.edu.ifba.graphqa.core.MultiHopQuery;
import br.edu.ifba.graphqa.intent.QueryIntentAnalyzer;
import br.edu.ifba.graphqa.query.AnswerRanker;
import br.edu.ifba.graphqa.query.AnswerSynthesizer;
import br.edu.ifba.graphqa.query.MultiHopQueryResult;
import br.edu.ifba.graphqa.query.PathFinder;
import br.edu.ifba.graphqa.query.QueryBudget;
import br.edu.ifba.graphqa.query.QueryOptions;
import br.edu.ifba.graphqa.resolve.QueryEntityResolver;
import br.edu.ifba.graphqa.storage.GraphStoreUnavailableException;
import br.edu.ifba.graphqa.storage.impl.InMemoryGraphStorage;
import br.edu.ifba.graphqa.utils.Futures;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the query pipeline stages and their orchestration.
 */
class PipelineStagesTest {

    private InMemoryGraphStorage storage;
    private PipelineContext context;

    @BeforeEach
    void setUp() {
        storage = new InMemoryGraphStorage();
        storage.initialize().join();
        GraphFixtures.seedCarterGraph(storage);
        context = new PipelineContext(MultiHopQuery.of("Who founded the Carter Center?", 2, 10),
            new QueryBudget(Duration.ofSeconds(5), 10_000));
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    // ========================================================================
    // UnderstandingStage Tests
    // ========================================================================

    @Nested
    @DisplayName("UnderstandingStage")
    class UnderstandingStageTests {

        @Test
        @DisplayName("should set intent and candidates")
        void shouldSetIntentAndCandidates() {
            UnderstandingStage stage = new UnderstandingStage(new QueryIntentAnalyzer(),
                new QueryEntityResolver(storage));

            stage.process(context).join();

            assertEquals(ExpectedAnswerType.PERSON, context.getIntent().expectedType());
            assertTrue(context.hasCandidates());
            assertEquals("o1", context.getCandidates().get(0).entityId());
            assertEquals("understand", stage.getName());
        }
    }

    // ========================================================================
    // PathSearchStage Tests
    // ========================================================================

    @Nested
    @DisplayName("PathSearchStage")
    class PathSearchStageTests {

        private PathSearchStage stage;

        @BeforeEach
        void setUp() {
            stage = new PathSearchStage(new PathFinder(storage, QueryOptions.defaults()));
        }

        @Test
        @DisplayName("should skip when no candidates exist")
        void shouldSkipWithoutCandidates() {
            assertTrue(stage.shouldSkip(context));
        }

        @Test
        @DisplayName("should store the paths of the candidates")
        void shouldStorePaths() {
            context.setCandidates(List.of(new Candidate("l1", "Atlanta", "LOCATION", "Atlanta", 1.0)));

            assertFalse(stage.shouldSkip(context));
            stage.process(context).join();

            assertTrue(context.hasPaths());
            assertEquals(3, context.getPathSearch().paths().size());
        }
    }

    // ========================================================================
    // RankingStage and SynthesisStage Tests
    // ========================================================================

    @Nested
    @DisplayName("RankingStage and SynthesisStage")
    class RankingAndSynthesisTests {

        @Test
        @DisplayName("should skip ranking when no paths exist")
        void shouldSkipRankingWithoutPaths() {
            RankingStage stage = new RankingStage(
                new AnswerRanker(storage, new QueryIntentAnalyzer(), QueryOptions.defaults()));

            assertTrue(stage.shouldSkip(context));
        }

        @Test
        @DisplayName("should synthesize the fallback answer for an empty context")
        void shouldSynthesizeFallback() {
            SynthesisStage stage = new SynthesisStage(new AnswerSynthesizer());

            assertFalse(stage.shouldSkip(context));
            stage.process(context).join();

            assertEquals(AnswerSynthesizer.NO_ANSWER, context.getAnswer());
        }
    }

    // ========================================================================
    // QueryPipeline Tests
    // ========================================================================

    @Nested
    @DisplayName("QueryPipeline")
    class QueryPipelineTests {

        private final List<String> executed = new ArrayList<>();

        private PipelineStage recording(String name, boolean skip) {
            return new PipelineStage() {
                @Override
                public CompletableFuture<PipelineContext> process(@NotNull PipelineContext ctx) {
                    executed.add(name);
                    return CompletableFuture.completedFuture(ctx);
                }

                @Override
                public String getName() {
                    return name;
                }

                @Override
                public boolean shouldSkip(@NotNull PipelineContext ctx) {
                    return skip;
                }
            };
        }

        @Test
        @DisplayName("should require at least one stage")
        void shouldRequireStages() {
            assertThrows(IllegalStateException.class, () -> QueryPipeline.builder().build());
        }

        @Test
        @DisplayName("should run stages in order and honor skips")
        void shouldRunStagesInOrder() {
            QueryPipeline pipeline = QueryPipeline.builder()
                .addStage(recording("first", false))
                .addStage(recording("skipped", true))
                .addStage(recording("last", false))
                .build();

            MultiHopQueryResult result = pipeline.execute(context.getQuery(), context.getBudget()).join();

            assertEquals(List.of("first", "last"), executed);
            assertEquals(0, result.pathsFound());
            assertEquals(2, result.queryMetadata().get("max_hops"));
        }

        @Test
        @DisplayName("should wrap stage failures and keep the original cause")
        void shouldWrapStageFailure() {
            PipelineStage failing = new PipelineStage() {
                @Override
                public CompletableFuture<PipelineContext> process(@NotNull PipelineContext ctx) {
                    return CompletableFuture.failedFuture(new GraphStoreUnavailableException("database is locked"));
                }

                @Override
                public String getName() {
                    return "failing";
                }
            };
            QueryPipeline pipeline = QueryPipeline.builder()
                .addStage(failing)
                .addStage(recording("after", false))
                .build();

            CompletableFuture<MultiHopQueryResult> future = pipeline.execute(context.getQuery(), context.getBudget());

            CompletionException wrapped = assertThrows(CompletionException.class, future::join);
            assertInstanceOf(QueryPipeline.PipelineException.class, wrapped.getCause());
            assertThrows(GraphStoreUnavailableException.class, () -> Futures.await(future));
            assertTrue(executed.isEmpty());
        }
    }
}
