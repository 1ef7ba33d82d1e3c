package br.edu.ifba.graphqa.query.pipeline;

import br.edu.ifba.graphqa.core.MultiHopQuery;
import br.edu.ifba.graphqa.core.QueryEntity;
import br.edu.ifba.graphqa.query.MultiHopQueryResult;
import br.edu.ifba.graphqa.query.PathSearchResult;
import br.edu.ifba.graphqa.query.QueryBudget;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs a query through its stages in order and assembles the response.
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * QueryPipeline pipeline = QueryPipeline.builder()
 *     .addStage(new UnderstandingStage(intentAnalyzer, entityResolver))
 *     .addStage(new PathSearchStage(pathFinder))
 *     .addStage(new RankingStage(ranker))
 *     .addStage(new SynthesisStage(synthesizer))
 *     .build();
 *
 * MultiHopQueryResult result = pipeline.execute(query, budget).join();
 * }</pre>
 */
public class QueryPipeline {

    private static final Logger logger = LoggerFactory.getLogger(QueryPipeline.class);

    static final long MIN_STAGE_WAIT_MILLIS = 250;

    private final List<PipelineStage> stages;

    private QueryPipeline(Builder builder) {
        this.stages = new ArrayList<>(builder.stages);
    }

    /**
     * Executes the query through all pipeline stages.
     *
     * @param query validated query
     * @param budget traversal budget of this query
     * @return future with the assembled result
     */
    public CompletableFuture<MultiHopQueryResult> execute(@NotNull MultiHopQuery query, @NotNull QueryBudget budget) {
        logger.info("Starting pipeline execution: maxHops={}, resultLimit={}",
            query.getMaxHops(), query.getResultLimit());
        PipelineContext context = new PipelineContext(query, budget);

        CompletableFuture<PipelineContext> future = CompletableFuture.completedFuture(context);
        for (PipelineStage stage : stages) {
            future = future.thenCompose(ctx -> executeStage(stage, ctx));
        }
        return future.thenApply(this::buildResult);
    }

    private CompletableFuture<PipelineContext> executeStage(@NotNull PipelineStage stage,
                                                            @NotNull PipelineContext context) {
        if (stage.shouldSkip(context)) {
            logger.debug("Skipping stage: {}", stage.getName());
            return CompletableFuture.completedFuture(context);
        }
        if (stage.isDeadlineBound() && context.isDeadlineReached()) {
            logger.warn("Skipping stage {}: query deadline reached", stage.getName());
            return CompletableFuture.completedFuture(context);
        }

        logger.debug("Executing stage: {}", stage.getName());
        long stageStart = System.currentTimeMillis();

        CompletableFuture<PipelineContext> processed = stage.process(context)
            .thenApply(ctx -> {
                long elapsed = System.currentTimeMillis() - stageStart;
                logger.debug("Stage {} completed in {}ms", stage.getName(), elapsed);
                return ctx;
            })
            .exceptionally(e -> {
                Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                logger.error("Stage {} failed: {}", stage.getName(), cause.getMessage(), cause);
                throw new PipelineException("Stage " + stage.getName() + " failed", cause);
            });
        if (!stage.isDeadlineBound()) {
            return processed;
        }
        return withinDeadline(stage, context, processed);
    }

    /**
     * Completes with the stage's outcome, or with the context as it stands once the query
     * deadline passes. A stage starting after the deadline, such as ranking the partial paths
     * of a timed-out search, still gets {@link #MIN_STAGE_WAIT_MILLIS}. Expiry cancels the
     * budget so in-flight traversals stop, and every later store-bound stage is skipped.
     */
    private CompletableFuture<PipelineContext> withinDeadline(PipelineStage stage, PipelineContext context,
                                                              CompletableFuture<PipelineContext> processed) {
        QueryBudget budget = context.getBudget();
        CompletableFuture<PipelineContext> bounded = new CompletableFuture<>();
        processed.whenComplete((ctx, error) -> {
            if (error != null) {
                bounded.completeExceptionally(error);
            } else {
                bounded.complete(ctx);
            }
        });
        long wait = Math.max(budget.remainingMillis(), MIN_STAGE_WAIT_MILLIS);
        CompletableFuture.delayedExecutor(wait, TimeUnit.MILLISECONDS).execute(() -> {
            if (!bounded.isDone()) {
                context.markDeadlineReached();
                budget.cancel();
                logger.warn("Stage {} did not finish before the query deadline; answering from partial results",
                    stage.getName());
                bounded.complete(context);
            }
        });
        return bounded;
    }

    private MultiHopQueryResult buildResult(@NotNull PipelineContext context) {
        PathSearchResult search = context.getPathSearch();
        List<QueryEntity> queryEntities = context.getCandidates().stream().map(QueryEntity::of).toList();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("max_hops", context.getQuery().getMaxHops());
        metadata.put("result_limit", context.getQuery().getResultLimit());
        metadata.put("candidates_resolved", queryEntities.size());
        metadata.put("expected_type", context.getIntent().expectedType().name());
        metadata.put("visited_nodes", context.getBudget().visitedNodes());

        double elapsed = context.elapsedSeconds();
        boolean truncated = search.truncated() || context.isDeadlineReached();
        logger.info("Pipeline completed in {}s: {} paths, {} results{}", String.format("%.3f", elapsed),
            search.paths().size(), context.getResults().size(), truncated ? " (truncated)" : "");

        return new MultiHopQueryResult(
            context.getAnswer(),
            context.getResults(),
            queryEntities,
            context.getIntent(),
            search.paths().size(),
            search.recordsExplored(),
            elapsed,
            MultiHopQueryResult.answerConfidence(context.getResults().size()),
            truncated,
            metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<PipelineStage> stages = new ArrayList<>();

        /**
         * Adds a stage. Stages run in the order they are added.
         */
        public Builder addStage(@NotNull PipelineStage stage) {
            this.stages.add(stage);
            return this;
        }

        public QueryPipeline build() {
            if (stages.isEmpty()) {
                throw new IllegalStateException("At least one stage is required");
            }
            return new QueryPipeline(this);
        }
    }

    /**
     * Thrown when a pipeline stage fails. The cause is the stage's own error.
     */
    public static class PipelineException extends RuntimeException {
        public PipelineException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
