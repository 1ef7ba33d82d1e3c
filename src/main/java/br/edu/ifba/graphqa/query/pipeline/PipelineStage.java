package br.edu.ifba.graphqa.query.pipeline;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * A stage of the multi-hop query pipeline.
 *
 * <p>Stages read their inputs from the {@link PipelineContext}, write their outputs
 * back to it and return the same instance. They hold no per-query state.</p>
 */
public interface PipelineStage {

    /**
     * Processes the pipeline context.
     *
     * @param context the context of the running query
     * @return future completing with the (modified) context
     */
    CompletableFuture<PipelineContext> process(@NotNull PipelineContext context);

    /**
     * Stage name for logging, e.g. "understand" or "rank".
     */
    String getName();

    /**
     * Whether this stage has nothing to do for the context. Never skipped by default.
     */
    default boolean shouldSkip(@NotNull PipelineContext context) {
        return false;
    }

    /**
     * Whether the stage waits on the graph store and must finish within the query deadline.
     * Such stages are skipped once an earlier stage has been cut off by the deadline.
     */
    default boolean isDeadlineBound() {
        return true;
    }
}
