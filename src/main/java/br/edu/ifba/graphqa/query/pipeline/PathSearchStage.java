package br.edu.ifba.graphqa.query.pipeline;

import br.edu.ifba.graphqa.query.PathFinder;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Traverses the graph from every resolved candidate.
 */
public class PathSearchStage implements PipelineStage {

    private static final String STAGE_NAME = "find-paths";

    private final PathFinder pathFinder;

    public PathSearchStage(@NotNull PathFinder pathFinder) {
        this.pathFinder = pathFinder;
    }

    @Override
    public CompletableFuture<PipelineContext> process(@NotNull PipelineContext context) {
        return pathFinder.findPaths(
                context.getCandidates(),
                context.getQuery().getMaxHops(),
                context.getQuery().getResultLimit(),
                context.getBudget())
            .thenApply(result -> {
                context.setPathSearch(result);
                return context;
            });
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }

    @Override
    public boolean shouldSkip(@NotNull PipelineContext context) {
        return !context.hasCandidates();
    }
}
