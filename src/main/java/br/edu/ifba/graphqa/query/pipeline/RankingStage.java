package br.edu.ifba.graphqa.query.pipeline;

import br.edu.ifba.graphqa.query.AnswerRanker;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Scores and orders the answers of the collected paths.
 */
public class RankingStage implements PipelineStage {

    private static final String STAGE_NAME = "rank";

    private final AnswerRanker ranker;

    public RankingStage(@NotNull AnswerRanker ranker) {
        this.ranker = ranker;
    }

    @Override
    public CompletableFuture<PipelineContext> process(@NotNull PipelineContext context) {
        return ranker.rank(
                context.getPathSearch().paths(),
                context.getIntent().expectedType(),
                context.getQueryText(),
                context.getQuery().getResultLimit())
            .thenApply(results -> {
                context.setResults(results);
                return context;
            });
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }

    @Override
    public boolean shouldSkip(@NotNull PipelineContext context) {
        return !context.hasPaths();
    }
}
