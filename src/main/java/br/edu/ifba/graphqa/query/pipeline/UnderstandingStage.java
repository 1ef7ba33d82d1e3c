package br.edu.ifba.graphqa.query.pipeline;

import br.edu.ifba.graphqa.intent.IntentAnalysis;
import br.edu.ifba.graphqa.intent.QueryIntentAnalyzer;
import br.edu.ifba.graphqa.resolve.QueryEntityResolver;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Classifies the expected answer type and resolves the entities the query mentions.
 */
public class UnderstandingStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(UnderstandingStage.class);
    private static final String STAGE_NAME = "understand";

    private final QueryIntentAnalyzer intentAnalyzer;
    private final QueryEntityResolver entityResolver;

    public UnderstandingStage(@NotNull QueryIntentAnalyzer intentAnalyzer,
                              @NotNull QueryEntityResolver entityResolver) {
        this.intentAnalyzer = intentAnalyzer;
        this.entityResolver = entityResolver;
    }

    @Override
    public CompletableFuture<PipelineContext> process(@NotNull PipelineContext context) {
        IntentAnalysis intent = intentAnalyzer.analyze(context.getQueryText());
        context.setIntent(intent);
        return entityResolver.resolve(context.getQueryText(), intent).thenApply(candidates -> {
            context.setCandidates(candidates);
            logger.debug("Intent {} with {} candidate entities", intent.expectedType(), candidates.size());
            return context;
        });
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }
}
