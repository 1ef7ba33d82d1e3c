package br.edu.ifba.graphqa.query.pipeline;

import br.edu.ifba.graphqa.query.AnswerSynthesizer;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Writes the templated answer sentence.
 */
public class SynthesisStage implements PipelineStage {

    private static final String STAGE_NAME = "synthesize";

    private final AnswerSynthesizer synthesizer;

    public SynthesisStage(@NotNull AnswerSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    @Override
    public CompletableFuture<PipelineContext> process(@NotNull PipelineContext context) {
        context.setAnswer(synthesizer.synthesize(context.getQueryText(), context.getResults()));
        return CompletableFuture.completedFuture(context);
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }

    // Pure templating: still answers from partial results after the deadline.
    @Override
    public boolean isDeadlineBound() {
        return false;
    }
}
