package br.edu.ifba.graphqa.query;

import br.edu.ifba.graphqa.core.MultiHopQuery;
import br.edu.ifba.graphqa.intent.QueryIntentAnalyzer;
import br.edu.ifba.graphqa.query.pipeline.PathSearchStage;
import br.edu.ifba.graphqa.query.pipeline.QueryPipeline;
import br.edu.ifba.graphqa.query.pipeline.RankingStage;
import br.edu.ifba.graphqa.query.pipeline.SynthesisStage;
import br.edu.ifba.graphqa.query.pipeline.UnderstandingStage;
import br.edu.ifba.graphqa.resolve.QueryEntityResolver;
import br.edu.ifba.graphqa.resolve.ResolverTaxonomy;
import br.edu.ifba.graphqa.storage.GraphStorage;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Answers free-text questions from the graph.
 *
 * <p>Wires intent analysis, entity resolution, path finding, ranking and answer
 * synthesis into one pipeline over an explicitly supplied store. Every call gets
 * its own {@link QueryBudget}; the engine keeps no state between queries.</p>
 */
public class MultiHopQueryEngine {

    private final QueryOptions options;
    private final QueryPipeline pipeline;

    public MultiHopQueryEngine(@NotNull GraphStorage graphStorage) {
        this(graphStorage, QueryOptions.defaults(), ResolverTaxonomy.defaults());
    }

    public MultiHopQueryEngine(@NotNull GraphStorage graphStorage, @NotNull QueryOptions options,
                               @NotNull ResolverTaxonomy taxonomy) {
        this.options = options;
        QueryIntentAnalyzer intentAnalyzer = new QueryIntentAnalyzer();
        QueryEntityResolver resolver = new QueryEntityResolver(graphStorage, taxonomy,
            options.maxCandidates(), options.scanLimit());
        this.pipeline = QueryPipeline.builder()
            .addStage(new UnderstandingStage(intentAnalyzer, resolver))
            .addStage(new PathSearchStage(new PathFinder(graphStorage, options)))
            .addStage(new RankingStage(new AnswerRanker(graphStorage, intentAnalyzer, options)))
            .addStage(new SynthesisStage(new AnswerSynthesizer()))
            .build();
    }

    public CompletableFuture<MultiHopQueryResult> query(@NotNull MultiHopQuery query) {
        return query(query, new QueryBudget(options.timeout(), options.maxVisitedNodes()));
    }

    /**
     * Runs the query under a caller-owned budget. Cancelling the returned future also
     * cancels the budget, which stops the traversals still in flight.
     */
    public CompletableFuture<MultiHopQueryResult> query(@NotNull MultiHopQuery query, @NotNull QueryBudget budget) {
        CompletableFuture<MultiHopQueryResult> result = pipeline.execute(query, budget);
        result.whenComplete((answer, error) -> {
            if (error instanceof CancellationException) {
                budget.cancel();
            }
        });
        return result;
    }

    public QueryOptions getOptions() {
        return options;
    }
}
