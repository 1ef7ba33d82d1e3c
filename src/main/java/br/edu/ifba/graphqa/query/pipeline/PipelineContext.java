package br.edu.ifba.graphqa.query.pipeline;

import br.edu.ifba.graphqa.core.AnswerResult;
import br.edu.ifba.graphqa.core.Candidate;
import br.edu.ifba.graphqa.core.MultiHopQuery;
import br.edu.ifba.graphqa.intent.IntentAnalysis;
import br.edu.ifba.graphqa.query.PathSearchResult;
import br.edu.ifba.graphqa.query.QueryBudget;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mutable state of one query as it flows through the pipeline.
 *
 * <pre>
 * Query → [Understand] → [FindPaths] → [Rank] → [Synthesize] → Result
 *              ↓              ↓           ↓           ↓
 *      intent, candidates  paths      results      answer
 * </pre>
 */
public final class PipelineContext {

    // === Input data ===

    private final MultiHopQuery query;
    private final QueryBudget budget;
    private final long startNanos;

    // === Set by stages ===

    private IntentAnalysis intent = IntentAnalysis.unknown();
    private List<Candidate> candidates = new ArrayList<>();
    private PathSearchResult pathSearch = PathSearchResult.empty();
    private List<AnswerResult> results = new ArrayList<>();
    private String answer = "";
    private volatile boolean deadlineReached;

    public PipelineContext(@NotNull MultiHopQuery query, @NotNull QueryBudget budget) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.startNanos = System.nanoTime();
    }

    @NotNull
    public MultiHopQuery getQuery() {
        return query;
    }

    @NotNull
    public String getQueryText() {
        return query.getQueryText();
    }

    @NotNull
    public QueryBudget getBudget() {
        return budget;
    }

    public double elapsedSeconds() {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    // === Intent ===

    @NotNull
    public IntentAnalysis getIntent() {
        return intent;
    }

    public void setIntent(@NotNull IntentAnalysis intent) {
        this.intent = intent;
    }

    // === Candidates ===

    @NotNull
    public List<Candidate> getCandidates() {
        return candidates;
    }

    public void setCandidates(@NotNull List<Candidate> candidates) {
        if (deadlineReached) {
            return;
        }
        this.candidates = new ArrayList<>(candidates);
    }

    public boolean hasCandidates() {
        return !candidates.isEmpty();
    }

    // === Paths ===

    @NotNull
    public PathSearchResult getPathSearch() {
        return pathSearch;
    }

    public void setPathSearch(@NotNull PathSearchResult pathSearch) {
        if (deadlineReached) {
            return;
        }
        this.pathSearch = pathSearch;
    }

    public boolean hasPaths() {
        return !pathSearch.paths().isEmpty();
    }

    // === Results ===

    @NotNull
    public List<AnswerResult> getResults() {
        return results;
    }

    public void setResults(@NotNull List<AnswerResult> results) {
        if (deadlineReached) {
            return;
        }
        this.results = new ArrayList<>(results);
    }

    @NotNull
    public String getAnswer() {
        return answer;
    }

    public void setAnswer(@NotNull String answer) {
        this.answer = answer;
    }

    // === Deadline ===

    /**
     * Marks the query as out of time. Store-backed output that arrives afterwards is dropped,
     * so the response is built from what the stages had produced by then.
     */
    public void markDeadlineReached() {
        this.deadlineReached = true;
    }

    public boolean isDeadlineReached() {
        return deadlineReached;
    }

    @Override
    public String toString() {
        String text = query.getQueryText();
        return "PipelineContext{" +
            "query='" + (text.length() > 50 ? text.substring(0, 50) + "..." : text) + '\'' +
            ", maxHops=" + query.getMaxHops() +
            ", candidates=" + candidates.size() +
            ", paths=" + pathSearch.paths().size() +
            ", results=" + results.size() +
            '}';
    }
}
