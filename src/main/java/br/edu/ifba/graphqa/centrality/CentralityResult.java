package br.edu.ifba.graphqa.centrality;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one PageRank computation.
 *
 * @param scores score of every node in the snapshot; they sum to 1
 * @param metrics graph structure summary
 * @param converged false when the iteration cap was hit first
 * @param iterations iterations actually performed
 */
public record CentralityResult(
    Map<String, Double> scores,
    GraphMetrics metrics,
    boolean converged,
    int iterations
) {
    public CentralityResult {
        scores = Map.copyOf(scores);
    }

    /**
     * Scores at or above {@code minScore}, highest first, ties by entity id.
     */
    public List<Map.Entry<String, Double>> ranked(double minScore) {
        return scores.entrySet().stream()
            .filter(e -> e.getValue() >= minScore)
            .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .toList();
    }
}
