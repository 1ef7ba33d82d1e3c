package br.edu.ifba.graphqa.centrality;

/**
 * Tuning of the PageRank power iteration.
 *
 * @param dampingFactor probability of following a relation instead of teleporting
 * @param maxIterations iteration cap
 * @param tolerance per-node convergence tolerance; the run converges when the L1
 *                  change between iterations drops below {@code nodeCount * tolerance}
 * @param minScore scores below this are neither reported nor stored
 * @param topK default number of entities reported
 * @param directed walk relations only from source to target; otherwise both ways
 */
public record CentralityOptions(
    double dampingFactor,
    int maxIterations,
    double tolerance,
    double minScore,
    int topK,
    boolean directed
) {
    public CentralityOptions {
        if (dampingFactor <= 0.0 || dampingFactor >= 1.0) {
            throw new IllegalArgumentException("dampingFactor must be in (0,1): " + dampingFactor);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1: " + maxIterations);
        }
        if (tolerance <= 0.0) {
            throw new IllegalArgumentException("tolerance must be > 0: " + tolerance);
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1: " + topK);
        }
    }

    public static CentralityOptions defaults() {
        return new CentralityOptions(0.85, 100, 1e-6, 1e-4, 20, false);
    }

    public CentralityOptions withMaxIterations(int newMaxIterations) {
        return new CentralityOptions(dampingFactor, newMaxIterations, tolerance, minScore, topK, directed);
    }

    public CentralityOptions withDirected(boolean newDirected) {
        return new CentralityOptions(dampingFactor, maxIterations, tolerance, minScore, topK, newDirected);
    }
}
