package br.edu.ifba.graphqa.query;

import java.time.Duration;

/**
 * Tuning of a multi-hop query.
 *
 * @param perCallLimit paths requested per candidate traversal at depths 1 and 2
 * @param deepPerCallLimit paths requested per candidate traversal at depth 3
 * @param earlyExitFactor deeper depths are skipped once {@code earlyExitFactor * resultLimit} paths are collected
 * @param timeout wall-clock limit of the traversal phase
 * @param maxVisitedNodes node expansions allowed per query across all traversals
 * @param pathWeight share of the raw path score in the final score
 * @param relevanceWeight share of the answer relevance in the final score
 * @param boostFactor multiplier turning raw path score into relevance when the intent is unknown
 * @param maxCandidates cap of resolved query entities
 * @param scanLimit entities scanned by the topical resolution pass
 */
public record QueryOptions(
    int perCallLimit,
    int deepPerCallLimit,
    int earlyExitFactor,
    Duration timeout,
    int maxVisitedNodes,
    double pathWeight,
    double relevanceWeight,
    double boostFactor,
    int maxCandidates,
    int scanLimit
) {
    public QueryOptions {
        if (perCallLimit < 1 || deepPerCallLimit < 1) {
            throw new IllegalArgumentException("per-call limits must be >= 1");
        }
        if (earlyExitFactor < 1) {
            throw new IllegalArgumentException("earlyExitFactor must be >= 1: " + earlyExitFactor);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (maxVisitedNodes < 1) {
            throw new IllegalArgumentException("maxVisitedNodes must be >= 1: " + maxVisitedNodes);
        }
        if (pathWeight < 0.0 || relevanceWeight < 0.0 || pathWeight + relevanceWeight > 1.0 + 1e-9) {
            throw new IllegalArgumentException(
                "score weights must be non-negative and sum to at most 1: " + pathWeight + ", " + relevanceWeight);
        }
        if (maxCandidates < 1 || scanLimit < 0) {
            throw new IllegalArgumentException("maxCandidates must be >= 1 and scanLimit >= 0");
        }
    }

    public static QueryOptions defaults() {
        return new QueryOptions(50, 30, 2, Duration.ofSeconds(5), 10_000, 0.3, 0.7, 2.0, 10, 100);
    }

    public int perCallLimit(int depth) {
        return depth >= 3 ? deepPerCallLimit : perCallLimit;
    }

    public QueryOptions withTimeout(Duration newTimeout) {
        return new QueryOptions(perCallLimit, deepPerCallLimit, earlyExitFactor, newTimeout, maxVisitedNodes,
            pathWeight, relevanceWeight, boostFactor, maxCandidates, scanLimit);
    }

    public QueryOptions withMaxVisitedNodes(int newMaxVisitedNodes) {
        return new QueryOptions(perCallLimit, deepPerCallLimit, earlyExitFactor, timeout, newMaxVisitedNodes,
            pathWeight, relevanceWeight, boostFactor, maxCandidates, scanLimit);
    }
}
