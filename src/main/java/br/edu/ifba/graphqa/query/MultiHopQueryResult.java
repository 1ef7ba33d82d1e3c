package br.edu.ifba.graphqa.query;

import br.edu.ifba.graphqa.core.AnswerResult;
import br.edu.ifba.graphqa.core.QueryEntity;
import br.edu.ifba.graphqa.intent.IntentAnalysis;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Response of a multi-hop query.
 *
 * @param answer templated answer sentence
 * @param results ranked answers
 * @param queryEntities entities resolved from the query text
 * @param intent expected answer type and its diagnostics
 * @param pathsFound valid paths collected before ranking
 * @param totalPathsExplored raw path records returned by the store
 * @param executionTimeSeconds wall-clock time of the query
 * @param answerConfidence 0 without results, else min(0.9, 0.3 + 0.1 per result)
 * @param truncated true when the deadline or the node budget cut traversal short
 * @param queryMetadata effective parameters and counters of the execution
 */
public record MultiHopQueryResult(
    @JsonProperty("answer") String answer,
    @JsonProperty("results") List<AnswerResult> results,
    @JsonProperty("query_entities") List<QueryEntity> queryEntities,
    @JsonProperty("intent") IntentAnalysis intent,
    @JsonProperty("paths_found") int pathsFound,
    @JsonProperty("total_paths_explored") int totalPathsExplored,
    @JsonProperty("execution_time_seconds") double executionTimeSeconds,
    @JsonProperty("answer_confidence") double answerConfidence,
    @JsonProperty("truncated") boolean truncated,
    @JsonProperty("query_metadata") Map<String, Object> queryMetadata
) {
    static final double MAX_ANSWER_CONFIDENCE = 0.9;

    public MultiHopQueryResult {
        results = List.copyOf(results);
        queryEntities = List.copyOf(queryEntities);
        queryMetadata = Map.copyOf(queryMetadata);
    }

    public static double answerConfidence(int resultCount) {
        if (resultCount <= 0) {
            return 0.0;
        }
        return Math.min(MAX_ANSWER_CONFIDENCE, 0.3 + 0.1 * resultCount);
    }
}
