package br.edu.ifba.graphqa.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A ranked answer derived from one path.
 */
public record AnswerResult(
    @JsonProperty("rank") int rank,
    @JsonProperty("answer_entity") String answerEntity,
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("entity_type") String entityType,
    @JsonProperty("path_rendering") String pathRendering,
    @JsonProperty("hops") int hops,
    @JsonProperty("evidence") String evidence,
    @JsonProperty("path_score") double pathScore,
    @JsonProperty("relevance_score") double relevanceScore,
    @JsonProperty("final_score") double finalScore,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("type_match") boolean typeMatch
) {
    public AnswerResult {
        if (finalScore < 0.0 || finalScore > 1.0) {
            throw new IllegalArgumentException("finalScore must be in [0,1]: " + finalScore);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1]: " + confidence);
        }
    }

    public AnswerResult withRank(int newRank) {
        return new AnswerResult(newRank, answerEntity, entityId, entityType, pathRendering, hops, evidence,
            pathScore, relevanceScore, finalScore, confidence, typeMatch);
    }
}
