package br.edu.ifba.graphqa.centrality;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of a centrality recomputation as returned to callers.
 */
public record CentralityReport(
    @JsonProperty("entity_type") String entityType,
    @JsonProperty("entities_processed") int entitiesProcessed,
    @JsonProperty("scores_stored") int scoresStored,
    @JsonProperty("top_entities") List<RankedEntity> topEntities,
    @JsonProperty("graph_metrics") GraphMetrics graphMetrics,
    @JsonProperty("converged") boolean converged,
    @JsonProperty("iterations") int iterations,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("execution_time_seconds") double executionTimeSeconds
) {

    /**
     * An entity of the reported top list.
     *
     * @param percentile share of scored entities ranked at or below this one, in percent
     */
    public record RankedEntity(
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("canonical_name") String canonicalName,
        @JsonProperty("entity_type") String entityType,
        @JsonProperty("score") double score,
        @JsonProperty("rank") int rank,
        @JsonProperty("percentile") double percentile
    ) {
    }
}
