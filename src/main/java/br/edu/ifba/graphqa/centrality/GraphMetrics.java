package br.edu.ifba.graphqa.centrality;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structural summary of the graph a centrality run was computed on.
 * Components are weakly connected ones.
 */
public record GraphMetrics(
    @JsonProperty("node_count") int nodeCount,
    @JsonProperty("edge_count") int edgeCount,
    @JsonProperty("density") double density,
    @JsonProperty("connected_components") int connectedComponents,
    @JsonProperty("is_connected") boolean connected,
    @JsonProperty("avg_degree") double avgDegree
) {
}
