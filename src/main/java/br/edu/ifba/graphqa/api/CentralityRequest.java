package br.edu.ifba.graphqa.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record CentralityRequest(
        @JsonProperty("entity_type")
        String entityType,

        @JsonProperty("top_k")
        @Min(value = 1, message = "top_k must be at least 1")
        @Max(value = 1000, message = "top_k must be at most 1000")
        Integer topK
) {
}
