package br.edu.ifba.graphqa.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record QueryRequest(
        @JsonProperty("query_text")
        @NotBlank(message = "query_text is required")
        String queryText,

        @JsonProperty("max_hops")
        Integer maxHops,

        @JsonProperty("result_limit")
        Integer resultLimit
) {
}
