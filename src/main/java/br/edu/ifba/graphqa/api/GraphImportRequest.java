package br.edu.ifba.graphqa.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Entities and relations produced by the upstream extraction step.
 */
public record GraphImportRequest(
        @JsonProperty("entities")
        List<@Valid EntityPayload> entities,

        @JsonProperty("relations")
        List<@Valid RelationPayload> relations
) {

    public record EntityPayload(
            @JsonProperty("id")
            @NotBlank(message = "entity id is required")
            String id,

            @JsonProperty("canonical_name")
            @NotBlank(message = "canonical_name is required")
            String canonicalName,

            @JsonProperty("entity_type")
            String entityType,

            @JsonProperty("confidence")
            @DecimalMin(value = "0.0", message = "confidence must be in [0,1]")
            @DecimalMax(value = "1.0", message = "confidence must be in [0,1]")
            Double confidence
    ) {
    }

    /**
     * A relation; a missing weight takes the store's default weight.
     */
    public record RelationPayload(
            @JsonProperty("source_id")
            @NotBlank(message = "source_id is required")
            String sourceId,

            @JsonProperty("target_id")
            @NotBlank(message = "target_id is required")
            String targetId,

            @JsonProperty("type")
            @NotBlank(message = "relation type is required")
            String type,

            @JsonProperty("weight")
            Double weight,

            @JsonProperty("confidence")
            @DecimalMin(value = "0.0", message = "confidence must be in [0,1]")
            @DecimalMax(value = "1.0", message = "confidence must be in [0,1]")
            Double confidence
    ) {
    }
}
