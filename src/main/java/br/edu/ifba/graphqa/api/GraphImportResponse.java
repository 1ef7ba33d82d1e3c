package br.edu.ifba.graphqa.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GraphImportResponse(
        @JsonProperty("entities_imported") int entitiesImported,
        @JsonProperty("relations_imported") int relationsImported
) {
}
