package br.edu.ifba.graphqa.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Query mention reported back to the caller: the entity name and its type.
 */
public record QueryEntity(
    @JsonProperty("text") String text,
    @JsonProperty("type") String type
) {
    public static QueryEntity of(Candidate candidate) {
        return new QueryEntity(candidate.canonicalName(), candidate.entityType());
    }
}
