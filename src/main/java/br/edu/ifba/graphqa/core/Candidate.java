package br.edu.ifba.graphqa.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * An entity hypothesized to be referenced by the query text.
 * Lives for a single request only.
 *
 * @param entityId id of the matched entity
 * @param canonicalName the matched entity's name
 * @param entityType the matched entity's type tag
 * @param matchedText query substring (or token) that produced the match
 * @param matchQuality match quality in [0,1]
 */
public record Candidate(
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("canonical_name") String canonicalName,
    @JsonProperty("entity_type") String entityType,
    @JsonProperty("matched_text") String matchedText,
    @JsonProperty("match_quality") double matchQuality
) {
    public Candidate {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(canonicalName, "canonicalName must not be null");
        Objects.requireNonNull(entityType, "entityType must not be null");
        Objects.requireNonNull(matchedText, "matchedText must not be null");
        if (matchQuality < 0.0 || matchQuality > 1.0) {
            throw new IllegalArgumentException("matchQuality must be in [0,1]: " + matchQuality);
        }
    }

    public static Candidate of(Entity entity, String matchedText, double matchQuality) {
        return new Candidate(entity.getId(), entity.getCanonicalName(), entity.getEntityType(),
            matchedText, matchQuality);
    }
}
