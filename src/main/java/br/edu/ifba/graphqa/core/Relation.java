package br.edu.ifba.graphqa.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Objects;

/**
 * A directed, typed relationship between two entities.
 * Relations are read-only for the query engine.
 */
public final class Relation {

    @JsonProperty("source_id")
    @NotNull
    private final String sourceId;

    @JsonProperty("target_id")
    @NotNull
    private final String targetId;

    @JsonProperty("type")
    @NotNull
    private final String type;

    @JsonProperty("weight")
    private final double weight;

    @JsonProperty("confidence")
    private final double confidence;

    /**
     * Constructs a new Relation.
     *
     * @param sourceId the source entity ID (required)
     * @param targetId the target entity ID (required)
     * @param type relationship type tag, upper-cased on construction (required)
     * @param weight transition weight; stores clamp it to their configured bounds
     * @param confidence extraction confidence in [0,1]
     */
    public Relation(
            @NotNull String sourceId,
            @NotNull String targetId,
            @NotNull String type,
            double weight,
            double confidence) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
        this.targetId = Objects.requireNonNull(targetId, "targetId must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null").trim().toUpperCase(Locale.ROOT);
        this.weight = weight;
        this.confidence = confidence;
    }

    @NotNull
    public String getSourceId() {
        return sourceId;
    }

    @NotNull
    public String getTargetId() {
        return targetId;
    }

    @NotNull
    public String getType() {
        return type;
    }

    public double getWeight() {
        return weight;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * Identity of a relation inside a store: one edge per (source, type, target).
     */
    @NotNull
    public String key() {
        return sourceId + "|" + type + "|" + targetId;
    }

    /**
     * Creates a new Relation with updated weight.
     */
    public Relation withWeight(double newWeight) {
        return new Relation(sourceId, targetId, type, newWeight, confidence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relation relation = (Relation) o;
        return Double.compare(relation.weight, weight) == 0 &&
               Double.compare(relation.confidence, confidence) == 0 &&
               sourceId.equals(relation.sourceId) &&
               targetId.equals(relation.targetId) &&
               type.equals(relation.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, targetId, type, weight, confidence);
    }

    @Override
    public String toString() {
        return "Relation{" +
               "sourceId='" + sourceId + '\'' +
               ", targetId='" + targetId + '\'' +
               ", type='" + type + '\'' +
               ", weight=" + weight +
               ", confidence=" + confidence +
               '}';
    }
}
