package br.edu.ifba.graphqa.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;

/**
 * An entity node of the knowledge graph.
 *
 * <p>Entities are produced by upstream extraction. The only field this service
 * changes is {@code centralityScore}, which is overwritten by centrality runs and
 * is {@code null} until the first run has scored the entity.</p>
 */
public final class Entity {

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("canonical_name")
    @NotNull
    private final String canonicalName;

    @JsonProperty("entity_type")
    @NotNull
    private final String entityType;

    @JsonProperty("confidence")
    private final double confidence;

    @JsonProperty("centrality_score")
    @Nullable
    private final Double centralityScore;

    /**
     * Constructs a new Entity.
     *
     * @param id unique entity id (required)
     * @param canonicalName normalized display name used for matching (required)
     * @param entityType type tag, upper-cased on construction (required)
     * @param confidence extraction confidence in [0,1]
     * @param centralityScore stored centrality score, or null when never scored
     */
    public Entity(
            @NotNull String id,
            @NotNull String canonicalName,
            @NotNull String entityType,
            double confidence,
            @Nullable Double centralityScore) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.canonicalName = Objects.requireNonNull(canonicalName, "canonicalName must not be null");
        this.entityType = Objects.requireNonNull(entityType, "entityType must not be null")
            .trim().toUpperCase(Locale.ROOT);
        this.confidence = confidence;
        this.centralityScore = centralityScore;
    }

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public String getCanonicalName() {
        return canonicalName;
    }

    @NotNull
    public String getEntityType() {
        return entityType;
    }

    public double getConfidence() {
        return confidence;
    }

    @Nullable
    public Double getCentralityScore() {
        return centralityScore;
    }

    /**
     * Centrality score with absent scores read as 0.
     */
    public double centralityOrZero() {
        return centralityScore != null ? centralityScore : 0.0;
    }

    /**
     * Creates a new Entity carrying the given centrality score.
     */
    public Entity withCentralityScore(@Nullable Double newScore) {
        return new Entity(id, canonicalName, entityType, confidence, newScore);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Double.compare(entity.confidence, confidence) == 0 &&
               id.equals(entity.id) &&
               canonicalName.equals(entity.canonicalName) &&
               entityType.equals(entity.entityType) &&
               Objects.equals(centralityScore, entity.centralityScore);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, canonicalName, entityType, confidence, centralityScore);
    }

    @Override
    public String toString() {
        return "Entity{" +
               "id='" + id + '\'' +
               ", canonicalName='" + canonicalName + '\'' +
               ", entityType='" + entityType + '\'' +
               ", confidence=" + confidence +
               ", centralityScore=" + centralityScore +
               '}';
    }

    public static final class Builder {
        private String id;
        private String canonicalName;
        private String entityType = "UNKNOWN";
        private double confidence = 1.0;
        private Double centralityScore;

        public Builder id(@NotNull String id) {
            this.id = id;
            return this;
        }

        public Builder canonicalName(@NotNull String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        public Builder entityType(@NotNull String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder centralityScore(@Nullable Double centralityScore) {
            this.centralityScore = centralityScore;
            return this;
        }

        public Entity build() {
            return new Entity(id, canonicalName, entityType, confidence, centralityScore);
        }
    }
}
