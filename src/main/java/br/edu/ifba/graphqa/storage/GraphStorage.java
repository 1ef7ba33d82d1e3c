package br.edu.ifba.graphqa.storage;

import br.edu.ifba.graphqa.core.Entity;
import br.edu.ifba.graphqa.core.Relation;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Graph store contract used by the multi-hop query engine and the centrality job.
 *
 * All reads are safe to issue concurrently. Entity and relation data is written by
 * the upstream extraction collaborator (through the upsert methods); the only data
 * this service writes itself are centrality scores.
 *
 * Implementations: InMemoryGraphStorage, SQLiteGraphStorage
 */
public interface GraphStorage extends AutoCloseable {

    /**
     * Initializes the storage backend.
     * Must be called before any other operations.
     *
     * @throws GraphStoreUnavailableException (through the future) if the backend cannot be opened
     */
    CompletableFuture<Void> initialize();

    // ===== Ingestion =====

    /**
     * Adds or replaces entities by id. Stored centrality scores of existing entities are kept.
     */
    CompletableFuture<Void> upsertEntities(@NotNull List<Entity> entities);

    /**
     * Adds or replaces relations keyed by (source, type, target).
     * Weights are clamped to the store's {@link EdgeWeightBounds}.
     *
     * @throws IllegalArgumentException (through the future) if an endpoint entity does not exist
     */
    CompletableFuture<Void> upsertRelations(@NotNull List<Relation> relations);

    // ===== Entity Lookup =====

    /**
     * Gets an entity by id.
     *
     * @return the entity, or null if not found
     */
    CompletableFuture<Entity> getEntity(@NotNull String entityId);

    /**
     * Finds entities whose canonical name equals {@code name}, ignoring case.
     * Entities sharing a name are all returned, ordered by id.
     *
     * @param name the name to match
     * @param typeFilter restricts the entity types considered
     * @param limit maximum number of entities
     */
    CompletableFuture<List<Entity>> getByExactName(@NotNull String name, @NotNull TypeFilter typeFilter, int limit);

    /**
     * Finds entities whose canonical name contains {@code name}, ignoring case, and
     * whose name length is at most {@code maxLengthRatio} times the length of {@code name}.
     * Shorter names come first, then ids.
     */
    CompletableFuture<List<Entity>> getBySubstring(@NotNull String name, @NotNull TypeFilter typeFilter,
                                                   double maxLengthRatio, int limit);

    /**
     * Returns up to {@code limit} entities ordered by id.
     */
    CompletableFuture<List<Entity>> scanEntities(int limit);

    /**
     * Fetches all entities whose canonical name is one of {@code names} in a single round trip.
     */
    CompletableFuture<List<Entity>> bulkGetByName(@NotNull Collection<String> names);

    // ===== Traversal =====

    /**
     * Enumerates simple paths of exactly {@code hops} relations starting at {@code startId}.
     *
     * Relations are walked in both directions; each edge records whether it was walked
     * forward. No node appears twice on a path, the start node included. Enumeration
     * order is deterministic and stops after {@code limit} paths or when the budget
     * refuses a visit.
     *
     * @param startId entity to start from
     * @param hops path length, 1 to 3
     * @param limit maximum number of paths
     * @param budget node-visit budget shared by the traversals of one query
     * @return raw path records
     */
    CompletableFuture<List<PathRecord>> traverse(@NotNull String startId, int hops, int limit,
                                                 @NotNull TraversalBudget budget);

    // ===== Centrality Scores =====

    /**
     * Sets the centrality score of one entity.
     */
    CompletableFuture<Void> writeScore(@NotNull String entityId, double score);

    /**
     * Removes the stored scores of every entity matched by the filter.
     *
     * @return number of entities whose score was cleared
     */
    CompletableFuture<Integer> clearScores(@NotNull TypeFilter typeFilter);

    /**
     * Clears the scores of the filtered subset and writes {@code scores} as one atomic
     * step. Readers observe either the previous scores or the new ones, never a mix.
     */
    CompletableFuture<Void> replaceScores(@NotNull TypeFilter typeFilter, @NotNull Map<String, Double> scores);

    /**
     * Entities with a stored score, highest first, ties by id.
     */
    CompletableFuture<List<Entity>> topByCentrality(int limit, @NotNull TypeFilter typeFilter);

    // ===== Snapshot & Statistics =====

    /**
     * Copies the nodes matched by the filter and the relations between them.
     */
    CompletableFuture<GraphSnapshot> loadSnapshot(@NotNull TypeFilter typeFilter);

    CompletableFuture<GraphStats> getStats();

    /**
     * Store-wide counters.
     */
    record GraphStats(
        @JsonProperty("entity_count") long entityCount,
        @JsonProperty("relation_count") long relationCount,
        @JsonProperty("scored_entity_count") long scoredEntityCount
    ) {
    }
}
