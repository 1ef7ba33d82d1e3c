package br.edu.ifba.graphqa.storage.impl;

import br.edu.ifba.graphqa.core.Entity;
import br.edu.ifba.graphqa.core.PathEdge;
import br.edu.ifba.graphqa.core.Relation;
import br.edu.ifba.graphqa.storage.EdgeWeightBounds;
import br.edu.ifba.graphqa.storage.GraphSnapshot;
import br.edu.ifba.graphqa.storage.GraphStorage;
import br.edu.ifba.graphqa.storage.PathRecord;
import br.edu.ifba.graphqa.storage.TraversalBudget;
import br.edu.ifba.graphqa.storage.TypeFilter;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory graph storage implementation inspired by NetworkX.
 * Uses adjacency lists for efficient graph operations.
 * Thread-safe with ConcurrentHashMap backing.
 *
 * <p>Centrality scores are kept apart from the entities in an immutable map that is
 * rebuilt and swapped on every score write, so readers always see one complete
 * generation of scores.</p>
 */
public class InMemoryGraphStorage implements GraphStorage {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphStorage.class);

    private static final Comparator<Entity> BY_ID = Comparator.comparing(Entity::getId);

    // Entity storage: entityId -> Entity (without score)
    private final ConcurrentHashMap<String, Entity> entities;

    // Adjacency list for outgoing edges: sourceId -> (relationKey -> Relation)
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Relation>> outgoingEdges;

    // Adjacency list for incoming edges: targetId -> (relationKey -> Relation)
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Relation>> incomingEdges;

    private final Object scoreLock = new Object();

    // Current score generation: entityId -> score
    private volatile Map<String, Double> scores = Map.of();

    private final EdgeWeightBounds weightBounds;

    private volatile boolean initialized = false;

    public InMemoryGraphStorage() {
        this(EdgeWeightBounds.DEFAULT);
    }

    public InMemoryGraphStorage(@NotNull EdgeWeightBounds weightBounds) {
        this.entities = new ConcurrentHashMap<>();
        this.outgoingEdges = new ConcurrentHashMap<>();
        this.incomingEdges = new ConcurrentHashMap<>();
        this.weightBounds = Objects.requireNonNull(weightBounds, "weightBounds must not be null");
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (!initialized) {
                initialized = true;
                logger.info("InMemoryGraphStorage initialized");
            }
        });
    }

    @Override
    public CompletableFuture<Void> upsertEntities(@NotNull List<Entity> entityList) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> {
            for (Entity entity : entityList) {
                entities.put(entity.getId(), entity.withCentralityScore(null));
            }
            logger.debug("Upserted {} entities", entityList.size());
        });
    }

    @Override
    public CompletableFuture<Void> upsertRelations(@NotNull List<Relation> relations) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> {
            for (Relation relation : relations) {
                if (!entities.containsKey(relation.getSourceId()) || !entities.containsKey(relation.getTargetId())) {
                    throw new IllegalArgumentException("Relation endpoints must exist: " + relation.key());
                }
            }
            for (Relation relation : relations) {
                Relation stored = relation.withWeight(weightBounds.clamp(relation.getWeight()));
                outgoingEdges.computeIfAbsent(stored.getSourceId(), k -> new ConcurrentHashMap<>())
                    .put(stored.key(), stored);
                incomingEdges.computeIfAbsent(stored.getTargetId(), k -> new ConcurrentHashMap<>())
                    .put(stored.key(), stored);
            }
            logger.debug("Upserted {} relations", relations.size());
        });
    }

    @Override
    public CompletableFuture<Entity> getEntity(@NotNull String entityId) {
        ensureInitialized();
        Entity entity = entities.get(entityId);
        return CompletableFuture.completedFuture(entity == null ? null : withScore(entity, scores));
    }

    @Override
    public CompletableFuture<List<Entity>> getByExactName(@NotNull String name, @NotNull TypeFilter typeFilter,
                                                          int limit) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Double> current = scores;
            String key = name.toLowerCase(Locale.ROOT);
            return entities.values().stream()
                .filter(e -> e.getCanonicalName().toLowerCase(Locale.ROOT).equals(key))
                .filter(e -> typeFilter.matches(e.getEntityType()))
                .sorted(BY_ID)
                .limit(limit)
                .map(e -> withScore(e, current))
                .toList();
        });
    }

    @Override
    public CompletableFuture<List<Entity>> getBySubstring(@NotNull String name, @NotNull TypeFilter typeFilter,
                                                          double maxLengthRatio, int limit) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Double> current = scores;
            String needle = name.toLowerCase(Locale.ROOT);
            double maxLength = name.length() * maxLengthRatio;
            return entities.values().stream()
                .filter(e -> e.getCanonicalName().toLowerCase(Locale.ROOT).contains(needle))
                .filter(e -> e.getCanonicalName().length() <= maxLength)
                .filter(e -> typeFilter.matches(e.getEntityType()))
                .sorted(Comparator.comparingInt((Entity e) -> e.getCanonicalName().length()).thenComparing(BY_ID))
                .limit(limit)
                .map(e -> withScore(e, current))
                .toList();
        });
    }

    @Override
    public CompletableFuture<List<Entity>> scanEntities(int limit) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Double> current = scores;
            return entities.values().stream()
                .sorted(BY_ID)
                .limit(limit)
                .map(e -> withScore(e, current))
                .toList();
        });
    }

    @Override
    public CompletableFuture<List<Entity>> bulkGetByName(@NotNull Collection<String> names) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            Set<String> wanted = new HashSet<>(names);
            Map<String, Double> current = scores;
            return entities.values().stream()
                .filter(e -> wanted.contains(e.getCanonicalName()))
                .sorted(BY_ID)
                .map(e -> withScore(e, current))
                .toList();
        });
    }

    @Override
    public CompletableFuture<List<PathRecord>> traverse(@NotNull String startId, int hops, int limit,
                                                        @NotNull TraversalBudget budget) {
        ensureInitialized();
        if (hops < 1) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("hops must be >= 1: " + hops));
        }
        return CompletableFuture.supplyAsync(() -> {
            List<PathRecord> results = new ArrayList<>();
            Entity start = entities.get(startId);
            if (start == null || limit <= 0) {
                return results;
            }
            Map<String, Double> current = scores;
            Deque<String> visited = new ArrayDeque<>();
            visited.addLast(startId);
            List<PathEdge> edgeTrail = new ArrayList<>();
            walk(startId, hops, limit, budget, visited, edgeTrail, results, current);
            logger.debug("Traversal from {} at depth {} produced {} paths", startId, hops, results.size());
            return results;
        });
    }

    private void walk(String nodeId, int remaining, int limit, TraversalBudget budget, Deque<String> visited,
                      List<PathEdge> edgeTrail, List<PathRecord> results, Map<String, Double> current) {
        if (remaining == 0) {
            List<Entity> nodes = new ArrayList<>(visited.size());
            for (String id : visited) {
                nodes.add(withScore(entities.get(id), current));
            }
            results.add(new PathRecord(nodes, List.copyOf(edgeTrail)));
            return;
        }
        if (!budget.tryVisit()) {
            return;
        }
        for (Neighbor neighbor : neighbors(nodeId)) {
            if (results.size() >= limit || budget.isCancelled()) {
                return;
            }
            if (visited.contains(neighbor.nodeId()) || !entities.containsKey(neighbor.nodeId())) {
                continue;
            }
            visited.addLast(neighbor.nodeId());
            edgeTrail.add(neighbor.edge());
            walk(neighbor.nodeId(), remaining - 1, limit, budget, visited, edgeTrail, results, current);
            edgeTrail.remove(edgeTrail.size() - 1);
            visited.removeLast();
        }
    }

    private List<Neighbor> neighbors(String nodeId) {
        List<Neighbor> result = new ArrayList<>();
        for (Relation r : outgoingEdges.getOrDefault(nodeId, new ConcurrentHashMap<>()).values()) {
            result.add(new Neighbor(r.getTargetId(), new PathEdge(r.getType(), r.getWeight(), true)));
        }
        for (Relation r : incomingEdges.getOrDefault(nodeId, new ConcurrentHashMap<>()).values()) {
            result.add(new Neighbor(r.getSourceId(), new PathEdge(r.getType(), r.getWeight(), false)));
        }
        result.sort(Comparator.comparing(Neighbor::nodeId)
            .thenComparing(n -> n.edge().type())
            .thenComparing(n -> !n.edge().forward()));
        return result;
    }

    private record Neighbor(String nodeId, PathEdge edge) {
    }

    @Override
    public CompletableFuture<Void> writeScore(@NotNull String entityId, double score) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> {
            if (!entities.containsKey(entityId)) {
                throw new IllegalArgumentException("Entity not found: " + entityId);
            }
            synchronized (scoreLock) {
                Map<String, Double> next = new HashMap<>(scores);
                next.put(entityId, score);
                scores = Map.copyOf(next);
            }
        });
    }

    @Override
    public CompletableFuture<Integer> clearScores(@NotNull TypeFilter typeFilter) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            synchronized (scoreLock) {
                Map<String, Double> next = new HashMap<>(scores);
                int before = next.size();
                next.keySet().removeIf(id -> inSubset(id, typeFilter));
                scores = Map.copyOf(next);
                int cleared = before - next.size();
                logger.debug("Cleared {} centrality scores for {}", cleared, typeFilter);
                return cleared;
            }
        });
    }

    @Override
    public CompletableFuture<Void> replaceScores(@NotNull TypeFilter typeFilter, @NotNull Map<String, Double> newScores) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> {
            synchronized (scoreLock) {
                Map<String, Double> next = new HashMap<>(scores);
                next.keySet().removeIf(id -> inSubset(id, typeFilter));
                newScores.forEach((id, score) -> {
                    if (entities.containsKey(id)) {
                        next.put(id, score);
                    }
                });
                scores = Map.copyOf(next);
            }
            logger.debug("Replaced centrality scores for {}: {} written", typeFilter, newScores.size());
        });
    }

    private boolean inSubset(String entityId, TypeFilter typeFilter) {
        Entity entity = entities.get(entityId);
        return entity == null || typeFilter.matches(entity.getEntityType());
    }

    @Override
    public CompletableFuture<List<Entity>> topByCentrality(int limit, @NotNull TypeFilter typeFilter) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Double> current = scores;
            return current.keySet().stream()
                .map(entities::get)
                .filter(Objects::nonNull)
                .filter(e -> typeFilter.matches(e.getEntityType()))
                .map(e -> withScore(e, current))
                .sorted(Comparator.comparingDouble(Entity::centralityOrZero).reversed().thenComparing(BY_ID))
                .limit(limit)
                .toList();
        });
    }

    @Override
    public CompletableFuture<GraphSnapshot> loadSnapshot(@NotNull TypeFilter typeFilter) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            List<String> nodeIds = entities.values().stream()
                .filter(e -> typeFilter.matches(e.getEntityType()))
                .map(Entity::getId)
                .sorted()
                .toList();
            Set<String> members = new HashSet<>(nodeIds);
            List<Relation> relations = new ArrayList<>();
            for (String id : nodeIds) {
                for (Relation r : outgoingEdges.getOrDefault(id, new ConcurrentHashMap<>()).values()) {
                    if (members.contains(r.getTargetId())) {
                        relations.add(r);
                    }
                }
            }
            relations.sort(Comparator.comparing(Relation::key));
            return new GraphSnapshot(nodeIds, relations);
        });
    }

    @Override
    public CompletableFuture<GraphStats> getStats() {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            long relationCount = outgoingEdges.values().stream().mapToLong(Map::size).sum();
            return new GraphStats(entities.size(), relationCount, scores.size());
        });
    }

    private static Entity withScore(Entity entity, Map<String, Double> current) {
        return entity.withCentralityScore(current.get(entity.getId()));
    }

    @Override
    public void close() {
        entities.clear();
        outgoingEdges.clear();
        incomingEdges.clear();
        scores = Map.of();
        initialized = false;
        logger.info("InMemoryGraphStorage closed");
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Storage not initialized. Call initialize() first.");
        }
    }
}
