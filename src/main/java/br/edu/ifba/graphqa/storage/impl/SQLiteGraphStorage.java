package br.edu.ifba.graphqa.storage.impl;

import br.edu.ifba.graphqa.core.Entity;
import br.edu.ifba.graphqa.core.PathEdge;
import br.edu.ifba.graphqa.core.Relation;
import br.edu.ifba.graphqa.storage.EdgeWeightBounds;
import br.edu.ifba.graphqa.storage.GraphSnapshot;
import br.edu.ifba.graphqa.storage.GraphStorage;
import br.edu.ifba.graphqa.storage.GraphStoreException;
import br.edu.ifba.graphqa.storage.PathRecord;
import br.edu.ifba.graphqa.storage.TraversalBudget;
import br.edu.ifba.graphqa.storage.TypeFilter;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * SQLite-based implementation of GraphStorage.
 *
 * <p>Uses relational tables (graph_entities, graph_relations, centrality_scores).
 * Type filters are rendered as {@code IN (?, ?, ...)} placeholder lists and bound
 * as parameters.</p>
 *
 * <p>Features:</p>
 * <ul>
 *   <li>Case-insensitive exact and bounded substring name lookup</li>
 *   <li>Depth-first simple-path enumeration with a shared node budget</li>
 *   <li>Transactional score replacement, observed atomically by WAL readers</li>
 *   <li>Batch upserts for ingestion</li>
 * </ul>
 */
public final class SQLiteGraphStorage implements GraphStorage {

    private static final Logger LOG = Logger.getLogger(SQLiteGraphStorage.class);

    private static final String ENTITY_COLUMNS = """
        SELECT e.id, e.canonical_name, e.entity_type, e.confidence, c.score
        FROM graph_entities e
        LEFT JOIN centrality_scores c ON c.entity_id = e.id
        """;

    private final SQLiteConnectionManager connectionManager;
    private final EdgeWeightBounds weightBounds;

    /**
     * Creates a new SQLiteGraphStorage.
     *
     * @param connectionManager the SQLite connection manager
     * @param weightBounds bounds relation weights are clamped to on upsert
     */
    public SQLiteGraphStorage(SQLiteConnectionManager connectionManager, EdgeWeightBounds weightBounds) {
        this.connectionManager = connectionManager;
        this.weightBounds = weightBounds;
    }

    public SQLiteGraphStorage(SQLiteConnectionManager connectionManager) {
        this(connectionManager, EdgeWeightBounds.DEFAULT);
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            // Opens a connection eagerly so an unreachable database fails at startup.
            Connection conn = connectionManager.getReadConnection();
            connectionManager.releaseReadConnection(conn);
            LOG.infof("Initialized SQLiteGraphStorage at %s", connectionManager.getDatabasePath());
        });
    }

    // ========== Ingestion ==========

    @Override
    public CompletableFuture<Void> upsertEntities(@NotNull List<Entity> entities) {
        return CompletableFuture.runAsync(() -> {
            String sql = """
                INSERT INTO graph_entities (id, canonical_name, name_lower, entity_type, confidence)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT(id) DO UPDATE SET
                    canonical_name = excluded.canonical_name,
                    name_lower = excluded.name_lower,
                    entity_type = excluded.entity_type,
                    confidence = excluded.confidence
                """;
            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    for (Entity entity : entities) {
                        stmt.setString(1, entity.getId());
                        stmt.setString(2, entity.getCanonicalName());
                        stmt.setString(3, entity.getCanonicalName().toLowerCase(Locale.ROOT));
                        stmt.setString(4, entity.getEntityType());
                        stmt.setDouble(5, entity.getConfidence());
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                conn.commit();
                LOG.debugf("Upserted %d entities", entities.size());
            } catch (SQLException e) {
                rollback(conn);
                throw new GraphStoreException("Failed to upsert entities", e);
            } finally {
                resetAutoCommit(conn);
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Void> upsertRelations(@NotNull List<Relation> relations) {
        return CompletableFuture.runAsync(() -> {
            String sql = """
                INSERT INTO graph_relations (source_id, target_id, type, weight, confidence)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT(source_id, type, target_id) DO UPDATE SET
                    weight = excluded.weight,
                    confidence = excluded.confidence
                """;
            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                Set<String> endpointIds = new LinkedHashSet<>();
                for (Relation relation : relations) {
                    endpointIds.add(relation.getSourceId());
                    endpointIds.add(relation.getTargetId());
                }
                Set<String> existing = existingIds(conn, endpointIds);
                for (Relation relation : relations) {
                    if (!existing.contains(relation.getSourceId()) || !existing.contains(relation.getTargetId())) {
                        throw new IllegalArgumentException("Relation endpoints must exist: " + relation.key());
                    }
                }
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    for (Relation relation : relations) {
                        stmt.setString(1, relation.getSourceId());
                        stmt.setString(2, relation.getTargetId());
                        stmt.setString(3, relation.getType());
                        stmt.setDouble(4, weightBounds.clamp(relation.getWeight()));
                        stmt.setDouble(5, relation.getConfidence());
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                conn.commit();
                LOG.debugf("Upserted %d relations", relations.size());
            } catch (SQLException e) {
                rollback(conn);
                throw new GraphStoreException("Failed to upsert relations", e);
            } catch (RuntimeException e) {
                rollback(conn);
                throw e;
            } finally {
                resetAutoCommit(conn);
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    private Set<String> existingIds(Connection conn, Set<String> ids) throws SQLException {
        Set<String> found = new LinkedHashSet<>();
        if (ids.isEmpty()) {
            return found;
        }
        String sql = "SELECT id FROM graph_entities WHERE id IN (" + placeholders(ids.size()) + ")";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            int idx = 1;
            for (String id : ids) {
                stmt.setString(idx++, id);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    found.add(rs.getString(1));
                }
            }
        }
        return found;
    }

    // ========== Entity Lookup ==========

    @Override
    public CompletableFuture<Entity> getEntity(@NotNull String entityId) {
        return CompletableFuture.supplyAsync(() -> {
            List<Entity> found = queryEntities(ENTITY_COLUMNS + "WHERE e.id = ?", List.of(entityId),
                "get entity " + entityId);
            return found.isEmpty() ? null : found.get(0);
        });
    }

    @Override
    public CompletableFuture<List<Entity>> getByExactName(@NotNull String name, @NotNull TypeFilter typeFilter,
                                                          int limit) {
        return CompletableFuture.supplyAsync(() -> {
            List<Object> params = new ArrayList<>();
            params.add(name.toLowerCase(Locale.ROOT));
            String sql = ENTITY_COLUMNS + "WHERE e.name_lower = ?" + typeClause(typeFilter, params)
                + " ORDER BY e.id LIMIT ?";
            params.add(limit);
            return queryEntities(sql, params, "find entities named '" + name + "'");
        });
    }

    @Override
    public CompletableFuture<List<Entity>> getBySubstring(@NotNull String name, @NotNull TypeFilter typeFilter,
                                                          double maxLengthRatio, int limit) {
        return CompletableFuture.supplyAsync(() -> {
            List<Object> params = new ArrayList<>();
            params.add(name.toLowerCase(Locale.ROOT));
            params.add(name.length() * maxLengthRatio);
            String sql = ENTITY_COLUMNS
                + "WHERE instr(e.name_lower, ?) > 0 AND length(e.canonical_name) <= ?"
                + typeClause(typeFilter, params)
                + " ORDER BY length(e.canonical_name), e.id LIMIT ?";
            params.add(limit);
            return queryEntities(sql, params, "find entities containing '" + name + "'");
        });
    }

    @Override
    public CompletableFuture<List<Entity>> scanEntities(int limit) {
        return CompletableFuture.supplyAsync(() ->
            queryEntities(ENTITY_COLUMNS + "ORDER BY e.id LIMIT ?", List.of(limit), "scan entities"));
    }

    @Override
    public CompletableFuture<List<Entity>> bulkGetByName(@NotNull Collection<String> names) {
        if (names.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture.supplyAsync(() -> {
            List<Object> params = new ArrayList<>(new LinkedHashSet<>(names));
            String sql = ENTITY_COLUMNS + "WHERE e.canonical_name IN (" + placeholders(params.size())
                + ") ORDER BY e.id";
            return queryEntities(sql, params, "bulk fetch " + params.size() + " names");
        });
    }

    // ========== Traversal ==========

    @Override
    public CompletableFuture<List<PathRecord>> traverse(@NotNull String startId, int hops, int limit,
                                                        @NotNull TraversalBudget budget) {
        if (hops < 1) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("hops must be >= 1: " + hops));
        }
        return CompletableFuture.supplyAsync(() -> {
            String neighborSql = """
                SELECT target_id AS neighbor_id, type, weight, 1 AS forward
                FROM graph_relations WHERE source_id = ?
                UNION ALL
                SELECT source_id AS neighbor_id, type, weight, 0 AS forward
                FROM graph_relations WHERE target_id = ?
                ORDER BY neighbor_id, type, forward DESC
                """;
            List<List<String>> nodePaths = new ArrayList<>();
            List<List<PathEdge>> edgePaths = new ArrayList<>();

            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement neighbors = conn.prepareStatement(neighborSql)) {
                if (!entityExists(conn, startId) || limit <= 0) {
                    return List.<PathRecord>of();
                }
                Deque<String> visited = new ArrayDeque<>();
                visited.addLast(startId);
                walk(neighbors, startId, hops, limit, budget, visited, new ArrayList<>(), nodePaths, edgePaths);

                Set<String> allIds = new LinkedHashSet<>();
                nodePaths.forEach(allIds::addAll);
                Map<String, Entity> byId = loadEntities(conn, allIds);

                List<PathRecord> records = new ArrayList<>(nodePaths.size());
                for (int i = 0; i < nodePaths.size(); i++) {
                    List<Entity> nodes = new ArrayList<>();
                    for (String id : nodePaths.get(i)) {
                        // A node deleted between the walk and the lookup yields a null entry.
                        nodes.add(byId.get(id));
                    }
                    records.add(new PathRecord(nodes, edgePaths.get(i)));
                }
                LOG.debugf("Traversal from %s at depth %d produced %d paths", startId, hops, records.size());
                return records;
            } catch (SQLException e) {
                throw new GraphStoreException("Failed to traverse from " + startId, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    private void walk(PreparedStatement neighbors, String nodeId, int remaining, int limit, TraversalBudget budget,
                      Deque<String> visited, List<PathEdge> edgeTrail,
                      List<List<String>> nodePaths, List<List<PathEdge>> edgePaths) throws SQLException {
        if (remaining == 0) {
            nodePaths.add(List.copyOf(visited));
            edgePaths.add(List.copyOf(edgeTrail));
            return;
        }
        if (!budget.tryVisit()) {
            return;
        }
        List<String> neighborIds = new ArrayList<>();
        List<PathEdge> edges = new ArrayList<>();
        neighbors.setString(1, nodeId);
        neighbors.setString(2, nodeId);
        try (ResultSet rs = neighbors.executeQuery()) {
            while (rs.next()) {
                neighborIds.add(rs.getString("neighbor_id"));
                edges.add(new PathEdge(rs.getString("type"), rs.getDouble("weight"), rs.getInt("forward") == 1));
            }
        }
        for (int i = 0; i < neighborIds.size(); i++) {
            if (nodePaths.size() >= limit || budget.isCancelled()) {
                return;
            }
            String next = neighborIds.get(i);
            if (visited.contains(next)) {
                continue;
            }
            visited.addLast(next);
            edgeTrail.add(edges.get(i));
            walk(neighbors, next, remaining - 1, limit, budget, visited, edgeTrail, nodePaths, edgePaths);
            edgeTrail.remove(edgeTrail.size() - 1);
            visited.removeLast();
        }
    }

    private boolean entityExists(Connection conn, String id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM graph_entities WHERE id = ?")) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    private Map<String, Entity> loadEntities(Connection conn, Set<String> ids) throws SQLException {
        Map<String, Entity> result = new HashMap<>();
        if (ids.isEmpty()) {
            return result;
        }
        String sql = ENTITY_COLUMNS + "WHERE e.id IN (" + placeholders(ids.size()) + ")";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, new ArrayList<>(ids));
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    Entity entity = mapEntity(rs);
                    result.put(entity.getId(), entity);
                }
            }
        }
        return result;
    }

    // ========== Centrality Scores ==========

    @Override
    public CompletableFuture<Void> writeScore(@NotNull String entityId, double score) {
        return CompletableFuture.runAsync(() -> {
            String sql = """
                INSERT INTO centrality_scores (entity_id, score, updated_at) VALUES (?, ?, datetime('now'))
                ON CONFLICT(entity_id) DO UPDATE SET score = excluded.score, updated_at = excluded.updated_at
                """;
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, entityId);
                stmt.setDouble(2, score);
                stmt.executeUpdate();
            } catch (SQLException e) {
                throw new GraphStoreException("Failed to write score for " + entityId, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Integer> clearScores(@NotNull TypeFilter typeFilter) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try {
                int cleared = deleteScores(conn, typeFilter);
                LOG.debugf("Cleared %d centrality scores for %s", cleared, typeFilter);
                return cleared;
            } catch (SQLException e) {
                throw new GraphStoreException("Failed to clear scores for " + typeFilter, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Void> replaceScores(@NotNull TypeFilter typeFilter, @NotNull Map<String, Double> scores) {
        return CompletableFuture.runAsync(() -> {
            String insertSql = """
                INSERT OR REPLACE INTO centrality_scores (entity_id, score, updated_at)
                SELECT id, ?, datetime('now') FROM graph_entities WHERE id = ?
                """;
            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                int cleared = deleteScores(conn, typeFilter);
                try (PreparedStatement stmt = conn.prepareStatement(insertSql)) {
                    for (Map.Entry<String, Double> entry : scores.entrySet()) {
                        stmt.setDouble(1, entry.getValue());
                        stmt.setString(2, entry.getKey());
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                conn.commit();
                LOG.infof("Replaced centrality scores for %s: cleared %d, wrote %d",
                    typeFilter, cleared, scores.size());
            } catch (SQLException e) {
                rollback(conn);
                throw new GraphStoreException("Failed to replace scores for " + typeFilter, e);
            } finally {
                resetAutoCommit(conn);
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    private int deleteScores(Connection conn, TypeFilter typeFilter) throws SQLException {
        if (typeFilter.isEmpty()) {
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM centrality_scores")) {
                return stmt.executeUpdate();
            }
        }
        String sql = "DELETE FROM centrality_scores WHERE entity_id IN "
            + "(SELECT id FROM graph_entities WHERE entity_type IN (" + placeholders(typeFilter.tags().size()) + "))";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, new ArrayList<>(typeFilter.tags()));
            return stmt.executeUpdate();
        }
    }

    @Override
    public CompletableFuture<List<Entity>> topByCentrality(int limit, @NotNull TypeFilter typeFilter) {
        return CompletableFuture.supplyAsync(() -> {
            List<Object> params = new ArrayList<>();
            String sql = ENTITY_COLUMNS + "WHERE c.score IS NOT NULL" + typeClause(typeFilter, params)
                + " ORDER BY c.score DESC, e.id LIMIT ?";
            params.add(limit);
            return queryEntities(sql, params, "list top entities by centrality");
        });
    }

    // ========== Snapshot & Statistics ==========

    @Override
    public CompletableFuture<GraphSnapshot> loadSnapshot(@NotNull TypeFilter typeFilter) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try {
                // One read transaction, so nodes and relations come from the same snapshot.
                conn.setAutoCommit(false);
                List<Object> params = new ArrayList<>();
                String nodeSql = "SELECT e.id FROM graph_entities e WHERE 1 = 1" + typeClause(typeFilter, params)
                    + " ORDER BY e.id";
                List<String> nodeIds = new ArrayList<>();
                try (PreparedStatement stmt = conn.prepareStatement(nodeSql)) {
                    bind(stmt, params);
                    try (ResultSet rs = stmt.executeQuery()) {
                        while (rs.next()) {
                            nodeIds.add(rs.getString(1));
                        }
                    }
                }

                List<Object> relParams = new ArrayList<>();
                String relSql = """
                    SELECT r.source_id, r.target_id, r.type, r.weight, r.confidence
                    FROM graph_relations r
                    JOIN graph_entities s ON s.id = r.source_id
                    JOIN graph_entities t ON t.id = r.target_id
                    WHERE 1 = 1""";
                if (!typeFilter.isEmpty()) {
                    relSql += " AND s.entity_type IN (" + placeholders(typeFilter.tags().size()) + ")"
                        + " AND t.entity_type IN (" + placeholders(typeFilter.tags().size()) + ")";
                    relParams.addAll(typeFilter.tags());
                    relParams.addAll(typeFilter.tags());
                }
                relSql += " ORDER BY r.source_id, r.type, r.target_id";
                List<Relation> relations = new ArrayList<>();
                try (PreparedStatement stmt = conn.prepareStatement(relSql)) {
                    bind(stmt, relParams);
                    try (ResultSet rs = stmt.executeQuery()) {
                        while (rs.next()) {
                            relations.add(new Relation(rs.getString(1), rs.getString(2), rs.getString(3),
                                rs.getDouble(4), rs.getDouble(5)));
                        }
                    }
                }
                conn.commit();
                return new GraphSnapshot(nodeIds, relations);
            } catch (SQLException e) {
                rollback(conn);
                throw new GraphStoreException("Failed to load graph snapshot for " + typeFilter, e);
            } finally {
                resetAutoCommit(conn);
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<GraphStats> getStats() {
        return CompletableFuture.supplyAsync(() -> {
            String sql = """
                SELECT (SELECT COUNT(*) FROM graph_entities),
                       (SELECT COUNT(*) FROM graph_relations),
                       (SELECT COUNT(*) FROM centrality_scores)
                """;
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql);
                 ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return new GraphStats(rs.getLong(1), rs.getLong(2), rs.getLong(3));
            } catch (SQLException e) {
                throw new GraphStoreException("Failed to read graph stats", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    // ========== Helpers ==========

    private List<Entity> queryEntities(String sql, List<?> params, String action) {
        Connection conn = connectionManager.getReadConnection();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            List<Entity> result = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(mapEntity(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to " + action, e);
        } finally {
            connectionManager.releaseReadConnection(conn);
        }
    }

    private static String typeClause(TypeFilter typeFilter, List<Object> params) {
        if (typeFilter.isEmpty()) {
            return "";
        }
        params.addAll(typeFilter.tags());
        return " AND e.entity_type IN (" + placeholders(typeFilter.tags().size()) + ")";
    }

    private static String placeholders(int count) {
        return "?,".repeat(count - 1) + "?";
    }

    private static void bind(PreparedStatement stmt, List<?> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object value = params.get(i);
            if (value instanceof String s) {
                stmt.setString(i + 1, s);
            } else if (value instanceof Integer n) {
                stmt.setInt(i + 1, n);
            } else if (value instanceof Double d) {
                stmt.setDouble(i + 1, d);
            } else if (value == null) {
                stmt.setNull(i + 1, Types.NULL);
            } else {
                stmt.setObject(i + 1, value);
            }
        }
    }

    private static Entity mapEntity(ResultSet rs) throws SQLException {
        double score = rs.getDouble(5);
        Double centrality = rs.wasNull() ? null : score;
        return new Entity(rs.getString(1), rs.getString(2), rs.getString(3), rs.getDouble(4), centrality);
    }

    private static void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            LOG.warn("Failed to rollback", rollbackEx);
        }
    }

    private static void resetAutoCommit(Connection conn) {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            LOG.warn("Failed to reset auto-commit", e);
        }
    }

    @Override
    public void close() {
        connectionManager.close();
        LOG.info("SQLiteGraphStorage closed");
    }
}
