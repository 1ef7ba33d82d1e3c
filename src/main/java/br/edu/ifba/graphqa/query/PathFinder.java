package br.edu.ifba.graphqa.query;

import br.edu.ifba.graphqa.core.Candidate;
import br.edu.ifba.graphqa.core.Entity;
import br.edu.ifba.graphqa.core.GraphPath;
import br.edu.ifba.graphqa.core.PathEdge;
import br.edu.ifba.graphqa.storage.GraphStorage;
import br.edu.ifba.graphqa.storage.PathRecord;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Collects 1 to {@code maxHops} hop paths starting at the query candidates.
 *
 * <p>Depths are explored in increasing order. Within a depth every candidate is
 * traversed concurrently and the results are gathered in candidate order. Deeper
 * depths are skipped once {@code earlyExitFactor * resultLimit} paths were found.</p>
 *
 * <p>A record the store returns in an unexpected shape is logged and skipped, as is
 * a candidate whose traversal fails. When the query deadline passes, pending
 * traversals are cancelled and the paths gathered so far are returned with the
 * truncated flag set.</p>
 */
public class PathFinder {

    private static final Logger logger = LoggerFactory.getLogger(PathFinder.class);

    static final double MISSING_CENTRALITY = 0.01;
    static final double MISSING_WEIGHT = 0.5;

    private static final Pattern RELATION_TYPE = Pattern.compile("[A-Z][A-Z0-9_]*");

    private final GraphStorage graphStorage;
    private final QueryOptions options;

    public PathFinder(@NotNull GraphStorage graphStorage, @NotNull QueryOptions options) {
        this.graphStorage = graphStorage;
        this.options = options;
    }

    /**
     * Finds paths for the given candidates.
     *
     * @param candidates resolved query entities, best first
     * @param maxHops deepest depth explored, 1 to 3
     * @param resultLimit number of answers the caller wants; drives the early exit
     * @param budget budget shared by every traversal of this query
     */
    public CompletableFuture<PathSearchResult> findPaths(@NotNull List<Candidate> candidates, int maxHops,
                                                         int resultLimit, @NotNull QueryBudget budget) {
        if (candidates.isEmpty()) {
            return CompletableFuture.completedFuture(PathSearchResult.empty());
        }
        Accumulator acc = new Accumulator((long) options.earlyExitFactor() * resultLimit);
        return searchDepth(candidates, 1, maxHops, budget, acc);
    }

    private CompletableFuture<PathSearchResult> searchDepth(List<Candidate> candidates, int depth, int maxHops,
                                                            QueryBudget budget, Accumulator acc) {
        if (depth > maxHops || acc.isSaturated()) {
            return CompletableFuture.completedFuture(acc.toResult());
        }
        if (budget.isCancelled() || budget.remainingMillis() == 0) {
            acc.truncated = true;
            return CompletableFuture.completedFuture(acc.toResult());
        }

        int limit = options.perCallLimit(depth);
        List<CompletableFuture<List<PathRecord>>> traversals = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            traversals.add(graphStorage.traverse(candidate.entityId(), depth, limit, budget));
        }
        CompletableFuture<?>[] settled = traversals.stream()
            .map(f -> f.handle((records, error) -> null))
            .toArray(CompletableFuture[]::new);

        return CompletableFuture.allOf(settled)
            .completeOnTimeout(null, budget.remainingMillis(), TimeUnit.MILLISECONDS)
            .thenCompose(ignored -> {
                collect(candidates, traversals, depth, budget, acc);
                if (acc.truncated) {
                    return CompletableFuture.completedFuture(acc.toResult());
                }
                logger.debug("Depth {} done: {} paths collected, {} records explored",
                    depth, acc.paths.size(), acc.records);
                return searchDepth(candidates, depth + 1, maxHops, budget, acc);
            });
    }

    private void collect(List<Candidate> candidates, List<CompletableFuture<List<PathRecord>>> traversals,
                         int depth, QueryBudget budget, Accumulator acc) {
        boolean timedOut = false;
        for (int i = 0; i < traversals.size(); i++) {
            CompletableFuture<List<PathRecord>> traversal = traversals.get(i);
            Candidate candidate = candidates.get(i);
            if (!traversal.isDone()) {
                traversal.cancel(true);
                timedOut = true;
                continue;
            }
            List<PathRecord> records;
            try {
                records = traversal.join();
            } catch (RuntimeException e) {
                logger.warn("Traversal from '{}' at depth {} failed, skipping candidate: {}",
                    candidate.canonicalName(), depth, e.getMessage());
                continue;
            }
            if (records == null) {
                continue;
            }
            for (PathRecord record : records) {
                acc.records++;
                GraphPath path = toPath(record, candidate.entityId(), depth);
                if (path != null) {
                    acc.paths.add(path);
                }
            }
        }
        if (timedOut) {
            budget.cancel();
            logger.warn("Query deadline reached at depth {}; returning {} partial paths", depth, acc.paths.size());
        }
        if (timedOut || budget.isExhausted()) {
            acc.truncated = true;
        }
    }

    /**
     * Validates a raw record and converts it, or returns null when it is malformed.
     */
    @Nullable
    GraphPath toPath(@Nullable PathRecord record, String startId, int depth) {
        String problem = checkShape(record, startId, depth);
        if (problem != null) {
            logger.warn("Skipping malformed path record from {} at depth {}: {}", startId, depth, problem);
            return null;
        }

        List<String> ids = new ArrayList<>(depth + 1);
        List<String> names = new ArrayList<>(depth + 1);
        double score = 1.0;
        for (Entity node : record.nodes()) {
            ids.add(node.getId());
            names.add(node.getCanonicalName());
            Double centrality = node.getCentralityScore();
            score *= centrality != null && Double.isFinite(centrality) && centrality > 0.0
                ? centrality
                : MISSING_CENTRALITY;
        }
        for (PathEdge edge : record.edges()) {
            score *= Double.isFinite(edge.weight()) && edge.weight() > 0.0 ? edge.weight() : MISSING_WEIGHT;
        }

        GraphPath path = new GraphPath(ids, names, record.edges(), Math.min(1.0, score));
        if (!path.hasDistinctNodes()) {
            logger.warn("Skipping path with a repeated node: {}", path.render());
            return null;
        }
        return path;
    }

    @Nullable
    private static String checkShape(@Nullable PathRecord record, String startId, int depth) {
        if (record == null || record.nodes() == null || record.edges() == null) {
            return "missing nodes or edges";
        }
        if (record.edges().size() != depth || record.nodes().size() != depth + 1) {
            return record.nodes().size() + " nodes and " + record.edges().size() + " edges";
        }
        for (Entity node : record.nodes()) {
            if (node == null) {
                return "null node";
            }
            if (node.getId() == null || node.getId().isBlank()
                    || node.getCanonicalName() == null || node.getCanonicalName().isBlank()) {
                return "node without id or name";
            }
        }
        if (!record.nodes().get(0).getId().equals(startId)) {
            return "path does not start at " + startId;
        }
        for (PathEdge edge : record.edges()) {
            if (edge == null) {
                return "null edge";
            }
            if (edge.type() == null || !RELATION_TYPE.matcher(edge.type()).matches()) {
                return "unknown relation type " + edge.type();
            }
        }
        return null;
    }

    private static final class Accumulator {
        private final long earlyExitThreshold;
        private final List<GraphPath> paths = new ArrayList<>();
        private int records;
        private boolean truncated;

        private Accumulator(long earlyExitThreshold) {
            this.earlyExitThreshold = earlyExitThreshold;
        }

        private boolean isSaturated() {
            return paths.size() >= earlyExitThreshold;
        }

        private PathSearchResult toResult() {
            return new PathSearchResult(paths, records, truncated);
        }
    }
}
