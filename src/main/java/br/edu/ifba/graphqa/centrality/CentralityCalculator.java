package br.edu.ifba.graphqa.centrality;

import br.edu.ifba.graphqa.core.Relation;
import br.edu.ifba.graphqa.storage.GraphSnapshot;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted PageRank by power iteration.
 *
 * <p>Relation weights are transition weights. Mass of nodes without outgoing
 * weight is spread uniformly over all nodes, as is the teleport mass, so the
 * returned scores always sum to 1. In undirected mode each relation contributes
 * its weight in both directions and parallel relations between the same pair add
 * up.</p>
 *
 * <p>Non-convergence is not an error: the last iterate is returned with
 * {@code converged=false}.</p>
 */
public class CentralityCalculator {

    private static final Logger logger = LoggerFactory.getLogger(CentralityCalculator.class);

    private final CentralityOptions options;

    public CentralityCalculator(@NotNull CentralityOptions options) {
        this.options = options;
    }

    public CentralityOptions getOptions() {
        return options;
    }

    /**
     * Computes PageRank scores and graph metrics for a snapshot.
     *
     * @throws GraphEmptyException if the snapshot has no nodes
     */
    public CentralityResult calculate(@NotNull GraphSnapshot snapshot) {
        if (snapshot.isEmpty()) {
            throw new GraphEmptyException("Graph is empty, cannot calculate centrality");
        }

        List<String> nodeIds = snapshot.nodeIds();
        int n = nodeIds.size();
        Map<String, Integer> index = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++) {
            index.put(nodeIds.get(i), i);
        }

        List<Map<Integer, Double>> transitions = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            transitions.add(new LinkedHashMap<>());
        }
        List<Relation> usable = new ArrayList<>();
        for (Relation relation : snapshot.relations()) {
            Integer s = index.get(relation.getSourceId());
            Integer t = index.get(relation.getTargetId());
            if (s == null || t == null) {
                continue;
            }
            usable.add(relation);
            double w = relation.getWeight();
            transitions.get(s).merge(t, w, Double::sum);
            if (!options.directed() && !s.equals(t)) {
                transitions.get(t).merge(s, w, Double::sum);
            }
        }

        int[][] targets = new int[n][];
        double[][] probabilities = new double[n][];
        boolean[] dangling = new boolean[n];
        for (int i = 0; i < n; i++) {
            Map<Integer, Double> row = transitions.get(i);
            double total = row.values().stream().mapToDouble(Double::doubleValue).sum();
            dangling[i] = total <= 0.0;
            targets[i] = new int[row.size()];
            probabilities[i] = new double[row.size()];
            int k = 0;
            for (Map.Entry<Integer, Double> entry : row.entrySet()) {
                targets[i][k] = entry.getKey();
                probabilities[i][k] = dangling[i] ? 0.0 : entry.getValue() / total;
                k++;
            }
        }

        double alpha = options.dampingFactor();
        double[] x = new double[n];
        Arrays.fill(x, 1.0 / n);
        boolean converged = false;
        int iterations = 0;

        while (iterations < options.maxIterations()) {
            iterations++;
            double[] last = x;
            x = new double[n];

            double danglingMass = 0.0;
            for (int i = 0; i < n; i++) {
                if (dangling[i]) {
                    danglingMass += last[i];
                }
            }
            double base = (alpha * danglingMass + (1.0 - alpha)) / n;

            for (int i = 0; i < n; i++) {
                double share = alpha * last[i];
                for (int k = 0; k < targets[i].length; k++) {
                    x[targets[i][k]] += share * probabilities[i][k];
                }
            }
            double err = 0.0;
            for (int i = 0; i < n; i++) {
                x[i] += base;
                err += Math.abs(x[i] - last[i]);
            }
            if (err < n * options.tolerance()) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            logger.warn("PageRank did not converge after {} iterations on {} nodes", iterations, n);
        } else {
            logger.debug("PageRank converged after {} iterations on {} nodes", iterations, n);
        }

        Map<String, Double> scores = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++) {
            scores.put(nodeIds.get(i), x[i]);
        }
        return new CentralityResult(scores, metrics(n, usable, index), converged, iterations);
    }

    private GraphMetrics metrics(int n, List<Relation> relations, Map<String, Integer> index) {
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
        }
        for (Relation relation : relations) {
            union(parent, index.get(relation.getSourceId()), index.get(relation.getTargetId()));
        }
        int components = 0;
        for (int i = 0; i < n; i++) {
            if (find(parent, i) == i) {
                components++;
            }
        }

        int edges = relations.size();
        double density = 0.0;
        if (n > 1) {
            double possible = (double) n * (n - 1);
            density = options.directed() ? edges / possible : 2.0 * edges / possible;
        }
        double avgDegree = 2.0 * edges / n;
        return new GraphMetrics(n, edges, density, components, components == 1, avgDegree);
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra != rb) {
            parent[Math.max(ra, rb)] = Math.min(ra, rb);
        }
    }
}
