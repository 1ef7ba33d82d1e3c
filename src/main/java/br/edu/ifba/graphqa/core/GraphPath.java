package br.edu.ifba.graphqa.core;

import java.util.HashSet;
import java.util.List;

/**
 * A simple path of one to three hops found for a query.
 *
 * <p>The first node is the query candidate the traversal started from, the last
 * node is the answer endpoint. {@code nodeIds} and {@code nodeNames} have one more
 * element than {@code edges}.</p>
 *
 * @param nodeIds entity ids in traversal order
 * @param nodeNames entity names in traversal order
 * @param edges traversed relations
 * @param rawScore product of node centralities and edge weights
 */
public record GraphPath(
    List<String> nodeIds,
    List<String> nodeNames,
    List<PathEdge> edges,
    double rawScore
) {
    public GraphPath {
        nodeIds = List.copyOf(nodeIds);
        nodeNames = List.copyOf(nodeNames);
        edges = List.copyOf(edges);
        if (nodeIds.size() != nodeNames.size() || nodeIds.size() != edges.size() + 1) {
            throw new IllegalArgumentException(
                "Path shape mismatch: " + nodeIds.size() + " ids, " + nodeNames.size() + " names, "
                    + edges.size() + " edges");
        }
    }

    public int hops() {
        return edges.size();
    }

    public String startName() {
        return nodeNames.get(0);
    }

    public String answerId() {
        return nodeIds.get(nodeIds.size() - 1);
    }

    public String answerName() {
        return nodeNames.get(nodeNames.size() - 1);
    }

    public List<String> intermediateNames() {
        return nodeNames.subList(1, nodeNames.size() - 1);
    }

    public List<String> relationTypes() {
        return edges.stream().map(PathEdge::type).toList();
    }

    public boolean hasDistinctNodes() {
        return new HashSet<>(nodeIds).size() == nodeIds.size();
    }

    /**
     * Renders the path with each relation in its stored direction,
     * e.g. {@code Jimmy Carter -[FOUNDED]-> Carter Center}.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(nodeNames.get(0));
        for (int i = 0; i < edges.size(); i++) {
            PathEdge edge = edges.get(i);
            if (edge.forward()) {
                sb.append(" -[").append(edge.type()).append("]-> ");
            } else {
                sb.append(" <-[").append(edge.type()).append("]- ");
            }
            sb.append(nodeNames.get(i + 1));
        }
        return sb.toString();
    }

    public String evidence() {
        List<String> via = intermediateNames();
        if (via.isEmpty()) {
            return "Direct relationship found";
        }
        return "Connected through " + String.join(" and ", via);
    }

    public String hopLabel() {
        return hops() + "-hop";
    }

    @Override
    public String toString() {
        return "GraphPath{" + render() + ", rawScore=" + rawScore + '}';
    }
}
