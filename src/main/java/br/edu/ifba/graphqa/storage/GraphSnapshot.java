package br.edu.ifba.graphqa.storage;

import br.edu.ifba.graphqa.core.Relation;

import java.util.List;

/**
 * Point-in-time copy of a (possibly type-filtered) graph used for centrality.
 *
 * @param nodeIds ids of the nodes in the snapshot, sorted
 * @param relations relations whose endpoints are both in the snapshot
 */
public record GraphSnapshot(List<String> nodeIds, List<Relation> relations) {

    public GraphSnapshot {
        nodeIds = List.copyOf(nodeIds);
        relations = List.copyOf(relations);
    }

    public boolean isEmpty() {
        return nodeIds.isEmpty();
    }
}
