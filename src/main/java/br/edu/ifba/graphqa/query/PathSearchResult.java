package br.edu.ifba.graphqa.query;

import br.edu.ifba.graphqa.core.GraphPath;

import java.util.List;

/**
 * Outcome of the traversal phase of one query.
 *
 * @param paths valid paths in discovery order
 * @param recordsExplored raw path records returned by the store, malformed ones included
 * @param truncated true when the deadline, the visit budget or a cancellation cut traversal short
 */
public record PathSearchResult(List<GraphPath> paths, int recordsExplored, boolean truncated) {

    public PathSearchResult {
        paths = List.copyOf(paths);
    }

    public static PathSearchResult empty() {
        return new PathSearchResult(List.of(), 0, false);
    }
}
