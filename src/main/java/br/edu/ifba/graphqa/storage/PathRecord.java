package br.edu.ifba.graphqa.storage;

import br.edu.ifba.graphqa.core.Entity;
import br.edu.ifba.graphqa.core.PathEdge;

import java.util.List;

/**
 * Raw path as returned by a store traversal.
 *
 * <p>Records are not validated here: a backend may hand back incomplete rows, so
 * either list may hold nulls or have an unexpected length. Callers check the
 * shape before use.</p>
 *
 * @param nodes entities along the path, start node first
 * @param edges relations between consecutive nodes
 */
public record PathRecord(List<Entity> nodes, List<PathEdge> edges) {
}
