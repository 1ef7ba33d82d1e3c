package br.edu.ifba.graphqa.core;

/**
 * One traversed relation of a path.
 *
 * @param type relation type tag
 * @param weight relation weight
 * @param forward true when the relation was walked from its source to its target
 */
public record PathEdge(String type, double weight, boolean forward) {
}
