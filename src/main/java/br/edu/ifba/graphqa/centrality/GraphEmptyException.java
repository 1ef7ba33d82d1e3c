package br.edu.ifba.graphqa.centrality;

/**
 * Centrality was requested on a graph (or type subset) without nodes.
 */
public class GraphEmptyException extends RuntimeException {

    public static final String CODE = "GRAPH_EMPTY";

    public GraphEmptyException(String message) {
        super(message);
    }

    public String getCode() {
        return CODE;
    }
}
