package br.edu.ifba.graphqa.storage;

/**
 * Failure reported by a graph store backend.
 */
public class GraphStoreException extends RuntimeException {

    public GraphStoreException(String message) {
        super(message);
    }

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
