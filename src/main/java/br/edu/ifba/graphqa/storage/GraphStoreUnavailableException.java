package br.edu.ifba.graphqa.storage;

/**
 * The configured graph backend cannot be reached or opened.
 * Fatal for the request; never retried.
 */
public class GraphStoreUnavailableException extends GraphStoreException {

    public GraphStoreUnavailableException(String message) {
        super(message);
    }

    public GraphStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
