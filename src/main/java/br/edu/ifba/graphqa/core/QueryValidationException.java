package br.edu.ifba.graphqa.core;

/**
 * Thrown when a query is rejected before execution.
 */
public class QueryValidationException extends RuntimeException {

    public QueryValidationException(String message) {
        super(message);
    }
}
