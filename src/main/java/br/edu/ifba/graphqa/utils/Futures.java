package br.edu.ifba.graphqa.utils;

import br.edu.ifba.graphqa.query.pipeline.QueryPipeline;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Blocking helpers for the store's asynchronous API, used at the service boundary.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Waits for {@code future} and rethrows its failure unwrapped, so callers and
     * exception mappers see the original exception type.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
    }

    /**
     * Strips {@link CompletionException} and pipeline stage wrappers.
     */
    public static RuntimeException unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof QueryPipeline.PipelineException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof RuntimeException runtime) {
            return runtime;
        }
        return new CompletionException(current);
    }
}
