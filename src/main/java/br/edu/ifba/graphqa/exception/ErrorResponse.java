package br.edu.ifba.graphqa.exception;

/**
 * Problem details body (RFC 7807) returned by the exception mappers.
 */
public record ErrorResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance
) {
}
