package br.edu.ifba.graphqa.exception;

import br.edu.ifba.graphqa.centrality.GraphEmptyException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class GraphEmptyExceptionMapper implements ExceptionMapper<GraphEmptyException> {

    static final int UNPROCESSABLE_ENTITY = 422;

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final GraphEmptyException exception) {
        final ErrorResponse error = new ErrorResponse(
            "urn:graph-qa:problem:" + GraphEmptyException.CODE,
            "Unprocessable Entity",
            UNPROCESSABLE_ENTITY,
            exception.getMessage(),
            uriInfo.getPath()
        );

        return Response.status(UNPROCESSABLE_ENTITY)
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
