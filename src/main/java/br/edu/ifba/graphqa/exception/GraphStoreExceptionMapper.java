package br.edu.ifba.graphqa.exception;

import br.edu.ifba.graphqa.storage.GraphStoreException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class GraphStoreExceptionMapper implements ExceptionMapper<GraphStoreException> {

    private static final Logger LOG = Logger.getLogger(GraphStoreExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final GraphStoreException exception) {
        LOG.errorf(exception, "Graph store operation failed: %s", exception.getMessage());

        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            "Internal Server Error",
            Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(),
            "Graph store operation failed",
            uriInfo.getPath()
        );

        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
