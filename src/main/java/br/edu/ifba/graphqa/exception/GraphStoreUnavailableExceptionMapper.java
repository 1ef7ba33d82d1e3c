package br.edu.ifba.graphqa.exception;

import br.edu.ifba.graphqa.storage.GraphStoreUnavailableException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class GraphStoreUnavailableExceptionMapper implements ExceptionMapper<GraphStoreUnavailableException> {

    private static final Logger LOG = Logger.getLogger(GraphStoreUnavailableExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final GraphStoreUnavailableException exception) {
        LOG.errorf(exception, "Graph store unavailable: %s", exception.getMessage());

        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            "Service Unavailable",
            Response.Status.SERVICE_UNAVAILABLE.getStatusCode(),
            exception.getMessage(),
            uriInfo.getPath()
        );

        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
