package br.edu.ifba.graphqa.api;

import br.edu.ifba.graphqa.query.MultiHopQueryResult;
import br.edu.ifba.graphqa.query.MultiHopQueryService;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/api/v1/graph")
public class QueryResources {

    @Inject
    MultiHopQueryService queryService;

    @POST
    @Path("/query")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public MultiHopQueryResult query(@Valid @NotNull(message = "Request body is required") final QueryRequest request) {
        return queryService.query(request.queryText(), request.maxHops(), request.resultLimit());
    }
}
