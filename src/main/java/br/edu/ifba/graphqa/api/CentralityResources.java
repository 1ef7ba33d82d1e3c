package br.edu.ifba.graphqa.api;

import br.edu.ifba.graphqa.centrality.CentralityReport;
import br.edu.ifba.graphqa.centrality.CentralityService;
import br.edu.ifba.graphqa.core.Entity;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

@Path("/api/v1/graph/centrality")
public class CentralityResources {

    @Inject
    CentralityService centralityService;

    /**
     * Recomputes centrality for the whole graph or one entity type and replaces the stored scores.
     */
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public CentralityReport recompute(@Valid final CentralityRequest request) {
        if (request == null) {
            return centralityService.recompute(null, null);
        }
        return centralityService.recompute(request.entityType(), request.topK());
    }

    @GET
    @Path("/top")
    @Produces(MediaType.APPLICATION_JSON)
    public List<Entity> top(
            @QueryParam("limit") @DefaultValue("10")
            @Min(value = 1, message = "limit must be at least 1")
            @Max(value = 1000, message = "limit must be at most 1000") final int limit,
            @QueryParam("entity_type") final String entityType) {
        return centralityService.topEntities(limit, entityType);
    }
}
