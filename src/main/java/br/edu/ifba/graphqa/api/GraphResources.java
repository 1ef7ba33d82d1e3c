package br.edu.ifba.graphqa.api;

import br.edu.ifba.graphqa.core.Entity;
import br.edu.ifba.graphqa.core.QueryValidationException;
import br.edu.ifba.graphqa.core.Relation;
import br.edu.ifba.graphqa.storage.GraphStorage;
import br.edu.ifba.graphqa.utils.Futures;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.util.List;

@Path("/api/v1/graph")
public class GraphResources {

    private static final Logger LOG = Logger.getLogger(GraphResources.class);

    @Inject
    GraphStorage graphStorage;

    @GET
    @Path("/stats")
    @Produces(MediaType.APPLICATION_JSON)
    public GraphStorage.GraphStats stats() {
        return Futures.await(graphStorage.getStats());
    }

    /**
     * Seeds the store. Entities are written before relations so relations may refer to them.
     */
    @POST
    @Path("/import")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public GraphImportResponse importGraph(@Valid @NotNull(message = "Request body is required")
                                           final GraphImportRequest request) {
        final List<Entity> entities = request.entities() == null ? List.of() : request.entities().stream()
                .map(e -> Entity.builder()
                        .id(e.id())
                        .canonicalName(e.canonicalName())
                        .entityType(e.entityType() == null || e.entityType().isBlank() ? "UNKNOWN" : e.entityType())
                        .confidence(e.confidence() == null ? 1.0 : e.confidence())
                        .build())
                .toList();
        final List<Relation> relations = request.relations() == null ? List.of() : request.relations().stream()
                .map(r -> new Relation(
                        r.sourceId(),
                        r.targetId(),
                        r.type(),
                        r.weight() == null ? Double.NaN : r.weight(),
                        r.confidence() == null ? 1.0 : r.confidence()))
                .toList();

        if (!relations.isEmpty() && relations.stream().anyMatch(r -> !r.getType().matches("[A-Z][A-Z0-9_]*"))) {
            throw new QueryValidationException("Relation types must match [A-Z][A-Z0-9_]*");
        }

        Futures.await(graphStorage.upsertEntities(entities));
        Futures.await(graphStorage.upsertRelations(relations));
        LOG.infof("Imported %d entities and %d relations", entities.size(), relations.size());
        return new GraphImportResponse(entities.size(), relations.size());
    }
}
