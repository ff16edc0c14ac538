package io.github.loregraph.index;

import io.github.loregraph.core.EntityEdge;
import io.github.loregraph.core.EntityGraphExpansionHit;
import io.github.loregraph.core.EntityGraphSettings;
import io.github.loregraph.core.EntityNode;
import io.github.loregraph.core.ResolvedEntity;
import io.github.loregraph.exception.ErrorResponse;
import io.github.loregraph.settings.SettingsProvider;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * REST resource over the entity graph index.
 *
 * <h2>Endpoints:</h2>
 * <ul>
 *   <li>{@code GET /entity-graph/entities?q=} - resolve entities named in a query</li>
 *   <li>{@code POST /entity-graph/expand} - resolve, then expand to neighboring notes</li>
 *   <li>{@code GET /entity-graph/nodes?path=} - one node with its outgoing edges</li>
 *   <li>{@code POST /entity-graph/rebuild} - full rebuild</li>
 *   <li>{@code GET /entity-graph/stats} - index size</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * POST /entity-graph/expand
 * Content-Type: application/json
 *
 * { "query": "What happened in Valoria?", "maxHops": 2, "maxExpandedDocs": 12 }
 * }</pre>
 *
 * @see EntityGraphIndexManager
 */
@Path("/entity-graph")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class EntityGraphResources {

    private static final Logger LOG = Logger.getLogger(EntityGraphResources.class);

    private final EntityGraphIndexManager indexManager;
    private final SettingsProvider settingsProvider;

    @Inject
    public EntityGraphResources(EntityGraphIndexManager indexManager, SettingsProvider settingsProvider) {
        this.indexManager = indexManager;
        this.settingsProvider = settingsProvider;
    }

    @GET
    @Path("/entities")
    public CompletionStage<List<ResolvedEntity>> resolveEntities(@QueryParam("q") String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query parameter 'q' must not be blank");
        }
        LOG.debugf("Resolve entities: q=%s", query);
        return indexManager.resolveEntities(query);
    }

    /**
     * Resolves the query and expands from the resolved entities.
     *
     * @return 200 with resolved entities and expansion hits, both empty when nothing resolves
     */
    @POST
    @Path("/expand")
    public CompletionStage<ExpandResponse> expand(@Valid ExpandRequest request) {
        EntityGraphSettings settings = settingsProvider.current();
        int maxHops = positiveOr(request.maxHops(), settings.maxHops());
        int maxExpandedDocs = positiveOr(request.maxExpandedDocs(), settings.maxExpandedDocs());

        LOG.infof("Entity graph expansion: query=%s, maxHops=%d, maxExpandedDocs=%d",
            request.query(), maxHops, maxExpandedDocs);

        return indexManager.resolveEntities(request.query())
            .thenApply(resolved -> new ExpandResponse(
                resolved,
                indexManager.expandFromResolvedEntities(resolved, maxHops, maxExpandedDocs)));
    }

    /**
     * Looks up a node by note path.
     *
     * @return 200 with the node and its outgoing edges, 404 when the path is not indexed
     */
    @GET
    @Path("/nodes")
    public CompletionStage<Response> getNode(@QueryParam("path") String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Query parameter 'path' must not be blank");
        }

        return indexManager.ensureReady().thenApply(ignored -> {
            Optional<EntityNode> node = indexManager.getNode(path);
            if (node.isEmpty()) {
                LOG.warnf("Entity node not found: %s", path);
                return Response.status(Response.Status.NOT_FOUND)
                    .entity(new ErrorResponse("about:blank", "Not Found",
                        Response.Status.NOT_FOUND.getStatusCode(), "Unknown entity: " + path, "/entity-graph/nodes"))
                    .type("application/problem+json")
                    .build();
            }
            return Response.ok(new NodeResponse(node.get(), indexManager.getOutgoingEdges(path))).build();
        });
    }

    @POST
    @Path("/rebuild")
    public CompletionStage<EntityGraphStats> rebuild() {
        LOG.info("Entity graph rebuild requested");
        return indexManager.rebuild().thenApply(ignored -> indexManager.getStats());
    }

    @GET
    @Path("/stats")
    public EntityGraphStats stats() {
        return indexManager.getStats();
    }

    private static int positiveOr(Integer requested, int fallback) {
        return requested != null && requested > 0 ? requested : fallback;
    }

    /**
     * Expansion request. Non-positive or missing bounds use the configured defaults.
     */
    public record ExpandRequest(
        @NotBlank(message = "query must not be blank") String query,
        Integer maxHops,
        Integer maxExpandedDocs
    ) {}

    public record ExpandResponse(
        List<ResolvedEntity> resolvedEntities,
        List<EntityGraphExpansionHit> hits
    ) {}

    public record NodeResponse(
        EntityNode node,
        List<EntityEdge> outgoingEdges
    ) {}
}
