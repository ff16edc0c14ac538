package io.github.loregraph.semantic;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * REST resource for reviewing and persisting semantic relations.
 *
 * <h2>Endpoints:</h2>
 * <ul>
 *   <li>{@code GET /semantic-relations/batches} - draft batches from the vault and buffered proposals</li>
 *   <li>{@code POST /semantic-relations/batches/apply} - write an edited batch into front matter</li>
 *   <li>{@code POST /semantic-relations/proposals} - ingest one tool output</li>
 *   <li>{@code GET /semantic-relations/proposals} - buffered proposals</li>
 *   <li>{@code DELETE /semantic-relations/proposals} - clear the buffer</li>
 * </ul>
 */
@Path("/semantic-relations")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SemanticRelationResources {

    private static final Logger LOG = Logger.getLogger(SemanticRelationResources.class);

    private final SemanticRelationBatchService batchService;
    private final SemanticRelationProposalStore proposalStore;
    private final ToolOutputProposalAdapter toolOutputAdapter;

    @Inject
    public SemanticRelationResources(SemanticRelationBatchService batchService,
                                     SemanticRelationProposalStore proposalStore,
                                     ToolOutputProposalAdapter toolOutputAdapter) {
        this.batchService = batchService;
        this.proposalStore = proposalStore;
        this.toolOutputAdapter = toolOutputAdapter;
    }

    @GET
    @Path("/batches")
    public List<SemanticRelationDraftBatch> getBatches(
        @QueryParam("includeVaultDrafts") @DefaultValue("true") boolean includeVaultDrafts,
        @QueryParam("includeToolProposals") @DefaultValue("true") boolean includeToolProposals
    ) {
        List<ProposalSourceAdapter> adapters = new ArrayList<>();
        if (includeToolProposals) {
            adapters.add(toolOutputAdapter);
        }
        List<SemanticRelationDraftBatch> batches =
            batchService.buildDraftBatches(new DraftBatchOptions(includeVaultDrafts, adapters));
        LOG.debugf("Built %d draft batches (vault=%s, toolProposals=%s)",
            (Object) batches.size(), includeVaultDrafts, includeToolProposals);
        return batches;
    }

    /**
     * Applies one edited batch. Row-level problems are reported in the body, never as an HTTP error.
     */
    @POST
    @Path("/batches/apply")
    public ApplyBatchResult applyBatch(@NotNull(message = "rows must not be null") List<SemanticRelationDraftRow> rows) {
        LOG.infof("Applying semantic batch: rows=%d", rows.size());
        ApplyBatchResult result = batchService.applyEditedBatch(rows);
        if (!result.errors().isEmpty()) {
            LOG.warnf("Semantic batch applied with errors: %s", result.errors());
        }
        return result;
    }

    @POST
    @Path("/proposals")
    public IngestResponse ingest(@Valid IngestRequest request) {
        int accepted = proposalStore.ingestFromToolOutput(request.toolName(), unwrap(request.payload()));
        LOG.infof("Ingested tool output: tool=%s, accepted=%d", request.toolName(), accepted);
        return new IngestResponse(accepted, proposalStore.getAllProposals().size());
    }

    @GET
    @Path("/proposals")
    public List<SemanticRelationProposal> getProposals() {
        return proposalStore.getAllProposals();
    }

    @DELETE
    @Path("/proposals")
    public Response clearProposals() {
        proposalStore.clear();
        LOG.info("Cleared buffered semantic relation proposals");
        return Response.noContent().build();
    }

    private static Object unwrap(JsonNode payload) {
        return payload != null && payload.isTextual() ? payload.textValue() : payload;
    }

    /**
     * Tool output to scan. {@code payload} may be structured JSON or a string holding text or JSON.
     */
    public record IngestRequest(
        @NotBlank(message = "toolName must not be blank") String toolName,
        JsonNode payload
    ) {}

    public record IngestResponse(
        int accepted,
        int stored
    ) {}
}
