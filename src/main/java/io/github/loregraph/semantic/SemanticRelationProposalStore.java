package io.github.loregraph.semantic;

import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Session-scoped buffer of relation proposals extracted from tool and model output.
 *
 * <p>Proposals are keyed by note, predicate and target. A proposal replaces a stored one with the
 * same key when its confidence is at least as high. The oldest entries are evicted beyond
 * {@link #MAX_STORED_PROPOSALS}.</p>
 */
@ApplicationScoped
public class SemanticRelationProposalStore {

    private static final Logger logger = LoggerFactory.getLogger(SemanticRelationProposalStore.class);

    static final int MAX_STORED_PROPOSALS = 2000;

    private final Map<String, SemanticRelationProposal> proposals = new LinkedHashMap<>();

    /**
     * Extracts proposals from one tool output and stores them with source field {@code tool:{toolName}}.
     *
     * @return number of proposals accepted
     */
    public int ingestFromToolOutput(@NotNull String toolName, @Nullable Object payload) {
        List<SemanticRelationProposal> extracted = ProposalPayloadExtractor.extract(payload);
        int accepted = ingestProposals(extracted, "tool:" + toolName);
        logger.debug("Ingested tool output from {}: extracted={}, accepted={}", toolName, extracted.size(), accepted);
        return accepted;
    }

    /**
     * Extracts proposals without touching stored state.
     */
    @NotNull
    public List<SemanticRelationProposal> extractProposals(@Nullable Object payload) {
        return ProposalPayloadExtractor.extract(payload);
    }

    /**
     * Normalizes and stores explicit proposals.
     *
     * @param defaultSourceField source field for proposals that carry none
     * @return number of proposals accepted
     */
    public synchronized int ingestProposals(@Nullable List<SemanticRelationProposal> incoming,
                                            @NotNull String defaultSourceField) {
        if (incoming == null || incoming.isEmpty()) {
            return 0;
        }

        Map<String, SemanticRelationProposal> batch = new LinkedHashMap<>();
        for (SemanticRelationProposal proposal : incoming) {
            Optional<SemanticRelationProposal> normalized = ProposalPayloadExtractor.normalize(proposal);
            normalized.map(p -> p.sourceField() != null ? p : p.withSourceField(defaultSourceField))
                    .ifPresent(p -> ProposalPayloadExtractor.mergeByConfidence(batch, p));
        }

        int accepted = 0;
        for (SemanticRelationProposal proposal : batch.values()) {
            if (ProposalPayloadExtractor.mergeByConfidence(proposals, proposal)) {
                accepted++;
            }
        }
        enforceCapacity();
        return accepted;
    }

    @NotNull
    public synchronized List<SemanticRelationProposal> getAllProposals() {
        return new ArrayList<>(proposals.values());
    }

    public synchronized void clear() {
        proposals.clear();
    }

    private void enforceCapacity() {
        int excess = proposals.size() - MAX_STORED_PROPOSALS;
        if (excess <= 0) {
            return;
        }
        Iterator<String> keys = proposals.keySet().iterator();
        while (excess-- > 0 && keys.hasNext()) {
            keys.next();
            keys.remove();
        }
        logger.debug("Evicted oldest proposals, {} remain", proposals.size());
    }
}
