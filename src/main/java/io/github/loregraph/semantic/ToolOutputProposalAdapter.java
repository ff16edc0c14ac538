package io.github.loregraph.semantic;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Surfaces proposals buffered from tool output as draft rows.
 */
@ApplicationScoped
public class ToolOutputProposalAdapter implements ProposalSourceAdapter {

    static final String ID = "tool-output-semantic-relations";
    static final String LABEL = "Tool Output Proposals";

    private final SemanticRelationProposalStore store;

    @Inject
    public ToolOutputProposalAdapter(SemanticRelationProposalStore store) {
        this.store = store;
    }

    @Override
    @NotNull
    public String id() {
        return ID;
    }

    @Override
    @NotNull
    public String label() {
        return LABEL;
    }

    @Override
    @NotNull
    public List<SemanticRelationProposal> getProposals() {
        return store.getAllProposals();
    }
}
