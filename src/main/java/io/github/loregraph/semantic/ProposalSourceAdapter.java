package io.github.loregraph.semantic;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * External source of relation proposals feeding the draft batch editor.
 */
public interface ProposalSourceAdapter {

    /**
     * Stable adapter id, used in row ids and default source fields.
     */
    @NotNull
    String id();

    /**
     * Human-readable name shown as the row's proposal source.
     */
    @NotNull
    default String label() {
        return id();
    }

    @NotNull
    List<SemanticRelationProposal> getProposals() throws Exception;
}
