package io.github.loregraph.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Why a document was reached through the entity graph.
 *
 * @param matchedEntities   canonical names of the seed entities that reached the document
 * @param relationTypes     relation types traversed into the document
 * @param hopDepth          minimum hop distance from any seed
 * @param evidenceCount     total evidence attached to contributing edges
 * @param relationPaths     short human-readable paths, at most {@value #MAX_RELATION_PATHS}
 * @param evidenceRefs      deduplicated evidence, at most {@value #MAX_EVIDENCE_REFS}
 * @param scoreContribution accumulated graph score
 */
public record EntityGraphExplanation(
        @NotNull List<String> matchedEntities,
        @NotNull List<RelationType> relationTypes,
        int hopDepth,
        int evidenceCount,
        @NotNull List<String> relationPaths,
        @NotNull List<EvidenceRef> evidenceRefs,
        double scoreContribution) {

    public static final int MAX_RELATION_PATHS = 6;
    public static final int MAX_EVIDENCE_REFS = 16;

    public EntityGraphExplanation {
        matchedEntities = List.copyOf(matchedEntities);
        relationTypes = List.copyOf(relationTypes);
        relationPaths = List.copyOf(relationPaths);
        evidenceRefs = List.copyOf(evidenceRefs);
    }
}
