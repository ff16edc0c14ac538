package io.github.loregraph.retrieval;

import io.github.loregraph.core.ResolvedEntity;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Outcome of graph augmentation.
 *
 * @param documents         merged documents, highest score first
 * @param entityQueryMode   whether the query resolved to at least one entity
 * @param hasEntityEvidence whether any merged document carries graph evidence
 * @param resolvedEntities  entities resolved from the query
 */
public record AugmentationResult(
        @NotNull List<RetrievalDocument> documents,
        boolean entityQueryMode,
        boolean hasEntityEvidence,
        @NotNull List<ResolvedEntity> resolvedEntities) {

    public AugmentationResult {
        documents = List.copyOf(documents);
        resolvedEntities = List.copyOf(resolvedEntities);
    }

    static AugmentationResult passThrough(List<RetrievalDocument> baseDocuments) {
        return new AugmentationResult(baseDocuments, false, false, List.of());
    }
}
