package io.github.loregraph.semantic;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Relation proposed by an external source, such as a model's tool call, before review.
 *
 * @param notePath    note the relation belongs to
 * @param predicate   predicate text, canonical id once normalized
 * @param targetPath  related note
 * @param confidence  fraction (up to 1) or percent, {@code null} when unknown
 * @param sourceField provenance recorded with the relation, optional
 */
public record SemanticRelationProposal(
        @NotNull String notePath,
        @NotNull String predicate,
        @NotNull String targetPath,
        @Nullable Double confidence,
        @Nullable String sourceField) {

    @NotNull
    public SemanticRelationProposal withSourceField(@Nullable String newSourceField) {
        return new SemanticRelationProposal(notePath, predicate, targetPath, confidence, newSourceField);
    }

    /**
     * Identity used for deduplication: note, predicate and target.
     */
    @NotNull
    public String identityKey() {
        return notePath + "|" + predicate + "|" + targetPath;
    }

    double confidenceOrZero() {
        return confidence != null ? confidence : 0;
    }
}
