package io.github.loregraph.core;

import org.jetbrains.annotations.NotNull;

/**
 * Document reached by graph expansion.
 *
 * @param path        target note path
 * @param title       canonical name of the target note
 * @param score       accumulated graph relevance
 * @param explanation evidence payload for the UI and the retrieval merge
 */
public record EntityGraphExpansionHit(
        @NotNull String path,
        @NotNull String title,
        double score,
        @NotNull EntityGraphExplanation explanation) {
}
