package io.github.loregraph.core;

import org.jetbrains.annotations.NotNull;

/**
 * Entity matched from a free-text query.
 *
 * @param entityId      canonical entity id
 * @param canonicalName display name
 * @param matchedAlias  normalized query term that hit the alias index
 * @param score         resolution score, higher is a stronger match
 */
public record ResolvedEntity(
        @NotNull String entityId,
        @NotNull String canonicalName,
        @NotNull String matchedAlias,
        double score) {
}
