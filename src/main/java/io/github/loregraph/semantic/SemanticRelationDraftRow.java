package io.github.loregraph.semantic;

import org.jetbrains.annotations.Nullable;

/**
 * One editable relation row in a draft batch.
 *
 * <p>Fields are loosely typed so that edited rows with a blank path, an unknown predicate or a
 * missing confidence can be reported per row instead of failing deserialization.</p>
 *
 * @param id             stable row id
 * @param notePath       note the relation is written to
 * @param sourceField    provenance recorded with the relation
 * @param predicate      canonical predicate id
 * @param targetPath     related note
 * @param confidence     integer percent, 0 to 100
 * @param proposalSource where the row came from, e.g. {@code vault-frontmatter}
 */
public record SemanticRelationDraftRow(
        String id,
        String notePath,
        String sourceField,
        String predicate,
        String targetPath,
        @Nullable Double confidence,
        @Nullable String proposalSource) {
}
