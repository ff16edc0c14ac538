package io.github.loregraph.index;

import io.github.loregraph.core.SemanticPredicate;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything the index extracted from one note. Edges are derived from descriptors, so replacing
 * a descriptor and re-running the edge passes is enough to bring the graph up to date.
 */
record NoteDescriptor(
        @NotNull String path,
        @NotNull String title,
        long mtime,
        @NotNull Set<String> tags,
        @NotNull Set<String> headings,
        @NotNull Set<String> outgoingTargets,
        @NotNull Set<String> frontmatterTargets,
        @NotNull Set<String> aliases,
        @NotNull List<SemanticRelation> semanticRelations) {

    NoteDescriptor {
        tags = freeze(tags);
        headings = freeze(headings);
        outgoingTargets = freeze(outgoingTargets);
        frontmatterTargets = freeze(frontmatterTargets);
        aliases = freeze(aliases);
        semanticRelations = List.copyOf(semanticRelations);
    }

    /**
     * Normalized semantic relation, confidence as a fraction in [0.1, 1].
     */
    record SemanticRelation(
            @NotNull String targetPath,
            @NotNull SemanticPredicate predicate,
            double confidence,
            @NotNull String sourceField) {
    }

    private static Set<String> freeze(Set<String> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
