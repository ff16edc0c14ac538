package io.github.loregraph.semantic;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Page of draft rows.
 *
 * @param id        {@code semantic-batch-{n}}, 1-based
 * @param index     0-based batch index
 * @param startRow  1-based index of the first row across all batches
 * @param endRow    1-based index of the last row
 * @param totalRows row count across all batches
 * @param rows      rows of this batch
 */
public record SemanticRelationDraftBatch(
        @NotNull String id,
        int index,
        int startRow,
        int endRow,
        int totalRows,
        @NotNull List<SemanticRelationDraftRow> rows) {

    public SemanticRelationDraftBatch {
        rows = List.copyOf(rows);
    }
}
