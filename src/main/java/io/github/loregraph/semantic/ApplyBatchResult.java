package io.github.loregraph.semantic;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Summary of applying one edited batch. Every input row has exactly one row result.
 *
 * @param updatedNotes     notes whose front matter was written
 * @param writtenRelations rows persisted
 * @param skippedRows      rows rejected by validation
 * @param errors           note-level error messages
 * @param rowResults       per-row outcomes
 */
public record ApplyBatchResult(
        int updatedNotes,
        int writtenRelations,
        int skippedRows,
        @NotNull List<String> errors,
        @NotNull List<ApplyRowResult> rowResults) {

    public ApplyBatchResult {
        errors = List.copyOf(errors);
        rowResults = List.copyOf(rowResults);
    }
}
