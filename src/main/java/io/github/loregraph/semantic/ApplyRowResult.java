package io.github.loregraph.semantic;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Per-row apply outcome.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApplyRowResult(
        String rowId,
        String notePath,
        String targetPath,
        String predicate,
        @NotNull RowStatus status,
        @Nullable String reason) {
}
