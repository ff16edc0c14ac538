package io.github.loregraph.vault;

import org.jetbrains.annotations.NotNull;

/**
 * Ordered slice of a note body.
 *
 * @param id      stable chunk id, {@code {path}#{n}}
 * @param content chunk text
 */
public record NoteChunk(@NotNull String id, @NotNull String content) {
}
