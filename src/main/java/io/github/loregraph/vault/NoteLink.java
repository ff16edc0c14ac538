package io.github.loregraph.vault;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Outgoing link found in a note body.
 *
 * @param link        raw link target as written, without section or alias suffix
 * @param displayText alias text after {@code |}, if any
 */
public record NoteLink(@NotNull String link, @Nullable String displayText) {
}
