package io.github.loregraph.vault;

import org.jetbrains.annotations.NotNull;

/**
 * Receives markdown note change events from a {@link NoteStore}.
 */
public interface NoteChangeListener {

    void onNoteModified(@NotNull NoteFile note);

    void onNoteCreated(@NotNull NoteFile note);

    void onNoteRenamed(@NotNull NoteFile note, @NotNull String oldPath);

    void onNoteDeleted(@NotNull String path);
}
