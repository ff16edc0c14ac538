package io.github.loregraph.vault;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.loregraph.utils.Subscription;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Host vault the entity graph is built from.
 *
 * <p>Implementations apply the configured include and exclude patterns: {@link #listNotes()}
 * only returns eligible notes and {@link #isEligible(NoteFile)} reports whether a given note
 * still passes them.</p>
 */
public interface NoteStore {

    /**
     * Lists every eligible markdown note.
     */
    @NotNull
    List<NoteFile> listNotes();

    @NotNull
    Optional<NoteFile> getNote(@NotNull String path);

    boolean isEligible(@NotNull NoteFile note);

    /**
     * Returns parsed metadata, or empty when the host has none for the path.
     */
    @NotNull
    Optional<NoteMetadata> getMetadata(@NotNull String path);

    /**
     * Resolves a link or path candidate to the path of an existing markdown note.
     *
     * @param candidate  raw link text or path
     * @param sourcePath note the candidate was found in, used for relative resolution
     * @return resolved note path, or empty
     */
    @NotNull
    Optional<String> resolveLink(@NotNull String candidate, @NotNull String sourcePath);

    @NotNull
    String read(@NotNull String path) throws IOException;

    /**
     * Atomically rewrites a note's front matter.
     *
     * @param path    note path
     * @param mutator mutates the front matter in place
     * @throws IOException if the note is missing or cannot be written
     */
    void processFrontmatter(@NotNull String path, @NotNull Consumer<ObjectNode> mutator) throws IOException;

    @NotNull
    Subscription addChangeListener(@NotNull NoteChangeListener listener);
}
