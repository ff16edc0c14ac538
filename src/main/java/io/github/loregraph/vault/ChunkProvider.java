package io.github.loregraph.vault;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the ordered chunks of a note for retrieval documents.
 */
public interface ChunkProvider {

    /**
     * @param path vault-relative note path
     * @return chunks in document order, empty when the note has no body
     * @throws IOException if the note cannot be read
     */
    @NotNull
    List<NoteChunk> getChunks(@NotNull String path) throws IOException;
}
