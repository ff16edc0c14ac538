package io.github.loregraph.vault.impl;

import io.github.loregraph.core.EntityGraphConfig;
import io.github.loregraph.vault.ChunkProvider;
import io.github.loregraph.vault.NoteChunk;
import io.github.loregraph.vault.NoteStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Chunks note bodies read through the {@link NoteStore}. Front matter is not part of any chunk.
 */
@ApplicationScoped
public class FileSystemChunkProvider implements ChunkProvider {

    private final NoteStore noteStore;
    private final int chunkSize;

    @Inject
    public FileSystemChunkProvider(NoteStore noteStore, EntityGraphConfig config) {
        this(noteStore, config.vault().chunkSize());
    }

    public FileSystemChunkProvider(@NotNull NoteStore noteStore, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be a positive integer.");
        }
        this.noteStore = noteStore;
        this.chunkSize = chunkSize;
    }

    @Override
    @NotNull
    public List<NoteChunk> getChunks(@NotNull String path) throws IOException {
        String body = MarkdownNoteParser.parse(path, noteStore.read(path)).body();
        List<String> texts = NoteChunker.chunk(body, chunkSize);

        List<NoteChunk> chunks = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            chunks.add(new NoteChunk(path + "#" + i, texts.get(i)));
        }
        return chunks;
    }
}
