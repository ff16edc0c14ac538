package io.github.loregraph.vault.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NoteChunkerTest {

    @Test
    @DisplayName("should prefer paragraph breaks")
    void testParagraphSplit() {
        List<String> chunks = NoteChunker.chunk("Alpha beta.\n\nGamma delta epsilon.", 20);

        assertEquals(List.of("Alpha beta.", "Gamma delta epsilon."), chunks);
    }

    @Test
    @DisplayName("should fall back to the last whitespace inside the window")
    void testWhitespaceSplit() {
        List<String> chunks = NoteChunker.chunk("one two three four", 9);

        assertEquals(List.of("one two", "three", "four"), chunks);
    }

    @Test
    @DisplayName("should force a split when a window has no whitespace")
    void testForcedSplit() {
        assertEquals(List.of("abcd", "efgh", "ij"), NoteChunker.chunk("abcdefghij", 4));
    }

    @Test
    @DisplayName("chunks should never exceed the chunk size")
    void testChunkSizeBound() {
        String body = "The Sworn Knight rode north. ".repeat(40);

        List<String> chunks = NoteChunker.chunk(body, 50);

        assertFalse(chunks.isEmpty());
        assertTrue(chunks.stream().allMatch(chunk -> chunk.length() <= 50 && !chunk.isBlank()));
    }

    @Test
    @DisplayName("blank input yields no chunks and a non-positive size is rejected")
    void testEdgeCases() {
        assertTrue(NoteChunker.chunk("", 10).isEmpty());
        assertTrue(NoteChunker.chunk(null, 10).isEmpty());
        assertTrue(NoteChunker.chunk(" \n\n ", 10).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> NoteChunker.chunk("text", 0));
    }
}
