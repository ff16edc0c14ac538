package io.github.loregraph.vault.impl;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a note body into chunks of at most {@code chunkSize} characters.
 *
 * <p>A chunk ends at the last paragraph break inside the window when there is one, otherwise
 * at the last whitespace, otherwise exactly at the window size. Chunks are trimmed and blank
 * chunks are dropped.</p>
 */
public final class NoteChunker {

    private NoteChunker() {
    }

    public static List<String> chunk(String body, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be a positive integer.");
        }

        List<String> chunks = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return chunks;
        }

        int length = body.length();
        int start = skipWhitespace(body, 0);
        while (start < length) {
            int end = Math.min(start + chunkSize, length);
            if (end < length && !Character.isWhitespace(body.charAt(end))) {
                end = findSplit(body, start, end);
            }

            String chunk = body.substring(start, end).trim();
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }
            start = skipWhitespace(body, end);
        }

        return chunks;
    }

    private static int findSplit(String body, int start, int end) {
        int paragraph = body.lastIndexOf("\n\n", end - 1);
        if (paragraph > start) {
            return paragraph;
        }
        for (int i = end - 1; i > start; i--) {
            if (Character.isWhitespace(body.charAt(i))) {
                return i;
            }
        }
        // No whitespace inside the window, force the split.
        return end;
    }

    private static int skipWhitespace(String body, int index) {
        int i = index;
        while (i < body.length() && Character.isWhitespace(body.charAt(i))) {
            i++;
        }
        return i;
    }
}
