package io.github.loregraph.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Pointer to where a relation was extracted from.
 *
 * @param path      vault-relative note path that produced the evidence
 * @param chunkId   optional chunk identifier for chunk-level drilldown
 * @param mtime     source note modification time at extraction
 * @param extractor relation extractor that emitted the evidence
 */
public record EvidenceRef(
        @NotNull String path,
        @Nullable String chunkId,
        long mtime,
        @NotNull RelationType extractor) {

    public EvidenceRef {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(extractor, "extractor must not be null");
    }

    /**
     * Evidence identity ignores mtime: the same note, chunk and extractor is the same evidence.
     */
    public boolean sameSourceAs(@NotNull EvidenceRef other) {
        return path.equals(other.path)
                && Objects.equals(chunkId, other.chunkId)
                && extractor == other.extractor;
    }

    @NotNull
    public EvidenceRef withExtractor(@NotNull RelationType newExtractor) {
        return new EvidenceRef(path, chunkId, mtime, newExtractor);
    }
}
