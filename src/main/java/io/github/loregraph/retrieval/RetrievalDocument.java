package io.github.loregraph.retrieval;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Retrieved passage with free-form metadata, as produced by lexical search and by graph expansion.
 *
 * @param pageContent passage text
 * @param metadata    metadata keyed by the constants of this class plus any retriever-specific keys
 */
public record RetrievalDocument(@NotNull String pageContent, @NotNull Map<String, Object> metadata) {

    public static final String PATH = "path";
    public static final String CHUNK_ID = "chunkId";
    public static final String TITLE = "title";
    public static final String MTIME = "mtime";
    public static final String CTIME = "ctime";
    public static final String SCORE = "score";
    public static final String RERANK_SCORE = "rerank_score";
    public static final String ENGINE = "engine";
    public static final String INCLUDE_IN_CONTEXT = "includeInContext";
    public static final String EXPLANATION = "explanation";
    public static final String ENTITY_EVIDENCE = "entityEvidence";
    public static final String ENTITY_QUERY_MODE = "entityQueryMode";
    public static final String MATCHED_ENTITIES = "matchedEntities";
    public static final String IS_CHUNK = "isChunk";

    private static final int CONTENT_KEY_LENGTH = 64;

    public RetrievalDocument {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @Nullable
    public Object get(@NotNull String key) {
        return metadata.get(key);
    }

    /**
     * Ranking score: {@code rerank_score} when it is a non-zero number, else {@code score}, else 0.
     */
    public double score() {
        Double rerank = nonZeroNumber(metadata.get(RERANK_SCORE));
        if (rerank != null) {
            return rerank;
        }
        Double score = nonZeroNumber(metadata.get(SCORE));
        return score != null ? score : 0;
    }

    /**
     * Identity used to merge documents from different retrievers: chunk id, then path, then title,
     * then the first 64 characters of content.
     */
    @NotNull
    public String key() {
        for (String field : new String[]{CHUNK_ID, PATH, TITLE}) {
            Object value = metadata.get(field);
            if (value != null && !(value instanceof String text && text.isEmpty())) {
                return value.toString();
            }
        }
        return pageContent.substring(0, Math.min(CONTENT_KEY_LENGTH, pageContent.length()));
    }

    public boolean hasEntityEvidence() {
        return Boolean.TRUE.equals(metadata.get(ENTITY_EVIDENCE));
    }

    /**
     * Returns a copy with {@code overrides} applied on top of this document's metadata.
     */
    @NotNull
    public RetrievalDocument withMetadata(@NotNull Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(overrides);
        return new RetrievalDocument(pageContent, merged);
    }

    @Nullable
    private static Double nonZeroNumber(@Nullable Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (d != 0 && Double.isFinite(d)) {
                return d;
            }
        }
        return null;
    }
}
