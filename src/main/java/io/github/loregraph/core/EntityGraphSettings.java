package io.github.loregraph.core;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of the runtime settings read by the index, the batch service and the retriever.
 *
 * <p>Field lists are sanitized on construction: entries are trimmed, blanks dropped and the
 * list capped at {@value #MAX_FIELDS}. Numeric settings are clamped into their valid ranges.</p>
 */
public record EntityGraphSettings(
        @NotNull List<String> aliasFields,
        boolean enableSemanticRelations,
        @NotNull List<String> semanticRelationFields,
        int semanticMinConfidence,
        int semanticBatchSize,
        boolean enableEntityGraphRetrieval,
        int maxHops,
        int maxExpandedDocs) {

    public static final int MAX_FIELDS = 24;
    public static final String DEFAULT_RELATION_FIELD = "relations";

    public static final int DEFAULT_MIN_CONFIDENCE = 70;
    public static final int DEFAULT_BATCH_SIZE = 25;
    public static final int MIN_BATCH_SIZE = 5;
    public static final int MAX_BATCH_SIZE = 200;
    public static final int DEFAULT_MAX_HOPS = 2;
    public static final int DEFAULT_MAX_EXPANDED_DOCS = 12;

    public EntityGraphSettings {
        aliasFields = sanitizeFields(aliasFields);
        semanticRelationFields = sanitizeFields(semanticRelationFields);
        semanticMinConfidence = Math.min(100, Math.max(0, semanticMinConfidence));
        semanticBatchSize = Math.min(MAX_BATCH_SIZE, Math.max(MIN_BATCH_SIZE, semanticBatchSize));
    }

    /**
     * Settings used when no configuration is available.
     */
    @NotNull
    public static EntityGraphSettings defaults() {
        return new EntityGraphSettings(
                List.of("aliases"),
                false,
                List.of(DEFAULT_RELATION_FIELD),
                DEFAULT_MIN_CONFIDENCE,
                DEFAULT_BATCH_SIZE,
                true,
                DEFAULT_MAX_HOPS,
                DEFAULT_MAX_EXPANDED_DOCS);
    }

    /**
     * Seeds a snapshot from the static configuration mapping.
     */
    @NotNull
    public static EntityGraphSettings from(@NotNull EntityGraphConfig config) {
        return new EntityGraphSettings(
                config.alias().fields(),
                config.semantic().enabled(),
                config.semantic().fields(),
                config.semantic().minConfidence(),
                config.semantic().batchSize(),
                config.retrieval().enabled(),
                config.retrieval().maxHops(),
                config.retrieval().maxExpandedDocs());
    }

    /**
     * Relation fields used by the batch editor. Never empty.
     */
    @NotNull
    public List<String> batchRelationFields() {
        return semanticRelationFields.isEmpty() ? List.of(DEFAULT_RELATION_FIELD) : semanticRelationFields;
    }

    /**
     * Front-matter field where batch edits are persisted.
     */
    @NotNull
    public String canonicalRelationField() {
        return batchRelationFields().get(0);
    }

    /**
     * Whether switching from this snapshot to {@code next} changes what the index extracts.
     */
    public boolean affectsIndex(@NotNull EntityGraphSettings next) {
        return !aliasFields.equals(next.aliasFields)
                || enableSemanticRelations != next.enableSemanticRelations
                || !semanticRelationFields.equals(next.semanticRelationFields)
                || semanticMinConfidence != next.semanticMinConfidence;
    }

    @NotNull
    public EntityGraphSettings withAliasFields(@NotNull List<String> fields) {
        return new EntityGraphSettings(fields, enableSemanticRelations, semanticRelationFields,
                semanticMinConfidence, semanticBatchSize, enableEntityGraphRetrieval, maxHops, maxExpandedDocs);
    }

    @NotNull
    public EntityGraphSettings withSemanticRelations(boolean enabled) {
        return new EntityGraphSettings(aliasFields, enabled, semanticRelationFields,
                semanticMinConfidence, semanticBatchSize, enableEntityGraphRetrieval, maxHops, maxExpandedDocs);
    }

    @NotNull
    public EntityGraphSettings withSemanticRelationFields(@NotNull List<String> fields) {
        return new EntityGraphSettings(aliasFields, enableSemanticRelations, fields,
                semanticMinConfidence, semanticBatchSize, enableEntityGraphRetrieval, maxHops, maxExpandedDocs);
    }

    @NotNull
    public EntityGraphSettings withSemanticMinConfidence(int percent) {
        return new EntityGraphSettings(aliasFields, enableSemanticRelations, semanticRelationFields,
                percent, semanticBatchSize, enableEntityGraphRetrieval, maxHops, maxExpandedDocs);
    }

    @NotNull
    public EntityGraphSettings withSemanticBatchSize(int batchSize) {
        return new EntityGraphSettings(aliasFields, enableSemanticRelations, semanticRelationFields,
                semanticMinConfidence, batchSize, enableEntityGraphRetrieval, maxHops, maxExpandedDocs);
    }

    @NotNull
    public EntityGraphSettings withEntityGraphRetrieval(boolean enabled) {
        return new EntityGraphSettings(aliasFields, enableSemanticRelations, semanticRelationFields,
                semanticMinConfidence, semanticBatchSize, enabled, maxHops, maxExpandedDocs);
    }

    @NotNull
    public EntityGraphSettings withRetrievalBounds(int hops, int expandedDocs) {
        return new EntityGraphSettings(aliasFields, enableSemanticRelations, semanticRelationFields,
                semanticMinConfidence, semanticBatchSize, enableEntityGraphRetrieval, hops, expandedDocs);
    }

    private static List<String> sanitizeFields(List<String> fields) {
        if (fields == null) {
            return List.of();
        }
        List<String> sanitized = new ArrayList<>();
        for (String field : fields) {
            if (field == null) {
                continue;
            }
            String trimmed = field.trim();
            if (!trimmed.isEmpty()) {
                sanitized.add(trimmed);
            }
            if (sanitized.size() == MAX_FIELDS) {
                break;
            }
        }
        return List.copyOf(sanitized);
    }
}
