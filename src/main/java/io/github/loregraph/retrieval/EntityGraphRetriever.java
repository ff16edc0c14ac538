package io.github.loregraph.retrieval;

import io.github.loregraph.core.EntityGraphExpansionHit;
import io.github.loregraph.core.EntityGraphSettings;
import io.github.loregraph.core.ResolvedEntity;
import io.github.loregraph.index.EntityGraphIndexManager;
import io.github.loregraph.settings.SettingsProvider;
import io.github.loregraph.vault.ChunkProvider;
import io.github.loregraph.vault.NoteChunk;
import io.github.loregraph.vault.NoteFile;
import io.github.loregraph.vault.NoteStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Augments lexical retrieval results with notes reached through the entity graph.
 *
 * <p>When the query names known entities, their graph neighbors are turned into evidence
 * documents and merged with the base documents by {@link RetrievalDocument#key()}. Every merged
 * document is tagged with the matched entities. When retrieval is disabled or nothing resolves,
 * the base documents pass through untouched.</p>
 */
@ApplicationScoped
public class EntityGraphRetriever {

    private static final Logger logger = LoggerFactory.getLogger(EntityGraphRetriever.class);

    static final String ENGINE_NAME = "entity-graph";

    private final EntityGraphIndexManager indexManager;
    private final ChunkProvider chunkProvider;
    private final NoteStore noteStore;
    private final SettingsProvider settingsProvider;

    @Inject
    public EntityGraphRetriever(EntityGraphIndexManager indexManager,
                                ChunkProvider chunkProvider,
                                NoteStore noteStore,
                                SettingsProvider settingsProvider) {
        this.indexManager = indexManager;
        this.chunkProvider = chunkProvider;
        this.noteStore = noteStore;
        this.settingsProvider = settingsProvider;
    }

    /**
     * Resolves entities in {@code query}, expands them and merges the evidence into {@code baseDocuments}.
     *
     * <p>Never completes exceptionally: a failed entity resolution is logged and treated as no match.</p>
     */
    @NotNull
    public CompletableFuture<AugmentationResult> augmentDocuments(@NotNull String query,
                                                                  @NotNull List<RetrievalDocument> baseDocuments,
                                                                  @NotNull AugmentationOptions options) {
        EntityGraphSettings settings = settingsProvider.current();
        if (!settings.enableEntityGraphRetrieval()) {
            return CompletableFuture.completedFuture(AugmentationResult.passThrough(baseDocuments));
        }

        CompletableFuture<List<ResolvedEntity>> resolution;
        try {
            resolution = indexManager.resolveEntities(query);
        } catch (RuntimeException e) {
            resolution = CompletableFuture.failedFuture(e);
        }

        return resolution
                .exceptionally(error -> {
                    logger.warn("Failed to resolve query entities", error);
                    return List.of();
                })
                .thenApply(resolved -> augment(resolved, baseDocuments, options, settings));
    }

    private AugmentationResult augment(List<ResolvedEntity> resolvedEntities,
                                       List<RetrievalDocument> baseDocuments,
                                       AugmentationOptions options,
                                       EntityGraphSettings settings) {
        if (resolvedEntities.isEmpty()) {
            return AugmentationResult.passThrough(baseDocuments);
        }

        int maxHops = bound(options.maxHops(), settings.maxHops(), EntityGraphSettings.DEFAULT_MAX_HOPS);
        int maxExpandedDocs = bound(options.maxExpandedDocs(), settings.maxExpandedDocs(),
                EntityGraphSettings.DEFAULT_MAX_EXPANDED_DOCS);

        List<EntityGraphExpansionHit> hits = indexManager.expandFromResolvedEntities(
                resolvedEntities, maxHops, maxExpandedDocs);
        List<RetrievalDocument> graphDocuments = buildEvidenceDocuments(hits);
        List<RetrievalDocument> merged = merge(baseDocuments, graphDocuments, resolvedEntities);
        boolean hasEntityEvidence = merged.stream().anyMatch(RetrievalDocument::hasEntityEvidence);

        logger.debug("entityQueryMode=true resolved={} expansionHits={} merged={}",
                resolvedEntities.size(), hits.size(), merged.size());
        return new AugmentationResult(merged, true, hasEntityEvidence, resolvedEntities);
    }

    static int bound(@Nullable Integer requested, int configured, int fallback) {
        int value;
        if (requested != null && requested > 0) {
            value = requested;
        } else if (configured > 0) {
            value = configured;
        } else {
            value = fallback;
        }
        return Math.max(1, value);
    }

    private List<RetrievalDocument> buildEvidenceDocuments(List<EntityGraphExpansionHit> hits) {
        List<RetrievalDocument> documents = new ArrayList<>();
        for (EntityGraphExpansionHit hit : hits) {
            Optional<NoteFile> note = noteStore.getNote(hit.path());
            if (note.isEmpty()) {
                continue;
            }

            try {
                toDocument(note.get(), hit).ifPresent(documents::add);
            } catch (IOException | RuntimeException e) {
                logger.warn("Failed to build graph document for {}", hit.path(), e);
            }
        }
        return documents;
    }

    private Optional<RetrievalDocument> toDocument(NoteFile note, EntityGraphExpansionHit hit) throws IOException {
        List<NoteChunk> chunks = chunkProvider.getChunks(note.path());
        NoteChunk topChunk = chunks.isEmpty() ? null : chunks.get(0);
        String content = topChunk != null && !topChunk.content().isEmpty()
                ? topChunk.content()
                : noteStore.read(note.path());
        if (content.isBlank()) {
            return Optional.empty();
        }

        Map<String, Object> explanation = new LinkedHashMap<>();
        explanation.put("entityGraph", hit.explanation());
        explanation.put("baseScore", hit.score());
        explanation.put("finalScore", hit.score());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(RetrievalDocument.PATH, note.path());
        if (topChunk != null) {
            metadata.put(RetrievalDocument.CHUNK_ID, topChunk.id());
        }
        metadata.put(RetrievalDocument.TITLE, note.basename());
        metadata.put(RetrievalDocument.MTIME, note.mtime());
        metadata.put(RetrievalDocument.CTIME, note.ctime());
        metadata.put(RetrievalDocument.SCORE, hit.score());
        metadata.put(RetrievalDocument.RERANK_SCORE, hit.score());
        metadata.put(RetrievalDocument.ENGINE, ENGINE_NAME);
        metadata.put(RetrievalDocument.INCLUDE_IN_CONTEXT, true);
        metadata.put(RetrievalDocument.EXPLANATION, explanation);
        metadata.put(RetrievalDocument.ENTITY_EVIDENCE, true);
        metadata.put(RetrievalDocument.IS_CHUNK, topChunk != null);
        return Optional.of(new RetrievalDocument(content, metadata));
    }

    /**
     * Merges base and graph documents by key. On collision the higher-scoring document wins,
     * explanations are combined and graph evidence is kept.
     */
    static List<RetrievalDocument> merge(List<RetrievalDocument> baseDocuments,
                                         List<RetrievalDocument> graphDocuments,
                                         List<ResolvedEntity> resolvedEntities) {
        List<String> matchedEntities = resolvedEntities.stream().map(ResolvedEntity::canonicalName).toList();
        Map<String, RetrievalDocument> merged = new LinkedHashMap<>();

        for (RetrievalDocument document : baseDocuments) {
            upsert(merged, document, false, matchedEntities);
        }
        for (RetrievalDocument document : graphDocuments) {
            upsert(merged, document, true, matchedEntities);
        }

        List<RetrievalDocument> sorted = new ArrayList<>(merged.values());
        sorted.sort(Comparator.comparingDouble(RetrievalDocument::score).reversed());
        return sorted;
    }

    private static void upsert(Map<String, RetrievalDocument> merged, RetrievalDocument document,
                               boolean fromGraph, List<String> matchedEntities) {
        String key = document.key();
        RetrievalDocument existing = merged.get(key);

        Map<String, Object> overrides = new LinkedHashMap<>();
        overrides.put(RetrievalDocument.ENTITY_QUERY_MODE, true);
        overrides.put(RetrievalDocument.MATCHED_ENTITIES, matchedEntities);

        if (existing == null) {
            overrides.put(RetrievalDocument.ENTITY_EVIDENCE, fromGraph || document.hasEntityEvidence());
            merged.put(key, document.withMetadata(overrides));
            return;
        }

        RetrievalDocument winner = document.score() > existing.score() ? document : existing;
        overrides.put(RetrievalDocument.EXPLANATION, mergeExplanations(
                existing.get(RetrievalDocument.EXPLANATION), document.get(RetrievalDocument.EXPLANATION)));
        overrides.put(RetrievalDocument.ENTITY_EVIDENCE, existing.hasEntityEvidence() || document.hasEntityEvidence());
        merged.put(key, winner.withMetadata(overrides));
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> mergeExplanations(@Nullable Object current, @Nullable Object incoming) {
        Map<String, Object> currentMap = current instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
        Map<String, Object> incomingMap = incoming instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();

        Map<String, Object> merged = new LinkedHashMap<>(currentMap);
        merged.putAll(incomingMap);
        Object entityGraph = incomingMap.get("entityGraph") != null
                ? incomingMap.get("entityGraph")
                : currentMap.get("entityGraph");
        if (entityGraph != null) {
            merged.put("entityGraph", entityGraph);
        }
        return merged;
    }
}
