package io.github.loregraph.semantic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.loregraph.core.EntityGraphSettings;
import io.github.loregraph.core.SemanticPredicate;
import io.github.loregraph.index.FrontmatterWalker;
import io.github.loregraph.index.SemanticRelationCandidate;
import io.github.loregraph.index.SemanticRelationExtractor;
import io.github.loregraph.index.WikiLinks;
import io.github.loregraph.settings.SettingsProvider;
import io.github.loregraph.vault.NoteFile;
import io.github.loregraph.vault.NoteMetadata;
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
import java.util.regex.Pattern;

/**
 * Builds reviewable batches of semantic relation rows and writes edited batches back into
 * note front matter.
 *
 * <p>Rows come from relations already declared in the vault and from proposal adapters. Applied
 * rows are merged into the canonical relation field (the first configured relation field) as
 * records keyed by predicate and wiki-link target.</p>
 */
@ApplicationScoped
public class SemanticRelationBatchService {

    private static final Logger logger = LoggerFactory.getLogger(SemanticRelationBatchService.class);

    static final String VAULT_PROPOSAL_SOURCE = "vault-frontmatter";
    static final String MISSING_NOTE_REASON = "Missing markdown note";

    private static final String[] PREDICATE_KEYS = {"predicate", "relation", "type"};
    private static final Pattern MD_SUFFIX = Pattern.compile("\\.md$", Pattern.CASE_INSENSITIVE);

    private static final Comparator<SemanticRelationDraftRow> ROW_ORDER = Comparator
            .comparing(SemanticRelationDraftRow::notePath)
            .thenComparing(SemanticRelationDraftRow::predicate)
            .thenComparing(SemanticRelationDraftRow::targetPath);

    private final NoteStore noteStore;
    private final SettingsProvider settingsProvider;

    @Inject
    public SemanticRelationBatchService(NoteStore noteStore, SettingsProvider settingsProvider) {
        this.noteStore = noteStore;
        this.settingsProvider = settingsProvider;
    }

    /**
     * Collects, deduplicates, sorts and pages draft rows.
     *
     * @return batches of at most {@code semanticBatchSize} rows, empty when there are no rows
     */
    @NotNull
    public List<SemanticRelationDraftBatch> buildDraftBatches(@NotNull DraftBatchOptions options) {
        EntityGraphSettings settings = settingsProvider.current();

        List<SemanticRelationDraftRow> rows = new ArrayList<>();
        if (options.includeVaultDrafts()) {
            rows.addAll(collectVaultRows(settings));
        }
        rows.addAll(collectAdapterRows(options.adapters(), settings.semanticMinConfidence()));

        List<SemanticRelationDraftRow> deduped = new ArrayList<>(dedupe(rows).values());
        deduped.sort(ROW_ORDER);
        if (deduped.isEmpty()) {
            return List.of();
        }

        int batchSize = settings.semanticBatchSize();
        List<SemanticRelationDraftBatch> batches = new ArrayList<>();
        for (int start = 0; start < deduped.size(); start += batchSize) {
            int endExclusive = Math.min(start + batchSize, deduped.size());
            int index = batches.size();
            batches.add(new SemanticRelationDraftBatch(
                    "semantic-batch-" + (index + 1),
                    index,
                    start + 1,
                    endExclusive,
                    deduped.size(),
                    deduped.subList(start, endExclusive)));
        }
        logger.debug("Built {} semantic draft batches from {} rows", batches.size(), deduped.size());
        return batches;
    }

    /**
     * Validates rows and merges the valid ones into each note's canonical relation field.
     *
     * <p>Never throws for row or note problems: invalid rows are {@link RowStatus#SKIPPED}, rows of
     * missing or unwritable notes are {@link RowStatus#ERROR}.</p>
     */
    @NotNull
    public ApplyBatchResult applyEditedBatch(@NotNull List<SemanticRelationDraftRow> rows) {
        List<String> errors = new ArrayList<>();
        List<ApplyRowResult> rowResults = new ArrayList<>();
        Map<String, List<SemanticRelationDraftRow>> rowsByNote = new LinkedHashMap<>();

        int skippedRows = 0;
        for (SemanticRelationDraftRow row : rows) {
            List<String> reasons = validate(row);
            if (reasons.isEmpty()) {
                rowsByNote.computeIfAbsent(row.notePath(), key -> new ArrayList<>()).add(row);
            } else {
                skippedRows++;
                rowResults.add(result(row, RowStatus.SKIPPED, String.join("; ", reasons)));
            }
        }

        String canonicalField = settingsProvider.current().canonicalRelationField();
        int updatedNotes = 0;
        int writtenRelations = 0;

        for (Map.Entry<String, List<SemanticRelationDraftRow>> entry : rowsByNote.entrySet()) {
            String notePath = entry.getKey();
            List<SemanticRelationDraftRow> noteRows = entry.getValue();

            if (noteStore.getNote(notePath).isEmpty()) {
                errors.add(MISSING_NOTE_REASON + ": " + notePath);
                noteRows.forEach(row -> rowResults.add(result(row, RowStatus.ERROR, MISSING_NOTE_REASON)));
                continue;
            }

            try {
                noteStore.processFrontmatter(notePath, frontmatter ->
                        frontmatter.set(canonicalField, mergeRelations(frontmatter.get(canonicalField), noteRows)));
                updatedNotes++;
                writtenRelations += noteRows.size();
                noteRows.forEach(row -> rowResults.add(result(row, RowStatus.APPLIED, null)));
            } catch (IOException | RuntimeException e) {
                String message = "Failed to update " + notePath + ": " + e.getMessage();
                logger.warn(message, e);
                errors.add(message);
                noteRows.forEach(row -> rowResults.add(result(row, RowStatus.ERROR, message)));
            }
        }

        logger.info("Applied semantic batch: updatedNotes={}, writtenRelations={}, skippedRows={}, errors={}",
                updatedNotes, writtenRelations, skippedRows, errors.size());
        return new ApplyBatchResult(updatedNotes, writtenRelations, skippedRows, errors, rowResults);
    }

    private List<SemanticRelationDraftRow> collectVaultRows(EntityGraphSettings settings) {
        List<SemanticRelationDraftRow> rows = new ArrayList<>();
        for (NoteFile note : noteStore.listNotes()) {
            try {
                Optional<ObjectNode> frontmatter = noteStore.getMetadata(note.path())
                        .map(NoteMetadata::frontmatter)
                        .filter(node -> !node.isEmpty());
                if (frontmatter.isEmpty()) {
                    continue;
                }

                List<SemanticRelationCandidate> candidates = SemanticRelationExtractor.extract(
                        frontmatter.get(),
                        note.path(),
                        settings.batchRelationFields(),
                        candidate -> resolveTarget(candidate, note.path()));

                Map<String, SemanticRelationDraftRow> noteRows = new LinkedHashMap<>();
                for (SemanticRelationCandidate candidate : candidates) {
                    String predicate = candidate.predicate().id();
                    SemanticRelationDraftRow row = new SemanticRelationDraftRow(
                            note.path() + "::" + predicate + "::" + candidate.targetPath(),
                            note.path(),
                            candidate.sourceField(),
                            predicate,
                            candidate.targetPath(),
                            (double) candidate.percentConfidence(settings.semanticMinConfidence()),
                            VAULT_PROPOSAL_SOURCE);
                    keepHigherConfidence(noteRows, row);
                }
                rows.addAll(noteRows.values());
            } catch (RuntimeException e) {
                logger.warn("Failed to inspect {}", note.path(), e);
            }
        }
        return rows;
    }

    private Optional<String> resolveTarget(String candidate, String sourcePath) {
        Optional<String> resolved = noteStore.resolveLink(candidate, sourcePath);
        if (resolved.isEmpty() && !candidate.endsWith(".md")) {
            resolved = noteStore.resolveLink(candidate + ".md", sourcePath);
        }
        return resolved;
    }

    private List<SemanticRelationDraftRow> collectAdapterRows(List<ProposalSourceAdapter> adapters, int minConfidence) {
        List<SemanticRelationDraftRow> rows = new ArrayList<>();
        for (ProposalSourceAdapter adapter : adapters) {
            List<SemanticRelationProposal> proposals;
            try {
                proposals = adapter.getProposals();
            } catch (Exception e) {
                logger.warn("Adapter failed: {}", adapter.id(), e);
                continue;
            }

            for (int index = 0; index < proposals.size(); index++) {
                SemanticRelationProposal proposal = proposals.get(index);
                Optional<SemanticPredicate> predicate = SemanticPredicate.parse(proposal.predicate());
                if (predicate.isEmpty()) {
                    continue;
                }

                String notePath = normalizePathCandidate(proposal.notePath(), proposal.notePath(), true);
                String targetPath = normalizePathCandidate(proposal.targetPath(),
                        notePath.isEmpty() ? proposal.notePath() : notePath, false);
                if (notePath.isEmpty() || targetPath.isEmpty()) {
                    continue;
                }

                String sourceField = proposal.sourceField() != null && !proposal.sourceField().isBlank()
                        ? proposal.sourceField().trim()
                        : "adapter:" + adapter.id();
                double confidence = proposal.confidence() == null
                        ? minConfidence
                        : SemanticRelationCandidate.toPercent(proposal.confidence());

                rows.add(new SemanticRelationDraftRow(
                        "adapter:" + adapter.id() + ":" + index + ":" + predicate.get().id() + ":" + targetPath,
                        notePath,
                        sourceField,
                        predicate.get().id(),
                        targetPath,
                        confidence,
                        adapter.label()));
            }
        }
        return rows;
    }

    /**
     * Resolves an adapter path against the vault, falling back to the literal path when it looks
     * like one.
     *
     * @return resolved path, or an empty string when unusable or a disallowed self-reference
     */
    String normalizePathCandidate(@Nullable String value, @NotNull String sourcePath, boolean allowSelf) {
        String candidate = WikiLinks.toPathCandidate(value);
        if (candidate.isEmpty()) {
            return "";
        }

        Optional<String> resolved = noteStore.resolveLink(candidate, sourcePath);
        if (resolved.isPresent()) {
            return !allowSelf && resolved.get().equals(sourcePath) ? "" : resolved.get();
        }

        if (candidate.contains("/") || candidate.endsWith(".md")) {
            String withExtension = candidate.endsWith(".md") ? candidate : candidate + ".md";
            return !allowSelf && withExtension.equals(sourcePath) ? "" : withExtension;
        }
        return candidate;
    }

    private static Map<String, SemanticRelationDraftRow> dedupe(List<SemanticRelationDraftRow> rows) {
        Map<String, SemanticRelationDraftRow> deduped = new LinkedHashMap<>();
        rows.forEach(row -> keepHigherConfidence(deduped, row));
        return deduped;
    }

    private static void keepHigherConfidence(Map<String, SemanticRelationDraftRow> rows, SemanticRelationDraftRow row) {
        String key = row.notePath() + "|" + row.predicate() + "|" + row.targetPath();
        SemanticRelationDraftRow existing = rows.get(key);
        if (existing == null || confidenceOf(row) > confidenceOf(existing)) {
            rows.put(key, row);
        }
    }

    private static double confidenceOf(SemanticRelationDraftRow row) {
        return row.confidence() != null ? row.confidence() : 0;
    }

    static List<String> validate(SemanticRelationDraftRow row) {
        List<String> reasons = new ArrayList<>();
        if (isBlank(row.notePath()) || isBlank(row.targetPath()) || isBlank(row.sourceField())) {
            reasons.add("Missing required fields");
        }
        if (SemanticPredicate.fromId(row.predicate()).isEmpty()) {
            reasons.add("Invalid predicate");
        }
        Double confidence = row.confidence();
        if (confidence == null || !Double.isFinite(confidence) || confidence < 0 || confidence > 100) {
            reasons.add("Confidence out of range");
        }
        return reasons;
    }

    private static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }

    private static ArrayNode mergeRelations(@Nullable JsonNode existing, List<SemanticRelationDraftRow> rows) {
        Map<String, ObjectNode> relations = new LinkedHashMap<>();
        for (ObjectNode relation : normalizeExisting(existing)) {
            relations.put(relationKey(relation), relation);
        }

        for (SemanticRelationDraftRow row : rows) {
            ObjectNode relation = JsonNodeFactory.instance.objectNode();
            relation.put("predicate", row.predicate());
            relation.put("target", toWikiLink(row.targetPath()));
            putConfidence(relation, row.confidence());
            relation.put("sourceField", row.sourceField());
            relations.put(relationKey(relation), relation);
        }

        ArrayNode merged = JsonNodeFactory.instance.arrayNode();
        relations.values().forEach(merged::add);
        return merged;
    }

    private static List<ObjectNode> normalizeExisting(@Nullable JsonNode value) {
        List<ObjectNode> records = new ArrayList<>();
        if (value == null || !value.isArray()) {
            return records;
        }

        for (JsonNode item : value) {
            if (!item.isObject()) {
                continue;
            }
            JsonNode predicateNode = FrontmatterWalker.firstTruthy(item, PREDICATE_KEYS);
            Optional<SemanticPredicate> predicate = predicateNode != null && predicateNode.isTextual()
                    ? SemanticPredicate.parse(predicateNode.textValue())
                    : Optional.empty();
            JsonNode targetNode = item.get("target");
            String target = targetNode != null && targetNode.isTextual() ? targetNode.textValue().trim() : "";
            if (predicate.isEmpty() || target.isEmpty()) {
                continue;
            }

            Double confidence = FrontmatterWalker.toNumber(item.get("confidence"));
            int percent = (int) Math.min(100, Math.max(0, Math.floor(confidence != null ? confidence : 0)));
            JsonNode sourceFieldNode = item.get("sourceField");
            String sourceField = sourceFieldNode != null && sourceFieldNode.isTextual()
                    && !sourceFieldNode.textValue().isBlank()
                    ? sourceFieldNode.textValue().trim()
                    : EntityGraphSettings.DEFAULT_RELATION_FIELD;

            ObjectNode record = JsonNodeFactory.instance.objectNode();
            record.put("predicate", predicate.get().id());
            record.put("target", target);
            record.put("confidence", percent);
            record.put("sourceField", sourceField);
            records.add(record);
        }
        return records;
    }

    private static void putConfidence(ObjectNode relation, Double confidence) {
        if (confidence == Math.rint(confidence)) {
            relation.put("confidence", confidence.intValue());
        } else {
            relation.put("confidence", confidence);
        }
    }

    private static String relationKey(ObjectNode relation) {
        return relation.get("predicate").textValue() + "|" + relation.get("target").textValue();
    }

    static String toWikiLink(String path) {
        return "[[" + MD_SUFFIX.matcher(path).replaceFirst("") + "]]";
    }

    private static ApplyRowResult result(SemanticRelationDraftRow row, RowStatus status, @Nullable String reason) {
        return new ApplyRowResult(row.id(), row.notePath(), row.targetPath(), row.predicate(), status, reason);
    }
}
