package io.github.loregraph.semantic;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.loregraph.core.EntityGraphSettings;
import io.github.loregraph.settings.ConfigSettingsProvider;
import io.github.loregraph.vault.InMemoryNoteStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for SemanticRelationBatchService.
 *
 * Covers:
 * - Draft rows from relation fields, convenience keys and proposal adapters
 * - Deduplication, ordering and paging
 * - Applying edited rows into front matter, with skipped and failed rows
 */
@ExtendWith(MockitoExtension.class)
class SemanticRelationBatchServiceTest {

    private static final String ARIN = "Characters/Arin.md";
    private static final String LIRA = "Characters/Lira.md";
    private static final String SUNHOLD = "Places/Sunhold.md";

    private static final String ARIN_CONTENT = """
            ---
            relations:
              - predicate: allied_with
                target: "[[Characters/Lira]]"
                confidence: 0.84
            locatedIn: "[[Sunhold]]"
            ---
            # Arin

            Sworn knight of the realm.
            """;

    @Mock
    private ProposalSourceAdapter adapter;

    private InMemoryNoteStore noteStore;
    private ConfigSettingsProvider settingsProvider;
    private SemanticRelationBatchService service;

    @BeforeEach
    void setUp() {
        noteStore = new InMemoryNoteStore();
        noteStore.put(ARIN, ARIN_CONTENT);
        noteStore.put(LIRA, "# Lira\n");
        noteStore.put(SUNHOLD, "# Sunhold\n");

        settingsProvider = new ConfigSettingsProvider(EntityGraphSettings.defaults().withSemanticBatchSize(5));
        service = new SemanticRelationBatchService(noteStore, settingsProvider);
    }

    private static SemanticRelationDraftRow row(String id, String notePath, String predicate, String targetPath,
                                                Double confidence) {
        return new SemanticRelationDraftRow(id, notePath, "batch-editor", predicate, targetPath, confidence, "test");
    }

    @Nested
    @DisplayName("Draft batches")
    class DraftBatches {

        @Test
        @DisplayName("should build rows from relation fields and convenience keys")
        void testVaultRows() {
            // Act
            List<SemanticRelationDraftBatch> batches = service.buildDraftBatches(DraftBatchOptions.vaultOnly());

            // Assert
            assertEquals(1, batches.size());
            SemanticRelationDraftBatch batch = batches.get(0);
            assertEquals("semantic-batch-1", batch.id());
            assertEquals(1, batch.startRow());
            assertEquals(2, batch.endRow());
            assertEquals(2, batch.totalRows());

            SemanticRelationDraftRow allied = batch.rows().get(0);
            assertEquals("allied_with", allied.predicate());
            assertEquals(LIRA, allied.targetPath());
            assertEquals(84.0, allied.confidence());
            assertEquals("relations", allied.sourceField());
            assertEquals(ARIN + "::allied_with::" + LIRA, allied.id());

            SemanticRelationDraftRow located = batch.rows().get(1);
            assertEquals("located_in", located.predicate());
            assertEquals(SUNHOLD, located.targetPath());
            assertEquals(70.0, located.confidence());
            assertEquals("locatedIn", located.sourceField());

            assertTrue(batch.rows().stream().allMatch(r -> "vault-frontmatter".equals(r.proposalSource())));
        }

        @Test
        @DisplayName("should resolve plain note titles in relation records")
        void testPlainTitleTarget() {
            noteStore.put(ARIN, """
                    ---
                    relations:
                      - predicate: allied_with
                        target: Lira
                    ---
                    """);

            List<SemanticRelationDraftBatch> batches = service.buildDraftBatches(DraftBatchOptions.vaultOnly());

            assertEquals(1, batches.size());
            assertEquals(1, batches.get(0).rows().size());
            assertEquals(LIRA, batches.get(0).rows().get(0).targetPath());
        }

        @Test
        @DisplayName("should add adapter rows and keep the higher confidence on duplicates")
        void testAdapterRows() throws Exception {
            // Arrange
            when(adapter.id()).thenReturn("ai-pass-1");
            when(adapter.label()).thenReturn("ai-pass-1");
            when(adapter.getProposals()).thenReturn(List.of(
                new SemanticRelationProposal(ARIN, "ally", "[[Characters/Lira]]", 95.0, null),
                new SemanticRelationProposal("Characters/Lira", "rival_of", "[[Arin]]", null, null),
                new SemanticRelationProposal(ARIN, "befriends", LIRA, 0.9, null)
            ));

            // Act
            List<SemanticRelationDraftBatch> batches = service.buildDraftBatches(
                new DraftBatchOptions(true, List.of(adapter)));

            // Assert
            List<SemanticRelationDraftRow> rows = batches.get(0).rows();
            assertEquals(3, rows.size());

            SemanticRelationDraftRow allied = rows.get(0);
            assertEquals("allied_with", allied.predicate());
            assertEquals(95.0, allied.confidence());
            assertEquals("adapter:ai-pass-1", allied.sourceField());
            assertEquals("adapter:ai-pass-1:0:allied_with:" + LIRA, allied.id());

            assertEquals("located_in", rows.get(1).predicate());

            SemanticRelationDraftRow rival = rows.get(2);
            assertEquals(LIRA, rival.notePath());
            assertEquals(ARIN, rival.targetPath());
            assertEquals(70.0, rival.confidence());
            assertEquals("ai-pass-1", rival.proposalSource());
            verify(adapter, times(1)).getProposals();
        }

        @Test
        @DisplayName("a failing adapter should not prevent other rows")
        void testFailingAdapter() throws Exception {
            when(adapter.id()).thenReturn("broken");
            when(adapter.getProposals()).thenThrow(new IOException("unreachable"));

            List<SemanticRelationDraftBatch> batches = service.buildDraftBatches(
                new DraftBatchOptions(true, List.of(adapter)));

            assertEquals(2, batches.get(0).totalRows());
        }

        @Test
        @DisplayName("should page sorted rows by the configured batch size")
        void testPaging() throws Exception {
            // Arrange
            List<SemanticRelationProposal> proposals = new ArrayList<>();
            for (int i = 12; i >= 1; i--) {
                proposals.add(new SemanticRelationProposal(ARIN, "rules", String.format("Region%02d", i), 80.0, "seed"));
            }
            when(adapter.id()).thenReturn("bulk");
            when(adapter.label()).thenReturn("Bulk");
            when(adapter.getProposals()).thenReturn(proposals);

            // Act
            List<SemanticRelationDraftBatch> batches = service.buildDraftBatches(
                new DraftBatchOptions(false, List.of(adapter)));

            // Assert
            assertEquals(3, batches.size());
            assertEquals("Region01", batches.get(0).rows().get(0).targetPath());
            assertEquals(5, batches.get(1).rows().size());
            SemanticRelationDraftBatch last = batches.get(2);
            assertEquals("semantic-batch-3", last.id());
            assertEquals(2, last.index());
            assertEquals(11, last.startRow());
            assertEquals(12, last.endRow());
            assertEquals(12, last.totalRows());
            assertEquals(2, last.rows().size());
            assertEquals("seed", last.rows().get(0).sourceField());
        }

        @Test
        @DisplayName("should return no batches when there are no rows")
        void testEmpty() {
            assertTrue(service.buildDraftBatches(new DraftBatchOptions(false, List.of())).isEmpty());
        }
    }

    @Nested
    @DisplayName("Apply edited batch")
    class ApplyEditedBatch {

        @Test
        @DisplayName("should merge rows into the canonical relation field")
        void testApply() {
            // Act
            ApplyBatchResult result = service.applyEditedBatch(List.of(
                row("1", ARIN, "rival_of", "Characters/Marek.md", 72.0)));

            // Assert
            assertEquals(1, result.updatedNotes());
            assertEquals(1, result.writtenRelations());
            assertEquals(0, result.skippedRows());
            assertTrue(result.errors().isEmpty());
            assertEquals(RowStatus.APPLIED, result.rowResults().get(0).status());

            JsonNode relations = noteStore.getMetadata(ARIN).orElseThrow().frontmatter().get("relations");
            assertEquals(2, relations.size());
            assertEquals("allied_with", relations.get(0).get("predicate").asText());
            assertEquals("[[Characters/Lira]]", relations.get(0).get("target").asText());
            assertEquals("relations", relations.get(0).get("sourceField").asText());

            JsonNode rival = relations.get(1);
            assertEquals("rival_of", rival.get("predicate").asText());
            assertEquals("[[Characters/Marek]]", rival.get("target").asText());
            assertEquals(72, rival.get("confidence").asInt());
            assertEquals("batch-editor", rival.get("sourceField").asText());

            assertTrue(noteStore.content(ARIN).contains("locatedIn"));
            assertTrue(noteStore.content(ARIN).contains("Sworn knight of the realm."));
        }

        @Test
        @DisplayName("a row with the same predicate and target should replace the existing record")
        void testApplyReplaces() {
            service.applyEditedBatch(List.of(row("1", ARIN, "allied_with", LIRA, 91.5)));

            JsonNode relations = noteStore.getMetadata(ARIN).orElseThrow().frontmatter().get("relations");
            assertEquals(1, relations.size());
            assertEquals(91.5, relations.get(0).get("confidence").asDouble(), 1e-9);
            assertEquals("batch-editor", relations.get(0).get("sourceField").asText());
        }

        @Test
        @DisplayName("should skip invalid rows with every reason")
        void testSkippedRows() {
            // Act
            ApplyBatchResult result = service.applyEditedBatch(List.of(
                row("invalid-row", "", "allied_with", "", 150.0),
                row("bad-predicate", ARIN, "befriends", LIRA, 50.0)));

            // Assert
            assertEquals(2, result.skippedRows());
            assertEquals(0, result.updatedNotes());
            ApplyRowResult invalid = result.rowResults().get(0);
            assertEquals(RowStatus.SKIPPED, invalid.status());
            assertEquals("Missing required fields; Confidence out of range", invalid.reason());
            assertEquals("Invalid predicate", result.rowResults().get(1).reason());
            assertEquals(ARIN_CONTENT, noteStore.content(ARIN));
        }

        @Test
        @DisplayName("rows for a missing note should be reported as errors")
        void testMissingNote() {
            ApplyBatchResult result = service.applyEditedBatch(List.of(
                row("1", "Characters/Ghost.md", "rules", SUNHOLD, 80.0)));

            assertEquals(0, result.updatedNotes());
            assertEquals(List.of("Missing markdown note: Characters/Ghost.md"), result.errors());
            assertEquals(RowStatus.ERROR, result.rowResults().get(0).status());
            assertEquals("Missing markdown note", result.rowResults().get(0).reason());
        }

        @Test
        @DisplayName("should write to the first configured relation field")
        void testCanonicalField() {
            settingsProvider.update(s -> s.withSemanticRelationFields(List.of("links", "relations")));

            service.applyEditedBatch(List.of(row("1", LIRA, "allied_with", ARIN, 80.0)));

            JsonNode links = noteStore.getMetadata(LIRA).orElseThrow().frontmatter().get("links");
            assertNotNull(links);
            assertEquals("[[Characters/Arin]]", links.get(0).get("target").asText());
        }
    }
}
