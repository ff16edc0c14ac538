package io.github.loregraph.vault.impl;

import io.github.loregraph.utils.Subscription;
import io.github.loregraph.vault.NoteChangeListener;
import io.github.loregraph.vault.NoteFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for FileSystemNoteStore.
 *
 * Covers:
 * - Vault scanning with include and exclude globs
 * - Link resolution order
 * - Front-matter writes and change events
 */
class FileSystemNoteStoreTest {

    @TempDir
    Path vault;

    private FileSystemNoteStore store;

    @BeforeEach
    void setUp() throws IOException {
        write("Places/Valoria.md", "---\naliases: [Kingdom of Valoria]\n---\n# Valoria\n\nSee [[Sunhold]].\n");
        write("Places/Sunhold.md", "# Sunhold\n");
        write("Characters/Arin.md", "# Arin\n");
        write("Characters/Notes/Sunhold.md", "# Sunhold notes\n");
        write("Templates/Character.md", "# {{name}}\n");
        write("Places/map.png", "not markdown");

        store = new FileSystemNoteStore(vault, List.of(), List.of("Templates/**"));
    }

    private void write(String relative, String content) throws IOException {
        Path file = vault.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Nested
    @DisplayName("Scanning")
    class Scanning {

        @Test
        @DisplayName("should list eligible markdown notes sorted by path")
        void testListNotes() {
            List<String> paths = store.listNotes().stream().map(NoteFile::path).toList();

            assertEquals(List.of(
                "Characters/Arin.md",
                "Characters/Notes/Sunhold.md",
                "Places/Sunhold.md",
                "Places/Valoria.md"), paths);
        }

        @Test
        @DisplayName("excluded notes should still be readable but not eligible")
        void testExcludedNote() {
            Optional<NoteFile> template = store.getNote("Templates/Character.md");

            assertTrue(template.isPresent());
            assertFalse(store.isEligible(template.get()));
            assertEquals("Character", template.get().basename());
        }

        @Test
        @DisplayName("include globs should restrict eligible notes")
        void testIncludeGlobs() {
            FileSystemNoteStore placesOnly = new FileSystemNoteStore(vault, List.of("Places/**"), List.of());

            assertEquals(2, placesOnly.listNotes().size());
        }

        @Test
        @DisplayName("a missing vault root should yield no notes")
        void testMissingRoot() {
            FileSystemNoteStore missing = new FileSystemNoteStore(vault.resolve("nowhere"), List.of(), List.of());

            assertTrue(missing.listNotes().isEmpty());
        }

        @Test
        @DisplayName("paths escaping the vault root should be rejected")
        void testPathEscape() {
            assertThrows(IllegalArgumentException.class, () -> store.read("../outside.md"));
        }
    }

    @Nested
    @DisplayName("Link resolution")
    class LinkResolution {

        @Test
        @DisplayName("should resolve exact paths with or without extension")
        void testExact() {
            assertEquals(Optional.of("Places/Sunhold.md"), store.resolveLink("Places/Sunhold", "Characters/Arin.md"));
            assertEquals(Optional.of("Places/Sunhold.md"), store.resolveLink("[[Places/Sunhold.md|keep]]", "Characters/Arin.md"));
        }

        @Test
        @DisplayName("should prefer a note next to the source before a basename match")
        void testRelativeToSource() {
            assertEquals(Optional.of("Places/Sunhold.md"), store.resolveLink("Sunhold", "Places/Valoria.md"));
            assertEquals(Optional.of("Characters/Notes/Sunhold.md"),
                store.resolveLink("Notes/Sunhold", "Characters/Arin.md"));
        }

        @Test
        @DisplayName("should fall back to a case-insensitive basename match")
        void testBasenameMatch() {
            assertEquals(Optional.of("Characters/Arin.md"), store.resolveLink("arin#Oath", "Places/Valoria.md"));
            assertEquals(Optional.empty(), store.resolveLink("Marek", "Places/Valoria.md"));
            assertEquals(Optional.empty(), store.resolveLink("  ", "Places/Valoria.md"));
        }
    }

    @Nested
    @DisplayName("Writes and events")
    class WritesAndEvents {

        private NoteChangeListener listener;
        private Subscription subscription;

        @BeforeEach
        void subscribe() {
            store.refresh();
            listener = mock(NoteChangeListener.class);
            subscription = store.addChangeListener(listener);
        }

        @Test
        @DisplayName("processFrontmatter should rewrite the note and fire a modify event")
        void testProcessFrontmatter() throws Exception {
            // Arrange
            assertEquals("Kingdom of Valoria",
                store.getMetadata("Places/Valoria.md").orElseThrow().frontmatter().get("aliases").get(0).asText());

            // Act
            store.processFrontmatter("Places/Valoria.md", frontmatter -> frontmatter.put("rules", "[[Sunhold]]"));

            // Assert
            String content = Files.readString(vault.resolve("Places/Valoria.md"));
            assertTrue(content.contains("rules:"));
            assertTrue(content.endsWith("# Valoria\n\nSee [[Sunhold]].\n"), "body and final newline kept");
            assertEquals("[[Sunhold]]",
                store.getMetadata("Places/Valoria.md").orElseThrow().frontmatter().get("rules").asText());
            verify(listener).onNoteModified(argThat(note -> note.path().equals("Places/Valoria.md")));
        }

        @Test
        @DisplayName("processFrontmatter on a missing note should fail without events")
        void testProcessFrontmatterMissing() {
            assertThrows(NoSuchFileException.class,
                () -> store.processFrontmatter("Places/Nowhere.md", frontmatter -> frontmatter.put("x", 1)));
            verifyNoInteractions(listener);
        }

        @Test
        @DisplayName("writeNote should fire create then modify")
        void testWriteNote() throws Exception {
            store.writeNote("Places/Grayharbor.md", "# Grayharbor\n");
            store.writeNote("Places/Grayharbor.md", "# Grayharbor\n\nA port.\n");

            verify(listener).onNoteCreated(argThat(note -> note.path().equals("Places/Grayharbor.md")));
            verify(listener).onNoteModified(argThat(note -> note.path().equals("Places/Grayharbor.md")));
            assertTrue(store.getNote("Places/Grayharbor.md").isPresent());
        }

        @Test
        @DisplayName("rename and delete should update the index and fire events")
        void testRenameAndDelete() throws Exception {
            NoteFile renamed = store.rename("Characters/Arin.md", "Characters/Arin Vale.md");
            store.delete("Places/Sunhold.md");

            assertEquals("Arin Vale", renamed.basename());
            assertTrue(store.getNote("Characters/Arin.md").isEmpty());
            assertTrue(store.getNote("Places/Sunhold.md").isEmpty());
            verify(listener).onNoteRenamed(renamed, "Characters/Arin.md");
            verify(listener).onNoteDeleted("Places/Sunhold.md");
        }

        @Test
        @DisplayName("notifyChanged should report external edits and deletions")
        void testNotifyChanged() throws Exception {
            write("Places/Eastwatch.md", "# Eastwatch\n");
            Files.delete(vault.resolve("Places/Sunhold.md"));

            store.notifyChanged("Places/Eastwatch.md");
            store.notifyChanged("Places/Sunhold.md");

            verify(listener).onNoteCreated(argThat(note -> note.path().equals("Places/Eastwatch.md")));
            verify(listener).onNoteDeleted("Places/Sunhold.md");
        }

        @Test
        @DisplayName("cancelled subscriptions should receive no events")
        void testUnsubscribe() throws Exception {
            subscription.close();

            store.delete("Places/Sunhold.md");

            verify(listener, never()).onNoteDeleted(anyString());
        }
    }
}
