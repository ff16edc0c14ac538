package io.github.loregraph.vault.impl;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.loregraph.vault.NoteLink;
import io.github.loregraph.vault.NoteMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownNoteParserTest {

    private static final String VALORIA = """
            ---
            aliases: [Kingdom of Valoria]
            tags: [kingdom, "#realm"]
            ---
            # Valoria

            Ruled from [[Sunhold|the keep]] under [[Characters/Arin#Oath]].
            See [map](Maps/Valoria%20Map.md) and [site](https://example.org/page.md).
            Tagged #history, #2024 and #lore/old.

            ```
            [[Ignored]] #ignored
            # Not a heading
            ```
            ## Borders
            """;

    @Test
    @DisplayName("should split front matter from the body")
    void testFrontmatter() {
        MarkdownNoteParser.ParsedNote parsed = MarkdownNoteParser.parse("Places/Valoria.md", VALORIA);

        assertEquals("Kingdom of Valoria", parsed.frontmatter().get("aliases").get(0).asText());
        assertTrue(parsed.body().startsWith("# Valoria"));
        assertSame(parsed.frontmatter(), parsed.metadata().frontmatter());
    }

    @Test
    @DisplayName("should extract wiki and markdown links outside code fences")
    void testLinks() {
        NoteMetadata metadata = MarkdownNoteParser.parse("Places/Valoria.md", VALORIA).metadata();

        assertEquals(List.of(
            new NoteLink("Sunhold", "the keep"),
            new NoteLink("Characters/Arin", null),
            new NoteLink("Maps/Valoria Map.md", "map")
        ), metadata.links());
    }

    @Test
    @DisplayName("markdown link targets should decode only valid percent escapes")
    void testLinkTargetDecoding() {
        // Arrange
        String body = "See [[Characters/Arin]], the [discount](50%off.md), [novel](War+Peace.md), "
            + "[caf\u00e9](Caf%C3%A9.md) and [broken](Bad%C3.md).\n";

        // Act
        NoteMetadata metadata = MarkdownNoteParser.parse("Places/Valoria.md", body).metadata();

        // Assert
        assertEquals(List.of(
            new NoteLink("Characters/Arin", null),
            new NoteLink("50%off.md", "discount"),
            new NoteLink("War+Peace.md", "novel"),
            new NoteLink("Caf\u00e9.md", "caf\u00e9"),
            new NoteLink("Bad%C3.md", "broken")
        ), metadata.links());
    }

    @Test
    @DisplayName("the body should keep its line terminators after the front matter")
    void testBodyLineTerminators() {
        MarkdownNoteParser.ParsedNote unix = MarkdownNoteParser.parse("a.md", "---\ntag: lore\n---\n# Title\n\nText\n");
        MarkdownNoteParser.ParsedNote windows = MarkdownNoteParser.parse("b.md", "---\r\ntag: lore\r\n---\r\nText\r\n");
        MarkdownNoteParser.ParsedNote closingOnly = MarkdownNoteParser.parse("c.md", "---\ntag: lore\n---");

        assertEquals("# Title\n\nText\n", unix.body());
        assertEquals("lore", windows.frontmatter().get("tag").asText());
        assertEquals("Text\r\n", windows.body());
        assertEquals("lore", closingOnly.frontmatter().get("tag").asText());
        assertEquals("", closingOnly.body());
    }

    @Test
    @DisplayName("should collect front-matter and inline tags, ignoring numeric tags and headings")
    void testTags() {
        NoteMetadata metadata = MarkdownNoteParser.parse("Places/Valoria.md", VALORIA).metadata();

        assertEquals(List.of("#kingdom", "#realm", "#history", "#lore/old"), metadata.tags());
    }

    @Test
    @DisplayName("should extract headings outside code fences")
    void testHeadings() {
        NoteMetadata metadata = MarkdownNoteParser.parse("Places/Valoria.md", VALORIA).metadata();

        assertEquals(List.of("Valoria", "Borders"), metadata.headings());
    }

    @Test
    @DisplayName("invalid, non-mapping or unterminated front matter should yield empty front matter")
    void testBrokenFrontmatter() {
        MarkdownNoteParser.ParsedNote invalid = MarkdownNoteParser.parse("a.md", "---\naliases: [unclosed\n---\nBody");
        MarkdownNoteParser.ParsedNote list = MarkdownNoteParser.parse("b.md", "---\n- a\n- b\n---\nBody");
        MarkdownNoteParser.ParsedNote open = MarkdownNoteParser.parse("c.md", "---\naliases: [x]\nBody");

        assertTrue(invalid.frontmatter().isEmpty());
        assertEquals("Body", invalid.body());
        assertTrue(list.frontmatter().isEmpty());
        assertTrue(open.frontmatter().isEmpty());
        assertEquals("---\naliases: [x]\nBody", open.body());
    }

    @Test
    @DisplayName("a byte order mark should not hide the front matter")
    void testByteOrderMark() {
        MarkdownNoteParser.ParsedNote parsed = MarkdownNoteParser.parse("a.md", "\uFEFF---\ntag: lore\n---\nBody");

        assertEquals(List.of("#lore"), parsed.metadata().tags());
    }

    @Test
    @DisplayName("rendered notes should parse back to the same front matter and body")
    void testRender() throws Exception {
        // Arrange
        ObjectNode frontmatter = JsonNodeFactory.instance.objectNode();
        frontmatter.putArray("aliases").add("Sunhold Keep");
        frontmatter.putArray("relations").addObject()
            .put("predicate", "located_in")
            .put("target", "[[Places/Valoria]]")
            .put("confidence", 80);

        // Act
        String rendered = MarkdownNoteParser.render(frontmatter, "# Sunhold\n");
        MarkdownNoteParser.ParsedNote parsed = MarkdownNoteParser.parse("Places/Sunhold.md", rendered);

        // Assert
        assertTrue(rendered.startsWith("---\n"));
        assertEquals(frontmatter, parsed.frontmatter());
        assertEquals("# Sunhold\n", parsed.body());
        assertEquals(rendered, MarkdownNoteParser.render(parsed.frontmatter(), parsed.body()));
        assertEquals("# Sunhold\n", MarkdownNoteParser.render(JsonNodeFactory.instance.objectNode(), "# Sunhold\n"));
    }
}
