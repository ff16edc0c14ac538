package io.github.loregraph.vault;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Parsed metadata of one note.
 *
 * @param links       outgoing links in document order
 * @param tags        tags including the leading {@code #}
 * @param headings    heading texts
 * @param frontmatter parsed front matter, empty object when the note has none
 */
public record NoteMetadata(
        @NotNull List<NoteLink> links,
        @NotNull List<String> tags,
        @NotNull List<String> headings,
        @NotNull ObjectNode frontmatter) {

    public NoteMetadata {
        links = List.copyOf(links);
        tags = List.copyOf(tags);
        headings = List.copyOf(headings);
    }

    @NotNull
    public static NoteMetadata empty() {
        return new NoteMetadata(List.of(), List.of(), List.of(), JsonNodeFactory.instance.objectNode());
    }
}
