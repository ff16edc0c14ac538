package io.github.loregraph.vault.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.github.loregraph.vault.NoteLink;
import io.github.loregraph.vault.NoteMetadata;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses markdown notes into front matter, body and link/tag/heading metadata.
 */
public final class MarkdownNoteParser {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownNoteParser.class);

    private static final YAMLMapper YAML_MAPPER = YAMLMapper.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
            .build();

    private static final String DELIMITER = "---";

    private static final Pattern WIKI_LINK = Pattern.compile(
            "\\[\\[([^\\]|#]+)(#[^\\]|]*)?(\\|([^\\]]+))?\\]\\]");
    private static final Pattern MARKDOWN_LINK = Pattern.compile(
            "(?<!!)\\[([^\\]]*)\\]\\(([^)\\s]+?\\.md)(#[^)\\s]*)?\\)");
    private static final Pattern INLINE_TAG = Pattern.compile(
            "(?:^|(?<=\\s))#([\\p{L}\\p{N}_/-]*[\\p{L}_/-][\\p{L}\\p{N}_/-]*)");
    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s+(.+?)\\s*#*\\s*$");
    private static final Pattern TAG_SEPARATOR = Pattern.compile("[,\\s]+");

    /**
     * One parsed note.
     *
     * @param frontmatter parsed front matter, empty when absent or invalid
     * @param body        note text after the front matter block
     * @param metadata    links, tags and headings
     */
    public record ParsedNote(@NotNull ObjectNode frontmatter, @NotNull String body, @NotNull NoteMetadata metadata) {
    }

    private MarkdownNoteParser() {
    }

    @NotNull
    public static ParsedNote parse(@NotNull String path, @NotNull String content) {
        String text = content.startsWith("\uFEFF") ? content.substring(1) : content;
        ObjectNode frontmatter = JsonNodeFactory.instance.objectNode();
        String body = text;

        int firstLineEnd = lineEnd(text, 0);
        if (text.substring(0, firstLineEnd).trim().equals(DELIMITER)) {
            int yamlStart = nextLineStart(text, firstLineEnd);
            int cursor = yamlStart;
            while (cursor < text.length()) {
                int end = lineEnd(text, cursor);
                String line = text.substring(cursor, end).trim();
                if (line.equals(DELIMITER) || line.equals("...")) {
                    frontmatter = parseYaml(path, text.substring(yamlStart, cursor));
                    body = text.substring(nextLineStart(text, end));
                    break;
                }
                cursor = nextLineStart(text, end);
            }
        }

        return new ParsedNote(frontmatter, body, new NoteMetadata(
                extractLinks(body),
                extractTags(body, frontmatter),
                extractHeadings(body),
                frontmatter));
    }

    private static int lineEnd(String text, int from) {
        int i = from;
        while (i < text.length() && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
            i++;
        }
        return i;
    }

    private static int nextLineStart(String text, int lineEnd) {
        if (lineEnd >= text.length()) {
            return text.length();
        }
        if (text.charAt(lineEnd) == '\r' && lineEnd + 1 < text.length() && text.charAt(lineEnd + 1) == '\n') {
            return lineEnd + 2;
        }
        return lineEnd + 1;
    }

    /**
     * Renders a note back to markdown with the given front matter.
     */
    @NotNull
    public static String render(@NotNull ObjectNode frontmatter, @NotNull String body) throws JsonProcessingException {
        if (frontmatter.isEmpty()) {
            return body;
        }
        String yaml = YAML_MAPPER.writeValueAsString(frontmatter);
        StringBuilder sb = new StringBuilder(yaml.length() + body.length() + 16);
        sb.append(DELIMITER).append('\n').append(yaml);
        if (!yaml.endsWith("\n")) {
            sb.append('\n');
        }
        sb.append(DELIMITER).append('\n').append(body);
        return sb.toString();
    }

    private static ObjectNode parseYaml(String path, String yaml) {
        if (yaml.isBlank()) {
            return JsonNodeFactory.instance.objectNode();
        }
        try {
            JsonNode node = YAML_MAPPER.readTree(yaml);
            if (node instanceof ObjectNode objectNode) {
                return objectNode;
            }
            logger.debug("Front matter of {} is not a mapping, ignoring it", path);
        } catch (JsonProcessingException e) {
            logger.warn("Invalid front matter in {}: {}", path, e.getOriginalMessage());
        }
        return JsonNodeFactory.instance.objectNode();
    }

    private static List<NoteLink> extractLinks(String body) {
        List<NoteLink> links = new ArrayList<>();
        forEachProseLine(body, line -> {
            Matcher wiki = WIKI_LINK.matcher(line);
            while (wiki.find()) {
                String target = wiki.group(1).trim();
                if (!target.isEmpty()) {
                    links.add(new NoteLink(target, blankToNull(wiki.group(4))));
                }
            }

            Matcher markdown = MARKDOWN_LINK.matcher(line);
            while (markdown.find()) {
                String target = markdown.group(2);
                if (target.contains("://")) {
                    continue;
                }
                links.add(new NoteLink(decodePercentEscapes(target), blankToNull(markdown.group(1))));
            }
        });
        return links;
    }

    /**
     * Decodes {@code %XX} escapes in a markdown link target. A {@code %} without two hex digits and
     * {@code +} are kept as written; a target whose escapes are not valid UTF-8 is returned unchanged.
     */
    static String decodePercentEscapes(String target) {
        if (target.indexOf('%') < 0) {
            return target;
        }
        StringBuilder out = new StringBuilder(target.length());
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        int i = 0;
        try {
            while (i < target.length()) {
                char c = target.charAt(i);
                if (c == '%' && i + 2 < target.length() && isHex(target.charAt(i + 1)) && isHex(target.charAt(i + 2))) {
                    pending.write(Integer.parseInt(target.substring(i + 1, i + 3), 16));
                    i += 3;
                    continue;
                }
                flushUtf8(pending, out);
                out.append(c);
                i++;
            }
            flushUtf8(pending, out);
        } catch (CharacterCodingException e) {
            logger.debug("Link target {} has invalid escapes, keeping it as written", target);
            return target;
        }
        return out.toString();
    }

    private static void flushUtf8(ByteArrayOutputStream pending, StringBuilder out) throws CharacterCodingException {
        if (pending.size() == 0) {
            return;
        }
        out.append(StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(pending.toByteArray())));
        pending.reset();
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static List<String> extractTags(String body, ObjectNode frontmatter) {
        Set<String> tags = new LinkedHashSet<>();
        collectFrontmatterTags(frontmatter.get("tags"), tags);
        collectFrontmatterTags(frontmatter.get("tag"), tags);

        forEachProseLine(body, line -> {
            if (HEADING.matcher(line).matches()) {
                return;
            }
            Matcher matcher = INLINE_TAG.matcher(line);
            while (matcher.find()) {
                tags.add("#" + matcher.group(1));
            }
        });
        return new ArrayList<>(tags);
    }

    private static void collectFrontmatterTags(JsonNode value, Set<String> out) {
        if (value == null || value.isNull()) {
            return;
        }
        if (value.isArray()) {
            value.forEach(item -> collectFrontmatterTags(item, out));
            return;
        }
        if (value.isValueNode()) {
            for (String part : TAG_SEPARATOR.split(value.asText())) {
                String tag = part.startsWith("#") ? part.substring(1) : part;
                if (!tag.isEmpty()) {
                    out.add("#" + tag);
                }
            }
        }
    }

    private static List<String> extractHeadings(String body) {
        List<String> headings = new ArrayList<>();
        forEachProseLine(body, line -> {
            Matcher matcher = HEADING.matcher(line);
            if (matcher.matches()) {
                headings.add(matcher.group(1));
            }
        });
        return headings;
    }

    private static void forEachProseLine(String body, Consumer<String> action) {
        boolean inFence = false;
        for (String line : body.lines().toList()) {
            String trimmed = line.trim();
            if (trimmed.startsWith("```") || trimmed.startsWith("~~~")) {
                inFence = !inFence;
                continue;
            }
            if (!inFence) {
                action.accept(line);
            }
        }
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
