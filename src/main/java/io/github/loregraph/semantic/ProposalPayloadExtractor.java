package io.github.loregraph.semantic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.loregraph.core.SemanticPredicate;
import io.github.loregraph.index.FrontmatterWalker;
import io.github.loregraph.index.SemanticRelationCandidate;
import io.github.loregraph.index.WikiLinks;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls relation proposals out of untrusted tool and model output.
 *
 * <p>Accepts structured payloads (nested under {@code data}, {@code result} or {@code payload},
 * listed under keys such as {@code semanticRelationProposals} or {@code relations}) as well as
 * text: JSON strings, {@code ENC:}-prefixed URL-encoded JSON, over-escaped JSON, JSON fragments
 * embedded in prose, and plain-text renderings of a {@code submitSemanticRelationProposals} call.
 * Nothing here throws on malformed input; unparseable content is dropped.</p>
 */
public final class ProposalPayloadExtractor {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final String ENCODED_PREFIX = "ENC:";
    private static final Pattern TOOL_CALL_MARKER = Pattern.compile("submitSemanticRelationProposals",
            Pattern.CASE_INSENSITIVE);

    private static final String[] ARRAY_KEYS = {
            "semanticRelationProposals", "semantic_relations", "relationProposals", "relations", "proposals", "items"
    };
    private static final String[] NESTED_KEYS = {"data", "result", "payload"};

    private static final String[] NOTE_PATH_KEYS = {"notePath", "sourcePath", "path", "fromPath", "from"};
    private static final String[] TARGET_PATH_KEYS = {"targetPath", "target", "to", "entity"};
    private static final String[] PREDICATE_KEYS = {"predicate", "relation", "type"};

    private ProposalPayloadExtractor() {
    }

    /**
     * Extracts normalized proposals, deduplicated by note, predicate and target.
     *
     * @param payload text, a Jackson tree, or any value Jackson can convert to a tree
     */
    @NotNull
    public static List<SemanticRelationProposal> extract(@Nullable Object payload) {
        Map<String, SemanticRelationProposal> deduped = new LinkedHashMap<>();
        for (JsonNode candidate : collectCandidates(payload)) {
            normalize(candidate).ifPresent(proposal -> mergeByConfidence(deduped, proposal));
        }
        return new ArrayList<>(deduped.values());
    }

    /**
     * Normalizes a proposal: paths unwrapped from wiki syntax with {@code .md} appended, predicate
     * canonicalized, confidence mapped onto an integer percent.
     *
     * @return the normalized proposal, or empty when a path or the predicate is unusable
     */
    @NotNull
    public static Optional<SemanticRelationProposal> normalize(@NotNull SemanticRelationProposal proposal) {
        String notePath = normalizePath(proposal.notePath());
        String targetPath = normalizePath(proposal.targetPath());
        Optional<SemanticPredicate> predicate = SemanticPredicate.parse(proposal.predicate());
        if (notePath.isEmpty() || targetPath.isEmpty() || predicate.isEmpty()) {
            return Optional.empty();
        }

        Double confidence = proposal.confidence() == null
                ? null
                : (double) SemanticRelationCandidate.toPercent(proposal.confidence());
        String sourceField = proposal.sourceField() != null && !proposal.sourceField().isBlank()
                ? proposal.sourceField().trim()
                : null;
        return Optional.of(new SemanticRelationProposal(notePath, predicate.get().id(), targetPath,
                confidence, sourceField));
    }

    /**
     * Stores {@code proposal} unless an entry with the same identity has a higher confidence.
     *
     * @return true if the proposal was stored
     */
    static boolean mergeByConfidence(Map<String, SemanticRelationProposal> target, SemanticRelationProposal proposal) {
        String key = proposal.identityKey();
        SemanticRelationProposal existing = target.get(key);
        if (existing != null && proposal.confidenceOrZero() < existing.confidenceOrZero()) {
            return false;
        }
        target.put(key, proposal);
        return true;
    }

    static String normalizePath(@Nullable String value) {
        String path = WikiLinks.toPathCandidate(value);
        if (path.isEmpty()) {
            return "";
        }
        return path.endsWith(".md") ? path : path + ".md";
    }

    private static Optional<SemanticRelationProposal> normalize(JsonNode record) {
        JsonNode notePath = FrontmatterWalker.firstTruthy(record, NOTE_PATH_KEYS);
        JsonNode targetPath = FrontmatterWalker.firstTruthy(record, TARGET_PATH_KEYS);
        JsonNode predicate = FrontmatterWalker.firstTruthy(record, PREDICATE_KEYS);
        if (!isText(notePath) || !isText(targetPath) || !isText(predicate)) {
            return Optional.empty();
        }

        JsonNode sourceField = record.get("sourceField");
        return normalize(new SemanticRelationProposal(
                notePath.textValue(),
                predicate.textValue(),
                targetPath.textValue(),
                FrontmatterWalker.toNumber(record.get("confidence")),
                isText(sourceField) ? sourceField.textValue() : null));
    }

    private static List<JsonNode> collectCandidates(@Nullable Object payload) {
        List<JsonNode> collected = new ArrayList<>();
        Deque<Object> queue = new ArrayDeque<>();
        Object root = toQueueItem(payload);
        if (root != null) {
            queue.add(root);
        }

        while (!queue.isEmpty()) {
            Object current = queue.poll();

            if (current instanceof String text) {
                tryParse(text).ifPresent(parsed -> enqueue(queue, parsed));
                embeddedJsonCandidates(text).forEach(parsed -> enqueue(queue, parsed));
                toolCallPayloads(text).forEach(parsed -> enqueue(queue, parsed));
                continue;
            }

            JsonNode node = (JsonNode) current;
            if (node.isArray()) {
                for (JsonNode item : node) {
                    if (isProposalLike(item)) {
                        collected.add(item);
                    }
                }
                continue;
            }
            if (!node.isObject()) {
                continue;
            }

            for (String key : ARRAY_KEYS) {
                JsonNode candidate = node.get(key);
                if (candidate != null && candidate.isArray()) {
                    queue.add(candidate);
                }
            }
            for (String key : NESTED_KEYS) {
                JsonNode nested = node.get(key);
                if (nested != null && (nested.isObject() || nested.isArray())) {
                    queue.add(nested);
                }
            }
        }
        return collected;
    }

    private static void enqueue(Collection<Object> queue, JsonNode parsed) {
        queue.add(parsed.isTextual() ? parsed.textValue() : parsed);
    }

    @Nullable
    private static Object toQueueItem(@Nullable Object payload) {
        if (payload == null) {
            return null;
        }
        if (payload instanceof String text) {
            return text;
        }
        if (payload instanceof JsonNode node) {
            return node.isTextual() ? node.textValue() : node;
        }
        try {
            return OBJECT_MAPPER.valueToTree(payload);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static boolean isProposalLike(@Nullable JsonNode value) {
        if (value == null || !value.isObject()) {
            return false;
        }
        boolean hasPredicate = isText(value.get("predicate")) || isText(value.get("relation"));
        boolean hasTarget = isText(value.get("target")) || isText(value.get("targetPath")) || isText(value.get("to"));
        boolean hasSource = isText(value.get("notePath")) || isText(value.get("sourcePath"))
                || isText(value.get("path")) || isText(value.get("fromPath"));
        return hasPredicate && hasTarget && hasSource;
    }

    private static boolean isText(@Nullable JsonNode value) {
        return value != null && value.isTextual();
    }

    /**
     * Parses JSON text, also trying the URL-decoded form of {@code ENC:} values and an
     * unescaped variant of over-escaped JSON.
     */
    static Optional<JsonNode> tryParse(String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        List<String> attempts = new ArrayList<>();
        attempts.add(trimmed);
        if (trimmed.startsWith(ENCODED_PREFIX)) {
            try {
                String encoded = trimmed.substring(ENCODED_PREFIX.length()).replace("+", "%2B");
                attempts.add(URLDecoder.decode(encoded, StandardCharsets.UTF_8));
            } catch (IllegalArgumentException e) {
                // malformed escape, the raw attempt still applies
            }
        }

        for (String attempt : attempts) {
            Optional<JsonNode> parsed = parseJson(attempt);
            if (parsed.isPresent()) {
                return parsed;
            }

            String unescaped = attempt
                    .replace("\\\"", "\"")
                    .replace("\\n", "\n")
                    .replace("\\t", "\t")
                    .replace("\\r", "\r");
            if (!unescaped.equals(attempt)) {
                parsed = parseJson(unescaped);
                if (parsed.isPresent()) {
                    return parsed;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> parseJson(String text) {
        try {
            return Optional.ofNullable(OBJECT_MAPPER.readTree(text));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static List<JsonNode> embeddedJsonCandidates(String text) {
        List<JsonNode> candidates = new ArrayList<>();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '{' && c != '[') {
                continue;
            }
            String fragment = balancedJson(text, i);
            if (!fragment.isEmpty()) {
                tryParse(fragment).ifPresent(candidates::add);
            }
        }
        return candidates;
    }

    private static List<JsonNode> toolCallPayloads(String text) {
        List<JsonNode> payloads = new ArrayList<>();
        Matcher marker = TOOL_CALL_MARKER.matcher(text);
        while (marker.find()) {
            int start = firstJsonStart(text, marker.end());
            if (start < 0) {
                continue;
            }
            String fragment = balancedJson(text, start);
            if (!fragment.isEmpty()) {
                tryParse(fragment).ifPresent(payloads::add);
            }
        }
        return payloads;
    }

    private static int firstJsonStart(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{' || c == '[') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the balanced object or array starting at {@code start}, honoring string literals
     * and escapes, or an empty string when it never closes.
     */
    static String balancedJson(String text, int start) {
        char opening = text.charAt(start);
        char closing;
        if (opening == '{') {
            closing = '}';
        } else if (opening == '[') {
            closing = ']';
        } else {
            return "";
        }

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }

            if (c == '"') {
                inString = true;
            } else if (c == opening) {
                depth++;
            } else if (c == closing) {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        return "";
    }
}
