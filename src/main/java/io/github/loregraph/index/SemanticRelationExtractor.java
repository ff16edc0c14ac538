package io.github.loregraph.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.loregraph.core.SemanticPredicate;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Extracts semantic relations from a note's front matter.
 *
 * <p>Two shapes are read: configured relation fields holding records such as
 * {@code {predicate: allied_with, target: "[[Characters/Lira]]", confidence: 0.84}}, and the
 * fixed convenience keys of {@link SemanticPredicate} ({@code alliedWith: "[[Characters/Lira]]"}).
 * A bare string only counts under a convenience key, where the key supplies the predicate.
 * Records with an unknown predicate or no resolvable target are dropped.</p>
 */
public final class SemanticRelationExtractor {

    private static final String[] PREDICATE_KEYS = {"predicate", "relation", "type"};
    private static final String[] TARGET_KEYS = {"target", "to", "entity", "path", "note"};

    private final String sourcePath;
    private final Function<String, Optional<String>> targetResolver;
    private final List<SemanticRelationCandidate> out = new ArrayList<>();

    private SemanticRelationExtractor(String sourcePath, Function<String, Optional<String>> targetResolver) {
        this.sourcePath = sourcePath;
        this.targetResolver = targetResolver;
    }

    /**
     * @param frontmatter    parsed front matter
     * @param sourcePath     path of the note the front matter belongs to; self-targets are dropped
     * @param relationFields configured relation field names
     * @param targetResolver resolves a raw target candidate to a note path
     * @return candidates in field order, not deduplicated
     */
    @NotNull
    public static List<SemanticRelationCandidate> extract(
            @NotNull ObjectNode frontmatter,
            @NotNull String sourcePath,
            @NotNull List<String> relationFields,
            @NotNull Function<String, Optional<String>> targetResolver) {
        SemanticRelationExtractor extractor = new SemanticRelationExtractor(sourcePath, targetResolver);

        for (String field : relationFields) {
            extractor.collect(frontmatter.get(field), field, null);
        }
        for (SemanticPredicate predicate : SemanticPredicate.values()) {
            extractor.collect(frontmatter.get(predicate.frontmatterKey()), predicate.frontmatterKey(), predicate);
        }
        return extractor.out;
    }

    private void collect(@Nullable JsonNode value, String sourceField, @Nullable SemanticPredicate defaultPredicate) {
        if (value == null) {
            return;
        }

        switch (value.getNodeType()) {
            case STRING -> {
                if (defaultPredicate == null) {
                    return;
                }
                for (String target : resolveTargets(value)) {
                    out.add(new SemanticRelationCandidate(target, defaultPredicate, null, sourceField));
                }
            }
            case ARRAY -> {
                for (JsonNode entry : value) {
                    collect(entry, sourceField, defaultPredicate);
                }
            }
            case OBJECT -> collectRecord(value, sourceField, defaultPredicate);
            default -> {
                // scalars other than strings carry no relation
            }
        }
    }

    private void collectRecord(JsonNode record, String sourceField, @Nullable SemanticPredicate defaultPredicate) {
        JsonNode predicateNode = FrontmatterWalker.firstTruthy(record, PREDICATE_KEYS);
        Optional<SemanticPredicate> predicate;
        if (predicateNode == null) {
            predicate = Optional.ofNullable(defaultPredicate);
        } else {
            predicate = predicateNode.isTextual()
                    ? SemanticPredicate.parse(predicateNode.textValue())
                    : Optional.empty();
        }
        if (predicate.isEmpty()) {
            return;
        }

        Double confidence = FrontmatterWalker.toNumber(record.get("confidence"));
        for (String target : resolveTargets(FrontmatterWalker.firstTruthy(record, TARGET_KEYS))) {
            out.add(new SemanticRelationCandidate(target, predicate.get(), confidence, sourceField));
        }
    }

    private Set<String> resolveTargets(@Nullable JsonNode value) {
        Set<String> candidates = new LinkedHashSet<>();
        FrontmatterWalker.forEachString(value, text -> {
            List<String> wikiTargets = WikiLinks.extractTargets(text);
            if (!wikiTargets.isEmpty()) {
                candidates.addAll(wikiTargets);
                return;
            }
            String trimmed = text.trim();
            if (!trimmed.isEmpty()) {
                candidates.add(trimmed);
            }
        });

        Set<String> resolved = new LinkedHashSet<>();
        for (String candidate : candidates) {
            targetResolver.apply(candidate)
                    .filter(path -> !path.equals(sourcePath))
                    .ifPresent(resolved::add);
        }
        return resolved;
    }
}
