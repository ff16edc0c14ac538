package io.github.loregraph.core;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canonical semantic predicates for worldbuilding relationships.
 *
 * <p>Every predicate also has a camelCase convenience front-matter key, so a note can
 * declare {@code alliedWith: "[[Characters/Lira]]"} instead of a full relation record.</p>
 */
public enum SemanticPredicate {

    PARENT_OF("parent_of", "parentOf"),
    CHILD_OF("child_of", "childOf"),
    SIBLING_OF("sibling_of", "siblingOf"),
    SPOUSE_OF("spouse_of", "spouseOf"),
    HOUSE_OF("house_of", "houseOf"),
    ALLIED_WITH("allied_with", "alliedWith"),
    RIVAL_OF("rival_of", "rivalOf"),
    RULES("rules", "rules"),
    RULED_BY("ruled_by", "ruledBy"),
    VASSAL_OF("vassal_of", "vassalOf"),
    OVERLORD_OF("overlord_of", "overlordOf"),
    MEMBER_OF("member_of", "memberOf"),
    LEADS("leads", "leads"),
    FOUNDED("founded", "founded"),
    FOUNDED_BY("founded_by", "foundedBy"),
    LOCATED_IN("located_in", "locatedIn"),
    GOVERNS("governs", "governs"),
    BORDERS("borders", "borders"),
    PART_OF("part_of", "partOf"),
    PARTICIPATED_IN("participated_in", "participatedIn"),
    OCCURRED_AT("occurred_at", "occurredAt"),
    DURING_ERA("during_era", "duringEra"),
    WIELDS("wields", "wields"),
    BOUND_TO("bound_to", "boundTo"),
    ARTIFACT_OF("artifact_of", "artifactOf");

    private static final Map<String, SemanticPredicate> ALIASES = Map.ofEntries(
            Map.entry("parent", PARENT_OF),
            Map.entry("child", CHILD_OF),
            Map.entry("sibling", SIBLING_OF),
            Map.entry("spouse", SPOUSE_OF),
            Map.entry("house", HOUSE_OF),
            Map.entry("ally", ALLIED_WITH),
            Map.entry("allies_with", ALLIED_WITH),
            Map.entry("rival", RIVAL_OF),
            Map.entry("enemy_of", RIVAL_OF),
            Map.entry("opposes", RIVAL_OF),
            Map.entry("locatedin", LOCATED_IN),
            Map.entry("residesin", LOCATED_IN),
            Map.entry("headquarteredin", LOCATED_IN),
            Map.entry("operatesin", LOCATED_IN),
            Map.entry("inhabits", LOCATED_IN),
            Map.entry("serves", MEMBER_OF),
            Map.entry("atwarwith", RIVAL_OF),
            Map.entry("borderdisputewith", BORDERS),
            Map.entry("sacredto", BOUND_TO),
            Map.entry("storedin", LOCATED_IN));

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern NON_KEY_CHARS = Pattern.compile("[^a-z0-9_]+");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_+");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

    private final String id;
    private final String frontmatterKey;

    SemanticPredicate(String id, String frontmatterKey) {
        this.id = id;
        this.frontmatterKey = frontmatterKey;
    }

    @JsonValue
    @NotNull
    public String id() {
        return id;
    }

    /**
     * Convenience front-matter key that maps directly to this predicate.
     */
    @NotNull
    public String frontmatterKey() {
        return frontmatterKey;
    }

    /**
     * Looks up a predicate by its exact canonical id.
     */
    @NotNull
    public static Optional<SemanticPredicate> fromId(@Nullable String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (SemanticPredicate predicate : values()) {
            if (predicate.id.equals(id)) {
                return Optional.of(predicate);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a free-form predicate ("alliedWith", "Enemy of", "ally") into a canonical predicate.
     *
     * @param value raw predicate text, may be null
     * @return the canonical predicate, or empty when the text names no known predicate
     */
    @NotNull
    public static Optional<SemanticPredicate> parse(@Nullable String value) {
        if (value == null) {
            return Optional.empty();
        }

        String normalized = normalizeKey(value);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }

        Optional<SemanticPredicate> canonical = fromId(normalized);
        if (canonical.isPresent()) {
            return canonical;
        }
        return Optional.ofNullable(ALIASES.get(normalized));
    }

    static String normalizeKey(String value) {
        String key = CAMEL_BOUNDARY.matcher(value.trim()).replaceAll("$1_$2");
        key = key.toLowerCase(Locale.ROOT);
        key = NON_KEY_CHARS.matcher(key).replaceAll("_");
        key = REPEATED_UNDERSCORES.matcher(key).replaceAll("_");
        return EDGE_UNDERSCORES.matcher(key).replaceAll("");
    }

    @Override
    public String toString() {
        return id;
    }
}
