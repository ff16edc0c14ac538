package io.github.loregraph.core;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

import java.util.Optional;

/**
 * Deterministic relation types extracted into the entity graph.
 *
 * <p>Each type carries the weight used by graph expansion scoring. Weights decrease
 * with how loose the connection is: an explicit link is worth more than two notes
 * that merely share a heading.</p>
 */
public enum RelationType {

    WIKI_LINK("wiki_link", 1.0),
    BACKLINK("backlink", 0.90),
    SHARED_TAG("shared_tag", 0.70),
    FRONTMATTER_REFERENCE("frontmatter_reference", 0.95),
    HEADING_COOCCURRENCE("heading_cooccurrence", 0.55),
    SEMANTIC_FRONTMATTER("semantic_frontmatter", 0.92);

    /** Weight applied to relation types without a dedicated weight. */
    public static final double DEFAULT_WEIGHT = 0.50;

    private final String id;
    private final double weight;

    RelationType(String id, double weight) {
        this.id = id;
        this.weight = weight;
    }

    /**
     * Wire identifier, e.g. {@code wiki_link}.
     */
    @JsonValue
    @NotNull
    public String id() {
        return id;
    }

    /**
     * Expansion scoring weight for this relation type.
     */
    public double weight() {
        return weight;
    }

    /**
     * Whether edges of this type are produced from a single source note
     * (and therefore removable by source path).
     */
    public boolean isDirect() {
        return this != SHARED_TAG && this != HEADING_COOCCURRENCE;
    }

    @NotNull
    public static Optional<RelationType> fromId(String id) {
        for (RelationType type : values()) {
            if (type.id.equals(id)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
