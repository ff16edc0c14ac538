package io.github.loregraph.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Directed relation edge between two entity nodes.
 *
 * <p>The edge id is deterministic: {@code {fromId}|{relation}[:{predicate}]|{toId}}. Extracting
 * the same relation again merges its evidence into the existing edge instead of creating a
 * second one. Confidence is clamped to [{@value #MIN_CONFIDENCE}, {@value #MAX_CONFIDENCE}].</p>
 *
 * <p>Instances are owned by the index manager and only mutated under its write lock.</p>
 */
public final class EntityEdge {

    public static final double MIN_CONFIDENCE = 0.1;
    public static final double MAX_CONFIDENCE = 1.0;

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("fromId")
    @NotNull
    private final String fromId;

    @JsonProperty("toId")
    @NotNull
    private final String toId;

    @JsonProperty("relation")
    @NotNull
    private final RelationType relation;

    @JsonProperty("confidence")
    private final double confidence;

    @JsonProperty("semanticPredicate")
    @Nullable
    private final SemanticPredicate semanticPredicate;

    @NotNull
    private final List<EvidenceRef> evidence;

    /**
     * Constructs a new edge seeded with one evidence record.
     *
     * @param fromId            source entity id (required)
     * @param toId              destination entity id (required)
     * @param relation          relation type (required)
     * @param confidence        raw confidence, clamped into range
     * @param semanticPredicate predicate for semantic front-matter edges (optional)
     * @param firstEvidence     evidence that produced the edge (required)
     */
    public EntityEdge(
            @NotNull String fromId,
            @NotNull String toId,
            @NotNull RelationType relation,
            double confidence,
            @Nullable SemanticPredicate semanticPredicate,
            @NotNull EvidenceRef firstEvidence) {
        this.fromId = Objects.requireNonNull(fromId, "fromId must not be null");
        this.toId = Objects.requireNonNull(toId, "toId must not be null");
        this.relation = Objects.requireNonNull(relation, "relation must not be null");
        this.confidence = clampConfidence(confidence);
        this.semanticPredicate = semanticPredicate;
        this.id = edgeId(fromId, relation, semanticPredicate, toId);
        this.evidence = new ArrayList<>();
        this.evidence.add(Objects.requireNonNull(firstEvidence, "firstEvidence must not be null"));
    }

    private EntityEdge(EntityEdge source) {
        this.id = source.id;
        this.fromId = source.fromId;
        this.toId = source.toId;
        this.relation = source.relation;
        this.confidence = source.confidence;
        this.semanticPredicate = source.semanticPredicate;
        this.evidence = new ArrayList<>(source.evidence);
    }

    /**
     * Detached copy whose evidence list no longer follows later merges into this edge.
     */
    @NotNull
    public EntityEdge copy() {
        return new EntityEdge(this);
    }

    /**
     * Builds the deterministic edge id.
     */
    @NotNull
    public static String edgeId(
            @NotNull String fromId,
            @NotNull RelationType relation,
            @Nullable SemanticPredicate semanticPredicate,
            @NotNull String toId) {
        String relationKey = semanticPredicate != null
                ? relation.id() + ":" + semanticPredicate.id()
                : relation.id();
        return fromId + "|" + relationKey + "|" + toId;
    }

    public static double clampConfidence(double confidence) {
        if (Double.isNaN(confidence)) {
            return MIN_CONFIDENCE;
        }
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));
    }

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public String getFromId() {
        return fromId;
    }

    @NotNull
    public String getToId() {
        return toId;
    }

    @NotNull
    public RelationType getRelation() {
        return relation;
    }

    public double getConfidence() {
        return confidence;
    }

    @Nullable
    public SemanticPredicate getSemanticPredicate() {
        return semanticPredicate;
    }

    /**
     * Evidence records in extraction order.
     *
     * @return snapshot copy of the evidence list
     */
    @JsonProperty("evidence")
    @NotNull
    public List<EvidenceRef> getEvidence() {
        return List.copyOf(evidence);
    }

    /**
     * Adds evidence unless an entry with the same path, chunk and extractor is already present.
     *
     * @return true if the evidence was added
     */
    public boolean mergeEvidence(@NotNull EvidenceRef ref) {
        for (EvidenceRef existing : evidence) {
            if (existing.sameSourceAs(ref)) {
                return false;
            }
        }
        evidence.add(ref);
        return true;
    }

    /**
     * Label used in relation paths, e.g. {@code semantic_frontmatter:allied_with}.
     */
    @NotNull
    public String relationLabel() {
        return relation == RelationType.SEMANTIC_FRONTMATTER && semanticPredicate != null
                ? relation.id() + ":" + semanticPredicate.id()
                : relation.id();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityEdge that = (EntityEdge) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "EntityEdge{" +
                "id='" + id + '\'' +
                ", confidence=" + confidence +
                ", evidence=" + evidence.size() +
                '}';
    }
}
