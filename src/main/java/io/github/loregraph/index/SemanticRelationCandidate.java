package io.github.loregraph.index;

import io.github.loregraph.core.SemanticPredicate;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Semantic relation read from front matter before confidence normalization.
 *
 * @param targetPath    resolved target note path
 * @param predicate     canonical predicate
 * @param rawConfidence declared confidence as written, {@code null} when absent or not numeric
 * @param sourceField   front-matter field the relation came from
 */
public record SemanticRelationCandidate(
        @NotNull String targetPath,
        @NotNull SemanticPredicate predicate,
        @Nullable Double rawConfidence,
        @NotNull String sourceField) {

    /**
     * Confidence as a fraction in [0.1, 1]: values up to 1 are fractions, larger values percentages.
     */
    public double fractionConfidence(int defaultPercent) {
        double value;
        if (rawConfidence == null) {
            value = defaultPercent / 100.0;
        } else if (rawConfidence <= 1) {
            value = rawConfidence;
        } else {
            value = rawConfidence / 100.0;
        }
        return Math.max(0.1, Math.min(1.0, value));
    }

    /**
     * Confidence as an integer percent in [0, 100]; absent confidence yields {@code defaultPercent}.
     */
    public int percentConfidence(int defaultPercent) {
        if (rawConfidence == null) {
            return defaultPercent;
        }
        return toPercent(rawConfidence);
    }

    /**
     * Maps a fraction (up to 1) or a percentage onto an integer percent in [0, 100].
     */
    public static int toPercent(double value) {
        double percent = value <= 1 ? Math.floor(value * 100) : Math.floor(value);
        return (int) Math.min(100, Math.max(0, percent));
    }
}
