package io.github.loregraph.retrieval;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Per-call expansion bounds. {@code null} or non-positive values fall back to the configured settings.
 */
public record AugmentationOptions(@Nullable Integer maxHops, @Nullable Integer maxExpandedDocs) {

    @NotNull
    public static AugmentationOptions defaults() {
        return new AugmentationOptions(null, null);
    }
}
