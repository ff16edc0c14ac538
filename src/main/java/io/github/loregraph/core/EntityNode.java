package io.github.loregraph.core;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Canonical entity derived from one note. The id is the note's vault-relative path.
 *
 * @param id            stable canonical id (note path)
 * @param canonicalName display name, usually the note basename
 * @param aliases       normalized aliases mapped to this node
 * @param mtime         last known note modification time
 * @param tags          normalized tags found on the note
 */
public record EntityNode(
        @NotNull String id,
        @NotNull String canonicalName,
        @NotNull Set<String> aliases,
        long mtime,
        @NotNull Set<String> tags) {

    public EntityNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(canonicalName, "canonicalName must not be null");
        aliases = Collections.unmodifiableSet(new LinkedHashSet<>(aliases));
        tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    /**
     * Back-reference to the note path (identical to the id).
     */
    @NotNull
    public String path() {
        return id;
    }
}
