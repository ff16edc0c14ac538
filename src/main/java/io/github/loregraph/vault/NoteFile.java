package io.github.loregraph.vault;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Markdown note known to the host.
 *
 * @param path     vault-relative path with {@code /} separators, e.g. {@code Places/Valoria.md}
 * @param basename file name without the {@code .md} extension
 * @param mtime    last modification time in epoch millis
 * @param ctime    creation time in epoch millis
 */
public record NoteFile(@NotNull String path, @NotNull String basename, long mtime, long ctime) {

    public NoteFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(basename, "basename must not be null");
    }

    /**
     * Builds a note whose basename is derived from the path.
     */
    @NotNull
    public static NoteFile of(@NotNull String path, long mtime, long ctime) {
        return new NoteFile(path, basenameOf(path), mtime, ctime);
    }

    @NotNull
    public static String basenameOf(@NotNull String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        return name.endsWith(".md") ? name.substring(0, name.length() - 3) : name;
    }
}
