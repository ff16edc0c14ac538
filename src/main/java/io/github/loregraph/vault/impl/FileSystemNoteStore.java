package io.github.loregraph.vault.impl;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.loregraph.core.EntityGraphConfig;
import io.github.loregraph.utils.Subscription;
import io.github.loregraph.vault.NoteChangeListener;
import io.github.loregraph.vault.NoteFile;
import io.github.loregraph.vault.NoteMetadata;
import io.github.loregraph.vault.NoteStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Note store backed by a directory of markdown files.
 *
 * <p>Notes are keyed by their {@code /}-separated path relative to the vault root. The path
 * index is built on first use; changes made through this store (front-matter writes, renames,
 * deletes) keep it current and notify listeners. External edits are picked up by
 * {@link #notifyChanged(String)} or {@link #refresh()}.</p>
 */
@ApplicationScoped
public class FileSystemNoteStore implements NoteStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemNoteStore.class);

    private static final String MARKDOWN_EXTENSION = ".md";

    private final Path root;
    private final List<PathMatcher> includes;
    private final List<PathMatcher> excludes;
    private final List<NoteChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, CachedMetadata> metadataCache = new ConcurrentHashMap<>();

    // Sorted so link resolution by basename is deterministic.
    private final TreeMap<String, NoteFile> notesByPath = new TreeMap<>();
    private boolean scanned;

    private record CachedMetadata(long mtime, NoteMetadata metadata) {
    }

    @Inject
    public FileSystemNoteStore(EntityGraphConfig config) {
        this(Path.of(config.vault().root()),
                config.vault().include().orElse(List.of()),
                config.vault().exclude().orElse(List.of()));
    }

    public FileSystemNoteStore(@NotNull Path root, @NotNull List<String> include, @NotNull List<String> exclude) {
        this.root = root.toAbsolutePath().normalize();
        this.includes = toMatchers(include);
        this.excludes = toMatchers(exclude);
        logger.info("File-system note store rooted at {} (include={}, exclude={})", this.root, include, exclude);
    }

    @NotNull
    public Path getRoot() {
        return root;
    }

    /**
     * Re-scans the vault directory, replacing the path index.
     */
    public synchronized void refresh() {
        notesByPath.clear();
        metadataCache.clear();
        scanned = true;

        if (!Files.isDirectory(root)) {
            logger.warn("Vault root {} does not exist, no notes indexed", root);
            return;
        }

        try (Stream<Path> files = Files.walk(root)) {
            files.filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(MARKDOWN_EXTENSION))
                    .forEach(file -> {
                        NoteFile note = loadNoteFile(relativize(file));
                        if (note != null) {
                            notesByPath.put(note.path(), note);
                        }
                    });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan vault " + root, e);
        }

        logger.debug("Scanned vault {}: {} markdown notes", root, notesByPath.size());
    }

    @Override
    @NotNull
    public synchronized List<NoteFile> listNotes() {
        ensureScanned();
        List<NoteFile> eligible = new ArrayList<>();
        for (NoteFile note : notesByPath.values()) {
            if (isEligible(note)) {
                eligible.add(note);
            }
        }
        return eligible;
    }

    @Override
    @NotNull
    public synchronized Optional<NoteFile> getNote(@NotNull String path) {
        ensureScanned();
        return Optional.ofNullable(notesByPath.get(path));
    }

    @Override
    public boolean isEligible(@NotNull NoteFile note) {
        Path relative = Path.of(note.path());
        if (!includes.isEmpty() && includes.stream().noneMatch(matcher -> matcher.matches(relative))) {
            return false;
        }
        return excludes.stream().noneMatch(matcher -> matcher.matches(relative));
    }

    @Override
    @NotNull
    public Optional<NoteMetadata> getMetadata(@NotNull String path) {
        Optional<NoteFile> note = getNote(path);
        if (note.isEmpty()) {
            return Optional.empty();
        }

        long mtime = note.get().mtime();
        CachedMetadata cached = metadataCache.get(path);
        if (cached != null && cached.mtime() == mtime) {
            return Optional.of(cached.metadata());
        }

        try {
            NoteMetadata metadata = MarkdownNoteParser.parse(path, read(path)).metadata();
            metadataCache.put(path, new CachedMetadata(mtime, metadata));
            return Optional.of(metadata);
        } catch (IOException e) {
            logger.warn("Failed to read metadata of {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    @NotNull
    public synchronized Optional<String> resolveLink(@NotNull String candidate, @NotNull String sourcePath) {
        ensureScanned();
        String linkPath = stripLinkSyntax(candidate);
        if (linkPath.isEmpty()) {
            return Optional.empty();
        }

        String withExtension = linkPath.endsWith(MARKDOWN_EXTENSION) ? linkPath : linkPath + MARKDOWN_EXTENSION;
        for (String exact : List.of(linkPath, withExtension)) {
            if (notesByPath.containsKey(exact)) {
                return Optional.of(exact);
            }
        }

        int folderEnd = sourcePath.lastIndexOf('/');
        if (folderEnd > 0) {
            String relative = normalizeRelative(sourcePath.substring(0, folderEnd) + "/" + withExtension);
            if (relative != null && notesByPath.containsKey(relative)) {
                return Optional.of(relative);
            }
        }

        String lowerSuffix = withExtension.toLowerCase(Locale.ROOT);
        for (String path : notesByPath.keySet()) {
            String lowerPath = path.toLowerCase(Locale.ROOT);
            if (lowerPath.equals(lowerSuffix) || lowerPath.endsWith("/" + lowerSuffix)) {
                return Optional.of(path);
            }
        }

        return Optional.empty();
    }

    @Override
    @NotNull
    public String read(@NotNull String path) throws IOException {
        return Files.readString(resolve(path));
    }

    @Override
    public void processFrontmatter(@NotNull String path, @NotNull Consumer<ObjectNode> mutator) throws IOException {
        NoteFile updated;
        synchronized (this) {
            ensureScanned();
            if (!notesByPath.containsKey(path)) {
                throw new NoSuchFileException(path, null, "Missing markdown note");
            }

            MarkdownNoteParser.ParsedNote parsed = MarkdownNoteParser.parse(path, read(path));
            ObjectNode frontmatter = parsed.frontmatter().deepCopy();
            mutator.accept(frontmatter);
            Files.writeString(resolve(path), MarkdownNoteParser.render(frontmatter, parsed.body()));

            updated = refreshEntry(path);
        }

        if (updated != null) {
            fire(listener -> listener.onNoteModified(updated));
        }
    }

    /**
     * Writes a note and emits a create or modify event.
     */
    @NotNull
    public NoteFile writeNote(@NotNull String path, @NotNull String content) throws IOException {
        NoteFile note;
        boolean existed;
        synchronized (this) {
            ensureScanned();
            existed = notesByPath.containsKey(path);
            Path file = resolve(path);
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, content);
            note = refreshEntry(path);
        }
        if (note == null) {
            throw new NoSuchFileException(path);
        }

        NoteFile written = note;
        fire(listener -> {
            if (existed) {
                listener.onNoteModified(written);
            } else {
                listener.onNoteCreated(written);
            }
        });
        return written;
    }

    /**
     * Re-reads one path after an external edit and emits the matching event.
     */
    public void notifyChanged(@NotNull String path) {
        boolean existed;
        NoteFile current;
        synchronized (this) {
            ensureScanned();
            existed = notesByPath.containsKey(path);
            current = refreshEntry(path);
        }

        if (current == null) {
            if (existed) {
                fire(listener -> listener.onNoteDeleted(path));
            }
            return;
        }
        fire(listener -> {
            if (existed) {
                listener.onNoteModified(current);
            } else {
                listener.onNoteCreated(current);
            }
        });
    }

    /**
     * Moves a note and emits a rename event.
     */
    @NotNull
    public NoteFile rename(@NotNull String oldPath, @NotNull String newPath) throws IOException {
        NoteFile renamed;
        synchronized (this) {
            ensureScanned();
            if (!notesByPath.containsKey(oldPath)) {
                throw new NoSuchFileException(oldPath, null, "Missing markdown note");
            }
            Path target = resolve(newPath);
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.move(resolve(oldPath), target, StandardCopyOption.ATOMIC_MOVE);
            refreshEntry(oldPath);
            renamed = refreshEntry(newPath);
        }
        if (renamed == null) {
            throw new NoSuchFileException(newPath);
        }

        NoteFile note = renamed;
        fire(listener -> listener.onNoteRenamed(note, oldPath));
        return note;
    }

    /**
     * Deletes a note and emits a delete event.
     */
    public void delete(@NotNull String path) throws IOException {
        boolean deleted;
        synchronized (this) {
            ensureScanned();
            deleted = Files.deleteIfExists(resolve(path));
            refreshEntry(path);
        }
        if (deleted) {
            fire(listener -> listener.onNoteDeleted(path));
        }
    }

    @Override
    @NotNull
    public Subscription addChangeListener(@NotNull NoteChangeListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void ensureScanned() {
        if (!scanned) {
            refresh();
        }
    }

    @Nullable
    private NoteFile refreshEntry(String path) {
        metadataCache.remove(path);
        NoteFile note = Files.isRegularFile(resolve(path)) ? loadNoteFile(path) : null;
        if (note == null) {
            notesByPath.remove(path);
        } else {
            notesByPath.put(path, note);
        }
        return note;
    }

    @Nullable
    private NoteFile loadNoteFile(String path) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(resolve(path), BasicFileAttributes.class);
            return NoteFile.of(path,
                    attributes.lastModifiedTime().toMillis(),
                    attributes.creationTime().toMillis());
        } catch (IOException e) {
            logger.warn("Failed to stat note {}: {}", path, e.getMessage());
            return null;
        }
    }

    private void fire(Consumer<NoteChangeListener> event) {
        for (NoteChangeListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Note change listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private Path resolve(String path) {
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the vault root: " + path);
        }
        return resolved;
    }

    private String relativize(Path file) {
        return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }

    static String stripLinkSyntax(String candidate) {
        String value = candidate.trim();
        if (value.startsWith("[[") && value.endsWith("]]")) {
            value = value.substring(2, value.length() - 2);
        }
        int alias = value.indexOf('|');
        if (alias >= 0) {
            value = value.substring(0, alias);
        }
        int section = value.indexOf('#');
        if (section >= 0) {
            value = value.substring(0, section);
        }
        value = value.trim();
        while (value.startsWith("/")) {
            value = value.substring(1);
        }
        return value;
    }

    @Nullable
    private static String normalizeRelative(String path) {
        Path normalized = Path.of(path).normalize();
        if (normalized.startsWith("..")) {
            return null;
        }
        return normalized.toString().replace(normalized.getFileSystem().getSeparator(), "/");
    }

    private static List<PathMatcher> toMatchers(List<String> patterns) {
        return patterns.stream()
                .filter(pattern -> pattern != null && !pattern.isBlank())
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern.trim()))
                .toList();
    }
}
