package io.github.loregraph.vault;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.loregraph.utils.Subscription;
import io.github.loregraph.vault.impl.MarkdownNoteParser;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Note store backed by a map of markdown strings, for tests.
 *
 * <p>{@link #put(String, String)} stores silently; {@link #write(String, String)},
 * {@link #rename(String, String)} and {@link #delete(String)} also fire change events.</p>
 */
public class InMemoryNoteStore implements NoteStore {

    private final Map<String, String> contents = new LinkedHashMap<>();
    private final Map<String, NoteFile> notes = new LinkedHashMap<>();
    private final Set<String> ineligible = new HashSet<>();
    private final List<NoteChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger listNotesCalls = new AtomicInteger();
    private final AtomicLong clock = new AtomicLong(1_000);

    public synchronized NoteFile put(String path, String content) {
        NoteFile note = NoteFile.of(path, clock.incrementAndGet(), notes.containsKey(path) ? notes.get(path).ctime() : clock.get());
        contents.put(path, content);
        notes.put(path, note);
        return note;
    }

    public NoteFile write(String path, String content) {
        boolean existed;
        synchronized (this) {
            existed = notes.containsKey(path);
        }
        NoteFile note = put(path, content);
        for (NoteChangeListener listener : listeners) {
            if (existed) {
                listener.onNoteModified(note);
            } else {
                listener.onNoteCreated(note);
            }
        }
        return note;
    }

    public NoteFile rename(String oldPath, String newPath) {
        NoteFile renamed;
        synchronized (this) {
            String content = contents.remove(oldPath);
            NoteFile old = notes.remove(oldPath);
            contents.put(newPath, content);
            renamed = NoteFile.of(newPath, clock.incrementAndGet(), old.ctime());
            notes.put(newPath, renamed);
        }
        for (NoteChangeListener listener : listeners) {
            listener.onNoteRenamed(renamed, oldPath);
        }
        return renamed;
    }

    public void delete(String path) {
        synchronized (this) {
            contents.remove(path);
            notes.remove(path);
        }
        for (NoteChangeListener listener : listeners) {
            listener.onNoteDeleted(path);
        }
    }

    public synchronized void markIneligible(String path) {
        ineligible.add(path);
    }

    public synchronized String content(String path) {
        return contents.get(path);
    }

    public int listNotesCalls() {
        return listNotesCalls.get();
    }

    @Override
    @NotNull
    public synchronized List<NoteFile> listNotes() {
        listNotesCalls.incrementAndGet();
        List<NoteFile> eligible = new ArrayList<>();
        for (NoteFile note : notes.values()) {
            if (isEligible(note)) {
                eligible.add(note);
            }
        }
        return eligible;
    }

    @Override
    @NotNull
    public synchronized Optional<NoteFile> getNote(@NotNull String path) {
        return Optional.ofNullable(notes.get(path));
    }

    @Override
    public synchronized boolean isEligible(@NotNull NoteFile note) {
        return !ineligible.contains(note.path());
    }

    @Override
    @NotNull
    public synchronized Optional<NoteMetadata> getMetadata(@NotNull String path) {
        String content = contents.get(path);
        if (content == null) {
            return Optional.empty();
        }
        return Optional.of(MarkdownNoteParser.parse(path, content).metadata());
    }

    @Override
    @NotNull
    public synchronized Optional<String> resolveLink(@NotNull String candidate, @NotNull String sourcePath) {
        String link = candidate.trim();
        if (link.isEmpty()) {
            return Optional.empty();
        }
        if (notes.containsKey(link)) {
            return Optional.of(link);
        }
        String withExtension = link.endsWith(".md") ? link : link + ".md";
        if (notes.containsKey(withExtension)) {
            return Optional.of(withExtension);
        }
        String suffix = "/" + withExtension.toLowerCase(Locale.ROOT);
        for (String path : notes.keySet()) {
            if (path.toLowerCase(Locale.ROOT).endsWith(suffix)) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }

    @Override
    @NotNull
    public synchronized String read(@NotNull String path) throws IOException {
        String content = contents.get(path);
        if (content == null) {
            throw new NoSuchFileException(path);
        }
        return content;
    }

    @Override
    public void processFrontmatter(@NotNull String path, @NotNull Consumer<ObjectNode> mutator) throws IOException {
        NoteFile note;
        synchronized (this) {
            String content = contents.get(path);
            if (content == null) {
                throw new NoSuchFileException(path, null, "Missing markdown note");
            }
            MarkdownNoteParser.ParsedNote parsed = MarkdownNoteParser.parse(path, content);
            ObjectNode frontmatter = parsed.frontmatter().deepCopy();
            mutator.accept(frontmatter);
            note = put(path, MarkdownNoteParser.render(frontmatter, parsed.body()));
        }
        for (NoteChangeListener listener : listeners) {
            listener.onNoteModified(note);
        }
    }

    @Override
    @NotNull
    public Subscription addChangeListener(@NotNull NoteChangeListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }
}
