package io.github.loregraph.index;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wiki-link syntax helpers: {@code [[target#section|display]]}.
 */
public final class WikiLinks {

    private static final Pattern WIKI_LINK = Pattern.compile("\\[\\[([^\\]|#]+)(?:#[^\\]]+)?(?:\\|[^\\]]+)?\\]\\]");
    private static final Pattern WHOLE_WIKI_LINK = Pattern.compile("^" + WIKI_LINK.pattern() + "$");

    private WikiLinks() {
    }

    /**
     * Extracts the link targets of every wiki link in the text, without section or display suffix.
     */
    @NotNull
    public static List<String> extractTargets(@Nullable String text) {
        List<String> targets = new ArrayList<>();
        if (text == null) {
            return targets;
        }
        Matcher matcher = WIKI_LINK.matcher(text);
        while (matcher.find()) {
            String target = matcher.group(1).trim();
            if (!target.isEmpty()) {
                targets.add(target);
            }
        }
        return targets;
    }

    /**
     * Returns the target when the whole (trimmed) value is exactly one wiki link.
     */
    @NotNull
    public static Optional<String> unwrap(@NotNull String value) {
        Matcher matcher = WHOLE_WIKI_LINK.matcher(value.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String target = matcher.group(1).trim();
        return target.isEmpty() ? Optional.empty() : Optional.of(target);
    }

    /**
     * Strips wiki syntax, section and display suffixes from a path candidate.
     */
    @NotNull
    public static String toPathCandidate(@Nullable String value) {
        if (value == null) {
            return "";
        }
        String raw = value.trim();
        if (raw.isEmpty()) {
            return "";
        }
        Optional<String> unwrapped = unwrap(raw);
        if (unwrapped.isPresent()) {
            return unwrapped.get();
        }
        String candidate = raw.split("\\|", -1)[0];
        return candidate.split("#", -1)[0].trim();
    }
}
