package io.github.loregraph.index;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes aliases and queries for deterministic matching: lowercase, bracket and brace
 * characters replaced by spaces, Unicode whitespace (including no-break spaces) collapsed.
 */
public final class AliasNormalizer {

    private static final Pattern BRACKETS = Pattern.compile("[\\[\\](){}]");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\uFEFF]+", Pattern.UNICODE_CHARACTER_CLASS);

    private AliasNormalizer() {
    }

    @NotNull
    public static String normalize(@Nullable String value) {
        if (value == null) {
            return "";
        }
        String normalized = BRACKETS.matcher(value.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(normalized).replaceAll(" ").trim();
    }
}
