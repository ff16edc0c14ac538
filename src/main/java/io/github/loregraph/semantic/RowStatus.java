package io.github.loregraph.semantic;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of applying one draft row.
 */
public enum RowStatus {
    APPLIED,
    SKIPPED,
    ERROR;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
