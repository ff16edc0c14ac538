package io.github.loregraph.settings;

import io.github.loregraph.core.EntityGraphSettings;
import org.jetbrains.annotations.NotNull;

/**
 * Receives settings snapshots whenever they change.
 */
@FunctionalInterface
public interface SettingsListener {

    void onSettingsChanged(@NotNull EntityGraphSettings previous, @NotNull EntityGraphSettings next);
}
