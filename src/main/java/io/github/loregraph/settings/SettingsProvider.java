package io.github.loregraph.settings;

import io.github.loregraph.core.EntityGraphSettings;
import io.github.loregraph.utils.Subscription;
import org.jetbrains.annotations.NotNull;

/**
 * Source of the current runtime settings.
 */
public interface SettingsProvider {

    /**
     * Returns the current settings snapshot.
     */
    @NotNull
    EntityGraphSettings current();

    /**
     * Registers a change listener.
     *
     * @param listener listener invoked with the previous and next snapshot
     * @return handle that unregisters the listener when closed
     */
    @NotNull
    Subscription subscribe(@NotNull SettingsListener listener);
}
