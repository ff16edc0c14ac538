package io.github.loregraph.settings;

import io.github.loregraph.core.EntityGraphConfig;
import io.github.loregraph.core.EntityGraphSettings;
import io.github.loregraph.utils.Subscription;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Settings provider seeded from {@link EntityGraphConfig} and updatable at runtime.
 */
@ApplicationScoped
public class ConfigSettingsProvider implements SettingsProvider {

    private static final Logger logger = LoggerFactory.getLogger(ConfigSettingsProvider.class);

    private final List<SettingsListener> listeners = new CopyOnWriteArrayList<>();
    private volatile EntityGraphSettings current;

    @Inject
    public ConfigSettingsProvider(EntityGraphConfig config) {
        this(EntityGraphSettings.from(config));
    }

    public ConfigSettingsProvider(@NotNull EntityGraphSettings initial) {
        this.current = Objects.requireNonNull(initial, "initial settings must not be null");
    }

    @Override
    @NotNull
    public EntityGraphSettings current() {
        return current;
    }

    @Override
    @NotNull
    public Subscription subscribe(@NotNull SettingsListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Applies an update and notifies listeners when the snapshot actually changed.
     *
     * @param update function producing the next snapshot from the current one
     * @return the resulting snapshot
     */
    @NotNull
    public EntityGraphSettings update(@NotNull UnaryOperator<EntityGraphSettings> update) {
        EntityGraphSettings previous;
        EntityGraphSettings next;
        synchronized (this) {
            previous = current;
            next = Objects.requireNonNull(update.apply(previous), "updated settings must not be null");
            current = next;
        }

        if (previous.equals(next)) {
            return next;
        }

        logger.debug("Entity graph settings changed: {}", next);
        for (SettingsListener listener : listeners) {
            try {
                listener.onSettingsChanged(previous, next);
            } catch (RuntimeException e) {
                logger.warn("Settings listener failed: {}", e.getMessage(), e);
            }
        }
        return next;
    }
}
