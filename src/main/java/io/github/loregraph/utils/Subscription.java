package io.github.loregraph.utils;

/**
 * Handle returned by listener registrations. Closing it unregisters the listener.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    /**
     * Unregisters the listener. Calling it more than once has no effect.
     */
    @Override
    void close();
}
