package com.activitytracker.events;

/**
 * Handle returned by {@link EventChannel#subscribe}; cancelling it stops further deliveries.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void cancel();

    @Override
    default void close() {
        cancel();
    }
}
