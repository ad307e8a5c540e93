package com.postbox.event;

/**
 * Handle returned by {@link EventStream#subscribe}. Closing it stops future delivery.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    /**
     * Stops delivery to the subscribed observer. Idempotent.
     */
    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
