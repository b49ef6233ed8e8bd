package com.convolog.eventstore;

import java.util.function.Consumer;

/**
 * In-process change notification channel fed by successful appends.
 *
 * <p>Delivery is best-effort: a notification published while nobody is subscribed, or lost in a
 * crash, is gone. The log stays durable regardless, so consumers that need every event pair their
 * subscription with a catch-up read of the log. Combined that way, consumers see each event at
 * least once and must apply it idempotently.
 */
public interface EventBus {

    /** Delivers the notification to every current subscriber. */
    void publish(StreamAppended notification);

    /**
     * Registers a subscriber.
     *
     * @return handle used to unsubscribe
     */
    Subscription subscribe(Consumer<StreamAppended> subscriber);

    /** Handle for an active subscription. */
    @FunctionalInterface
    interface Subscription extends AutoCloseable {

        void cancel();

        @Override
        default void close() {
            cancel();
        }
    }
}
