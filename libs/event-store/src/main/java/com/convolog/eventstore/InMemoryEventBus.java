package com.convolog.eventstore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * {@link EventBus} that calls subscribers synchronously on the publishing thread.
 *
 * <p>A failing subscriber is logged and skipped so it can never fail the append that published
 * the notification. Subscribers that do real work should hand notifications off to their own
 * thread.
 */
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final List<Consumer<StreamAppended>> subscribers = new CopyOnWriteArrayList<>();

    @Override
    public void publish(StreamAppended notification) {
        for (Consumer<StreamAppended> subscriber : subscribers) {
            try {
                subscriber.accept(notification);
            } catch (RuntimeException e) {
                log.warn("Subscriber failed for stream {} (versions {}-{}); it must recover from the log",
                        notification.streamId(), notification.firstVersion(), notification.lastVersion(), e);
            }
        }
    }

    @Override
    public Subscription subscribe(Consumer<StreamAppended> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
