package com.activitytracker.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe channel for one event type.
 * <p>
 * Delivery is synchronous on the publishing thread. A subscriber that throws is logged and
 * does not prevent delivery to the remaining subscribers.
 *
 * @param <E> event type
 */
public class EventChannel<E> {

    private static final Logger log = LoggerFactory.getLogger(EventChannel.class);

    private final String name;
    private final List<Consumer<? super E>> subscribers = new CopyOnWriteArrayList<>();

    public EventChannel(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Subscription subscribe(Consumer<? super E> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        subscribers.add(subscriber);
        log.debug("Subscribed to {} ({} subscriber(s))", name, subscribers.size());
        return () -> subscribers.remove(subscriber);
    }

    public void publish(E event) {
        Objects.requireNonNull(event, "event");
        log.debug("Publishing {} on {}", event, name);
        for (Consumer<? super E> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException ex) {
                log.error("Subscriber of {} failed for {}", name, event, ex);
            }
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
