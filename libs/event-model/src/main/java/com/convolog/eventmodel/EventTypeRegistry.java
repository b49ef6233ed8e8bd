package com.convolog.eventmodel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Two-way mapping between event type tags and the payload classes that represent them.
 *
 * <p>Each tag maps to exactly one payload class and vice versa. Lookups of unregistered tags
 * return empty from {@link #classFor(String)}; {@link #decode(StoredEvent)} treats them as a
 * programming error.
 *
 * @param <E> common supertype of the payloads, typically a sealed interface
 */
public final class EventTypeRegistry<E> {

    private final Map<String, Class<? extends E>> classesByType = new LinkedHashMap<>();
    private final Map<Class<?>, String> typesByClass = new LinkedHashMap<>();

    /**
     * Registers a payload class under the given tag.
     *
     * @throws IllegalArgumentException if the tag or class is already registered
     */
    public EventTypeRegistry<E> register(String eventType, Class<? extends E> payloadType) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType must not be null or blank");
        }
        if (classesByType.containsKey(eventType)) {
            throw new IllegalArgumentException("event type already registered: " + eventType);
        }
        if (typesByClass.containsKey(payloadType)) {
            throw new IllegalArgumentException("payload class already registered: " + payloadType.getName());
        }
        classesByType.put(eventType, payloadType);
        typesByClass.put(payloadType, eventType);
        return this;
    }

    /** Looks up the payload class for a tag. Case-sensitive. */
    public Optional<Class<? extends E>> classFor(String eventType) {
        return Optional.ofNullable(classesByType.get(eventType));
    }

    /**
     * Returns the tag of a payload.
     *
     * @throws IllegalArgumentException if the payload's class is not registered
     */
    public String typeOf(E payload) {
        String type = typesByClass.get(payload.getClass());
        if (type == null) {
            throw new IllegalArgumentException("unregistered payload class: " + payload.getClass().getName());
        }
        return type;
    }

    /** Checks whether a tag is registered. */
    public boolean isKnown(String eventType) {
        return classesByType.containsKey(eventType);
    }

    /** All registered tags, in registration order. */
    public Set<String> eventTypes() {
        return Collections.unmodifiableSet(classesByType.keySet());
    }

    /** Converts a typed payload into its string-keyed storage form. */
    public EventData encode(E payload) {
        return EventData.of(typeOf(payload), EventSerializer.toData(payload));
    }

    /**
     * Converts a stored event back into its typed payload.
     *
     * @throws IllegalStateException if the event type is not registered
     */
    public E decode(StoredEvent event) {
        Class<? extends E> payloadType = classFor(event.eventType())
                .orElseThrow(() -> new IllegalStateException(
                        "unknown event type " + event.eventType() + " in stream " + event.streamId()));
        return EventSerializer.fromData(event.data(), payloadType);
    }
}
