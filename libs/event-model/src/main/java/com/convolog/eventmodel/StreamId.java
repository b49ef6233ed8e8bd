package com.convolog.eventmodel;

import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Identifier of an event stream, following the {@code "<kind>-<uuid>"} convention.
 *
 * <p>The kind names the entity the stream belongs to (e.g. {@code conversation}); the id is the
 * entity's UUID. Streams are not stored separately, they exist only through their events.
 *
 * @param kind lower-case entity kind, e.g. "conversation"
 * @param id unique identifier of the entity instance
 */
public record StreamId(String kind, UUID id) {

    private static final Pattern KIND = Pattern.compile("[a-z][a-z0-9_]*");

    public StreamId {
        if (kind == null || !KIND.matcher(kind).matches()) {
            throw new IllegalArgumentException("kind must match " + KIND.pattern() + ": " + kind);
        }
        Objects.requireNonNull(id, "id must not be null");
    }

    /** Creates a stream id for the given kind and entity id. */
    public static StreamId of(String kind, UUID id) {
        return new StreamId(kind, id);
    }

    /** Creates a stream id for a new entity of the given kind. */
    public static StreamId random(String kind) {
        return new StreamId(kind, UUID.randomUUID());
    }

    /**
     * Parses a {@code "<kind>-<uuid>"} string.
     *
     * @throws IllegalArgumentException if the value does not follow the convention
     */
    public static StreamId parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("stream id must not be null");
        }
        // a UUID is 36 characters, preceded by the '-' separator
        int separator = value.length() - 37;
        if (separator < 1 || value.charAt(separator) != '-') {
            throw new IllegalArgumentException("not a <kind>-<uuid> stream id: " + value);
        }
        try {
            return new StreamId(value.substring(0, separator), UUID.fromString(value.substring(separator + 1)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("not a <kind>-<uuid> stream id: " + value, e);
        }
    }

    /** Returns true if the value parses as a stream id. */
    public static boolean isValid(String value) {
        try {
            parse(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** Prefix shared by every stream of the given kind, e.g. {@code "conversation-"}. */
    public static String prefix(String kind) {
        return kind + "-";
    }

    @Override
    public String toString() {
        return kind + "-" + id;
    }
}
