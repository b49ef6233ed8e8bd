package com.convolog.eventstore;

/**
 * Storage failure in the event or snapshot store (driver error, timeout, lost connection).
 * Always surfaced to the caller; retry policy belongs to the caller.
 */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
