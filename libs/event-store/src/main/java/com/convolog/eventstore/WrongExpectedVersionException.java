package com.convolog.eventstore;

/**
 * Thrown when an append loses an optimistic concurrency race: the stream is no longer at the
 * version the caller expected. Nothing from the rejected append was persisted.
 *
 * <p>Recoverable: reload the aggregate and retry, or report the conflict upstream.
 */
public class WrongExpectedVersionException extends RuntimeException {

    private final String streamId;
    private final long expectedVersion;

    public WrongExpectedVersionException(String streamId, long expectedVersion, long actualVersion) {
        super("Stream " + streamId + " is at version " + actualVersion + ", expected " + expectedVersion);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
    }

    public WrongExpectedVersionException(String streamId, long expectedVersion, Throwable cause) {
        super("Concurrent write to stream " + streamId + " after version " + expectedVersion, cause);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
    }

    public String streamId() {
        return streamId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }
}
