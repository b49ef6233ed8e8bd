package com.convolog.aggregate;

import com.convolog.eventmodel.StoredEvent;

import java.util.List;

/**
 * Outcome of a successful command.
 *
 * @param state   state after the new events were applied
 * @param version stream version after the command
 * @param events  events appended by the command; empty for a no-op
 */
public record ExecutionResult<S>(S state, long version, List<StoredEvent> events) {

    public ExecutionResult {
        events = List.copyOf(events);
    }

    public boolean noop() {
        return events.isEmpty();
    }
}
