package com.convolog.aggregate;

import com.convolog.eventmodel.EventData;
import com.convolog.eventmodel.StoredEvent;

import java.util.List;

/**
 * A consistency boundary whose state is the fold of its event stream.
 *
 * <p>Implementations are stateless strategies: the state lives in values of type {@code S} that
 * {@link AggregateLoader} rebuilds on every load. Both {@link #apply} and {@link #handle} must be
 * pure; the same inputs always produce the same outputs.
 *
 * @param <S> state type; must convert to and from a string-keyed map for snapshots
 * @param <C> command type
 */
public interface Aggregate<S, C> {

    /** Tag written as the snapshot type. */
    String type();

    /** State class, used to decode snapshots. */
    Class<S> stateType();

    /** State before any event has been applied. */
    S init();

    /**
     * Folds one event into the state.
     *
     * @throws IllegalStateException for an event type this aggregate does not know
     */
    S apply(S state, StoredEvent event);

    /**
     * Decides which events a command produces against the current state.
     *
     * @return events to append; empty when the command is a valid no-op
     * @throws CommandRejectedException when the command breaks a business rule
     */
    List<EventData> handle(S state, C command);
}
