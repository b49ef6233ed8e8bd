package com.convolog.aggregate;

/**
 * Aggregate state rebuilt from the log.
 *
 * @param state   the folded state
 * @param version version of the last event applied, 0 for an empty stream
 */
public record LoadedAggregate<S>(S state, long version) {}
