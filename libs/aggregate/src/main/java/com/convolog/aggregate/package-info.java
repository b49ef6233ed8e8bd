/**
 * Aggregate contract and the command-execution pipeline.
 *
 * <p>An {@link com.convolog.aggregate.Aggregate} is a pure strategy; the
 * {@link com.convolog.aggregate.AggregateLoader} rebuilds its state from the event store for
 * every command and appends the result under optimistic concurrency.
 */
package com.convolog.aggregate;
