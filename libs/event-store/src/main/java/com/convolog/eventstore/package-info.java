/**
 * Durable, append-only event log and snapshot store.
 *
 * <p>{@link com.convolog.eventstore.EventStore} and {@link com.convolog.eventstore.SnapshotStore}
 * are the seams; {@link com.convolog.eventstore.JdbcEventStore} and
 * {@link com.convolog.eventstore.JdbcSnapshotStore} implement them on Spring JDBC. Successful
 * appends are announced on an {@link com.convolog.eventstore.EventBus}.
 */
package com.convolog.eventstore;
