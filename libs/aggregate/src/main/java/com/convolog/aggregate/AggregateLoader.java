package com.convolog.aggregate;

import com.convolog.eventmodel.EventData;
import com.convolog.eventmodel.EventSerializer;
import com.convolog.eventmodel.EventSerializer.EventSerializationException;
import com.convolog.eventmodel.StoredEvent;
import com.convolog.eventstore.EventStore;
import com.convolog.eventstore.Snapshot;
import com.convolog.eventstore.SnapshotStore;
import com.convolog.eventstore.WrongExpectedVersionException;
import com.convolog.observability.CorrelationContextHolder;
import com.convolog.observability.MetricFactory;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stateless command pipeline: load state from the log, decide, append.
 *
 * <p>Holds no per-aggregate state and takes no locks, so any number of threads may execute
 * commands against the same stream. Races are settled by the event store, which rejects all but
 * one append at a given version with {@link WrongExpectedVersionException}. Conflicts are not
 * retried here.
 *
 * <p>When {@code snapshotEvery} is positive, a snapshot is saved whenever an append crosses a
 * multiple of it. Snapshot reads and writes never decide the outcome of a command.
 */
public class AggregateLoader {

    private static final Logger log = LoggerFactory.getLogger(AggregateLoader.class);

    /** Events read per round trip while replaying. */
    public static final int DEFAULT_PAGE_SIZE = 10_000;

    static final String METADATA_COMMAND = "command";

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final MetricFactory metrics;
    private final int pageSize;
    private final int snapshotEvery;
    private final Timer loadTimer;

    public AggregateLoader(EventStore eventStore, SnapshotStore snapshotStore, MetricFactory metrics) {
        this(eventStore, snapshotStore, metrics, DEFAULT_PAGE_SIZE, 0);
    }

    public AggregateLoader(EventStore eventStore, SnapshotStore snapshotStore, MetricFactory metrics,
                           int pageSize, int snapshotEvery) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        if (snapshotEvery < 0) {
            throw new IllegalArgumentException("snapshotEvery must be >= 0");
        }
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.metrics = metrics;
        this.pageSize = pageSize;
        this.snapshotEvery = snapshotEvery;
        this.loadTimer = metrics.timer("aggregate.load", "Time to rebuild aggregate state from the log");
    }

    /**
     * Rebuilds the state of a stream: latest snapshot if usable, then every later event.
     */
    public <S> LoadedAggregate<S> load(Aggregate<S, ?> aggregate, String streamId) {
        Timer.Sample sample = Timer.start(metrics.registry());
        try {
            return replay(aggregate, streamId);
        } finally {
            sample.stop(loadTimer);
        }
    }

    /**
     * Loads the stream, runs the command and appends what it produced at the loaded version.
     *
     * @throws CommandRejectedException      when the aggregate rejects the command
     * @throws WrongExpectedVersionException when another writer appended first
     */
    public <S, C> ExecutionResult<S> execute(Aggregate<S, C> aggregate, String streamId, C command) {
        LoadedAggregate<S> loaded = load(aggregate, streamId);

        List<EventData> decided;
        try {
            decided = aggregate.handle(loaded.state(), command);
        } catch (CommandRejectedException e) {
            count("rejected");
            log.debug("{} on {} rejected: {}", commandName(command), streamId, e.reason());
            throw e;
        }

        if (decided.isEmpty()) {
            count("noop");
            return new ExecutionResult<>(loaded.state(), loaded.version(), List.of());
        }

        List<StoredEvent> stored;
        try {
            stored = eventStore.append(streamId, loaded.version(), withMetadata(decided, command));
        } catch (WrongExpectedVersionException e) {
            count("conflict");
            log.debug("{} on {} lost a race at version {}", commandName(command), streamId, loaded.version());
            throw e;
        }

        S state = loaded.state();
        for (StoredEvent event : stored) {
            state = aggregate.apply(state, event);
        }
        long version = stored.get(stored.size() - 1).streamVersion();
        count("ok");

        maybeSnapshot(aggregate, streamId, loaded.version(), version, state);
        return new ExecutionResult<>(state, version, stored);
    }

    private <S> LoadedAggregate<S> replay(Aggregate<S, ?> aggregate, String streamId) {
        S state = aggregate.init();
        long version = 0;

        Optional<S> fromSnapshot = Optional.empty();
        Optional<Snapshot> snapshot = latestSnapshot(streamId);
        if (snapshot.isPresent()) {
            fromSnapshot = decode(aggregate, snapshot.get());
        }
        if (fromSnapshot.isPresent()) {
            state = fromSnapshot.get();
            version = snapshot.get().streamVersion();
        }

        while (true) {
            List<StoredEvent> page = eventStore.readForward(streamId, version + 1, pageSize);
            for (StoredEvent event : page) {
                state = aggregate.apply(state, event);
                version = event.streamVersion();
            }
            if (page.size() < pageSize) {
                return new LoadedAggregate<>(state, version);
            }
        }
    }

    private Optional<Snapshot> latestSnapshot(String streamId) {
        try {
            return snapshotStore.latest(streamId);
        } catch (RuntimeException e) {
            log.warn("Snapshot lookup for {} failed, replaying from the start", streamId, e);
            return Optional.empty();
        }
    }

    private <S> Optional<S> decode(Aggregate<S, ?> aggregate, Snapshot snapshot) {
        if (!aggregate.type().equals(snapshot.snapshotType())) {
            log.warn("Ignoring {} snapshot of {}: expected type {}",
                    snapshot.snapshotType(), snapshot.streamId(), aggregate.type());
            return Optional.empty();
        }
        try {
            return Optional.of(EventSerializer.fromData(snapshot.data(), aggregate.stateType()));
        } catch (EventSerializationException e) {
            log.warn("Unreadable snapshot of {} at version {}, replaying from the start",
                    snapshot.streamId(), snapshot.streamVersion(), e);
            return Optional.empty();
        }
    }

    private <S> void maybeSnapshot(Aggregate<S, ?> aggregate, String streamId, long before, long after, S state) {
        if (snapshotEvery == 0 || before / snapshotEvery == after / snapshotEvery) {
            return;
        }
        try {
            snapshotStore.save(streamId, after, aggregate.type(), EventSerializer.toData(state));
        } catch (RuntimeException e) {
            log.warn("Failed to snapshot {} at version {}", streamId, after, e);
        }
    }

    private static List<EventData> withMetadata(List<EventData> events, Object command) {
        Map<String, Object> common = new LinkedHashMap<>();
        common.put(METADATA_COMMAND, commandName(command));
        CorrelationContextHolder.get().ifPresent(ctx -> common.putAll(ctx.toMetadata()));

        List<EventData> stamped = new ArrayList<>(events.size());
        for (EventData event : events) {
            Map<String, Object> metadata = new LinkedHashMap<>(common);
            metadata.putAll(event.metadata());
            stamped.add(event.withMetadata(metadata));
        }
        return stamped;
    }

    private static String commandName(Object command) {
        return command.getClass().getSimpleName();
    }

    private void count(String outcome) {
        metrics.counter("aggregate.commands", "Commands executed, by outcome", "outcome", outcome).increment();
    }
}
