package com.convolog.eventstore;

import com.convolog.eventmodel.EventData;
import com.convolog.eventmodel.StoredEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JdbcEventStore")
class JdbcEventStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30.123456Z");

    private TestDatabase db;
    private InMemoryEventBus bus;
    private List<StreamAppended> published;
    private JdbcEventStore store;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        bus = new InMemoryEventBus();
        published = new ArrayList<>();
        bus.subscribe(published::add);
        store = new JdbcEventStore(db.jdbcTemplate, db.transactionTemplate, bus, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    private static EventData event(String type, String key, Object value) {
        return EventData.of(type, Map.of(key, value));
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        @DisplayName("assigns versions 1..n to a new stream in submission order")
        void appendsToNewStream() {
            var stored = store.append("conversation-a", 0, List.of(
                    event("ConversationCreated", "title", "Hello"),
                    event("UserMessageAdded", "content", "hi")));

            assertThat(stored).extracting(StoredEvent::streamVersion).containsExactly(1L, 2L);
            assertThat(stored).extracting(StoredEvent::eventType)
                    .containsExactly("ConversationCreated", "UserMessageAdded");
            assertThat(store.readForward("conversation-a")).isEqualTo(stored);
            assertThat(store.currentVersion("conversation-a")).isEqualTo(2);
        }

        @Test
        @DisplayName("continues from the expected version")
        void appendsAtExpectedVersion() {
            store.append("s-1", 0, List.of(event("A", "n", 1)));
            var stored = store.append("s-1", 1, List.of(event("B", "n", 2), event("C", "n", 3)));

            assertThat(stored).extracting(StoredEvent::streamVersion).containsExactly(2L, 3L);
            assertThat(store.readForward("s-1")).extracting(StoredEvent::streamVersion)
                    .containsExactly(1L, 2L, 3L);
        }

        @Test
        @DisplayName("rejects a stale expected version and writes nothing")
        void rejectsStaleVersion() {
            store.append("s-1", 0, List.of(event("A", "n", 1), event("B", "n", 2)));
            published.clear();

            assertThatThrownBy(() -> store.append("s-1", 1, List.of(event("C", "n", 3))))
                    .isInstanceOf(WrongExpectedVersionException.class)
                    .satisfies(e -> {
                        var conflict = (WrongExpectedVersionException) e;
                        assertThat(conflict.streamId()).isEqualTo("s-1");
                        assertThat(conflict.expectedVersion()).isEqualTo(1);
                    });

            assertThat(store.currentVersion("s-1")).isEqualTo(2);
            assertThat(published).isEmpty();
        }

        @Test
        @DisplayName("rejects an expected version ahead of the stream")
        void rejectsFutureVersion() {
            assertThatThrownBy(() -> store.append("s-1", 3, List.of(event("A", "n", 1))))
                    .isInstanceOf(WrongExpectedVersionException.class);
            assertThat(store.currentVersion("s-1")).isZero();
        }

        @Test
        @DisplayName("rejects an empty event list")
        void rejectsEmptyList() {
            assertThatThrownBy(() -> store.append("s-1", 0, List.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("events must not be empty");
        }

        @Test
        @DisplayName("persists data, metadata and the insertion time")
        void persistsAllFields() {
            var data = Map.<String, Object>of("message_id", "m-1", "chunk_index", 3, "nested", Map.of("ok", true));
            var metadata = Map.<String, Object>of("correlation_id", "corr-1", "command", "AddUserMessage");

            store.append("s-1", 0, List.of(new EventData("UserMessageAdded", data, metadata)));

            var read = store.readForward("s-1").get(0);
            assertThat(read.data()).isEqualTo(data);
            assertThat(read.metadata()).isEqualTo(metadata);
            assertThat(read.insertedAt()).isEqualTo(NOW);
            assertThat(read.id()).isNotNull();
        }

        @Test
        @DisplayName("publishes exactly one notification per successful append")
        void publishesOnce() {
            var stored = store.append("s-1", 0, List.of(event("A", "n", 1), event("B", "n", 2)));

            assertThat(published).hasSize(1);
            assertThat(published.get(0).streamId()).isEqualTo("s-1");
            assertThat(published.get(0).events()).isEqualTo(stored);
            assertThat(published.get(0).firstVersion()).isEqualTo(1);
            assertThat(published.get(0).lastVersion()).isEqualTo(2);
        }

        @Test
        @DisplayName("a failing subscriber does not fail the append")
        void subscriberFailureIsIsolated() {
            bus.subscribe(n -> {
                throw new IllegalStateException("boom");
            });

            var stored = store.append("s-1", 0, List.of(event("A", "n", 1)));

            assertThat(stored).hasSize(1);
            assertThat(store.currentVersion("s-1")).isEqualTo(1);
        }

        @Test
        @DisplayName("wraps storage failures in EventStoreException")
        void wrapsStorageFailures() {
            db.jdbcTemplate.execute("DROP TABLE events");

            assertThatThrownBy(() -> store.append("s-1", 0, List.of(event("A", "n", 1))))
                    .isInstanceOf(EventStoreException.class)
                    .hasMessageContaining("s-1");
            assertThat(published).isEmpty();
        }
    }

    @Nested
    @DisplayName("concurrent writers")
    class ConcurrentWriters {

        @Test
        @DisplayName("exactly one writer wins a contested version")
        void singleWinner() throws Exception {
            store.append("s-1", 0, List.of(event("A", "n", 0)));
            published.clear();

            int writers = 8;
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Boolean>> results = new ArrayList<>();
                for (int i = 0; i < writers; i++) {
                    int writer = i;
                    Callable<Boolean> attempt = () -> {
                        start.await();
                        try {
                            store.append("s-1", 1, List.of(event("B", "writer", writer)));
                            return true;
                        } catch (WrongExpectedVersionException e) {
                            return false;
                        }
                    };
                    results.add(pool.submit(attempt));
                }
                start.countDown();

                int winners = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(30, TimeUnit.SECONDS)) {
                        winners++;
                    }
                }

                assertThat(winners).isEqualTo(1);
                assertThat(store.readForward("s-1")).extracting(StoredEvent::streamVersion)
                        .containsExactly(1L, 2L);
                assertThat(published).hasSize(1);
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("sequential writers that reload always succeed and keep versions gapless")
        void gaplessUnderRetry() throws Exception {
            int writers = 4;
            int eventsPerWriter = 5;
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            try {
                List<Future<?>> results = new ArrayList<>();
                for (int w = 0; w < writers; w++) {
                    results.add(pool.submit(() -> {
                        int written = 0;
                        while (written < eventsPerWriter) {
                            try {
                                store.append("s-1", store.currentVersion("s-1"), List.of(event("E", "n", written)));
                                written++;
                            } catch (WrongExpectedVersionException e) {
                                // reload and retry
                            }
                        }
                    }));
                }
                for (Future<?> result : results) {
                    result.get(60, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            var versions = store.readForward("s-1").stream().map(StoredEvent::streamVersion).toList();
            assertThat(versions).containsExactlyElementsOf(
                    IntStream.rangeClosed(1, writers * eventsPerWriter).mapToObj(i -> (long) i).toList());
        }
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @BeforeEach
        void seed() {
            store.append("s-1", 0, List.of(event("A", "n", 1), event("B", "n", 2), event("C", "n", 3),
                    event("D", "n", 4), event("E", "n", 5)));
        }

        @Test
        @DisplayName("readForward honours fromVersion and maxCount")
        void readsPage() {
            assertThat(store.readForward("s-1", 2, 2)).extracting(StoredEvent::streamVersion)
                    .containsExactly(2L, 3L);
            assertThat(store.readForward("s-1", 5, 10)).extracting(StoredEvent::eventType)
                    .containsExactly("E");
            assertThat(store.readForward("s-1", 6, 10)).isEmpty();
        }

        @Test
        @DisplayName("unknown streams read as empty at version 0")
        void unknownStream() {
            assertThat(store.readForward("missing")).isEmpty();
            assertThat(store.currentVersion("missing")).isZero();
        }

        @Test
        @DisplayName("rejects a non-positive page size")
        void rejectsBadPageSize() {
            assertThatThrownBy(() -> store.readForward("s-1", 1, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("streamIds lists distinct ids matching a literal prefix")
        void listsStreamIds() {
            store.append("conversation-b", 0, List.of(event("A", "n", 1)));
            store.append("conversation-a", 0, List.of(event("A", "n", 1), event("B", "n", 2)));
            store.append("conversationXa", 0, List.of(event("A", "n", 1)));
            store.append("conv_x-1", 0, List.of(event("A", "n", 1)));
            store.append("convAx-1", 0, List.of(event("A", "n", 1)));

            assertThat(store.streamIds("conversation-")).containsExactly("conversation-a", "conversation-b");
            assertThat(store.streamIds("conv_")).containsExactly("conv_x-1");
        }
    }
}
