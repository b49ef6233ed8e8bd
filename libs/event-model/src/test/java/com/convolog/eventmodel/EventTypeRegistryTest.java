package com.convolog.eventmodel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventTypeRegistry")
class EventTypeRegistryTest {

    sealed interface CounterEvent permits Incremented, Reset {}

    record Incremented(int amount) implements CounterEvent {}

    record Reset(String reason) implements CounterEvent {}

    private final EventTypeRegistry<CounterEvent> registry = new EventTypeRegistry<CounterEvent>()
            .register("CounterIncremented", Incremented.class)
            .register("CounterReset", Reset.class);

    private static StoredEvent stored(String type, Map<String, Object> data) {
        return new StoredEvent(UUID.randomUUID(), "counter-" + UUID.randomUUID(), 1, type, data, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("lookups")
    class Lookups {

        @Test
        @DisplayName("classFor returns the registered class")
        void classForKnown() {
            assertThat(registry.classFor("CounterIncremented")).contains(Incremented.class);
        }

        @Test
        @DisplayName("classFor is case-sensitive")
        void caseSensitive() {
            assertThat(registry.classFor("counterincremented")).isEmpty();
            assertThat(registry.isKnown("COUNTERRESET")).isFalse();
        }

        @Test
        @DisplayName("eventTypes keeps registration order")
        void registrationOrder() {
            assertThat(registry.eventTypes()).containsExactly("CounterIncremented", "CounterReset");
        }

        @Test
        @DisplayName("rejects duplicate tags")
        void rejectsDuplicateTag() {
            assertThatThrownBy(() -> registry.register("CounterReset", Incremented.class))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("encode/decode")
    class EncodeDecode {

        @Test
        @DisplayName("encode tags the payload and uses string keys")
        void encodeTags() {
            var data = registry.encode(new Incremented(3));

            assertThat(data.eventType()).isEqualTo("CounterIncremented");
            assertThat(data.data()).containsEntry("amount", 3);
        }

        @Test
        @DisplayName("decode restores the typed payload")
        void decodeRestores() {
            var payload = registry.decode(stored("CounterReset", Map.of("reason", "manual")));

            assertThat(payload).isEqualTo(new Reset("manual"));
        }

        @Test
        @DisplayName("decode treats unknown event types as a programming error")
        void decodeUnknown() {
            assertThatThrownBy(() -> registry.decode(stored("CounterExploded", Map.of())))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("CounterExploded");
        }
    }
}
