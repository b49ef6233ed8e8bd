package com.convolog.chat.conversation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.convolog.aggregate.AggregateLoader;
import com.convolog.aggregate.CommandRejectedException;
import com.convolog.chat.MutableClock;
import com.convolog.chat.conversation.ConversationCommand.AddUserMessage;
import com.convolog.chat.conversation.ConversationCommand.CreateConversation;
import com.convolog.chat.conversation.ConversationCommand.ForkConversation;
import com.convolog.eventstore.InMemoryEventBus;
import com.convolog.eventstore.testing.InMemoryEventStore;
import com.convolog.eventstore.testing.InMemorySnapshotStore;
import com.convolog.observability.MetricFactory;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConversationService")
class ConversationServiceTest {

    private static final UUID USER_ID = UUID.fromString("0c2b9f0e-55d2-4a3f-8b7e-1f2e3d4c5b6a");

    private InMemoryEventStore store;
    private ConversationService conversations;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2025-06-01T12:00:00Z"));
        store = new InMemoryEventStore(new InMemoryEventBus(), clock);
        AggregateLoader loader = new AggregateLoader(store, new InMemorySnapshotStore(), MetricFactory.noop("aggregate"));
        conversations = new ConversationService(loader, new ConversationAggregate(clock));
    }

    private String parentWithOneMessage() {
        UUID id = UUID.randomUUID();
        conversations.create(new CreateConversation(id, USER_ID, "parent", "claude-sonnet", null));
        String streamId = ConversationAggregate.streamId(id);
        conversations.execute(streamId, new AddUserMessage(UUID.randomUUID(), "hello"));
        return streamId;
    }

    private static ForkConversation fork(UUID id, String parentStreamId, long atVersion) {
        return new ForkConversation(id, USER_ID, parentStreamId, atVersion, null, "claude-sonnet", null);
    }

    private static void assertRejected(Runnable call, String reason) {
        assertThatThrownBy(call::run)
                .isInstanceOf(CommandRejectedException.class)
                .satisfies(e -> assertThat(((CommandRejectedException) e).reason()).isEqualTo(reason));
    }

    @Nested
    @DisplayName("fork")
    class Fork {

        @Test
        @DisplayName("starts the new stream at the parent's version")
        void forks() {
            String parent = parentWithOneMessage();
            UUID id = UUID.randomUUID();

            var result = conversations.fork(fork(id, parent, 2));

            assertThat(result.version()).isEqualTo(1);
            assertThat(result.state().parentStreamId()).isEqualTo(parent);
            assertThat(result.state().status()).isEqualTo(ConversationStatus.ACTIVE);
        }

        @Test
        @DisplayName("rejects a conversation forked from its own stream")
        void rejectsSelfParent() {
            UUID id = UUID.randomUUID();

            assertRejected(() -> conversations.fork(fork(id, ConversationAggregate.streamId(id), 1)),
                    ConversationAggregate.INVALID_FORK_PARENT);
            assertThat(store.currentVersion(ConversationAggregate.streamId(id))).isZero();
        }

        @Test
        @DisplayName("rejects a parent that was never created")
        void rejectsUnknownParent() {
            UUID id = UUID.randomUUID();
            String parent = ConversationAggregate.streamId(UUID.randomUUID());

            assertRejected(() -> conversations.fork(fork(id, parent, 1)), ConversationAggregate.CONVERSATION_NOT_FOUND);
            assertThat(store.currentVersion(ConversationAggregate.streamId(id))).isZero();
        }

        @Test
        @DisplayName("rejects a fork version past the parent's last event")
        void rejectsVersionPastParent() {
            String parent = parentWithOneMessage();

            assertRejected(() -> conversations.fork(fork(UUID.randomUUID(), parent, 3)),
                    ConversationAggregate.INVALID_FORK_VERSION);
        }

        @Test
        @DisplayName("rejects a parent on another kind of stream")
        void rejectsOtherStreamKinds() {
            assertThatThrownBy(() -> conversations.fork(fork(UUID.randomUUID(), "invoice-" + UUID.randomUUID(), 1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
