package com.convolog.chat.conversation;

import com.convolog.aggregate.Aggregate;
import com.convolog.aggregate.CommandRejectedException;
import com.convolog.chat.conversation.ConversationCommand.AddUserMessage;
import com.convolog.chat.conversation.ConversationCommand.ArchiveConversation;
import com.convolog.chat.conversation.ConversationCommand.CompleteStream;
import com.convolog.chat.conversation.ConversationCommand.CompleteToolCall;
import com.convolog.chat.conversation.ConversationCommand.CreateConversation;
import com.convolog.chat.conversation.ConversationCommand.FailStream;
import com.convolog.chat.conversation.ConversationCommand.ForkConversation;
import com.convolog.chat.conversation.ConversationCommand.ReceiveChunk;
import com.convolog.chat.conversation.ConversationCommand.StartAssistantStream;
import com.convolog.chat.conversation.ConversationCommand.StartToolCall;
import com.convolog.chat.conversation.ConversationCommand.UpdateTitle;
import com.convolog.chat.conversation.ConversationEvent.AssistantChunkReceived;
import com.convolog.chat.conversation.ConversationEvent.AssistantStreamCompleted;
import com.convolog.chat.conversation.ConversationEvent.AssistantStreamFailed;
import com.convolog.chat.conversation.ConversationEvent.AssistantStreamStarted;
import com.convolog.chat.conversation.ConversationEvent.ConversationArchived;
import com.convolog.chat.conversation.ConversationEvent.ConversationCreated;
import com.convolog.chat.conversation.ConversationEvent.ConversationForked;
import com.convolog.chat.conversation.ConversationEvent.ConversationTitleUpdated;
import com.convolog.chat.conversation.ConversationEvent.ToolCallCompleted;
import com.convolog.chat.conversation.ConversationEvent.ToolCallStarted;
import com.convolog.chat.conversation.ConversationEvent.UserMessageAdded;
import com.convolog.eventmodel.EventData;
import com.convolog.eventmodel.StoredEvent;
import com.convolog.eventmodel.StreamId;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * State machine of a single conversation.
 *
 * <pre>
 * new --create--> created --user message--> active --stream started--> streaming
 * streaming --completed | failed--> active
 * new --fork--> active
 * created | active | streaming --archive--> archived
 * </pre>
 *
 * <p>Archiving while a reply is streaming first fails the in-flight message with error type
 * {@code conversation_archived}, so the projection never keeps a message stuck in
 * {@code streaming}. Archiving an archived conversation is a no-op.
 */
public class ConversationAggregate implements Aggregate<ConversationState, ConversationCommand> {

    public static final String TYPE = "conversation";
    public static final String DEFAULT_TITLE = "New Conversation";

    public static final String CONVERSATION_EXISTS = "conversation_exists";
    public static final String CONVERSATION_NOT_FOUND = "conversation_not_found";
    public static final String CONVERSATION_ARCHIVED = "conversation_archived";
    public static final String STREAM_IN_PROGRESS = "stream_in_progress";
    public static final String EMPTY_CONTENT = "empty_content";
    public static final String EMPTY_TITLE = "empty_title";
    public static final String INVALID_STATUS = "invalid_status";
    public static final String INVALID_FORK_VERSION = "invalid_fork_version";
    public static final String INVALID_FORK_PARENT = "invalid_fork_parent";
    public static final String NOT_STREAMING = "not_streaming";
    public static final String MESSAGE_MISMATCH = "message_mismatch";

    private final Clock clock;

    public ConversationAggregate(Clock clock) {
        this.clock = clock;
    }

    public static String streamId(UUID conversationId) {
        return StreamId.of(TYPE, conversationId).toString();
    }

    public static String streamPrefix() {
        return StreamId.prefix(TYPE);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Class<ConversationState> stateType() {
        return ConversationState.class;
    }

    @Override
    public ConversationState init() {
        return ConversationState.initial();
    }

    @Override
    public ConversationState apply(ConversationState state, StoredEvent stored) {
        ConversationEvent event = ConversationEvents.decode(stored);

        if (event instanceof ConversationCreated e) {
            return new ConversationState(e.conversationId(), e.userId(), e.title(), e.modelId(), e.systemPrompt(),
                    ConversationStatus.CREATED, 0, null, null, null, 0);
        }
        if (event instanceof ConversationForked e) {
            return new ConversationState(e.newConversationId(), e.userId(), e.title(), e.modelId(), e.systemPrompt(),
                    ConversationStatus.ACTIVE, 0, null, e.parentStreamId(), e.forkAtVersion(), 0);
        }
        if (event instanceof UserMessageAdded) {
            return state.withMessageAdded(ConversationStatus.ACTIVE, null);
        }
        if (event instanceof AssistantStreamStarted e) {
            return state.withMessageAdded(ConversationStatus.STREAMING, e.messageId());
        }
        if (event instanceof AssistantChunkReceived || event instanceof ToolCallCompleted) {
            return state;
        }
        if (event instanceof AssistantStreamCompleted || event instanceof AssistantStreamFailed) {
            return state.withStreamEnded(ConversationStatus.ACTIVE);
        }
        if (event instanceof ToolCallStarted) {
            return state.withToolCallStarted();
        }
        if (event instanceof ConversationTitleUpdated e) {
            return state.withTitle(e.title());
        }
        if (event instanceof ConversationArchived) {
            return state.withStreamEnded(ConversationStatus.ARCHIVED);
        }
        throw new IllegalStateException("unhandled conversation event " + stored.eventType());
    }

    @Override
    public List<EventData> handle(ConversationState state, ConversationCommand command) {
        Instant now = clock.instant();

        if (command instanceof CreateConversation c) {
            requireNew(state);
            return events(new ConversationCreated(c.conversationId(), c.userId(), titleOrDefault(c.title()),
                    c.modelId(), c.systemPrompt(), now));
        }
        if (command instanceof ForkConversation c) {
            requireNew(state);
            if (c.forkAtVersion() < 1) {
                throw new CommandRejectedException(INVALID_FORK_VERSION,
                        "Fork version must be at least 1, was " + c.forkAtVersion());
            }
            return events(new ConversationForked(c.newConversationId(), c.parentStreamId(), c.forkAtVersion(),
                    c.userId(), titleOrDefault(c.title()), c.modelId(), c.systemPrompt(), now));
        }
        if (command instanceof AddUserMessage c) {
            switch (state.status()) {
                case NEW:
                    throw new CommandRejectedException(CONVERSATION_NOT_FOUND);
                case ARCHIVED:
                    throw new CommandRejectedException(CONVERSATION_ARCHIVED);
                case STREAMING:
                    throw new CommandRejectedException(STREAM_IN_PROGRESS);
                default:
                    break;
            }
            if (c.content() == null || c.content().isBlank()) {
                throw new CommandRejectedException(EMPTY_CONTENT);
            }
            return events(new UserMessageAdded(c.messageId(), c.content(), now));
        }
        if (command instanceof StartAssistantStream c) {
            requireStatus(state, ConversationStatus.ACTIVE);
            String modelId = c.modelId() != null ? c.modelId() : state.modelId();
            return events(new AssistantStreamStarted(c.messageId(), modelId, now));
        }
        if (command instanceof ReceiveChunk c) {
            requireStreaming(state, c.messageId());
            return events(new AssistantChunkReceived(c.messageId(), c.chunkIndex(), c.contentBlockIndex(),
                    c.deltaType(), c.deltaText(), now));
        }
        if (command instanceof CompleteStream c) {
            requireStreaming(state, c.messageId());
            return events(new AssistantStreamCompleted(c.messageId(), c.fullContent(), c.stopReason(),
                    c.inputTokens(), c.outputTokens(), c.latencyMs(), now));
        }
        if (command instanceof FailStream c) {
            if (!state.isStreaming() || !c.messageId().equals(state.streamingMessageId())) {
                return List.of();
            }
            return events(new AssistantStreamFailed(c.messageId(), c.errorType(), c.errorMessage(),
                    c.retryCount(), now));
        }
        if (command instanceof StartToolCall c) {
            requireStatus(state, ConversationStatus.ACTIVE, ConversationStatus.STREAMING);
            return events(new ToolCallStarted(c.messageId(), c.toolUseId(), c.toolName(), c.input(), now));
        }
        if (command instanceof CompleteToolCall c) {
            requireStatus(state, ConversationStatus.ACTIVE, ConversationStatus.STREAMING);
            return events(new ToolCallCompleted(c.messageId(), c.toolUseId(), c.toolName(), c.input(), c.output(),
                    c.durationMs(), now));
        }
        if (command instanceof UpdateTitle c) {
            requireStatus(state, ConversationStatus.CREATED, ConversationStatus.ACTIVE, ConversationStatus.STREAMING);
            if (c.title() == null || c.title().isBlank()) {
                throw new CommandRejectedException(EMPTY_TITLE);
            }
            if (c.title().equals(state.title())) {
                return List.of();
            }
            return events(new ConversationTitleUpdated(c.title(), now));
        }
        if (command instanceof ArchiveConversation) {
            return archive(state, now);
        }
        throw new IllegalArgumentException("unsupported command " + command.getClass().getName());
    }

    private static List<EventData> archive(ConversationState state, Instant now) {
        switch (state.status()) {
            case NEW:
                throw new CommandRejectedException(CONVERSATION_NOT_FOUND);
            case ARCHIVED:
                return List.of();
            case STREAMING:
                return events(
                        new AssistantStreamFailed(state.streamingMessageId(), CONVERSATION_ARCHIVED,
                                "Conversation archived while the reply was streaming", 0, now),
                        new ConversationArchived(now));
            default:
                return events(new ConversationArchived(now));
        }
    }

    private static void requireNew(ConversationState state) {
        if (state.status() != ConversationStatus.NEW) {
            throw new CommandRejectedException(CONVERSATION_EXISTS);
        }
    }

    private static void requireStatus(ConversationState state, ConversationStatus... allowed) {
        for (ConversationStatus status : allowed) {
            if (state.status() == status) {
                return;
            }
        }
        throw new CommandRejectedException(INVALID_STATUS,
                "Command not allowed while conversation is " + state.status().value());
    }

    private static void requireStreaming(ConversationState state, UUID messageId) {
        if (!state.isStreaming()) {
            throw new CommandRejectedException(NOT_STREAMING);
        }
        if (!messageId.equals(state.streamingMessageId())) {
            throw new CommandRejectedException(MESSAGE_MISMATCH,
                    "Message " + messageId + " is not the one streaming (" + state.streamingMessageId() + ")");
        }
    }

    private static String titleOrDefault(String title) {
        return title == null || title.isBlank() ? DEFAULT_TITLE : title;
    }

    private static List<EventData> events(ConversationEvent... events) {
        return Arrays.stream(events).map(ConversationEvents::encode).toList();
    }
}
