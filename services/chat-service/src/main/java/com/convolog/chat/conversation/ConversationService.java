package com.convolog.chat.conversation;

import com.convolog.aggregate.AggregateLoader;
import com.convolog.aggregate.CommandRejectedException;
import com.convolog.aggregate.ExecutionResult;
import com.convolog.aggregate.LoadedAggregate;
import com.convolog.eventmodel.StreamId;

/**
 * Entry point for upstream callers: runs conversation commands through the command pipeline.
 *
 * <p>Callers bind a {@link com.convolog.observability.CorrelationContext} beforehand to have it
 * recorded on the appended events. Rejections, conflicts and storage errors propagate unchanged.
 */
public class ConversationService {

    private final AggregateLoader loader;
    private final ConversationAggregate aggregate;

    public ConversationService(AggregateLoader loader, ConversationAggregate aggregate) {
        this.loader = loader;
        this.aggregate = aggregate;
    }

    public ExecutionResult<ConversationState> execute(String streamId, ConversationCommand command) {
        requireConversationStream(streamId);
        return loader.execute(aggregate, streamId, command);
    }

    /** Creates the conversation on its own stream. */
    public ExecutionResult<ConversationState> create(ConversationCommand.CreateConversation command) {
        return loader.execute(aggregate, ConversationAggregate.streamId(command.conversationId()), command);
    }

    /**
     * Starts a new conversation stream seeded from a parent stream.
     *
     * @throws CommandRejectedException if the parent is the new stream itself, does not exist, or
     *                                  has no event at {@code forkAtVersion}
     */
    public ExecutionResult<ConversationState> fork(ConversationCommand.ForkConversation command) {
        String parentStreamId = command.parentStreamId();
        requireConversationStream(parentStreamId);
        String streamId = ConversationAggregate.streamId(command.newConversationId());
        if (streamId.equals(parentStreamId)) {
            throw new CommandRejectedException(ConversationAggregate.INVALID_FORK_PARENT,
                    "A conversation cannot be forked from itself");
        }
        LoadedAggregate<ConversationState> parent = loader.load(aggregate, parentStreamId);
        if (parent.state().status() == ConversationStatus.NEW) {
            throw new CommandRejectedException(ConversationAggregate.CONVERSATION_NOT_FOUND,
                    "No conversation on " + parentStreamId);
        }
        if (command.forkAtVersion() > parent.version()) {
            throw new CommandRejectedException(ConversationAggregate.INVALID_FORK_VERSION,
                    "Fork version " + command.forkAtVersion() + " is past " + parentStreamId
                            + " at version " + parent.version());
        }
        return loader.execute(aggregate, streamId, command);
    }

    public LoadedAggregate<ConversationState> load(String streamId) {
        requireConversationStream(streamId);
        return loader.load(aggregate, streamId);
    }

    private static void requireConversationStream(String streamId) {
        if (!ConversationAggregate.TYPE.equals(StreamId.parse(streamId).kind())) {
            throw new IllegalArgumentException("not a conversation stream: " + streamId);
        }
    }
}
