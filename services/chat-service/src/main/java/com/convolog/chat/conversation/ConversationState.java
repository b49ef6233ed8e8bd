package com.convolog.chat.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.UUID;

/**
 * Decision state of one conversation, rebuilt from its stream. Also the snapshot shape.
 *
 * @param conversationId     id of the conversation, null before creation
 * @param userId             owner
 * @param title              current title
 * @param modelId            default model for assistant replies
 * @param systemPrompt       system prompt, may be null
 * @param status             lifecycle status
 * @param messageCount       user and assistant messages in this stream
 * @param streamingMessageId assistant message being streamed, set only while {@code streaming}
 * @param parentStreamId     stream this conversation was forked from, if any
 * @param forkAtVersion      parent version the fork was taken at, if any
 * @param toolCallCount      tool calls started in this stream
 */
public record ConversationState(
        UUID conversationId,
        UUID userId,
        String title,
        String modelId,
        String systemPrompt,
        ConversationStatus status,
        int messageCount,
        UUID streamingMessageId,
        String parentStreamId,
        Long forkAtVersion,
        int toolCallCount) {

    public ConversationState {
        if (status == null) status = ConversationStatus.NEW;
    }

    public static ConversationState initial() {
        return new ConversationState(null, null, null, null, null, ConversationStatus.NEW, 0, null, null, null, 0);
    }

    @JsonIgnore
    public boolean isStreaming() {
        return status == ConversationStatus.STREAMING;
    }

    ConversationState withTitle(String newTitle) {
        return new ConversationState(conversationId, userId, newTitle, modelId, systemPrompt, status,
                messageCount, streamingMessageId, parentStreamId, forkAtVersion, toolCallCount);
    }

    ConversationState withMessageAdded(ConversationStatus newStatus, UUID newStreamingMessageId) {
        return new ConversationState(conversationId, userId, title, modelId, systemPrompt, newStatus,
                messageCount + 1, newStreamingMessageId, parentStreamId, forkAtVersion, toolCallCount);
    }

    ConversationState withStreamEnded(ConversationStatus newStatus) {
        return new ConversationState(conversationId, userId, title, modelId, systemPrompt, newStatus,
                messageCount, null, parentStreamId, forkAtVersion, toolCallCount);
    }

    ConversationState withToolCallStarted() {
        return new ConversationState(conversationId, userId, title, modelId, systemPrompt, status,
                messageCount, streamingMessageId, parentStreamId, forkAtVersion, toolCallCount + 1);
    }
}
