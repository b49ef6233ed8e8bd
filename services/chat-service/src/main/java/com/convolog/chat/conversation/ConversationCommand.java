package com.convolog.chat.conversation;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Requests against a conversation stream, decided by {@link ConversationAggregate}.
 */
public sealed interface ConversationCommand {

    record CreateConversation(UUID conversationId, UUID userId, String title, String modelId, String systemPrompt)
            implements ConversationCommand {

        public CreateConversation {
            Objects.requireNonNull(conversationId, "conversationId");
            Objects.requireNonNull(userId, "userId");
        }
    }

    record ForkConversation(
            UUID newConversationId,
            UUID userId,
            String parentStreamId,
            long forkAtVersion,
            String title,
            String modelId,
            String systemPrompt) implements ConversationCommand {

        public ForkConversation {
            Objects.requireNonNull(newConversationId, "newConversationId");
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(parentStreamId, "parentStreamId");
        }
    }

    record AddUserMessage(UUID messageId, String content) implements ConversationCommand {

        public AddUserMessage {
            Objects.requireNonNull(messageId, "messageId");
        }
    }

    /** {@code modelId} falls back to the conversation's model when null. */
    record StartAssistantStream(UUID messageId, String modelId) implements ConversationCommand {

        public StartAssistantStream {
            Objects.requireNonNull(messageId, "messageId");
        }
    }

    record ReceiveChunk(UUID messageId, int chunkIndex, int contentBlockIndex, String deltaType, String deltaText)
            implements ConversationCommand {

        public ReceiveChunk {
            Objects.requireNonNull(messageId, "messageId");
            if (deltaType == null) deltaType = "text_delta";
        }
    }

    record CompleteStream(
            UUID messageId,
            String fullContent,
            String stopReason,
            Integer inputTokens,
            Integer outputTokens,
            Long latencyMs) implements ConversationCommand {

        public CompleteStream {
            Objects.requireNonNull(messageId, "messageId");
        }
    }

    record FailStream(UUID messageId, String errorType, String errorMessage, int retryCount)
            implements ConversationCommand {

        public FailStream {
            Objects.requireNonNull(messageId, "messageId");
        }
    }

    record StartToolCall(UUID messageId, String toolUseId, String toolName, Map<String, Object> input)
            implements ConversationCommand {

        public StartToolCall {
            Objects.requireNonNull(messageId, "messageId");
            Objects.requireNonNull(toolUseId, "toolUseId");
            Objects.requireNonNull(toolName, "toolName");
            if (input == null) input = Map.of();
        }
    }

    record CompleteToolCall(
            UUID messageId,
            String toolUseId,
            String toolName,
            Map<String, Object> input,
            Map<String, Object> output,
            Long durationMs) implements ConversationCommand {

        public CompleteToolCall {
            Objects.requireNonNull(messageId, "messageId");
            Objects.requireNonNull(toolUseId, "toolUseId");
            Objects.requireNonNull(toolName, "toolName");
            if (input == null) input = Map.of();
            if (output == null) output = Map.of();
        }
    }

    record UpdateTitle(String title) implements ConversationCommand {}

    record ArchiveConversation() implements ConversationCommand {}
}
