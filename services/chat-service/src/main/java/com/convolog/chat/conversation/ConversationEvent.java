package com.convolog.chat.conversation;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Payloads of the events in a conversation stream. Field names are stored snake_case.
 */
public sealed interface ConversationEvent {

    Instant timestamp();

    record ConversationCreated(
            UUID conversationId,
            UUID userId,
            String title,
            String modelId,
            String systemPrompt,
            Instant timestamp) implements ConversationEvent {}

    record ConversationForked(
            UUID newConversationId,
            String parentStreamId,
            long forkAtVersion,
            UUID userId,
            String title,
            String modelId,
            String systemPrompt,
            Instant timestamp) implements ConversationEvent {}

    record UserMessageAdded(UUID messageId, String content, Instant timestamp) implements ConversationEvent {}

    record AssistantStreamStarted(UUID messageId, String modelId, Instant timestamp) implements ConversationEvent {}

    record AssistantChunkReceived(
            UUID messageId,
            int chunkIndex,
            int contentBlockIndex,
            String deltaType,
            String deltaText,
            Instant timestamp) implements ConversationEvent {}

    record AssistantStreamCompleted(
            UUID messageId,
            String fullContent,
            String stopReason,
            Integer inputTokens,
            Integer outputTokens,
            Long latencyMs,
            Instant timestamp) implements ConversationEvent {}

    record AssistantStreamFailed(
            UUID messageId,
            String errorType,
            String errorMessage,
            int retryCount,
            Instant timestamp) implements ConversationEvent {}

    record ToolCallStarted(
            UUID messageId,
            String toolUseId,
            String toolName,
            Map<String, Object> input,
            Instant timestamp) implements ConversationEvent {}

    record ToolCallCompleted(
            UUID messageId,
            String toolUseId,
            String toolName,
            Map<String, Object> input,
            Map<String, Object> output,
            Long durationMs,
            Instant timestamp) implements ConversationEvent {}

    record ConversationTitleUpdated(String title, Instant timestamp) implements ConversationEvent {}

    record ConversationArchived(Instant timestamp) implements ConversationEvent {}
}
