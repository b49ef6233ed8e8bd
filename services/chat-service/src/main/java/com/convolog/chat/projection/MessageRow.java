package com.convolog.chat.projection;

import java.time.Instant;
import java.util.UUID;

/** Row of the {@code messages} read model. */
public record MessageRow(
        UUID id,
        UUID conversationId,
        String role,
        String content,
        String status,
        String modelId,
        String stopReason,
        Integer inputTokens,
        Integer outputTokens,
        Integer totalTokens,
        Long latencyMs,
        Long streamVersion,
        int position,
        Instant insertedAt,
        Instant updatedAt) {}
