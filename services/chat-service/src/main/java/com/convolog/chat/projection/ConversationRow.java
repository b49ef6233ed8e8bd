package com.convolog.chat.projection;

import java.time.Instant;
import java.util.UUID;

/** Row of the {@code conversations} read model. */
public record ConversationRow(
        UUID id,
        String streamId,
        UUID userId,
        String title,
        String modelId,
        String systemPrompt,
        String status,
        UUID parentConversationId,
        Long forkAtVersion,
        int messageCount,
        Instant lastMessageAt,
        long lastProjectedVersion,
        Instant insertedAt,
        Instant updatedAt) {}
