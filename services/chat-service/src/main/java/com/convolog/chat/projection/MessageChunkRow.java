package com.convolog.chat.projection;

import java.util.UUID;

/** Row of the {@code message_chunks} read model. */
public record MessageChunkRow(
        UUID id, UUID messageId, int chunkIndex, int contentBlockIndex, String deltaType, String deltaText) {}
