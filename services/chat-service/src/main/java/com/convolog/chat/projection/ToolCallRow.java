package com.convolog.chat.projection;

import java.util.Map;
import java.util.UUID;

/** Row of the {@code tool_calls} read model. */
public record ToolCallRow(
        UUID id,
        UUID messageId,
        String toolUseId,
        String toolName,
        Map<String, Object> input,
        Map<String, Object> output,
        String status,
        Long durationMs) {}
