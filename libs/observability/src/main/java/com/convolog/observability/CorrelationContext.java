package com.convolog.observability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable correlation context for the command currently being executed.
 *
 * <p>Upstream callers (API handlers, background sweeps) bind a context before executing commands.
 * The command pipeline copies it into the metadata of every appended event, and the values are
 * mirrored into SLF4J MDC so log lines carry them.
 *
 * @param correlationId ID of the business flow (e.g. one user turn with its assistant reply)
 * @param causationId   ID of whatever triggered this command (request, event, sweep run)
 * @param userId        acting user (nullable for system actions)
 * @param requestId     ID of this specific request (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String causationId,
        String userId,
        String requestId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_CAUSATION_ID = "causationId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_REQUEST_ID = "requestId";

    static final List<String> MDC_KEYS =
            List.of(MDC_CORRELATION_ID, MDC_CAUSATION_ID, MDC_USER_ID, MDC_REQUEST_ID);

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context for work initiated by the system itself, e.g. a scheduled sweep. */
    public static CorrelationContext system(String source) {
        return new CorrelationContext(UUID.randomUUID().toString(), source, null, null);
    }

    /** MDC values keyed by {@link #MDC_KEYS}; absent values are null. */
    Map<String, String> mdcEntries() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(MDC_CORRELATION_ID, correlationId);
        entries.put(MDC_CAUSATION_ID, causationId);
        entries.put(MDC_USER_ID, userId);
        entries.put(MDC_REQUEST_ID, requestId);
        return entries;
    }

    /**
     * Event metadata entries for this context, snake_case keyed. Null values are left out.
     */
    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("correlation_id", correlationId);
        putIfPresent(metadata, "causation_id", causationId);
        putIfPresent(metadata, "user_id", userId);
        putIfPresent(metadata, "request_id", requestId);
        return metadata;
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, String value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }
}
