package com.convolog.chat.projection;

import com.convolog.eventmodel.EventSerializer;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * JDBC access to the chat read models.
 *
 * <p>Every write is keyed by a stable identifier and can be repeated without changing the result:
 * inserts check for an existing row first, counters are recomputed from the rows they count. The
 * projector is the only writer, so check-then-insert needs no locking beyond its transaction.
 */
public class ProjectionRepository {

    private static final String CONVERSATION_COLUMNS = """
            id, stream_id, user_id, title, model_id, system_prompt, status, parent_conversation_id,
            fork_at_version, message_count, last_message_at, last_projected_version, inserted_at, updated_at
            """;

    private static final String MESSAGE_COLUMNS = """
            id, conversation_id, role, content, status, model_id, stop_reason, input_tokens, output_tokens,
            total_tokens, latency_ms, stream_version, position, inserted_at, updated_at
            """;

    private static final RowMapper<ConversationRow> CONVERSATION_MAPPER = (rs, rowNum) -> new ConversationRow(
            rs.getObject("id", UUID.class),
            rs.getString("stream_id"),
            rs.getObject("user_id", UUID.class),
            rs.getString("title"),
            rs.getString("model_id"),
            rs.getString("system_prompt"),
            rs.getString("status"),
            rs.getObject("parent_conversation_id", UUID.class),
            rs.getObject("fork_at_version", Long.class),
            rs.getInt("message_count"),
            instant(rs, "last_message_at"),
            rs.getLong("last_projected_version"),
            instant(rs, "inserted_at"),
            instant(rs, "updated_at"));

    private static final RowMapper<MessageRow> MESSAGE_MAPPER = (rs, rowNum) -> new MessageRow(
            rs.getObject("id", UUID.class),
            rs.getObject("conversation_id", UUID.class),
            rs.getString("role"),
            rs.getString("content"),
            rs.getString("status"),
            rs.getString("model_id"),
            rs.getString("stop_reason"),
            rs.getObject("input_tokens", Integer.class),
            rs.getObject("output_tokens", Integer.class),
            rs.getObject("total_tokens", Integer.class),
            rs.getObject("latency_ms", Long.class),
            rs.getObject("stream_version", Long.class),
            rs.getInt("position"),
            instant(rs, "inserted_at"),
            instant(rs, "updated_at"));

    private static final RowMapper<MessageChunkRow> CHUNK_MAPPER = (rs, rowNum) -> new MessageChunkRow(
            rs.getObject("id", UUID.class),
            rs.getObject("message_id", UUID.class),
            rs.getInt("chunk_index"),
            rs.getInt("content_block_index"),
            rs.getString("delta_type"),
            rs.getString("delta_text"));

    private static final RowMapper<ToolCallRow> TOOL_CALL_MAPPER = (rs, rowNum) -> new ToolCallRow(
            rs.getObject("id", UUID.class),
            rs.getObject("message_id", UUID.class),
            rs.getString("tool_use_id"),
            rs.getString("tool_name"),
            EventSerializer.readMap(rs.getString("input")),
            EventSerializer.readMap(rs.getString("output")),
            rs.getString("status"),
            rs.getObject("duration_ms", Long.class));

    private final JdbcTemplate jdbcTemplate;

    public ProjectionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    // ── Conversations ──

    /** Highest stream version folded into the read models, 0 if the stream is not projected. */
    public long lastProjectedVersion(String streamId) {
        List<Long> versions = jdbcTemplate.queryForList(
                "SELECT last_projected_version FROM conversations WHERE stream_id = ?", Long.class, streamId);
        return versions.isEmpty() ? 0 : versions.get(0);
    }

    public Optional<ConversationRow> findConversationByStreamId(String streamId) {
        return jdbcTemplate.query("SELECT " + CONVERSATION_COLUMNS + " FROM conversations WHERE stream_id = ?",
                CONVERSATION_MAPPER, streamId).stream().findFirst();
    }

    public Optional<ConversationRow> findConversation(UUID id) {
        return jdbcTemplate.query("SELECT " + CONVERSATION_COLUMNS + " FROM conversations WHERE id = ?",
                CONVERSATION_MAPPER, id).stream().findFirst();
    }

    /** Conversations still {@code streaming} whose last projected event is older than the cutoff. */
    public List<ConversationRow> findStreamingSince(Instant cutoff, int limit) {
        return jdbcTemplate.query("SELECT " + CONVERSATION_COLUMNS
                        + " FROM conversations WHERE status = 'streaming' AND updated_at < ? ORDER BY updated_at LIMIT ?",
                CONVERSATION_MAPPER, timestamp(cutoff), limit);
    }

    /** Inserts the conversation unless a row with the same id exists. */
    public boolean insertConversation(ConversationRow row) {
        if (exists("SELECT COUNT(*) FROM conversations WHERE id = ?", row.id())) {
            return false;
        }
        jdbcTemplate.update("INSERT INTO conversations (" + CONVERSATION_COLUMNS
                        + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                row.id(), row.streamId(), row.userId(), row.title(), row.modelId(), row.systemPrompt(),
                row.status(), row.parentConversationId(), row.forkAtVersion(), row.messageCount(),
                timestamp(row.lastMessageAt()), row.lastProjectedVersion(), timestamp(row.insertedAt()),
                timestamp(row.updatedAt()));
        return true;
    }

    public void updateStatus(UUID conversationId, String status) {
        jdbcTemplate.update("UPDATE conversations SET status = ? WHERE id = ?", status, conversationId);
    }

    public void updateTitle(UUID conversationId, String title) {
        jdbcTemplate.update("UPDATE conversations SET title = ? WHERE id = ?", title, conversationId);
    }

    /** Recomputes {@code message_count}; moves {@code last_message_at} when a time is given. */
    public void refreshMessageCount(UUID conversationId, Instant lastMessageAt) {
        jdbcTemplate.update("""
                UPDATE conversations
                SET message_count = (SELECT COUNT(*) FROM messages WHERE conversation_id = ?)
                WHERE id = ?
                """, conversationId, conversationId);
        if (lastMessageAt != null) {
            jdbcTemplate.update("UPDATE conversations SET last_message_at = ? WHERE id = ?",
                    timestamp(lastMessageAt), conversationId);
        }
    }

    /** Records that the stream has been projected up to {@code version}. */
    public void advance(String streamId, long version, Instant at) {
        jdbcTemplate.update(
                "UPDATE conversations SET last_projected_version = ?, updated_at = ? WHERE stream_id = ?",
                version, timestamp(at), streamId);
    }

    // ── Messages ──

    public Optional<MessageRow> findMessage(UUID id) {
        return jdbcTemplate.query("SELECT " + MESSAGE_COLUMNS + " FROM messages WHERE id = ?", MESSAGE_MAPPER, id)
                .stream().findFirst();
    }

    public List<MessageRow> findMessages(UUID conversationId) {
        return jdbcTemplate.query("SELECT " + MESSAGE_COLUMNS
                + " FROM messages WHERE conversation_id = ? ORDER BY position", MESSAGE_MAPPER, conversationId);
    }

    public int nextPosition(UUID conversationId) {
        Integer max = jdbcTemplate.queryForObject(
                "SELECT MAX(position) FROM messages WHERE conversation_id = ?", Integer.class, conversationId);
        return max == null ? 1 : max + 1;
    }

    /** Inserts the message unless a row with the same id exists. */
    public boolean insertMessage(MessageRow row) {
        if (exists("SELECT COUNT(*) FROM messages WHERE id = ?", row.id())) {
            return false;
        }
        jdbcTemplate.update("INSERT INTO messages (" + MESSAGE_COLUMNS
                        + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                row.id(), row.conversationId(), row.role(), row.content(), row.status(), row.modelId(),
                row.stopReason(), row.inputTokens(), row.outputTokens(), row.totalTokens(), row.latencyMs(),
                row.streamVersion(), row.position(), timestamp(row.insertedAt()), timestamp(row.updatedAt()));
        return true;
    }

    public void completeMessage(UUID id, String content, String stopReason, Integer inputTokens,
                                Integer outputTokens, Long latencyMs, Instant at) {
        Integer total = inputTokens != null && outputTokens != null ? inputTokens + outputTokens : null;
        jdbcTemplate.update("""
                UPDATE messages
                SET status = 'complete', content = ?, stop_reason = ?, input_tokens = ?, output_tokens = ?,
                    total_tokens = ?, latency_ms = ?, updated_at = ?
                WHERE id = ?
                """, content, stopReason, inputTokens, outputTokens, total, latencyMs, timestamp(at), id);
    }

    public void updateMessageStatus(UUID id, String status, Instant at) {
        jdbcTemplate.update("UPDATE messages SET status = ?, updated_at = ? WHERE id = ?", status, timestamp(at), id);
    }

    // ── Chunks ──

    public boolean insertChunk(MessageChunkRow row, Instant at) {
        if (exists("SELECT COUNT(*) FROM message_chunks WHERE message_id = ? AND chunk_index = ?",
                row.messageId(), row.chunkIndex())) {
            return false;
        }
        jdbcTemplate.update("""
                INSERT INTO message_chunks (id, message_id, chunk_index, content_block_index, delta_type, delta_text,
                                            inserted_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """, row.id(), row.messageId(), row.chunkIndex(), row.contentBlockIndex(), row.deltaType(),
                row.deltaText(), timestamp(at));
        return true;
    }

    public List<MessageChunkRow> findChunks(UUID messageId) {
        return jdbcTemplate.query("""
                SELECT id, message_id, chunk_index, content_block_index, delta_type, delta_text
                FROM message_chunks WHERE message_id = ? ORDER BY chunk_index
                """, CHUNK_MAPPER, messageId);
    }

    // ── Tool calls ──

    public boolean insertToolCall(ToolCallRow row, Instant at) {
        if (exists("SELECT COUNT(*) FROM tool_calls WHERE message_id = ? AND tool_use_id = ?",
                row.messageId(), row.toolUseId())) {
            return false;
        }
        jdbcTemplate.update("""
                INSERT INTO tool_calls (id, message_id, tool_use_id, tool_name, input, output, status, duration_ms,
                                        inserted_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """, row.id(), row.messageId(), row.toolUseId(), row.toolName(), json(row.input()),
                json(row.output()), row.status(), row.durationMs(), timestamp(at), timestamp(at));
        return true;
    }

    /** Marks the tool call completed, inserting it if its start was never projected. */
    public void completeToolCall(ToolCallRow row, Instant at) {
        int updated = jdbcTemplate.update("""
                UPDATE tool_calls
                SET tool_name = ?, input = ?, output = ?, status = ?, duration_ms = ?, updated_at = ?
                WHERE message_id = ? AND tool_use_id = ?
                """, row.toolName(), json(row.input()), json(row.output()), row.status(), row.durationMs(),
                timestamp(at), row.messageId(), row.toolUseId());
        if (updated == 0) {
            insertToolCall(row, at);
        }
    }

    public List<ToolCallRow> findToolCalls(UUID messageId) {
        return jdbcTemplate.query("""
                SELECT id, message_id, tool_use_id, tool_name, input, output, status, duration_ms
                FROM tool_calls WHERE message_id = ? ORDER BY inserted_at, tool_use_id
                """, TOOL_CALL_MAPPER, messageId);
    }

    // ── Helpers ──

    private boolean exists(String countSql, Object... args) {
        Long count = jdbcTemplate.queryForObject(countSql, Long.class, args);
        return count != null && count > 0;
    }

    private static String json(Map<String, Object> value) {
        return value == null ? null : EventSerializer.toJson(value);
    }

    private static OffsetDateTime timestamp(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant.truncatedTo(ChronoUnit.MICROS), ZoneOffset.UTC);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
