package com.convolog.chat.projection;

import com.convolog.chat.conversation.ConversationAggregate;
import com.convolog.chat.conversation.ConversationEvent;
import com.convolog.chat.conversation.ConversationEvent.AssistantChunkReceived;
import com.convolog.chat.conversation.ConversationEvent.AssistantStreamCompleted;
import com.convolog.chat.conversation.ConversationEvent.AssistantStreamFailed;
import com.convolog.chat.conversation.ConversationEvent.AssistantStreamStarted;
import com.convolog.chat.conversation.ConversationEvent.ConversationArchived;
import com.convolog.chat.conversation.ConversationEvent.ConversationCreated;
import com.convolog.chat.conversation.ConversationEvent.ConversationForked;
import com.convolog.chat.conversation.ConversationEvent.ConversationTitleUpdated;
import com.convolog.chat.conversation.ConversationEvent.ToolCallCompleted;
import com.convolog.chat.conversation.ConversationEvent.ToolCallStarted;
import com.convolog.chat.conversation.ConversationEvent.UserMessageAdded;
import com.convolog.chat.conversation.ConversationEvents;
import com.convolog.chat.conversation.ConversationStatus;
import com.convolog.eventmodel.StoredEvent;
import com.convolog.eventstore.EventBus;
import com.convolog.eventstore.EventStore;
import com.convolog.eventstore.StreamAppended;
import com.convolog.observability.CorrelationContext;
import com.convolog.observability.CorrelationContextHolder;
import com.convolog.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Builds the chat read models from conversation streams.
 *
 * <h2>Delivery</h2>
 *
 * <p>Append notifications from the {@link EventBus} are handed to a single worker thread, so
 * streams are projected one event at a time in version order. Notifications can be lost (none are
 * queued while the projector is stopped), so the worker also runs a catch-up against the log on
 * start and then every {@code catchUpInterval}. Together they deliver every event at least once.
 *
 * <h2>Idempotency</h2>
 *
 * <p>{@code conversations.last_projected_version} records the projector's position in each
 * stream and advances in the same transaction as the event's mutations. Events at or below it
 * are skipped. An event further ahead than the next version means a notification was missed; the
 * stream is then replayed from the log instead.
 *
 * <h2>Forks</h2>
 *
 * <p>A fork copies its parent's messages as they stood at {@code fork_at_version}, rebuilt from the
 * parent's log rather than its projected rows. A reply still streaming at that version is copied
 * as {@code failed}. A fork whose parent log is shorter than the fork version fails and is retried.
 *
 * <h2>Failures</h2>
 *
 * <p>A failing event rolls back alone, is logged, and leaves its stream in
 * {@link #failedStreams()} until a later catch-up succeeds. Projection errors never reach the
 * writers that published the notification.
 */
public class ChatProjector implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ChatProjector.class);

    private final EventStore eventStore;
    private final EventBus eventBus;
    private final ProjectionRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Duration catchUpInterval;
    private final int pageSize;

    private final Counter projected;
    private final Counter skipped;
    private final Counter failures;
    private final AtomicLong failedStreamGauge;
    private final Set<String> failedStreams = ConcurrentHashMap.newKeySet();

    private volatile ScheduledExecutorService worker;
    private volatile EventBus.Subscription subscription;
    private volatile boolean running;

    public ChatProjector(EventStore eventStore, EventBus eventBus, ProjectionRepository repository,
                         TransactionTemplate transactionTemplate, MetricFactory metrics,
                         Duration catchUpInterval, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.eventStore = eventStore;
        this.eventBus = eventBus;
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.catchUpInterval = catchUpInterval;
        this.pageSize = pageSize;
        this.projected = metrics.counter("projector.events", "Events applied to the read models", "outcome", "projected");
        this.skipped = metrics.counter("projector.events", "Events applied to the read models", "outcome", "skipped");
        this.failures = metrics.counter("projector.failures", "Events that failed to project");
        this.failedStreamGauge = metrics.gauge("projector.failed_streams", "Streams waiting for a repair catch-up");
    }

    // ── Lifecycle ──

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        worker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "chat-projector");
            thread.setDaemon(true);
            return thread;
        });
        subscription = eventBus.subscribe(this::onAppended);
        if (catchUpInterval != null && !catchUpInterval.isZero() && !catchUpInterval.isNegative()) {
            worker.scheduleWithFixedDelay(this::scheduledCatchUp, 0, catchUpInterval.toMillis(), TimeUnit.MILLISECONDS);
        } else {
            worker.execute(this::scheduledCatchUp);
        }
        running = true;
        log.info("Chat projector started (catchUpInterval={}, pageSize={})", catchUpInterval, pageSize);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        subscription.cancel();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Chat projector did not drain in time, interrupting");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
        log.info("Chat projector stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Waits until the worker has processed everything queued before this call.
     *
     * @return false if the timeout elapsed first or the projector is not running
     */
    public boolean flush(Duration timeout) {
        ScheduledExecutorService current = worker;
        if (!running || current == null) {
            return false;
        }
        try {
            Future<?> marker = current.submit(() -> { });
            marker.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (TimeoutException | ExecutionException | RejectedExecutionException e) {
            return false;
        }
    }

    /** Queues a full catch-up on the worker. */
    public void requestCatchUp() {
        submit(this::scheduledCatchUp);
    }

    /** Streams whose last projection attempt failed and that still wait for a catch-up. */
    public Set<String> failedStreams() {
        return Set.copyOf(failedStreams);
    }

    // ── Worker tasks ──

    private void onAppended(StreamAppended notification) {
        if (!notification.streamId().startsWith(ConversationAggregate.streamPrefix())) {
            return;
        }
        submit(() -> handle(notification));
    }

    private void submit(Runnable task) {
        ScheduledExecutorService current = worker;
        if (current == null) {
            return;
        }
        try {
            current.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Projector is shutting down, dropping task; the next catch-up covers it");
        }
    }

    void handle(StreamAppended notification) {
        String streamId = notification.streamId();
        CorrelationContext context = contextOf(notification.events().get(0));
        CorrelationContextHolder.runWithContext(context, () -> {
            try {
                long last = repository.lastProjectedVersion(streamId);
                if (notification.firstVersion() > last + 1) {
                    log.debug("Gap in {} (projected {}, received {}), catching up from the log",
                            streamId, last, notification.firstVersion());
                    catchUp(streamId);
                    return;
                }
                for (StoredEvent event : notification.events()) {
                    project(event);
                }
                markRepaired(streamId);
            } catch (RuntimeException e) {
                markFailed(streamId, e);
            }
        });
    }

    /** Runs a catch-up and keeps any failure inside the task, so the fixed-delay schedule survives it. */
    private void scheduledCatchUp() {
        try {
            catchUpAll();
        } catch (Throwable t) {
            log.error("Catch-up run failed, the next run is still scheduled", t);
        }
    }

    void catchUpAll() {
        List<String> streamIds;
        try {
            streamIds = eventStore.streamIds(ConversationAggregate.streamPrefix());
        } catch (RuntimeException e) {
            log.error("Catch-up could not list conversation streams", e);
            return;
        }
        int caughtUp = 0;
        for (String streamId : streamIds) {
            try {
                if (eventStore.currentVersion(streamId) > repository.lastProjectedVersion(streamId)) {
                    catchUp(streamId);
                    caughtUp++;
                }
                markRepaired(streamId);
            } catch (RuntimeException e) {
                markFailed(streamId, e);
            }
        }
        if (caughtUp > 0) {
            log.info("Catch-up projected missing events for {} of {} conversation stream(s)", caughtUp, streamIds.size());
        }
    }

    /** Replays everything after the stream's projected version. */
    void catchUp(String streamId) {
        long next = repository.lastProjectedVersion(streamId) + 1;
        while (true) {
            List<StoredEvent> page = eventStore.readForward(streamId, next, pageSize);
            for (StoredEvent event : page) {
                project(event);
                next = event.streamVersion() + 1;
            }
            if (page.size() < pageSize) {
                return;
            }
        }
    }

    // ── Projection ──

    private void project(StoredEvent stored) {
        ConversationEvent event = ConversationEvents.decode(stored);

        Boolean applied = transactionTemplate.execute(status -> {
            long last = repository.lastProjectedVersion(stored.streamId());
            if (stored.streamVersion() <= last) {
                return false;
            }
            if (stored.streamVersion() != last + 1) {
                throw new IllegalStateException("Event " + stored.streamVersion() + " of " + stored.streamId()
                        + " is not next after projected version " + last);
            }
            apply(stored, event);
            repository.advance(stored.streamId(), stored.streamVersion(), stored.insertedAt());
            return true;
        });

        if (Boolean.TRUE.equals(applied)) {
            projected.increment();
        } else {
            skipped.increment();
        }
    }

    private void apply(StoredEvent stored, ConversationEvent event) {
        Instant at = stored.insertedAt();

        if (event instanceof ConversationCreated e) {
            repository.insertConversation(new ConversationRow(e.conversationId(), stored.streamId(), e.userId(),
                    e.title(), e.modelId(), e.systemPrompt(), ConversationStatus.CREATED.value(), null, null, 0,
                    null, 0, at, at));
            return;
        }
        if (event instanceof ConversationForked e) {
            applyFork(stored, e, at);
            return;
        }

        ConversationRow conversation = repository.findConversationByStreamId(stored.streamId())
                .orElseThrow(() -> new IllegalStateException("No projected conversation for " + stored.streamId()
                        + " at event " + stored.streamVersion()));
        UUID conversationId = conversation.id();

        if (event instanceof UserMessageAdded e) {
            repository.insertMessage(new MessageRow(e.messageId(), conversationId, "user", e.content(), "complete",
                    null, null, null, null, null, null, stored.streamVersion(),
                    repository.nextPosition(conversationId), at, at));
            repository.updateStatus(conversationId, ConversationStatus.ACTIVE.value());
            repository.refreshMessageCount(conversationId, at);
        } else if (event instanceof AssistantStreamStarted e) {
            repository.insertMessage(new MessageRow(e.messageId(), conversationId, "assistant", "", "streaming",
                    e.modelId(), null, null, null, null, null, stored.streamVersion(),
                    repository.nextPosition(conversationId), at, at));
            repository.updateStatus(conversationId, ConversationStatus.STREAMING.value());
            repository.refreshMessageCount(conversationId, null);
        } else if (event instanceof AssistantChunkReceived e) {
            repository.insertChunk(new MessageChunkRow(chunkId(e.messageId(), e.chunkIndex()), e.messageId(),
                    e.chunkIndex(), e.contentBlockIndex(), e.deltaType(), e.deltaText()), at);
        } else if (event instanceof AssistantStreamCompleted e) {
            repository.completeMessage(e.messageId(), e.fullContent(), e.stopReason(), e.inputTokens(),
                    e.outputTokens(), e.latencyMs(), at);
            repository.updateStatus(conversationId, ConversationStatus.ACTIVE.value());
            repository.refreshMessageCount(conversationId, at);
        } else if (event instanceof AssistantStreamFailed e) {
            repository.updateMessageStatus(e.messageId(), "failed", at);
            repository.updateStatus(conversationId, ConversationStatus.ACTIVE.value());
        } else if (event instanceof ToolCallStarted e) {
            repository.insertToolCall(new ToolCallRow(toolCallId(e.messageId(), e.toolUseId()), e.messageId(),
                    e.toolUseId(), e.toolName(), e.input(), null, "started", null), at);
        } else if (event instanceof ToolCallCompleted e) {
            repository.completeToolCall(new ToolCallRow(toolCallId(e.messageId(), e.toolUseId()), e.messageId(),
                    e.toolUseId(), e.toolName(), e.input(), e.output(), "completed", e.durationMs()), at);
        } else if (event instanceof ConversationTitleUpdated e) {
            repository.updateTitle(conversationId, e.title());
        } else if (event instanceof ConversationArchived) {
            repository.updateStatus(conversationId, ConversationStatus.ARCHIVED.value());
        } else {
            throw new IllegalStateException("unhandled conversation event " + stored.eventType());
        }
    }

    private void applyFork(StoredEvent stored, ConversationForked e, Instant at) {
        Set<String> visiting = new HashSet<>();
        visiting.add(stored.streamId());
        ForkSource parent = forkSource(e.parentStreamId(), e.forkAtVersion(), visiting);

        boolean inserted = repository.insertConversation(new ConversationRow(e.newConversationId(), stored.streamId(),
                e.userId(), e.title(), e.modelId(), e.systemPrompt(), ConversationStatus.ACTIVE.value(),
                parent.conversationId(), e.forkAtVersion(), 0, null, 0, at, at));
        if (!inserted) {
            return;
        }

        Instant lastMessageAt = null;
        for (MessageRow message : parent.messages()) {
            repository.insertMessage(copyInto(e.newConversationId(), message, at));
            lastMessageAt = message.insertedAt();
        }
        repository.refreshMessageCount(e.newConversationId(), lastMessageAt);
    }

    /**
     * Rebuilds a stream's conversation id and messages as they stood at {@code toVersion} from its
     * events, following forks of forks. The result never depends on how far the stream itself has
     * been projected.
     *
     * @throws IllegalStateException if the stream does not reach {@code toVersion} yet, or the fork
     *                               chain loops back on itself
     */
    private ForkSource forkSource(String streamId, long toVersion, Set<String> visiting) {
        if (!visiting.add(streamId)) {
            throw new IllegalStateException("Fork chain loops back to " + streamId);
        }
        UUID conversationId = null;
        Map<UUID, MessageRow> messages = new LinkedHashMap<>();
        long next = 1;
        long last = 0;
        while (next <= toVersion) {
            int count = (int) Math.min(pageSize, toVersion - next + 1);
            List<StoredEvent> page = eventStore.readForward(streamId, next, count);
            for (StoredEvent stored : page) {
                ConversationEvent event = ConversationEvents.decode(stored);
                Instant at = stored.insertedAt();
                if (event instanceof ConversationCreated e) {
                    conversationId = e.conversationId();
                } else if (event instanceof ConversationForked e) {
                    conversationId = e.newConversationId();
                    for (MessageRow inherited : forkSource(e.parentStreamId(), e.forkAtVersion(), visiting).messages()) {
                        MessageRow copy = copyInto(conversationId, inherited, at);
                        messages.put(copy.id(), copy);
                    }
                } else if (event instanceof UserMessageAdded e) {
                    messages.put(e.messageId(), new MessageRow(e.messageId(), conversationId, "user", e.content(),
                            "complete", null, null, null, null, null, null, stored.streamVersion(),
                            messages.size() + 1, at, at));
                } else if (event instanceof AssistantStreamStarted e) {
                    messages.put(e.messageId(), new MessageRow(e.messageId(), conversationId, "assistant", "",
                            "streaming", e.modelId(), null, null, null, null, null, stored.streamVersion(),
                            messages.size() + 1, at, at));
                } else if (event instanceof AssistantStreamCompleted e) {
                    messages.computeIfPresent(e.messageId(), (id, m) -> completed(m, e, at));
                } else if (event instanceof AssistantStreamFailed e) {
                    messages.computeIfPresent(e.messageId(), (id, m) -> withStatus(m, "failed", at));
                }
                last = stored.streamVersion();
            }
            if (page.size() < count) {
                break;
            }
            next += page.size();
        }
        visiting.remove(streamId);
        if (conversationId == null || last < toVersion) {
            throw new IllegalStateException("Fork source " + streamId + " reaches version " + last
                    + ", fork needs " + toVersion);
        }
        return new ForkSource(conversationId, List.copyOf(messages.values()));
    }

    /** Copy of a parent message owned by the fork. A reply still streaming at the fork point is failed. */
    private static MessageRow copyInto(UUID conversationId, MessageRow message, Instant at) {
        String status = "streaming".equals(message.status()) ? "failed" : message.status();
        return new MessageRow(forkedMessageId(conversationId, message.id()), conversationId, message.role(),
                message.content(), status, message.modelId(), message.stopReason(), message.inputTokens(),
                message.outputTokens(), message.totalTokens(), message.latencyMs(), message.streamVersion(),
                message.position(), at, at);
    }

    private static MessageRow completed(MessageRow m, AssistantStreamCompleted e, Instant at) {
        Integer total = e.inputTokens() != null && e.outputTokens() != null
                ? e.inputTokens() + e.outputTokens()
                : null;
        return new MessageRow(m.id(), m.conversationId(), m.role(), e.fullContent(), "complete", m.modelId(),
                e.stopReason(), e.inputTokens(), e.outputTokens(), total, e.latencyMs(), m.streamVersion(),
                m.position(), m.insertedAt(), at);
    }

    private static MessageRow withStatus(MessageRow m, String status, Instant at) {
        return new MessageRow(m.id(), m.conversationId(), m.role(), m.content(), status, m.modelId(),
                m.stopReason(), m.inputTokens(), m.outputTokens(), m.totalTokens(), m.latencyMs(),
                m.streamVersion(), m.position(), m.insertedAt(), at);
    }

    private record ForkSource(UUID conversationId, List<MessageRow> messages) {
    }

    // ── Helpers ──

    static UUID forkedMessageId(UUID conversationId, UUID parentMessageId) {
        return nameUuid("fork:" + conversationId + ":" + parentMessageId);
    }

    static UUID chunkId(UUID messageId, int chunkIndex) {
        return nameUuid("chunk:" + messageId + ":" + chunkIndex);
    }

    static UUID toolCallId(UUID messageId, String toolUseId) {
        return nameUuid("tool_call:" + messageId + ":" + toolUseId);
    }

    private static UUID nameUuid(String name) {
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }

    private static CorrelationContext contextOf(StoredEvent event) {
        Object correlationId = event.metadata().get("correlation_id");
        if (correlationId instanceof String id && !id.isBlank()) {
            Object userId = event.metadata().get("user_id");
            return new CorrelationContext(id, event.id().toString(), userId instanceof String u ? u : null, null);
        }
        return CorrelationContext.system("chat-projector");
    }

    private void markFailed(String streamId, RuntimeException e) {
        failures.increment();
        failedStreams.add(streamId);
        failedStreamGauge.set(failedStreams.size());
        log.error("Failed to project {}, it will be retried by the next catch-up", streamId, e);
    }

    private void markRepaired(String streamId) {
        if (failedStreams.remove(streamId)) {
            failedStreamGauge.set(failedStreams.size());
            log.info("Projection of {} recovered", streamId);
        }
    }
}
