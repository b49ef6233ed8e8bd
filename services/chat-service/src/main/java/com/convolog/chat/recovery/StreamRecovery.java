package com.convolog.chat.recovery;

import com.convolog.aggregate.CommandRejectedException;
import com.convolog.aggregate.LoadedAggregate;
import com.convolog.chat.conversation.ConversationCommand.FailStream;
import com.convolog.chat.conversation.ConversationService;
import com.convolog.chat.conversation.ConversationState;
import com.convolog.chat.projection.ConversationRow;
import com.convolog.chat.projection.ProjectionRepository;
import com.convolog.eventstore.WrongExpectedVersionException;
import com.convolog.observability.CorrelationContext;
import com.convolog.observability.CorrelationContextHolder;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Safety net for assistant replies that never finished.
 *
 * <p>A conversation left {@code streaming} after its stream producer died would block new user
 * messages forever. This sweep finds projected conversations that have been streaming for longer
 * than {@code streamTimeout} and fails the in-flight message with error type
 * {@code stream_timeout}. The authoritative check happens in the aggregate: if the stream ended in
 * the meantime, the command is a no-op. Conflicts and rejections are logged and left to the next
 * sweep.
 */
public class StreamRecovery {

    private static final Logger log = LoggerFactory.getLogger(StreamRecovery.class);

    public static final String STREAM_TIMEOUT = "stream_timeout";

    private final ProjectionRepository repository;
    private final ConversationService conversations;
    private final Clock clock;
    private final Duration streamTimeout;
    private final int batchSize;

    public StreamRecovery(ProjectionRepository repository, ConversationService conversations, Clock clock,
                          Duration streamTimeout, int batchSize) {
        this.repository = repository;
        this.conversations = conversations;
        this.clock = clock;
        this.streamTimeout = streamTimeout;
        this.batchSize = batchSize;
    }

    @Scheduled(
            fixedDelayString = "${convolog.chat.recovery.sweep-interval-ms:60000}",
            initialDelayString = "${convolog.chat.recovery.sweep-interval-ms:60000}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Stream recovery sweep failed", e);
        }
    }

    /**
     * Runs one sweep.
     *
     * @return number of streams that were failed
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(streamTimeout);
        List<ConversationRow> stale = repository.findStreamingSince(cutoff, batchSize);
        if (stale.isEmpty()) {
            log.trace("No stuck streams");
            return 0;
        }

        log.info("Found {} conversation(s) streaming since before {}", stale.size(), cutoff);
        CorrelationContext context = CorrelationContext.system("stream-recovery");
        return CorrelationContextHolder.callWithContext(context, () -> {
            int recovered = 0;
            for (ConversationRow conversation : stale) {
                if (recover(conversation)) {
                    recovered++;
                }
            }
            return recovered;
        });
    }

    private boolean recover(ConversationRow conversation) {
        String streamId = conversation.streamId();
        try {
            LoadedAggregate<ConversationState> loaded = conversations.load(streamId);
            ConversationState state = loaded.state();
            if (!state.isStreaming()) {
                log.debug("{} is no longer streaming, projection will catch up", streamId);
                return false;
            }
            var result = conversations.execute(streamId, new FailStream(state.streamingMessageId(), STREAM_TIMEOUT,
                    "No stream activity for " + streamTimeout, 0));
            if (result.noop()) {
                return false;
            }
            log.warn("Failed stuck message {} in {} after {}", state.streamingMessageId(), streamId, streamTimeout);
            return true;
        } catch (WrongExpectedVersionException e) {
            log.info("{} changed during recovery, retrying on the next sweep", streamId);
        } catch (CommandRejectedException e) {
            log.warn("Recovery of {} rejected: {}", streamId, e.reason());
        } catch (RuntimeException e) {
            log.error("Recovery of {} failed", streamId, e);
        }
        return false;
    }
}
