package com.convolog.chat.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Chat service settings, bound from {@code convolog.chat.*}.
 *
 * <pre>
 * convolog:
 *   chat:
 *     name: chat-service
 *     environment: production
 *     aggregate:
 *       page-size: 10000
 *       snapshot-every: 100
 *     store:
 *       query-timeout: 5s
 *       transaction-timeout: 10s
 *     projector:
 *       enabled: true
 *       catch-up-interval: 30s
 *       page-size: 500
 *     recovery:
 *       enabled: true
 *       stream-timeout: 5m
 *       sweep-interval-ms: 60000
 *       batch-size: 100
 * </pre>
 *
 * <p>Missing groups and fields fall back to the defaults shown above; the compact constructors
 * run before Bean Validation, so defaults satisfy the constraints.
 *
 * @param name service name used in logs and metrics
 * @param environment deployment environment
 * @param aggregate command pipeline tuning
 * @param store event store timeouts
 * @param projector read-model projector settings
 * @param recovery stuck-stream sweep settings
 */
@Validated
@ConfigurationProperties(prefix = "convolog.chat")
public record ChatProperties(
        @NotBlank String name,
        String environment,
        @Valid Aggregate aggregate,
        @Valid Store store,
        @Valid Projector projector,
        @Valid Recovery recovery) {

    public ChatProperties {
        if (environment == null || environment.isBlank()) environment = "development";
        if (aggregate == null) aggregate = new Aggregate(null, null);
        if (store == null) store = new Store(null, null);
        if (projector == null) projector = new Projector(null, null, null);
        if (recovery == null) recovery = new Recovery(null, null, null, null);
    }

    /**
     * @param pageSize events read per round trip while rebuilding state
     * @param snapshotEvery save a snapshot every this many events, 0 to disable
     */
    public record Aggregate(@Positive Integer pageSize, @PositiveOrZero Integer snapshotEvery) {
        public Aggregate {
            if (pageSize == null) pageSize = 10_000;
            if (snapshotEvery == null) snapshotEvery = 100;
        }
    }

    /**
     * @param queryTimeout JDBC statement timeout for store calls, rounded up to whole seconds, zero for none
     * @param transactionTimeout timeout of an append transaction
     */
    public record Store(Duration queryTimeout, Duration transactionTimeout) {
        public Store {
            if (queryTimeout == null) queryTimeout = Duration.ofSeconds(5);
            if (transactionTimeout == null) transactionTimeout = Duration.ofSeconds(10);
        }
    }

    /**
     * @param enabled whether the projector runs in this instance
     * @param catchUpInterval delay between full catch-ups against the log, 0 for start-up only
     * @param pageSize events read per round trip during catch-up
     */
    public record Projector(Boolean enabled, Duration catchUpInterval, @Positive Integer pageSize) {
        public Projector {
            if (enabled == null) enabled = true;
            if (catchUpInterval == null) catchUpInterval = Duration.ofSeconds(30);
            if (pageSize == null) pageSize = 500;
        }
    }

    /**
     * @param enabled whether the sweep runs in this instance
     * @param streamTimeout how long a conversation may stream without new events
     * @param sweepIntervalMs delay between sweeps in milliseconds
     * @param batchSize maximum conversations recovered per sweep
     */
    public record Recovery(Boolean enabled, Duration streamTimeout, @Positive Long sweepIntervalMs,
                           @Positive Integer batchSize) {
        public Recovery {
            if (enabled == null) enabled = true;
            if (streamTimeout == null) streamTimeout = Duration.ofMinutes(5);
            if (sweepIntervalMs == null) sweepIntervalMs = 60_000L;
            if (batchSize == null) batchSize = 100;
        }
    }
}
