package com.convolog.chat.config;

import com.convolog.aggregate.AggregateLoader;
import com.convolog.chat.conversation.ConversationAggregate;
import com.convolog.chat.conversation.ConversationService;
import com.convolog.chat.projection.ChatProjector;
import com.convolog.chat.projection.ChatProjectorHealthIndicator;
import com.convolog.chat.projection.ProjectionRepository;
import com.convolog.chat.recovery.StreamRecovery;
import com.convolog.eventstore.EventBus;
import com.convolog.eventstore.EventStore;
import com.convolog.eventstore.InMemoryEventBus;
import com.convolog.eventstore.JdbcEventStore;
import com.convolog.eventstore.JdbcSnapshotStore;
import com.convolog.eventstore.SnapshotStore;
import com.convolog.eventstore.migration.FlywayMigrationConfig;
import com.convolog.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Wires the event store, command pipeline, projector and recovery sweep.
 */
@Configuration
@Import(FlywayMigrationConfig.class)
public class ChatServiceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource, ChatProperties properties) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout(ceilSeconds(properties.store().queryTimeout()));
        return jdbcTemplate;
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager,
                                                   ChatProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        int timeout = ceilSeconds(properties.store().transactionTimeout());
        template.setTimeout(timeout > 0 ? timeout : TransactionDefinition.TIMEOUT_DEFAULT);
        return template;
    }

    /** Whole seconds, rounded up so a sub-second timeout never becomes 0 (no timeout). */
    static int ceilSeconds(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return 0;
        }
        long seconds = timeout.getSeconds() + (timeout.getNano() > 0 ? 1 : 0);
        return (int) Math.min(seconds, Integer.MAX_VALUE);
    }

    // ── Event store ──

    @Bean
    public EventBus eventBus() {
        return new InMemoryEventBus();
    }

    @Bean
    public EventStore eventStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                 EventBus eventBus, Clock clock) {
        return new JdbcEventStore(jdbcTemplate, transactionTemplate, eventBus, clock);
    }

    @Bean
    public SnapshotStore snapshotStore(JdbcTemplate jdbcTemplate, Clock clock) {
        return new JdbcSnapshotStore(jdbcTemplate, clock);
    }

    // ── Commands ──

    @Bean
    public AggregateLoader aggregateLoader(EventStore eventStore, SnapshotStore snapshotStore,
                                           MeterRegistry meterRegistry, ChatProperties properties) {
        return new AggregateLoader(eventStore, snapshotStore, new MetricFactory(meterRegistry, "aggregate"),
                properties.aggregate().pageSize(), properties.aggregate().snapshotEvery());
    }

    @Bean
    public ConversationAggregate conversationAggregate(Clock clock) {
        return new ConversationAggregate(clock);
    }

    @Bean
    public ConversationService conversationService(AggregateLoader aggregateLoader,
                                                   ConversationAggregate conversationAggregate) {
        return new ConversationService(aggregateLoader, conversationAggregate);
    }

    // ── Read models ──

    @Bean
    public ProjectionRepository projectionRepository(JdbcTemplate jdbcTemplate) {
        return new ProjectionRepository(jdbcTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "convolog.chat.projector", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public ChatProjector chatProjector(EventStore eventStore, EventBus eventBus, ProjectionRepository repository,
                                       TransactionTemplate transactionTemplate, MeterRegistry meterRegistry,
                                       ChatProperties properties) {
        return new ChatProjector(eventStore, eventBus, repository, transactionTemplate,
                new MetricFactory(meterRegistry, "projector"), properties.projector().catchUpInterval(),
                properties.projector().pageSize());
    }

    @Bean
    @ConditionalOnProperty(prefix = "convolog.chat.projector", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public ChatProjectorHealthIndicator chatProjectorHealthIndicator(ChatProjector chatProjector) {
        return new ChatProjectorHealthIndicator(chatProjector);
    }

    @Bean
    @ConditionalOnProperty(prefix = "convolog.chat.recovery", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public StreamRecovery streamRecovery(ProjectionRepository repository, ConversationService conversationService,
                                         Clock clock, ChatProperties properties) {
        return new StreamRecovery(repository, conversationService, clock, properties.recovery().streamTimeout(),
                properties.recovery().batchSize());
    }
}
