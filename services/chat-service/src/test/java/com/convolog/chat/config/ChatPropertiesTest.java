package com.convolog.chat.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the {@link ChatProperties} record defaults and constraints, without a Spring
 * context.
 */
@DisplayName("ChatProperties")
class ChatPropertiesTest {

    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    @Test
    @DisplayName("fills every missing group with defaults")
    void defaults() {
        var props = new ChatProperties("chat-service", null, null, null, null, null);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.aggregate().pageSize()).isEqualTo(10_000);
        assertThat(props.aggregate().snapshotEvery()).isEqualTo(100);
        assertThat(props.store().queryTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.store().transactionTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(props.projector().enabled()).isTrue();
        assertThat(props.projector().catchUpInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.projector().pageSize()).isEqualTo(500);
        assertThat(props.recovery().enabled()).isTrue();
        assertThat(props.recovery().streamTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(props.recovery().sweepIntervalMs()).isEqualTo(60_000L);
        assertThat(props.recovery().batchSize()).isEqualTo(100);
        assertThat(validator.validate(props)).isEmpty();
    }

    @Test
    @DisplayName("keeps explicit values")
    void explicitValues() {
        var props = new ChatProperties("chat", "production",
                new ChatProperties.Aggregate(50, 0),
                new ChatProperties.Store(Duration.ofSeconds(1), Duration.ofSeconds(2)),
                new ChatProperties.Projector(false, Duration.ZERO, 10),
                new ChatProperties.Recovery(false, Duration.ofMinutes(2), 1_000L, 5));

        assertThat(props.aggregate().snapshotEvery()).isZero();
        assertThat(props.projector().enabled()).isFalse();
        assertThat(props.projector().catchUpInterval()).isZero();
        assertThat(props.recovery().streamTimeout()).isEqualTo(Duration.ofMinutes(2));
        assertThat(validator.validate(props)).isEmpty();
    }

    @Test
    @DisplayName("rejects a blank name and non-positive sizes")
    void constraints() {
        var props = new ChatProperties(" ", null,
                new ChatProperties.Aggregate(0, -1),
                null,
                new ChatProperties.Projector(null, null, -5),
                new ChatProperties.Recovery(null, null, 0L, 0));

        assertThat(validator.validate(props))
                .extracting(violation -> violation.getPropertyPath().toString())
                .containsExactlyInAnyOrder("name", "aggregate.pageSize", "aggregate.snapshotEvery",
                        "projector.pageSize", "recovery.sweepIntervalMs", "recovery.batchSize");
    }
}
