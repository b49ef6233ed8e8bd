package com.convolog.chat.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.time.Duration;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;

@DisplayName("ChatServiceConfig")
class ChatServiceConfigTest {

    private final ChatServiceConfig config = new ChatServiceConfig();

    private static ChatProperties storeTimeouts(Duration query, Duration transaction) {
        return new ChatProperties("chat-service", null, null, new ChatProperties.Store(query, transaction), null, null);
    }

    @Test
    @DisplayName("sub-second store timeouts round up to one second instead of disabling the timeout")
    void subSecondTimeouts() {
        ChatProperties properties = storeTimeouts(Duration.ofMillis(500), Duration.ofMillis(1));

        assertThat(config.jdbcTemplate(mock(DataSource.class), properties).getQueryTimeout()).isEqualTo(1);
        assertThat(config.transactionTemplate(mock(PlatformTransactionManager.class), properties).getTimeout())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("fractional timeouts round up to the next whole second")
    void roundsUp() {
        ChatProperties properties = storeTimeouts(Duration.ofMillis(2_001), Duration.ofSeconds(10));

        assertThat(config.jdbcTemplate(mock(DataSource.class), properties).getQueryTimeout()).isEqualTo(3);
        assertThat(config.transactionTemplate(mock(PlatformTransactionManager.class), properties).getTimeout())
                .isEqualTo(10);
    }

    @Test
    @DisplayName("a zero timeout leaves statements and transactions unbounded")
    void zeroMeansNoTimeout() {
        ChatProperties properties = storeTimeouts(Duration.ZERO, Duration.ZERO);

        assertThat(config.jdbcTemplate(mock(DataSource.class), properties).getQueryTimeout()).isZero();
        assertThat(config.transactionTemplate(mock(PlatformTransactionManager.class), properties).getTimeout())
                .isEqualTo(TransactionDefinition.TIMEOUT_DEFAULT);
    }
}
