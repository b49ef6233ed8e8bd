package com.convolog.chat;

import com.convolog.chat.config.ChatProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Chat service: conversation command pipeline, read-model projector and stuck-stream recovery.
 *
 * <p>Runs the event store migrations on start, then starts the projector once the context is
 * refreshed. Spring Boot's own Flyway auto-configuration stays disabled
 * ({@code spring.flyway.enabled=false}); migrations are owned by
 * {@link com.convolog.eventstore.migration.FlywayMigrationConfig}.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(ChatProperties.class)
public class ChatServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(ChatServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ChatServiceApplication.class, args);
        log.info("Chat service started");
    }
}
