package com.convolog.eventstore.migration;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Flyway settings for the event store and the schemas that ship alongside it.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * convolog:
 *   flyway:
 *     enabled: true
 *     locations:
 *       - classpath:db/migration/eventstore
 *       - classpath:db/migration/chat
 *     baseline-on-migrate: false
 * }</pre>
 *
 * @param enabled whether migrations run on startup
 * @param locations migration locations, applied as one versioned sequence
 * @param baselineOnMigrate baseline a non-empty schema that has no history table
 */
@Validated
@ConfigurationProperties(prefix = "convolog.flyway")
public record FlywayConfigProperties(
        Boolean enabled, @NotEmpty List<String> locations, Boolean baselineOnMigrate) {

    /** Location of the event and snapshot tables. */
    public static final String EVENT_STORE_LOCATION = "classpath:db/migration/eventstore";

    public FlywayConfigProperties {
        if (enabled == null) enabled = true;
        if (locations == null || locations.isEmpty()) locations = List.of(EVENT_STORE_LOCATION);
        if (baselineOnMigrate == null) baselineOnMigrate = false;
        locations = List.copyOf(locations);
    }
}
