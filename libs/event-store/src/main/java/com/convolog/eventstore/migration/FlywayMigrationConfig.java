package com.convolog.eventstore.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Runs the Flyway migrations against the application {@link DataSource} when the context starts.
 *
 * <p>Spring Boot's own Flyway auto-configuration must be switched off for services importing this
 * class:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * @see FlywayConfigProperties
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "convolog.flyway", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FlywayMigrationConfig {

    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    /** Bean name of the migrated Flyway instance; beans that touch the schema may depend on it. */
    public static final String FLYWAY_BEAN = "convologFlyway";

    @Bean(name = FLYWAY_BEAN)
    public Flyway convologFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        Flyway flyway = createFlyway(dataSource, properties);
        migrate(flyway);
        return flyway;
    }

    static Flyway createFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations().toArray(String[]::new))
                .baselineOnMigrate(properties.baselineOnMigrate())
                .cleanDisabled(true)
                .load();
    }

    static MigrateResult migrate(Flyway flyway) {
        MigrateResult result = flyway.migrate();
        log.info("Applied {} migration(s), schema at version {}",
                result.migrationsExecuted, result.targetSchemaVersion);
        return result;
    }
}
