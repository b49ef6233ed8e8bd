/**
 * Flyway schema migration for the event store.
 *
 * <ul>
 *   <li>{@link com.convolog.eventstore.migration.FlywayConfigProperties} externalized settings
 *   <li>{@link com.convolog.eventstore.migration.FlywayMigrationConfig} runs the migrations on the
 *       application data source
 * </ul>
 */
package com.convolog.eventstore.migration;
