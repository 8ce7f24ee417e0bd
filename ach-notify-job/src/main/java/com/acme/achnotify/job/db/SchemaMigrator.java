package com.acme.achnotify.job.db;

import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;

/**
 * Applies the Flyway migrations shipped in the persistence module before a run. Connects with
 * the default datasource settings directly, outside the transaction-aware pool.
 */
@Slf4j
@Singleton
public class SchemaMigrator {

  private final boolean enabled;
  private final String locations;
  private final String url;
  private final String username;
  private final String password;

  public SchemaMigrator(
      @Value("${ach-notify.schema.migrate:true}") boolean enabled,
      @Value("${ach-notify.schema.locations:`classpath:db/migration`}") String locations,
      @Value("${datasources.default.url}") String url,
      @Value("${datasources.default.username:}") String username,
      @Value("${datasources.default.password:}") String password) {
    this.enabled = enabled;
    this.locations = locations;
    this.url = url;
    this.username = username;
    this.password = password;
  }

  /**
   * @return number of migrations applied, 0 when disabled or already current
   */
  public int migrate() {
    if (!enabled) {
      log.info("Schema migration disabled (ach-notify.schema.migrate=false)");
      return 0;
    }
    Flyway flyway =
        Flyway.configure()
            .dataSource(url, username, password)
            .locations(locations.split(","))
            .load();
    MigrateResult result = flyway.migrate();
    log.info(
        "Schema migrated to version {} ({} migration(s) applied)",
        result.targetSchemaVersion != null ? result.targetSchemaVersion : result.initialSchemaVersion,
        result.migrationsExecuted);
    return result.migrationsExecuted;
  }
}
