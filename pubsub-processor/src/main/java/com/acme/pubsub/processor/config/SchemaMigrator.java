package com.acme.pubsub.processor.config;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.util.Locale;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Applies the Flyway scripts shipped with the JDBC module for the configured dialect. */
@Singleton
@Requires(property = "db.dialect")
public class SchemaMigrator {
  private static final Logger LOG = LoggerFactory.getLogger(SchemaMigrator.class);

  public int migrate(DataSource dataSource, String dialect) {
    String location = "classpath:db/migration/" + dialect.toLowerCase(Locale.ROOT);
    MigrateResult result =
        Flyway.configure().dataSource(dataSource).locations(location).load().migrate();
    LOG.info("Schema migrated from {}: {} migration(s) applied", location, result.migrationsExecuted);
    return result.migrationsExecuted;
  }
}
