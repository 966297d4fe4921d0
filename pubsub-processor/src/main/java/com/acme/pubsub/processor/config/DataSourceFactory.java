package com.acme.pubsub.processor.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** HikariCP pool for the JDBC message store and dead-letter repository. */
@Factory
@Requires(property = "db.dialect")
public class DataSourceFactory {
  private static final Logger LOG = LoggerFactory.getLogger(DataSourceFactory.class);

  @Singleton
  @Bean(preDestroy = "close")
  public HikariDataSource dataSource(
      DataSourceProperties properties,
      SchemaMigrator migrator,
      @Value("${db.dialect}") String dialect) {
    HikariConfig config = new HikariConfig();
    config.setPoolName("pubsub");
    config.setJdbcUrl(properties.getUrl());
    config.setUsername(properties.getUsername());
    config.setPassword(properties.getPassword());
    if (properties.getDriverClassName() != null) {
      config.setDriverClassName(properties.getDriverClassName());
    }
    config.setMaximumPoolSize(properties.getMaximumPoolSize());
    config.setMinimumIdle(properties.getMinimumIdle());

    HikariDataSource dataSource = new HikariDataSource(config);
    LOG.info("Opened {} connection pool to {}", dialect, properties.getUrl());
    if (properties.isMigrate()) {
      migrator.migrate(dataSource, dialect);
    }
    return dataSource;
  }
}
