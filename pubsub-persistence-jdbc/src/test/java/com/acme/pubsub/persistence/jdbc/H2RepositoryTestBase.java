package com.acme.pubsub.persistence.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;

/**
 * Base class for H2-based repository integration tests. Each test class gets its own in-memory
 * database migrated with the H2 scripts shipped on the classpath.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class H2RepositoryTestBase {

  protected HikariDataSource dataSource;

  @BeforeAll
  protected void setupSchema() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(
        "jdbc:h2:mem:" + getClass().getSimpleName() + ";DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE");
    config.setDriverClassName("org.h2.Driver");
    config.setUsername("sa");
    config.setPassword("");
    config.setMaximumPoolSize(5);

    dataSource = new HikariDataSource(config);

    Flyway.configure().dataSource(dataSource).locations("classpath:db/migration/h2").load().migrate();
  }

  @AfterAll
  void tearDown() {
    if (dataSource != null) {
      dataSource.close();
    }
  }

  protected DataSource getDataSource() {
    return dataSource;
  }

  protected void truncate(String... tables) throws SQLException {
    try (Connection conn = dataSource.getConnection();
        Statement statement = conn.createStatement()) {
      for (String table : tables) {
        statement.execute("DELETE FROM " + table);
      }
    }
  }
}
