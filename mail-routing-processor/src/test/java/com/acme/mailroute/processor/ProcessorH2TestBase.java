package com.acme.mailroute.processor;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;

/**
 * H2 in-memory database migrated with the persistence module's migrations, for tests that run the
 * processor against real repositories.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class ProcessorH2TestBase {

  protected static HikariDataSource dataSource;

  @BeforeAll
  protected void setupSchema() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:processordb;DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE");
    config.setDriverClassName("org.h2.Driver");
    config.setUsername("sa");
    config.setPassword("");
    config.setMaximumPoolSize(8);

    dataSource = new HikariDataSource(config);

    Flyway flyway =
        Flyway.configure().dataSource(dataSource).locations("classpath:db/migration/h2").load();
    flyway.migrate();
  }

  protected void clearTables() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().execute("DELETE FROM mail_message");
      conn.createStatement().execute("DELETE FROM message_filter");
    }
  }

  @AfterAll
  void tearDown() {
    if (dataSource != null) {
      dataSource.close();
    }
  }
}
