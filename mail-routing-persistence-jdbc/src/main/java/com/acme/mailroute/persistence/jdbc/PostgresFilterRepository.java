package com.acme.mailroute.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresFilterRepository extends JdbcFilterRepository {

  public PostgresFilterRepository(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected String getInsertIfAbsentSql() {
    return """
        INSERT INTO message_filter (kind, pattern, created_at)
        VALUES (?, ?, ?)
        ON CONFLICT (kind, pattern) DO NOTHING
        """;
  }
}
