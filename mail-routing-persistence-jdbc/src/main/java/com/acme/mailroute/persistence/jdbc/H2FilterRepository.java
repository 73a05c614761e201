package com.acme.mailroute.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2FilterRepository extends JdbcFilterRepository {

  public H2FilterRepository(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected String getInsertIfAbsentSql() {
    return """
        INSERT INTO message_filter (kind, pattern, created_at)
        SELECT ?, ?, ?
        WHERE NOT EXISTS(SELECT 1 FROM message_filter WHERE kind = ? AND pattern = ?)
        """;
  }
}
