package com.acme.mailroute.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** PostgreSQL-specific implementation of MessageRepository. JSON columns are JSONB. */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresMessageRepository extends JdbcMessageRepository {

  public PostgresMessageRepository(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected String getInsertIfAbsentSql() {
    return """
        INSERT INTO mail_message (id, external_id, subject, body, sender, recipient, received_at,
                                  headers, status, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, CAST(? AS JSONB), ?, ?, ?)
        ON CONFLICT (external_id) DO NOTHING
        """;
  }

  @Override
  protected String getSaveClassificationSql() {
    return """
        UPDATE mail_message
        SET category = ?, confidence = ?, department = ?, stage = ?, explanation = ?,
            sentiment = ?, priority = ?, probabilities = CAST(? AS JSONB),
            keywords = CAST(? AS JSONB), classified_at = ?, updated_at = ?
        WHERE id = ?
        """;
  }

  @Override
  protected String getMarkProcessedSql() {
    return """
        UPDATE mail_message
        SET status = ?, action_log = CAST(? AS JSONB), error = ?, updated_at = ?
        WHERE id = ?
        """;
  }
}
