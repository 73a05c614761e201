package com.acme.mailroute.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** H2-specific implementation of MessageRepository */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2MessageRepository extends JdbcMessageRepository {

  public H2MessageRepository(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected String getInsertIfAbsentSql() {
    return """
        INSERT INTO mail_message (id, external_id, subject, body, sender, recipient, received_at,
                                  headers, status, created_at, updated_at)
        SELECT ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?
        WHERE NOT EXISTS(SELECT 1 FROM mail_message WHERE external_id = ?)
        """;
  }

  @Override
  protected String getSaveClassificationSql() {
    return """
        UPDATE mail_message
        SET category = ?, confidence = ?, department = ?, stage = ?, explanation = ?,
            sentiment = ?, priority = ?, probabilities = ?, keywords = ?,
            classified_at = ?, updated_at = ?
        WHERE id = ?
        """;
  }

  @Override
  protected String getMarkProcessedSql() {
    return """
        UPDATE mail_message
        SET status = ?, action_log = ?, error = ?, updated_at = ?
        WHERE id = ?
        """;
  }
}
