package com.acme.mailroute.persistence.jdbc;

import static com.acme.mailroute.persistence.jdbc.mapper.MessageRecordMapper.toTimestamp;

import com.acme.mailroute.core.Jsons;
import com.acme.mailroute.core.PermanentException;
import com.acme.mailroute.dispatch.ActionResult;
import com.acme.mailroute.domain.ClassificationResult;
import com.acme.mailroute.domain.Message;
import com.acme.mailroute.domain.MessageRecord;
import com.acme.mailroute.domain.ProcessingStatus;
import com.acme.mailroute.persistence.jdbc.mapper.MessageRecordMapper;
import com.acme.mailroute.repository.MessageRepository;
import io.micronaut.transaction.annotation.Transactional;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of MessageRepository using Template Method pattern. Subclasses
 * supply the dialect-specific insert-if-absent and JSON-column statements.
 */
public abstract class JdbcMessageRepository implements MessageRepository {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcMessageRepository.class);

  protected static final String COLUMNS =
      "id, external_id, subject, body, sender, recipient, received_at, headers, status, category,"
          + " confidence, department, stage, explanation, sentiment, priority, probabilities,"
          + " keywords, classified_at, action_log, error, created_at, updated_at";

  protected final DataSource dataSource;

  protected JdbcMessageRepository(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  @Override
  @Transactional
  public Optional<MessageRecord> insertIfAbsent(Message message) {
    String sql = getInsertIfAbsentSql();
    UUID id = UUID.randomUUID();
    Instant now = Instant.now();

    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {

      ps.setObject(1, id);
      ps.setString(2, message.externalId());
      ps.setString(3, message.subject());
      ps.setString(4, message.body());
      ps.setString(5, message.sender());
      ps.setString(6, message.recipient());
      ps.setTimestamp(7, toTimestamp(message.receivedAt()));
      ps.setString(8, Jsons.toJson(message.headers()));
      ps.setString(9, ProcessingStatus.PENDING.name());
      ps.setTimestamp(10, toTimestamp(now));
      ps.setTimestamp(11, toTimestamp(now));
      // H2 style: INSERT ... SELECT ... WHERE NOT EXISTS(... external_id = ?)
      if (sql.contains("WHERE NOT EXISTS")) {
        ps.setString(12, message.externalId());
      }

      if (ps.executeUpdate() == 0) {
        LOG.debug("Message already stored: externalId={}", message.externalId());
        return Optional.empty();
      }
      LOG.debug("Stored message: id={}, externalId={}", id, message.externalId());
      return Optional.of(MessageRecord.pending(id, message, now));

    } catch (SQLException e) {
      if (ExceptionTranslator.isUniqueViolation(e)) {
        // lost a concurrent insert race on external_id
        LOG.debug(
            "Message already stored (concurrent insert): externalId={}", message.externalId());
        return Optional.empty();
      }
      throw ExceptionTranslator.translateException(e, "insert message", LOG);
    }
  }

  @Override
  @Transactional
  public Optional<MessageRecord> findById(UUID id) {
    return findOne("SELECT " + COLUMNS + " FROM mail_message WHERE id = ?", id, "find by id");
  }

  @Override
  @Transactional
  public Optional<MessageRecord> findByExternalId(String externalId) {
    if (externalId == null) {
      return Optional.empty();
    }
    return findOne(
        "SELECT " + COLUMNS + " FROM mail_message WHERE external_id = ?",
        externalId,
        "find by external id");
  }

  @Override
  @Transactional
  public List<MessageRecord> findByStatus(ProcessingStatus status, int limit) {
    String sql =
        "SELECT "
            + COLUMNS
            + " FROM mail_message WHERE status = ? ORDER BY created_at, id LIMIT ?";

    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, status.name());
      ps.setInt(2, limit);
      List<MessageRecord> records = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          records.add(MessageRecordMapper.map(rs));
        }
      }
      return records;
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "find messages by status", LOG);
    }
  }

  @Override
  @Transactional
  public long countByStatus(ProcessingStatus status) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps =
            conn.prepareStatement("SELECT COUNT(*) FROM mail_message WHERE status = ?")) {
      ps.setString(1, status.name());
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getLong(1) : 0L;
      }
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "count messages by status", LOG);
    }
  }

  @Override
  @Transactional
  public long count() {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM mail_message");
        ResultSet rs = ps.executeQuery()) {
      return rs.next() ? rs.getLong(1) : 0L;
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "count messages", LOG);
    }
  }

  @Override
  @Transactional
  public void markProcessing(UUID id) {
    String sql = "UPDATE mail_message SET status = ?, updated_at = ? WHERE id = ?";

    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, ProcessingStatus.PROCESSING.name());
      ps.setTimestamp(2, toTimestamp(Instant.now()));
      ps.setObject(3, id);
      requireUpdated(ps.executeUpdate(), id);
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "mark message processing", LOG);
    }
  }

  @Override
  @Transactional
  public void saveClassification(UUID id, ClassificationResult classification) {
    Instant now = Instant.now();

    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getSaveClassificationSql())) {
      ps.setString(1, classification.category());
      ps.setDouble(2, classification.confidence());
      ps.setString(3, classification.department());
      ps.setString(4, classification.stage());
      ps.setString(5, classification.explanation());
      ps.setString(6, classification.sentiment());
      ps.setString(7, classification.priority());
      ps.setString(8, Jsons.toJson(classification.probabilities()));
      ps.setString(9, Jsons.toJson(classification.keywords()));
      ps.setTimestamp(10, toTimestamp(now));
      ps.setTimestamp(11, toTimestamp(now));
      ps.setObject(12, id);
      requireUpdated(ps.executeUpdate(), id);
      LOG.debug(
          "Saved classification: id={}, category={}, stage={}",
          id,
          classification.category(),
          classification.stage());
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "save classification", LOG);
    }
  }

  @Override
  @Transactional
  public void markProcessed(UUID id, List<ActionResult> actions) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getMarkProcessedSql())) {
      ps.setString(1, ProcessingStatus.PROCESSED.name());
      ps.setString(2, Jsons.toJson(actions == null ? List.of() : actions));
      ps.setNull(3, Types.VARCHAR);
      ps.setTimestamp(4, toTimestamp(Instant.now()));
      ps.setObject(5, id);
      requireUpdated(ps.executeUpdate(), id);
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "mark message processed", LOG);
    }
  }

  @Override
  @Transactional
  public void markFailed(UUID id, String error) {
    String sql = "UPDATE mail_message SET status = ?, error = ?, updated_at = ? WHERE id = ?";

    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, ProcessingStatus.FAILED.name());
      ps.setString(2, truncate(error));
      ps.setTimestamp(3, toTimestamp(Instant.now()));
      ps.setObject(4, id);
      requireUpdated(ps.executeUpdate(), id);
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "mark message failed", LOG);
    }
  }

  private Optional<MessageRecord> findOne(String sql, Object key, String operation) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setObject(1, key);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(MessageRecordMapper.map(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, operation, LOG);
    }
  }

  private static void requireUpdated(int rows, UUID id) {
    if (rows == 0) {
      throw new PermanentException("Message not found: " + id);
    }
  }

  private static String truncate(String error) {
    if (error == null) {
      return null;
    }
    return error.length() > 4000 ? error.substring(0, 4000) : error;
  }

  // Template methods for database-specific SQL

  /**
   * Parameters 1-11: id, external_id, subject, body, sender, recipient, received_at, headers,
   * status, created_at, updated_at.
   */
  protected abstract String getInsertIfAbsentSql();

  /**
   * Parameters 1-12: category, confidence, department, stage, explanation, sentiment, priority,
   * probabilities, keywords, classified_at, updated_at, id.
   */
  protected abstract String getSaveClassificationSql();

  /** Parameters 1-5: status, action_log, error, updated_at, id. */
  protected abstract String getMarkProcessedSql();
}
