package com.acme.mailroute.persistence.jdbc;

import com.acme.mailroute.core.ValidationException;
import com.acme.mailroute.domain.FilterConfiguration;
import com.acme.mailroute.domain.FilterKind;
import com.acme.mailroute.repository.FilterRepository;
import io.micronaut.transaction.annotation.Transactional;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Abstract JDBC implementation of FilterRepository. Patterns are stored lower-cased. */
public abstract class JdbcFilterRepository implements FilterRepository {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcFilterRepository.class);

  protected final DataSource dataSource;

  protected JdbcFilterRepository(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  @Override
  @Transactional
  public FilterConfiguration load() {
    List<String> senders = new ArrayList<>();
    List<String> subjects = new ArrayList<>();

    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps =
            conn.prepareStatement("SELECT kind, pattern FROM message_filter ORDER BY id");
        ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        FilterKind kind = FilterKind.valueOf(rs.getString("kind"));
        (kind == FilterKind.SENDER ? senders : subjects).add(rs.getString("pattern"));
      }
      return new FilterConfiguration(senders, subjects);
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "load message filters", LOG);
    }
  }

  @Override
  @Transactional
  public boolean add(FilterKind kind, String pattern) {
    String normalized = normalize(pattern);
    String sql = getInsertIfAbsentSql();

    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, kind.name());
      ps.setString(2, normalized);
      ps.setTimestamp(3, Timestamp.from(Instant.now()));
      if (sql.contains("WHERE NOT EXISTS")) {
        ps.setString(4, kind.name());
        ps.setString(5, normalized);
      }
      boolean added = ps.executeUpdate() > 0;
      LOG.debug("Add filter: kind={}, pattern={}, added={}", kind, normalized, added);
      return added;
    } catch (SQLException e) {
      if (ExceptionTranslator.isUniqueViolation(e)) {
        return false;
      }
      throw ExceptionTranslator.translateException(e, "add message filter", LOG);
    }
  }

  @Override
  @Transactional
  public boolean remove(FilterKind kind, String pattern) {
    String normalized = normalize(pattern);

    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps =
            conn.prepareStatement("DELETE FROM message_filter WHERE kind = ? AND pattern = ?")) {
      ps.setString(1, kind.name());
      ps.setString(2, normalized);
      return ps.executeUpdate() > 0;
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "remove message filter", LOG);
    }
  }

  private static String normalize(String pattern) {
    if (pattern == null || pattern.isBlank()) {
      throw new ValidationException("Filter pattern cannot be empty");
    }
    return pattern.trim().toLowerCase(Locale.ROOT);
  }

  /** Parameters 1-3: kind, pattern, created_at. */
  protected abstract String getInsertIfAbsentSql();
}
