package com.acme.mailroute.persistence.jdbc;

import com.acme.mailroute.core.PermanentException;
import com.acme.mailroute.core.TransientException;
import java.sql.SQLException;
import java.util.Locale;
import org.slf4j.Logger;

/**
 * Translates {@link SQLException} into the pipeline's retry vocabulary: {@link
 * TransientException} for errors worth retrying, {@link PermanentException} for the rest.
 */
public final class ExceptionTranslator {

  static final String UNIQUE_VIOLATION = "23505";

  private ExceptionTranslator() {}

  /**
   * @param operation short description of the failed operation, used in the log and message
   * @return the exception to throw; unknown errors are treated as transient
   */
  public static RuntimeException translateException(
      SQLException originalException, String operation, Logger logger) {

    logger.error("Database operation failed: {}", operation, originalException);

    if (isTransientError(originalException)) {
      return new TransientException(
          String.format(
              "Transient database error during %s: %s",
              operation, originalException.getMessage()),
          originalException);
    }

    if (isPermanentError(originalException)) {
      return new PermanentException(
          String.format(
              "Permanent database error during %s: %s",
              operation, originalException.getMessage()),
          originalException);
    }

    return new TransientException(
        String.format("Database error during %s: %s", operation, originalException.getMessage()),
        originalException);
  }

  /** Both H2 and PostgreSQL report unique-key conflicts with SQLSTATE 23505. */
  public static boolean isUniqueViolation(SQLException exception) {
    return exception != null && UNIQUE_VIOLATION.equals(exception.getSQLState());
  }

  private static boolean isTransientError(SQLException exception) {
    if (exception == null) {
      return false;
    }
    String message = lower(exception.getMessage());
    if (message.contains("timeout")
        || message.contains("connection refused")
        || message.contains("deadlock")
        || message.contains("too many connections")
        || message.contains("pool exhausted")) {
      return true;
    }

    String sqlState = exception.getSQLState();
    if (sqlState != null) {
      // 08xxx connection exception, 40xxx transaction rollback
      if (sqlState.startsWith("08") || sqlState.startsWith("40") || sqlState.equals("57P03")) {
        return true;
      }
    }

    // H2: 90008 general timeout
    return exception.getErrorCode() == 90008;
  }

  private static boolean isPermanentError(SQLException exception) {
    if (exception == null) {
      return false;
    }
    String message = lower(exception.getMessage());
    if (message.contains("syntax error")
        || message.contains("table not found")
        || message.contains("column not found")
        || message.contains("does not exist")
        || message.contains("constraint violation")
        || message.contains("unique constraint")
        || message.contains("type mismatch")) {
      return true;
    }

    String sqlState = exception.getSQLState();
    if (sqlState != null
        && (sqlState.startsWith("22")
            || sqlState.startsWith("23")
            || sqlState.startsWith("42")
            || sqlState.startsWith("3D")
            || sqlState.startsWith("3F"))) {
      return true;
    }

    // H2: 90002 table not found, 90007 parameter count, 42122 column not found
    int errorCode = exception.getErrorCode();
    return errorCode == 90002 || errorCode == 90007 || errorCode == 42122;
  }

  private static String lower(String message) {
    return message == null ? "" : message.toLowerCase(Locale.ROOT);
  }
}
