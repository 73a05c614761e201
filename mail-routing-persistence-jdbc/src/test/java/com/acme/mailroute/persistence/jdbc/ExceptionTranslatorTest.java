package com.acme.mailroute.persistence.jdbc;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.mailroute.core.PermanentException;
import com.acme.mailroute.core.TransientException;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class ExceptionTranslatorTest {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionTranslatorTest.class);

  @Nested
  @DisplayName("Transient Error Detection")
  class TransientErrorTests {

    @Test
    @DisplayName("connection failures are transient")
    void testConnectionFailure() {
      // Given
      SQLException cause = new SQLException("Connection refused to host", "08001");

      // When
      RuntimeException result = ExceptionTranslator.translateException(cause, "connect", logger);

      // Then
      assertThat(result).isInstanceOf(TransientException.class).hasCause(cause);
      assertThat(result.getMessage()).contains("connect");
    }

    @Test
    @DisplayName("deadlocks are transient")
    void testDeadlock() {
      SQLException cause = new SQLException("Deadlock detected", "40P01");

      assertThat(ExceptionTranslator.translateException(cause, "update", logger))
          .isInstanceOf(TransientException.class);
    }

    @Test
    @DisplayName("unrecognised errors default to transient")
    void testUnknownDefaultsToTransient() {
      SQLException cause = new SQLException("something odd");

      assertThat(ExceptionTranslator.translateException(cause, "query", logger))
          .isInstanceOf(TransientException.class);
    }
  }

  @Nested
  @DisplayName("Permanent Error Detection")
  class PermanentErrorTests {

    @Test
    @DisplayName("syntax errors are permanent")
    void testSyntaxError() {
      SQLException cause = new SQLException("bad statement", "42601");

      assertThat(ExceptionTranslator.translateException(cause, "query", logger))
          .isInstanceOf(PermanentException.class);
    }

    @Test
    @DisplayName("H2 table-not-found error code is permanent")
    void testH2TableNotFound() {
      SQLException cause = new SQLException("missing", null, 90002);

      assertThat(ExceptionTranslator.translateException(cause, "query", logger))
          .isInstanceOf(PermanentException.class);
    }
  }

  @Test
  @DisplayName("unique violation is recognised by SQLSTATE")
  void testUniqueViolation() {
    assertThat(ExceptionTranslator.isUniqueViolation(new SQLException("dup", "23505"))).isTrue();
    assertThat(ExceptionTranslator.isUniqueViolation(new SQLException("fk", "23503"))).isFalse();
    assertThat(ExceptionTranslator.isUniqueViolation(null)).isFalse();
  }
}
