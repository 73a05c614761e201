package com.acme.mailroute.persistence.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.acme.mailroute.core.PermanentException;
import com.acme.mailroute.dispatch.ActionResult;
import com.acme.mailroute.dispatch.ActionStatus;
import com.acme.mailroute.domain.ClassificationResult;
import com.acme.mailroute.domain.Message;
import com.acme.mailroute.domain.MessageRecord;
import com.acme.mailroute.domain.ProcessingStatus;
import com.acme.mailroute.rules.ActionType;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** H2-based integration tests for the JDBC MessageRepository. */
class H2MessageRepositoryTest extends H2RepositoryTestBase {

  private H2MessageRepository repository;

  @BeforeEach
  void setUp() throws Exception {
    repository = new H2MessageRepository(dataSource);

    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().execute("DELETE FROM mail_message");
    }
  }

  private static Message message(String externalId, String subject) {
    return new Message(
            externalId,
            subject,
            "Body of " + subject,
            "Alice <alice@example.com>",
            "team@company.com",
            Instant.parse("2024-03-01T10:15:30Z"),
            Map.of(Message.HAS_ATTACHMENT, "true"))
        .normalized();
  }

  @Nested
  @DisplayName("Insert If Absent")
  class InsertTests {

    @Test
    @DisplayName("first insert stores a PENDING record with all message fields")
    void testInsertStoresPendingRecord() {
      // When
      Optional<MessageRecord> inserted = repository.insertIfAbsent(message("ext-1", "Hello"));

      // Then
      assertThat(inserted).isPresent();
      MessageRecord loaded = repository.findById(inserted.get().id()).orElseThrow();
      assertThat(loaded.status()).isEqualTo(ProcessingStatus.PENDING);
      assertThat(loaded.message().subject()).isEqualTo("Hello");
      assertThat(loaded.message().sender()).isEqualTo("Alice <alice@example.com>");
      assertThat(loaded.message().recipient()).isEqualTo("team@company.com");
      assertThat(loaded.message().receivedAt()).isEqualTo(Instant.parse("2024-03-01T10:15:30Z"));
      assertThat(loaded.message().hasAttachment()).isTrue();
      assertThat(loaded.classification()).isNull();
      assertThat(loaded.actions()).isEmpty();
    }

    @Test
    @DisplayName("long subject, sender and recipient are stored without truncation")
    void testLongFieldsStoredInFull() {
      // Given
      String subject = "Re: ".repeat(700) + "invoice";
      String sender = "Accounts Payable <" + "ap".repeat(400) + "@vendor.example>";
      String recipient = "team-" + "x".repeat(800) + "@company.com";
      Message longMessage =
          new Message("ext-long", subject, "body", sender, recipient, null, Map.of()).normalized();

      // When
      Optional<MessageRecord> inserted = repository.insertIfAbsent(longMessage);

      // Then
      Message loaded = repository.findById(inserted.orElseThrow().id()).orElseThrow().message();
      assertThat(loaded.subject()).isEqualTo(subject);
      assertThat(loaded.sender()).isEqualTo(sender);
      assertThat(loaded.recipient()).isEqualTo(recipient);
    }

    @Test
    @DisplayName("a unique violation from a concurrent insert is reported as a duplicate")
    void testUniqueViolationIsDuplicate() throws Exception {
      // Given
      DataSource racing = mock(DataSource.class);
      Connection conn = mock(Connection.class);
      PreparedStatement ps = mock(PreparedStatement.class);
      when(racing.getConnection()).thenReturn(conn);
      when(conn.prepareStatement(anyString())).thenReturn(ps);
      when(ps.executeUpdate())
          .thenThrow(new SQLException("Unique index or primary key violation", "23505"));

      // When
      Optional<MessageRecord> inserted =
          new H2MessageRepository(racing).insertIfAbsent(message("ext-race", "Hello"));

      // Then
      assertThat(inserted).isEmpty();
    }

    @Test
    @DisplayName("duplicate external id returns empty and stores nothing")
    void testDuplicateExternalId() {
      // Given
      repository.insertIfAbsent(message("ext-2", "First"));

      // When
      Optional<MessageRecord> second = repository.insertIfAbsent(message("ext-2", "Second"));

      // Then
      assertThat(second).isEmpty();
      assertThat(repository.count()).isEqualTo(1);
      assertThat(repository.findByExternalId("ext-2").orElseThrow().message().subject())
          .isEqualTo("First");
    }

    @Test
    @DisplayName("messages without external id are always stored")
    void testNullExternalIdNeverDeduplicated() {
      // When
      repository.insertIfAbsent(message(null, "One"));
      repository.insertIfAbsent(message(null, "Two"));

      // Then
      assertThat(repository.count()).isEqualTo(2);
      assertThat(repository.findByExternalId(null)).isEmpty();
    }
  }

  @Nested
  @DisplayName("Status Transitions")
  class StatusTests {

    @Test
    @DisplayName("classification and action log are persisted and read back")
    void testSaveClassificationAndMarkProcessed() {
      // Given
      UUID id = repository.insertIfAbsent(message("ext-3", "Invoice")).orElseThrow().id();
      ClassificationResult result =
          new ClassificationResult(
              "finance",
              0.7,
              Map.of("finance", 0.7, "sales", 0.3),
              "Finance",
              "Matched keywords [invoice]",
              "domain",
              null,
              "normal",
              Map.of("finance", List.of("invoice")));
      ActionResult action =
          new ActionResult(
              ActionType.TAG,
              "Billing",
              ActionStatus.COMPLETED,
              null,
              "billing_route",
              Instant.now().truncatedTo(ChronoUnit.MILLIS));

      // When
      repository.markProcessing(id);
      repository.saveClassification(id, result);
      repository.markProcessed(id, List.of(action));

      // Then
      MessageRecord loaded = repository.findById(id).orElseThrow();
      assertThat(loaded.status()).isEqualTo(ProcessingStatus.PROCESSED);
      assertThat(loaded.classification()).isEqualTo(result);
      assertThat(loaded.actions()).containsExactly(action);
      assertThat(loaded.error()).isNull();
    }

    @Test
    @DisplayName("markFailed stores the error and markProcessed clears it")
    void testFailedThenProcessed() {
      // Given
      UUID id = repository.insertIfAbsent(message("ext-4", "Retry me")).orElseThrow().id();

      // When
      repository.markFailed(id, "classifier exploded");

      // Then
      MessageRecord failed = repository.findById(id).orElseThrow();
      assertThat(failed.status()).isEqualTo(ProcessingStatus.FAILED);
      assertThat(failed.error()).isEqualTo("classifier exploded");

      // When
      repository.markProcessed(id, List.of());

      // Then
      assertThat(repository.findById(id).orElseThrow().error()).isNull();
    }

    @Test
    @DisplayName("updating an unknown id is a permanent error")
    void testUnknownId() {
      assertThatThrownBy(() -> repository.markProcessing(UUID.randomUUID()))
          .isInstanceOf(PermanentException.class)
          .hasMessageContaining("Message not found");
    }
  }

  @Nested
  @DisplayName("Queries")
  class QueryTests {

    @Test
    @DisplayName("findByStatus returns oldest first and honours the limit")
    void testFindByStatus() throws Exception {
      // Given
      UUID first = repository.insertIfAbsent(message("q-1", "First")).orElseThrow().id();
      Thread.sleep(5);
      UUID second = repository.insertIfAbsent(message("q-2", "Second")).orElseThrow().id();
      Thread.sleep(5);
      UUID third = repository.insertIfAbsent(message("q-3", "Third")).orElseThrow().id();
      repository.markFailed(third, "boom");

      // When
      List<MessageRecord> pending = repository.findByStatus(ProcessingStatus.PENDING, 10);
      List<MessageRecord> limited = repository.findByStatus(ProcessingStatus.PENDING, 1);

      // Then
      assertThat(pending).extracting(MessageRecord::id).containsExactly(first, second);
      assertThat(limited).extracting(MessageRecord::id).containsExactly(first);
      assertThat(repository.countByStatus(ProcessingStatus.PENDING)).isEqualTo(2);
      assertThat(repository.countByStatus(ProcessingStatus.FAILED)).isEqualTo(1);
      assertThat(repository.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("findById returns empty for unknown id")
    void testFindUnknown() {
      assertThat(repository.findById(UUID.randomUUID())).isEmpty();
    }
  }
}
