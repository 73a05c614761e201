package com.acme.mailroute.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.acme.mailroute.config.PollingConfig;
import com.acme.mailroute.core.MailSourceException;
import com.acme.mailroute.core.ValidationException;
import com.acme.mailroute.domain.IngestionOutcome.Received;
import com.acme.mailroute.domain.IngestionOutcome.Skipped;
import com.acme.mailroute.domain.Message;
import com.acme.mailroute.spi.MailSourceClient;
import com.acme.mailroute.spi.RawMessage;
import io.micronaut.scheduling.TaskScheduler;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("MailPoller Tests")
class MailPollerTest {

  private static final Map<String, String> CREDENTIALS = Map.of("token", "secret");

  @Mock private MailSourceClient source;
  @Mock private IngestionCoordinator coordinator;
  @Mock private FilterService filters;
  @Mock private TaskScheduler scheduler;
  @Mock private ScheduledFuture<Object> future;

  private final PollingConfig config = new PollingConfig();
  private MailPoller poller;

  @BeforeEach
  void setup() {
    config.setBatchSize(3);
    config.setInterval(Duration.ofSeconds(30));
    poller = new MailPoller(source, coordinator, filters, config, scheduler);
    lenient()
        .doReturn(future)
        .when(scheduler)
        .scheduleWithFixedDelay(any(Duration.class), any(Duration.class), any(Runnable.class));
  }

  private static RawMessage raw(String id, String sender, String subject) {
    return new RawMessage(id, subject, "body " + id, sender, null, null, Map.of());
  }

  private static Received received() {
    return Received.queued(UUID.randomUUID());
  }

  @Nested
  @DisplayName("start")
  class StartTests {

    @Test
    @DisplayName("backfills one batch before the first steady-state cycle is scheduled")
    void testBackfillBeforeSchedule() {
      // Given
      when(source.connect(CREDENTIALS)).thenReturn(true);
      when(source.fetchMessages(3, "in:inbox"))
          .thenReturn(
              List.of(raw("m1", "a@x", "one"), raw("m2", "b@x", "two"), raw("m3", "c@x", "3")));
      when(coordinator.receive(any(Message.class))).thenReturn(received());

      // When
      PollStartResult result = poller.start(CREDENTIALS);

      // Then
      assertThat(result).isEqualTo(new PollStartResult(true, 3));
      InOrder order = inOrder(source, coordinator, scheduler);
      order.verify(source).connect(CREDENTIALS);
      order.verify(source).fetchMessages(3, "in:inbox");
      order.verify(coordinator, times(3)).receive(any(Message.class));
      order
          .verify(scheduler)
          .scheduleWithFixedDelay(
              eq(Duration.ofSeconds(30)), eq(Duration.ofSeconds(30)), any(Runnable.class));
      verify(source, never()).fetchMessages(3, "is:unread");
    }

    @Test
    @DisplayName("a refused connection raises MailSourceException and schedules nothing")
    void testConnectRefused() {
      // Given
      when(source.connect(CREDENTIALS)).thenReturn(false);

      // When / Then
      assertThatThrownBy(() -> poller.start(CREDENTIALS)).isInstanceOf(MailSourceException.class);
      verify(scheduler, never())
          .scheduleWithFixedDelay(any(Duration.class), any(Duration.class), any(Runnable.class));
      assertThat(poller.status().running()).isFalse();
    }

    @Test
    @DisplayName("connect errors are wrapped in MailSourceException")
    void testConnectThrows() {
      // Given
      when(source.connect(CREDENTIALS)).thenThrow(new IllegalStateException("network"));

      // When / Then
      assertThatThrownBy(() -> poller.start(CREDENTIALS))
          .isInstanceOf(MailSourceException.class)
          .hasMessageContaining("network");
    }

    @Test
    @DisplayName("a failing backfill fetch still starts the loop")
    void testBackfillFetchFails() {
      // Given
      when(source.connect(CREDENTIALS)).thenReturn(true);
      when(source.fetchMessages(3, "in:inbox")).thenThrow(new MailSourceException("quota"));

      // When
      PollStartResult result = poller.start(CREDENTIALS);

      // Then
      assertThat(result).isEqualTo(new PollStartResult(true, 0));
      assertThat(poller.status().failures()).isEqualTo(1);
    }

    @Test
    @DisplayName("starting twice does not schedule a second loop")
    void testStartTwice() {
      // Given
      when(source.connect(CREDENTIALS)).thenReturn(true);
      when(source.fetchMessages(3, "in:inbox")).thenReturn(List.of());
      poller.start(CREDENTIALS);

      // When
      PollStartResult second = poller.start(CREDENTIALS);

      // Then
      assertThat(second.started()).isFalse();
      verify(source, times(1)).connect(CREDENTIALS);
    }
  }

  @Nested
  @DisplayName("poll cycle")
  class PollCycleTests {

    @BeforeEach
    void started() {
      when(source.connect(CREDENTIALS)).thenReturn(true);
      when(source.fetchMessages(3, "in:inbox")).thenReturn(List.of());
      poller.start(CREDENTIALS);
    }

    @Test
    @DisplayName("filtered, duplicate and invalid messages are counted and skipped")
    void testPerMessageOutcomes() {
      // Given
      RawMessage newsletter = raw("n1", "news@list.example", "Weekly digest");
      RawMessage dup = raw("d1", "a@x", "seen");
      RawMessage empty = raw("e1", "a@x", "");
      RawMessage fresh = raw("f1", "b@x", "hello");
      when(source.fetchMessages(3, "is:unread"))
          .thenReturn(List.of(newsletter, dup, empty, fresh));
      when(filters.shouldIgnore(anyString(), anyString())).thenReturn(false);
      when(filters.shouldIgnore("news@list.example", "Weekly digest")).thenReturn(true);
      when(coordinator.receive(dup.toMessage())).thenReturn(Skipped.duplicate("d1"));
      when(coordinator.receive(empty.toMessage()))
          .thenThrow(new ValidationException("Subject and body cannot both be empty"));
      when(coordinator.receive(fresh.toMessage())).thenReturn(received());

      // When
      poller.pollOnce();

      // Then
      PollStatus status = poller.status();
      assertThat(status.polls()).isEqualTo(1);
      assertThat(status.ingested()).isEqualTo(1);
      assertThat(status.filtered()).isEqualTo(1);
      assertThat(status.duplicates()).isEqualTo(1);
      assertThat(status.failures()).isEqualTo(1);
      assertThat(status.lastPollAt()).isNotNull();
      verify(coordinator, never()).receive(newsletter.toMessage());
    }

    @Test
    @DisplayName("a fetch failure is logged and the next cycle runs normally")
    void testFetchFailureContinues() {
      // Given
      when(source.fetchMessages(3, "is:unread"))
          .thenThrow(new MailSourceException("timeout"))
          .thenReturn(List.of(raw("m1", "a@x", "hi")));
      when(coordinator.receive(any(Message.class))).thenReturn(received());

      // When
      poller.pollOnce();
      poller.pollOnce();

      // Then
      PollStatus status = poller.status();
      assertThat(status.polls()).isEqualTo(2);
      assertThat(status.failures()).isEqualTo(1);
      assertThat(status.ingested()).isEqualTo(1);
    }

    @Test
    @DisplayName("stop cancels the schedule, disconnects and turns later cycles into no-ops")
    void testStop() {
      // When
      poller.stop();
      poller.pollOnce();

      // Then
      verify(future).cancel(false);
      verify(source).disconnect();
      verify(source, never()).fetchMessages(3, "is:unread");
      assertThat(poller.status().running()).isFalse();
      verify(coordinator, never()).receive(any());
      verify(filters, never()).shouldIgnore(anyString(), anyString());
    }
  }

  @Test
  @DisplayName("status reports configuration and connection state")
  void testStatus() {
    // Given
    when(source.isConnected()).thenReturn(true);

    // When
    PollStatus status = poller.status();

    // Then
    assertThat(status.connected()).isTrue();
    assertThat(status.interval()).isEqualTo(Duration.ofSeconds(30));
    assertThat(status.batchSize()).isEqualTo(3);
    assertThat(status.running()).isFalse();
    verify(source, never()).connect(anyMap());
  }
}
