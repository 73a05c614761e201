package com.acme.mailroute.processor;

import com.acme.mailroute.config.PollingConfig;
import com.acme.mailroute.core.MailSourceException;
import com.acme.mailroute.core.ValidationException;
import com.acme.mailroute.domain.IngestionOutcome;
import com.acme.mailroute.spi.MailSourceClient;
import com.acme.mailroute.spi.RawMessage;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Pulls messages from the {@link MailSourceClient}. On start it connects, backfills one batch with
 * the backfill query and then polls at a fixed delay. Errors in a cycle are logged and the loop
 * carries on at the next interval.
 */
@Slf4j
@Singleton
@Requires(beans = MailSourceClient.class)
public class MailPoller {

  private final MailSourceClient source;
  private final IngestionCoordinator coordinator;
  private final FilterService filters;
  private final PollingConfig config;
  private final TaskScheduler scheduler;

  private final AtomicLong polls = new AtomicLong();
  private final AtomicLong ingested = new AtomicLong();
  private final AtomicLong filtered = new AtomicLong();
  private final AtomicLong duplicates = new AtomicLong();
  private final AtomicLong failures = new AtomicLong();

  private volatile boolean running;
  private volatile Instant lastPollAt;
  private ScheduledFuture<?> schedule;

  public MailPoller(
      MailSourceClient source,
      IngestionCoordinator coordinator,
      FilterService filters,
      PollingConfig config,
      @Named(TaskExecutors.SCHEDULED) TaskScheduler scheduler) {
    this.source = source;
    this.coordinator = coordinator;
    this.filters = filters;
    this.config = config;
    this.scheduler = scheduler;
  }

  /**
   * @throws MailSourceException if the source cannot be connected
   */
  public synchronized PollStartResult start(Map<String, String> credentials) {
    if (running) {
      log.info("Poller already running");
      return new PollStartResult(false, 0);
    }
    connect(credentials);

    int backfilled = ingestBatch(config.getBackfillQuery());
    log.info("Backfill ingested {} messages", backfilled);

    running = true;
    schedule =
        scheduler.scheduleWithFixedDelay(
            config.getInterval(), config.getInterval(), this::pollOnce);
    log.info(
        "Polling every {} with batch size {}", config.getIntervalString(), config.getBatchSize());
    return new PollStartResult(true, backfilled);
  }

  public synchronized void stop() {
    running = false;
    if (schedule != null) {
      schedule.cancel(false);
      schedule = null;
    }
    try {
      source.disconnect();
    } catch (RuntimeException e) {
      log.warn("Disconnect failed: {}", e.getMessage());
    }
    log.info("Poller stopped");
  }

  @PreDestroy
  void close() {
    if (running) {
      stop();
    }
  }

  /** One steady-state cycle. Does nothing once stopped. */
  public void pollOnce() {
    if (!running) {
      return;
    }
    try {
      int count = ingestBatch(config.getPollQuery());
      log.debug("Poll cycle ingested {} messages", count);
    } catch (RuntimeException e) {
      // an exception escaping here would cancel the schedule
      failures.incrementAndGet();
      log.error("Error in poll cycle: {}", e.getMessage(), e);
    } finally {
      polls.incrementAndGet();
      lastPollAt = Instant.now();
    }
  }

  public PollStatus status() {
    boolean connected;
    try {
      connected = source.isConnected();
    } catch (RuntimeException e) {
      log.warn("Connection check failed: {}", e.getMessage());
      connected = false;
    }
    return new PollStatus(
        running,
        connected,
        config.getInterval(),
        config.getBatchSize(),
        lastPollAt,
        polls.get(),
        ingested.get(),
        filtered.get(),
        duplicates.get(),
        failures.get());
  }

  private void connect(Map<String, String> credentials) {
    boolean connected;
    try {
      connected = source.connect(credentials);
    } catch (MailSourceException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new MailSourceException("Failed to connect to mail source: " + e.getMessage(), e);
    }
    if (!connected) {
      throw new MailSourceException("Mail source refused the connection");
    }
    log.info("Connected to mail source");
  }

  private int ingestBatch(String query) {
    List<RawMessage> batch;
    try {
      batch = source.fetchMessages(config.getBatchSize(), query);
    } catch (RuntimeException e) {
      failures.incrementAndGet();
      log.warn("Fetch with query '{}' failed: {}", query, e.getMessage());
      return 0;
    }
    int count = 0;
    for (RawMessage raw : batch) {
      if (ingest(raw)) {
        count++;
      }
    }
    return count;
  }

  private boolean ingest(RawMessage raw) {
    try {
      if (filters.shouldIgnore(raw.sender(), raw.subject())) {
        filtered.incrementAndGet();
        log.debug("Filtered message {} from {}", raw.id(), raw.sender());
        return false;
      }
      IngestionOutcome outcome = coordinator.receive(raw.toMessage());
      if (outcome instanceof IngestionOutcome.Skipped) {
        duplicates.incrementAndGet();
        return false;
      }
      ingested.incrementAndGet();
      return true;
    } catch (ValidationException e) {
      failures.incrementAndGet();
      log.warn("Rejected message {}: {}", raw.id(), e.getMessage());
    } catch (RuntimeException e) {
      failures.incrementAndGet();
      log.error("Failed to ingest message {}: {}", raw.id(), e.getMessage(), e);
    }
    return false;
  }
}
