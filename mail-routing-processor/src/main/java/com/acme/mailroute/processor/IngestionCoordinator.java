package com.acme.mailroute.processor;

import com.acme.mailroute.config.IngestionConfig;
import com.acme.mailroute.domain.ClassificationResult;
import com.acme.mailroute.domain.IngestionOutcome;
import com.acme.mailroute.domain.IngestionOutcome.Received;
import com.acme.mailroute.domain.IngestionOutcome.Skipped;
import com.acme.mailroute.domain.Message;
import com.acme.mailroute.domain.MessageRecord;
import com.acme.mailroute.domain.ProcessingStatus;
import com.acme.mailroute.repository.MessageRepository;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for new messages. Validates, deduplicates on external id and hands the stored record
 * to the {@link RoutingPipeline}, inline or on a background job depending on {@code
 * ingestion.mode}.
 */
@Slf4j
@Singleton
public class IngestionCoordinator {

  private final MessageRepository messages;
  private final RoutingPipeline pipeline;
  private final BackgroundTaskSupervisor supervisor;
  private final IngestionConfig config;

  public IngestionCoordinator(
      MessageRepository messages,
      RoutingPipeline pipeline,
      BackgroundTaskSupervisor supervisor,
      IngestionConfig config) {
    this.messages = messages;
    this.pipeline = pipeline;
    this.supervisor = supervisor;
    this.config = config;
  }

  /**
   * @throws com.acme.mailroute.core.ValidationException if subject and body are both empty; nothing
   *     is stored
   */
  public IngestionOutcome receive(Message message) {
    Message normalized = message.normalized();

    Optional<MessageRecord> stored = messages.insertIfAbsent(normalized);
    if (stored.isEmpty()) {
      log.info("Skipped duplicate message externalId={}", normalized.externalId());
      return Skipped.duplicate(normalized.externalId());
    }
    UUID id = stored.get().id();
    log.info(
        "Received message {} externalId={} from {}",
        id,
        normalized.externalId(),
        normalized.sender());

    if (config.isAsync()) {
      return submit(id, normalized) ? Received.queued(id) : new Received(id, null, false);
    }
    ClassificationResult classification = pipeline.process(id, normalized).orElse(null);
    return Received.classified(id, classification);
  }

  /**
   * @return true when no background work is left, false on timeout
   */
  public boolean waitForBackground(Duration timeout) {
    return supervisor.drain(timeout);
  }

  /**
   * Runs the pipeline again for PENDING records, then PROCESSING records untouched for {@code
   * ingestion.stale-processing-after}, then FAILED ones, oldest first. Records with a job still in
   * flight are left alone.
   *
   * @return number of records resubmitted
   */
  public int reprocessPending(int limit) {
    return reprocessPending(limit, config.getStaleProcessingAfter());
  }

  /**
   * @param processingGrace PROCESSING records updated within this window are assumed to be in
   *     flight; {@link Duration#ZERO} recovers all of them, which is only safe before any work
   *     has been accepted
   */
  public int reprocessPending(int limit, Duration processingGrace) {
    Instant staleBefore = Instant.now().minus(processingGrace);
    int resubmitted = 0;
    for (ProcessingStatus status :
        List.of(ProcessingStatus.PENDING, ProcessingStatus.PROCESSING, ProcessingStatus.FAILED)) {
      if (resubmitted >= limit) {
        break;
      }
      for (MessageRecord record : messages.findByStatus(status, limit - resubmitted)) {
        if (supervisor.isRunning(jobName(record.id()))) {
          continue;
        }
        if (status == ProcessingStatus.PROCESSING && record.updatedAt().isAfter(staleBefore)) {
          continue;
        }
        if (config.isAsync()) {
          if (!submit(record.id(), record.message())) {
            continue;
          }
        } else {
          pipeline.process(record.id(), record.message());
        }
        resubmitted++;
      }
    }
    log.info("Reprocessing resubmitted {} messages", resubmitted);
    return resubmitted;
  }

  private boolean submit(UUID id, Message message) {
    try {
      supervisor.spawn(jobName(id), () -> pipeline.process(id, message));
      return true;
    } catch (IllegalStateException e) {
      log.warn("Could not queue message {}: {}", id, e.getMessage());
      messages.markFailed(id, e.getMessage());
      return false;
    }
  }

  static String jobName(UUID id) {
    return "route-" + id;
  }
}
