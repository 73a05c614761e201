package com.acme.mailroute.repository;

import com.acme.mailroute.dispatch.ActionResult;
import com.acme.mailroute.domain.ClassificationResult;
import com.acme.mailroute.domain.Message;
import com.acme.mailroute.domain.MessageRecord;
import com.acme.mailroute.domain.ProcessingStatus;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Persistence for ingested messages, keyed by surrogate id and unique external id. */
public interface MessageRepository {

  /**
   * Atomically store the message as PENDING unless a record with the same external id exists.
   * Messages without an external id are always stored.
   *
   * @return the new record, or empty for a duplicate
   */
  Optional<MessageRecord> insertIfAbsent(Message message);

  Optional<MessageRecord> findById(UUID id);

  Optional<MessageRecord> findByExternalId(String externalId);

  /** Oldest first. */
  List<MessageRecord> findByStatus(ProcessingStatus status, int limit);

  long countByStatus(ProcessingStatus status);

  long count();

  void markProcessing(UUID id);

  /** Replaces the current classification. */
  void saveClassification(UUID id, ClassificationResult classification);

  /** Stores the action log and clears any previous error. */
  void markProcessed(UUID id, List<ActionResult> actions);

  void markFailed(UUID id, String error);
}
