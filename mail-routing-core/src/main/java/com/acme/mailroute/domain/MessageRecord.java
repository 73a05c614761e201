package com.acme.mailroute.domain;

import com.acme.mailroute.dispatch.ActionResult;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** A persisted message with its current classification and the outcome of routing it. */
public record MessageRecord(
    UUID id,
    Message message,
    ProcessingStatus status,
    ClassificationResult classification,
    List<ActionResult> actions,
    String error,
    Instant createdAt,
    Instant updatedAt) {

  public MessageRecord {
    actions = actions == null ? List.of() : List.copyOf(actions);
  }

  public static MessageRecord pending(UUID id, Message message, Instant now) {
    return new MessageRecord(
        id, message, ProcessingStatus.PENDING, null, List.of(), null, now, now);
  }

  public String externalId() {
    return message.externalId();
  }
}
