package com.acme.mailroute.domain;

import java.util.UUID;

/** What {@code receive} did with a message. */
public sealed interface IngestionOutcome {

  /**
   * The message was stored. {@code classification} is set in synchronous mode and null when the
   * work was queued.
   */
  record Received(UUID recordId, ClassificationResult classification, boolean classificationQueued)
      implements IngestionOutcome {

    public static Received classified(UUID recordId, ClassificationResult classification) {
      return new Received(recordId, classification, false);
    }

    public static Received queued(UUID recordId) {
      return new Received(recordId, null, true);
    }
  }

  /** Nothing was stored. */
  record Skipped(String externalId, String reason) implements IngestionOutcome {
    public static final String DUPLICATE = "duplicate";

    public static Skipped duplicate(String externalId) {
      return new Skipped(externalId, DUPLICATE);
    }
  }
}
