package com.acme.mailroute.domain;

/** Lifecycle of a persisted message. */
public enum ProcessingStatus {
  PENDING,
  PROCESSING,
  PROCESSED,
  FAILED;

  /** Records a reprocess run picks up again. */
  public boolean isRetryable() {
    return this == PENDING || this == FAILED;
  }
}
