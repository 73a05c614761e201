package com.acme.mailroute.processor;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/** Handle to work running on the {@link BackgroundTaskSupervisor}. */
public record BackgroundJob(
    UUID id, String name, Instant startedAt, CompletableFuture<Void> future) {

  public boolean isDone() {
    return future.isDone();
  }
}
