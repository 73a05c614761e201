package com.acme.mailroute.config;

import java.time.Duration;

/** Ingestion settings. Pure POJO - no framework dependencies. */
public class IngestionConfig {

  private IngestionMode mode = IngestionMode.ASYNCHRONOUS;
  private Duration drainTimeout = Duration.ofSeconds(30); // best-effort wait at shutdown
  private int workerThreads = 4;
  private boolean reprocessOnStartup = true;
  private int reprocessLimit = 100;
  // a PROCESSING record untouched for this long is treated as abandoned
  private Duration staleProcessingAfter = Duration.ofMinutes(5);

  public IngestionMode getMode() {
    return mode;
  }

  public void setMode(IngestionMode mode) {
    this.mode = mode;
  }

  public boolean isAsync() {
    return mode == IngestionMode.ASYNCHRONOUS;
  }

  public Duration getDrainTimeout() {
    return drainTimeout;
  }

  public void setDrainTimeout(Duration drainTimeout) {
    this.drainTimeout = drainTimeout;
  }

  public long getDrainTimeoutMillis() {
    return drainTimeout.toMillis();
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }

  public boolean isReprocessOnStartup() {
    return reprocessOnStartup;
  }

  public void setReprocessOnStartup(boolean reprocessOnStartup) {
    this.reprocessOnStartup = reprocessOnStartup;
  }

  public int getReprocessLimit() {
    return reprocessLimit;
  }

  public void setReprocessLimit(int reprocessLimit) {
    this.reprocessLimit = reprocessLimit;
  }

  public Duration getStaleProcessingAfter() {
    return staleProcessingAfter;
  }

  public void setStaleProcessingAfter(Duration staleProcessingAfter) {
    this.staleProcessingAfter = staleProcessingAfter;
  }
}
