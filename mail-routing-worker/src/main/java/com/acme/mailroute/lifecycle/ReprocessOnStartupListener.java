package com.acme.mailroute.lifecycle;

import com.acme.mailroute.config.IngestionConfig;
import com.acme.mailroute.processor.IngestionCoordinator;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Resubmits records left behind by the previous run: never started, cut off mid-pipeline at
 * shutdown, or failed. Runs before polling starts, so every PROCESSING record is abandoned.
 */
@Slf4j
@Singleton
@Requires(property = "ingestion.reprocess-on-startup", value = "true", defaultValue = "true")
public class ReprocessOnStartupListener implements ApplicationEventListener<StartupEvent> {

  private final IngestionCoordinator coordinator;
  private final IngestionConfig config;

  public ReprocessOnStartupListener(IngestionCoordinator coordinator, IngestionConfig config) {
    this.coordinator = coordinator;
    this.config = config;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    try {
      int resubmitted = coordinator.reprocessPending(config.getReprocessLimit(), Duration.ZERO);
      if (resubmitted > 0) {
        log.info("Resubmitted {} unfinished messages from the previous run", resubmitted);
      }
    } catch (RuntimeException e) {
      // the records stay as they are and are picked up by the next reprocess run
      log.error("Startup reprocessing failed: {}", e.getMessage(), e);
    }
  }
}
