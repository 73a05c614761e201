package com.acme.mailroute.lifecycle;

import com.acme.mailroute.config.IngestionConfig;
import com.acme.mailroute.processor.IngestionCoordinator;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.ShutdownEvent;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/** Gives queued routing jobs {@code ingestion.drain-timeout} to finish before beans close. */
@Slf4j
@Singleton
public class DrainOnShutdownListener implements ApplicationEventListener<ShutdownEvent> {

  private final IngestionCoordinator coordinator;
  private final IngestionConfig config;

  public DrainOnShutdownListener(IngestionCoordinator coordinator, IngestionConfig config) {
    this.coordinator = coordinator;
    this.config = config;
  }

  @Override
  public void onApplicationEvent(ShutdownEvent event) {
    if (coordinator.waitForBackground(config.getDrainTimeout())) {
      log.info("Background routing drained");
    } else {
      log.warn("Shutting down with routing jobs still running after {}", config.getDrainTimeout());
    }
  }
}
