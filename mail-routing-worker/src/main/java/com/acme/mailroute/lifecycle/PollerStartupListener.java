package com.acme.mailroute.lifecycle;

import com.acme.mailroute.config.PollingConfig;
import com.acme.mailroute.core.MailSourceException;
import com.acme.mailroute.processor.MailPoller;
import com.acme.mailroute.processor.PollStartResult;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/** Starts the poll loop once the server is up, when {@code polling.enabled} is set. */
@Slf4j
@Singleton
@Requires(beans = MailPoller.class)
@Requires(property = "polling.enabled", value = "true")
public class PollerStartupListener implements ApplicationEventListener<ServerStartupEvent> {

  private final MailPoller poller;
  private final PollingConfig config;

  public PollerStartupListener(MailPoller poller, PollingConfig config) {
    this.poller = poller;
    this.config = config;
  }

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    try {
      PollStartResult result = poller.start(config.getCredentials());
      log.info("Poller started={}, backfilled {} messages", result.started(), result.backfilled());
    } catch (MailSourceException e) {
      // the application keeps serving; polling can be restarted once the source is reachable
      log.error("Could not start poller: {}", e.getMessage(), e);
    }
  }
}
