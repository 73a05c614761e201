package com.acme.mailroute.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/** Poll loop settings. Pure POJO - no framework dependencies. */
public class PollingConfig {

  private boolean enabled = false;
  private Duration interval = Duration.ofSeconds(60);
  private int batchSize = 10;
  private String pollQuery = "is:unread";
  private String backfillQuery = "in:inbox";
  // handed to MailSourceClient.connect when polling starts with the application
  private Map<String, String> credentials = new HashMap<>();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Duration getInterval() {
    return interval;
  }

  public void setInterval(Duration interval) {
    this.interval = interval;
  }

  public String getIntervalString() {
    return interval.toSeconds() + "s";
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public String getPollQuery() {
    return pollQuery;
  }

  public void setPollQuery(String pollQuery) {
    this.pollQuery = pollQuery;
  }

  public String getBackfillQuery() {
    return backfillQuery;
  }

  public void setBackfillQuery(String backfillQuery) {
    this.backfillQuery = backfillQuery;
  }

  public Map<String, String> getCredentials() {
    return credentials;
  }

  public void setCredentials(Map<String, String> credentials) {
    this.credentials = credentials == null ? new HashMap<>() : new HashMap<>(credentials);
  }
}
