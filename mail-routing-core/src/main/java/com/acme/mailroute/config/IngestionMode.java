package com.acme.mailroute.config;

public enum IngestionMode {
  /** Classify and route inline; the caller gets the classification back. */
  SYNCHRONOUS,
  /** Hand the message to a background job and return immediately. */
  ASYNCHRONOUS
}
