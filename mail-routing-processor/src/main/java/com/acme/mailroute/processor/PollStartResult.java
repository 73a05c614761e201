package com.acme.mailroute.processor;

/**
 * @param started false when the poller was already running
 * @param backfilled messages ingested by the backfill on connect
 */
public record PollStartResult(boolean started, int backfilled) {}
