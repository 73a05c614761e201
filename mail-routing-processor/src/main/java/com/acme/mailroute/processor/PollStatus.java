package com.acme.mailroute.processor;

import java.time.Duration;
import java.time.Instant;

/** Snapshot of the poll loop for operators. */
public record PollStatus(
    boolean running,
    boolean connected,
    Duration interval,
    int batchSize,
    Instant lastPollAt,
    long polls,
    long ingested,
    long filtered,
    long duplicates,
    long failures) {}
