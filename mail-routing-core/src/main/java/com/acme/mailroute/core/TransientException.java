package com.acme.mailroute.core;

/** Failure that may succeed on a later attempt (lost connection, lock timeout, deadlock). */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
