package com.acme.mailroute.core;

/** Thrown by a classifier stage that cannot produce an answer right now. */
public class ClassifierUnavailableException extends RuntimeException {
  public ClassifierUnavailableException(String message) {
    super(message);
  }

  public ClassifierUnavailableException(String message, Throwable e) {
    super(message, e);
  }
}
