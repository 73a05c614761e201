package com.acme.mailroute.core;

/** Failure that will not go away on retry (bad SQL, constraint violation, malformed data). */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
