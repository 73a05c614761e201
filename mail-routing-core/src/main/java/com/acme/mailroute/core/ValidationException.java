package com.acme.mailroute.core;

/**
 * Raised at the ingestion boundary when an inbound message cannot be accepted. Nothing has been
 * persisted when this is thrown.
 */
public class ValidationException extends RuntimeException {
  public ValidationException(String message) {
    super(message);
  }
}
