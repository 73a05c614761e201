package com.acme.mailroute.core;

/** Connect or fetch failure reported by a mail source client. */
public class MailSourceException extends RuntimeException {
  public MailSourceException(String message) {
    super(message);
  }

  public MailSourceException(String message, Throwable e) {
    super(message, e);
  }
}
