package com.acme.mailroute.spi;

import com.acme.mailroute.domain.Message;
import java.time.Instant;
import java.util.Map;

/** A message as a mail source hands it over, before validation. */
public record RawMessage(
    String id,
    String subject,
    String body,
    String sender,
    String recipient,
    Instant receivedAt,
    Map<String, String> headers) {

  public Message toMessage() {
    return new Message(id, subject, body, sender, recipient, receivedAt, headers);
  }
}
