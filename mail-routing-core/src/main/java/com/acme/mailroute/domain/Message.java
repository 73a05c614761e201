package com.acme.mailroute.domain;

import com.acme.mailroute.core.ValidationException;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * An inbound email-like message. Instances handed to the pipeline have gone through {@link
 * #normalized()} and are never mutated afterwards.
 *
 * @param externalId source-assigned id, unique when present; null for API-submitted messages
 * @param headers opaque header map, {@code has_attachment} is the only key the pipeline reads
 */
public record Message(
    String externalId,
    String subject,
    String body,
    String sender,
    String recipient,
    Instant receivedAt,
    Map<String, String> headers) {

  public static final String NO_SUBJECT = "(No Subject)";
  public static final String UNKNOWN_SENDER = "unknown";
  public static final String HAS_ATTACHMENT = "has_attachment";

  public Message {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public static Message of(String externalId, String subject, String body, String sender) {
    return new Message(externalId, subject, body, sender, null, null, Map.of());
  }

  /**
   * Trims text fields and fills defaults.
   *
   * @throws ValidationException if subject and body are both empty after trimming
   */
  public Message normalized() {
    String s = trim(subject);
    String b = trim(body);
    if (s.isEmpty() && b.isEmpty()) {
      throw new ValidationException("Subject and body cannot both be empty");
    }
    String from = trim(sender);
    String id = externalId == null || externalId.isBlank() ? null : externalId.trim();
    return new Message(
        id,
        s.isEmpty() ? NO_SUBJECT : s,
        b,
        from.isEmpty() ? UNKNOWN_SENDER : from,
        recipient == null ? null : recipient.trim(),
        receivedAt == null ? Instant.now() : receivedAt,
        headers);
  }

  public boolean hasAttachment() {
    return Boolean.parseBoolean(headers.getOrDefault(HAS_ATTACHMENT, "false"));
  }

  /** Lower-cased bare address, with any display name and angle brackets removed. */
  public String senderAddress() {
    String from = sender == null ? "" : sender;
    int lt = from.lastIndexOf('<');
    if (lt >= 0) {
      int gt = from.indexOf('>', lt);
      from = gt > lt ? from.substring(lt + 1, gt) : from.substring(lt + 1);
    }
    return from.trim().toLowerCase(Locale.ROOT);
  }

  /** Part of the sender address after '@', or empty when there is none. */
  public String senderDomain() {
    String address = senderAddress();
    int at = address.lastIndexOf('@');
    return at < 0 ? "" : address.substring(at + 1);
  }

  private static String trim(String v) {
    return v == null ? "" : v.trim();
  }
}
