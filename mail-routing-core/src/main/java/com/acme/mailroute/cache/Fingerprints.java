package com.acme.mailroute.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/** Content fingerprints used as result cache keys. */
public final class Fingerprints {

  private Fingerprints() {}

  /**
   * SHA-256 over lower-cased, whitespace-collapsed subject and body. The sender is not part of the
   * key.
   */
  public static String of(String subject, String body) {
    String normalized = normalize(subject) + "\n" + normalize(body);
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  static String normalize(String text) {
    return text == null ? "" : text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }
}
