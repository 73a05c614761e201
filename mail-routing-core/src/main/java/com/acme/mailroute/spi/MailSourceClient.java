package com.acme.mailroute.spi;

import java.util.List;
import java.util.Map;

/**
 * Connection to an external mailbox. Implementations report failures as {@link
 * com.acme.mailroute.core.MailSourceException}.
 */
public interface MailSourceClient {

  /** Returns false when the source refused the credentials. */
  boolean connect(Map<String, String> credentials);

  boolean isConnected();

  /**
   * Most recent messages first.
   *
   * @param query source-specific filter, may be null
   */
  List<RawMessage> fetchMessages(int limit, String query);

  void disconnect();
}
