package com.acme.mailroute.classify;

import java.util.List;

/** Vocabulary shared by the general-purpose and baseline stages. */
public final class MailboxCategory {
  public static final String SPAM = "spam";
  public static final String IMPORTANT = "important";
  public static final String PROMOTION = "promotion";
  public static final String SOCIAL = "social";
  public static final String UPDATES = "updates";

  public static final List<String> ALL = List.of(SPAM, IMPORTANT, PROMOTION, SOCIAL, UPDATES);

  private MailboxCategory() {}
}
