package com.acme.mailroute.classify;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Keyword-based urgency: {@code critical}, {@code high}, {@code normal} or {@code low}. */
public class PriorityDetector {
  public static final String CRITICAL = "critical";
  public static final String HIGH = "high";
  public static final String NORMAL = "normal";
  public static final String LOW = "low";

  private static final Pattern CRITICAL_TERMS =
      words(
          List.of(
              "urgent", "emergency", "critical", "immediate", "immediately", "asap", "outage",
              "security breach", "data breach", "server down", "system down", "production down",
              "due today", "sev1", "p0", "p1", "blocker"));
  private static final Pattern HIGH_TERMS =
      words(
          List.of(
              "important", "time-sensitive", "deadline", "due tomorrow", "escalation", "escalate",
              "overdue", "final notice", "compliance", "audit", "high priority", "sev2", "p2"));
  private static final Pattern LOW_TERMS =
      words(
          List.of(
              "fyi", "no rush", "low priority", "not urgent", "newsletter", "digest",
              "unsubscribe", "weekly update", "monthly update"));

  public String detect(String subject, String body) {
    String text =
        ((subject == null ? "" : subject) + "\n" + (body == null ? "" : body))
            .toLowerCase(Locale.ROOT);
    if (CRITICAL_TERMS.matcher(text).find()) {
      return CRITICAL;
    }
    if (HIGH_TERMS.matcher(text).find()) {
      return HIGH;
    }
    if (LOW_TERMS.matcher(text).find()) {
      return LOW;
    }
    return NORMAL;
  }

  private static Pattern words(List<String> terms) {
    String alternation = String.join("|", terms.stream().map(Pattern::quote).toList());
    return Pattern.compile("(?<![a-z0-9])(" + alternation + ")(?![a-z0-9])");
  }
}
