package com.acme.mailroute.domain;

import java.util.List;
import java.util.Locale;

/**
 * Ignore-lists consulted before a polled message is ingested. Entries are lower-cased substrings.
 */
public record FilterConfiguration(List<String> ignoredSenders, List<String> ignoredSubjects) {

  public FilterConfiguration {
    ignoredSenders = ignoredSenders == null ? List.of() : List.copyOf(ignoredSenders);
    ignoredSubjects = ignoredSubjects == null ? List.of() : List.copyOf(ignoredSubjects);
  }

  public static FilterConfiguration empty() {
    return new FilterConfiguration(List.of(), List.of());
  }

  /** Case-insensitive substring match on sender or subject. */
  public boolean shouldIgnore(String sender, String subject) {
    String from = sender == null ? "" : sender.toLowerCase(Locale.ROOT);
    String subj = subject == null ? "" : subject.toLowerCase(Locale.ROOT);
    return ignoredSenders.stream().anyMatch(from::contains)
        || ignoredSubjects.stream().anyMatch(subj::contains);
  }
}
