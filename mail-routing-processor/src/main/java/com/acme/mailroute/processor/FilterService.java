package com.acme.mailroute.processor;

import com.acme.mailroute.domain.FilterConfiguration;
import com.acme.mailroute.domain.FilterKind;
import com.acme.mailroute.repository.FilterRepository;
import jakarta.inject.Singleton;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Pre-filter for polled messages. Loads the ignore-lists lazily and reloads them after every
 * change, so an update applies from the next poll on.
 */
@Slf4j
@Singleton
public class FilterService {

  private final FilterRepository repository;
  private final AtomicReference<FilterConfiguration> current = new AtomicReference<>();

  public FilterService(FilterRepository repository) {
    this.repository = repository;
  }

  public FilterConfiguration filters() {
    FilterConfiguration loaded = current.get();
    if (loaded == null) {
      loaded = reload();
    }
    return loaded;
  }

  public boolean shouldIgnore(String sender, String subject) {
    return filters().shouldIgnore(sender, subject);
  }

  public boolean addIgnoredSender(String pattern) {
    return change(repository.add(FilterKind.SENDER, pattern), "added", FilterKind.SENDER, pattern);
  }

  public boolean removeIgnoredSender(String pattern) {
    return change(
        repository.remove(FilterKind.SENDER, pattern), "removed", FilterKind.SENDER, pattern);
  }

  public boolean addIgnoredSubject(String pattern) {
    return change(
        repository.add(FilterKind.SUBJECT, pattern), "added", FilterKind.SUBJECT, pattern);
  }

  public boolean removeIgnoredSubject(String pattern) {
    return change(
        repository.remove(FilterKind.SUBJECT, pattern), "removed", FilterKind.SUBJECT, pattern);
  }

  private boolean change(boolean changed, String verb, FilterKind kind, String pattern) {
    if (changed) {
      log.info("Filter {} {}: {}", kind, verb, pattern);
      reload();
    }
    return changed;
  }

  private FilterConfiguration reload() {
    FilterConfiguration loaded = repository.load();
    current.set(loaded);
    return loaded;
  }
}
