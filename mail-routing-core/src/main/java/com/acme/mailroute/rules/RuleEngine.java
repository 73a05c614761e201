package com.acme.mailroute.rules;

import com.acme.mailroute.domain.ClassificationResult;
import com.acme.mailroute.domain.Message;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Priority-ordered rule evaluation with stop semantics.
 *
 * <p>Rules are kept as an immutable snapshot sorted by priority (descending) and then by the order
 * they were first added. Admin writes rebuild the snapshot under the write lock; evaluation holds
 * the read lock, so a write never interleaves with a running evaluation. Updating a rule keeps its
 * original position among rules of equal priority.
 */
@Slf4j
public class RuleEngine {

  private record Registered(Rule rule, long sequence) {}

  private static final Comparator<Registered> ORDER =
      Comparator.comparingInt((Registered r) -> r.rule().priority())
          .reversed()
          .thenComparingLong(Registered::sequence);

  private final ConditionEvaluator evaluator;
  private final SenderLists senderLists;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Registered> rules = new LinkedHashMap<>();
  private List<Registered> snapshot = List.of();
  private long sequence;

  public RuleEngine(ConditionEvaluator evaluator, SenderLists senderLists) {
    this.evaluator = evaluator;
    this.senderLists = senderLists;
  }

  public List<MatchedRule> evaluate(Message message, ClassificationResult classification) {
    lock.readLock().lock();
    try {
      Map<ListRef, List<String>> lists = new EnumMap<>(ListRef.class);
      for (ListRef ref : ListRef.values()) {
        lists.put(ref, senderLists.snapshot(ref));
      }

      List<MatchedRule> matched = new ArrayList<>();
      for (Registered registered : snapshot) {
        Rule rule = registered.rule();
        if (!rule.enabled()) {
          continue;
        }
        Rule live = rule.usesLists() ? refreshLists(rule, lists) : rule;
        Optional<MatchedRule> hit = tryMatch(live, message, classification);
        if (hit.isEmpty()) {
          continue;
        }
        matched.add(hit.get());
        log.debug("Rule {} matched (priority {})", rule.id(), rule.priority());
        if (rule.stopProcessing()) {
          log.debug("Rule {} stops evaluation", rule.id());
          break;
        }
      }
      return matched;
    } finally {
      lock.readLock().unlock();
    }
  }

  private Optional<MatchedRule> tryMatch(
      Rule rule, Message message, ClassificationResult classification) {
    try {
      for (Condition c : rule.conditions()) {
        if (!evaluator.matches(c, message, classification)) {
          return Optional.empty();
        }
      }
      return Optional.of(
          new MatchedRule(
              rule.id(),
              rule.name(),
              rule.priority(),
              rule.actions().resolve(classification),
              rule.stopProcessing()));
    } catch (RuntimeException e) {
      log.warn("Rule {} could not be evaluated, treating as no match: {}", rule.id(), e.toString());
      return Optional.empty();
    }
  }

  private static Rule refreshLists(Rule rule, Map<ListRef, List<String>> lists) {
    List<Condition> refreshed =
        rule.conditions().stream()
            .map(c -> c.listRef() == null ? c : c.withValue(lists.get(c.listRef())))
            .toList();
    return rule.withConditions(refreshed);
  }

  /**
   * @throws IllegalStateException if a rule with the same id exists
   */
  public void addRule(Rule rule) {
    write(
        () -> {
          if (rules.containsKey(rule.id())) {
            throw new IllegalStateException("Rule already exists: " + rule.id());
          }
          rules.put(rule.id(), new Registered(rule, ++sequence));
          return null;
        });
    log.info("Added rule {} (priority {})", rule.id(), rule.priority());
  }

  /** Returns false when no rule has this id. */
  public boolean updateRule(Rule rule) {
    boolean updated =
        write(
            () -> {
              Registered existing = rules.get(rule.id());
              if (existing == null) {
                return false;
              }
              rules.put(rule.id(), new Registered(rule, existing.sequence()));
              return true;
            });
    if (updated) {
      log.info("Updated rule {}", rule.id());
    }
    return updated;
  }

  public boolean deleteRule(String id) {
    boolean deleted = write(() -> rules.remove(id) != null);
    if (deleted) {
      log.info("Deleted rule {}", id);
    }
    return deleted;
  }

  public boolean setEnabled(String id, boolean enabled) {
    return write(
        () -> {
          Registered existing = rules.get(id);
          if (existing == null) {
            return false;
          }
          rules.put(id, new Registered(existing.rule().withEnabled(enabled), existing.sequence()));
          return true;
        });
  }

  /** Drops every rule and loads the given ones in iteration order. */
  public void replaceAll(Collection<Rule> replacement) {
    write(
        () -> {
          rules.clear();
          for (Rule r : replacement) {
            if (rules.putIfAbsent(r.id(), new Registered(r, ++sequence)) != null) {
              throw new IllegalStateException("Duplicate rule id: " + r.id());
            }
          }
          return null;
        });
    log.info("Loaded {} rules", replacement.size());
  }

  public Optional<Rule> getRule(String id) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(rules.get(id)).map(Registered::rule);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** All rules in evaluation order. */
  public List<Rule> listRules() {
    lock.readLock().lock();
    try {
      return snapshot.stream().map(Registered::rule).toList();
    } finally {
      lock.readLock().unlock();
    }
  }

  public SenderLists senderLists() {
    return senderLists;
  }

  private <T> T write(Supplier<T> change) {
    lock.writeLock().lock();
    try {
      T result = change.get();
      snapshot = rules.values().stream().sorted(ORDER).toList();
      return result;
    } finally {
      lock.writeLock().unlock();
    }
  }
}
