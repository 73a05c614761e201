package com.acme.mailroute.rules;

import java.util.List;

/**
 * One test within a rule.
 *
 * @param value a string, number, boolean, or list of strings depending on type and operator
 * @param category label whose probability a {@link ConditionType#PROBABILITY} condition reads
 * @param listRef when set, {@code value} is replaced by the live list before every evaluation
 */
public record Condition(
    ConditionType type, Operator operator, Object value, String category, ListRef listRef) {

  public Condition {
    if (type == null || operator == null) {
      throw new IllegalArgumentException("Condition type and operator are required");
    }
    if (type == ConditionType.PROBABILITY && (category == null || category.isBlank())) {
      throw new IllegalArgumentException("Probability condition needs a category");
    }
    if (value instanceof List<?> l) {
      value = List.copyOf(l);
    }
  }

  public static Condition of(ConditionType type, Operator operator, Object value) {
    return new Condition(type, operator, value, null, null);
  }

  public static Condition probability(String category, Operator operator, double value) {
    return new Condition(ConditionType.PROBABILITY, operator, value, category, null);
  }

  public static Condition onList(ConditionType type, Operator operator, ListRef listRef) {
    return new Condition(type, operator, List.of(), null, listRef);
  }

  public Condition withValue(Object newValue) {
    return new Condition(type, operator, newValue, category, listRef);
  }
}
