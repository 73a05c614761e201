package com.acme.mailroute.rules;

import com.acme.mailroute.domain.ClassificationResult;
import com.acme.mailroute.domain.Message;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Evaluates a single {@link Condition}. String comparisons ignore case. Throws {@link
 * IllegalArgumentException} for combinations it cannot evaluate, such as an ordering operator
 * over a sender or an unparsable number; the engine counts that rule as not matching.
 */
public class ConditionEvaluator {

  private final ZoneId zone;

  public ConditionEvaluator(ZoneId zone) {
    this.zone = zone;
  }

  public boolean matches(Condition c, Message message, ClassificationResult classification) {
    return switch (c.type()) {
      case CATEGORY -> text(c, classification.category());
      case DEPARTMENT -> text(c, classification.department());
      case CONFIDENCE -> number(c, classification.confidence());
      case PROBABILITY -> number(c, classification.probabilityOf(c.category()));
      case SENTIMENT -> text(c, classification.sentiment());
      case SENDER -> text(c, message.senderAddress());
      case SUBJECT -> text(c, message.subject());
      case BODY -> text(c, message.body());
      case DOMAIN -> text(c, message.senderDomain());
      case KEYWORDS -> keywords(c, message.subject() + " " + message.body());
      case TIME_OF_DAY -> timeOfDay(c, receivedAt(message));
      case DAY_OF_WEEK -> dayOfWeek(c, receivedAt(message));
      case HAS_ATTACHMENT -> flag(c, message.hasAttachment());
    };
  }

  private ZonedDateTime receivedAt(Message message) {
    Instant at = message.receivedAt() == null ? Instant.now() : message.receivedAt();
    return at.atZone(zone);
  }

  private static boolean text(Condition c, String rawActual) {
    String actual = lower(rawActual);
    Object value = c.value();
    return switch (c.operator()) {
      case EQUALS -> actual.equals(lower(single(value)));
      case NOT_EQUALS -> !actual.equals(lower(single(value)));
      case CONTAINS -> actual.contains(lower(single(value)));
      case NOT_CONTAINS -> !actual.contains(lower(single(value)));
      case STARTS_WITH -> actual.startsWith(lower(single(value)));
      case ENDS_WITH -> actual.endsWith(lower(single(value)));
      case REGEX -> regex(single(value)).matcher(actual).find();
      case IN -> list(value).contains(actual);
      case NOT_IN -> !list(value).contains(actual);
      default -> throw unsupported(c);
    };
  }

  private static boolean number(Condition c, double actual) {
    if (c.operator() == Operator.IN || c.operator() == Operator.NOT_IN) {
      boolean found = list(c.value()).stream().anyMatch(v -> parse(v) == actual);
      return c.operator() == Operator.IN ? found : !found;
    }
    double expected = parse(c.value());
    return switch (c.operator()) {
      case EQUALS -> Double.compare(actual, expected) == 0;
      case NOT_EQUALS -> Double.compare(actual, expected) != 0;
      case GREATER_THAN -> actual > expected;
      case LESS_THAN -> actual < expected;
      case GREATER_OR_EQUAL -> actual >= expected;
      case LESS_OR_EQUAL -> actual <= expected;
      default -> throw unsupported(c);
    };
  }

  private static boolean keywords(Condition c, String text) {
    String actual = lower(text);
    if (c.operator() == Operator.REGEX) {
      return regex(single(c.value())).matcher(actual).find();
    }
    boolean any = list(c.value()).stream().anyMatch(actual::contains);
    return switch (c.operator()) {
      case CONTAINS, IN -> any;
      case NOT_CONTAINS, NOT_IN -> !any;
      default -> throw unsupported(c);
    };
  }

  private static boolean timeOfDay(Condition c, ZonedDateTime at) {
    LocalTime actual = at.toLocalTime().withSecond(0).withNano(0);
    int cmp = actual.compareTo(LocalTime.parse(single(c.value()).trim()));
    return switch (c.operator()) {
      case EQUALS -> cmp == 0;
      case NOT_EQUALS -> cmp != 0;
      case GREATER_THAN -> cmp > 0;
      case LESS_THAN -> cmp < 0;
      case GREATER_OR_EQUAL -> cmp >= 0;
      case LESS_OR_EQUAL -> cmp <= 0;
      default -> throw unsupported(c);
    };
  }

  private static boolean dayOfWeek(Condition c, ZonedDateTime at) {
    if (c.operator().isOrdering()) {
      // ISO numbering, Monday = 1
      return number(c, at.getDayOfWeek().getValue());
    }
    return text(c, at.getDayOfWeek().name());
  }

  private static boolean flag(Condition c, boolean actual) {
    boolean expected = Boolean.parseBoolean(single(c.value()));
    return switch (c.operator()) {
      case EQUALS -> actual == expected;
      case NOT_EQUALS -> actual != expected;
      default -> throw unsupported(c);
    };
  }

  private static Pattern regex(String expression) {
    return Pattern.compile(expression, Pattern.CASE_INSENSITIVE);
  }

  private static String single(Object value) {
    if (value == null) {
      throw new IllegalArgumentException("Condition value is missing");
    }
    if (value instanceof List<?>) {
      throw new IllegalArgumentException("Expected a single value but got a list");
    }
    return value.toString();
  }

  /** Lower-cased entries; a string value is split on commas. */
  private static List<String> list(Object value) {
    if (value == null) {
      return List.of();
    }
    if (value instanceof List<?> l) {
      return l.stream().map(o -> lower(String.valueOf(o).trim())).toList();
    }
    return Arrays.stream(value.toString().split(",")).map(s -> lower(s.trim())).toList();
  }

  private static double parse(Object value) {
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    try {
      return Double.parseDouble(single(value).trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a number: " + value, e);
    }
  }

  private static String lower(String s) {
    return s == null ? "" : s.toLowerCase(Locale.ROOT);
  }

  private static IllegalArgumentException unsupported(Condition c) {
    return new IllegalArgumentException(
        "Operator " + c.operator() + " is not supported for " + c.type());
  }
}
