package com.acme.mailroute.rules;

import java.util.Map;

/**
 * A side effect produced by a matching rule.
 *
 * @param value main argument: folder, tag, priority level, address, snooze time or handler name
 * @param params free-form extra arguments, e.g. {@code assignee} for a task
 */
public record Action(ActionType type, String value, Map<String, String> params) {

  public Action {
    if (type == null) {
      throw new IllegalArgumentException("Action type is required");
    }
    params = params == null ? Map.of() : Map.copyOf(params);
  }

  public static Action of(ActionType type, String value) {
    return new Action(type, value, Map.of());
  }

  public static Action of(ActionType type) {
    return new Action(type, null, Map.of());
  }

  public static Action route(String folder) {
    return of(ActionType.ROUTE, folder);
  }

  public static Action tag(String tag) {
    return of(ActionType.TAG, tag);
  }

  public static Action priority(String level) {
    return of(ActionType.PRIORITY, level);
  }

  public static Action forward(String address) {
    return of(ActionType.FORWARD, address);
  }

  public String param(String key) {
    return params.get(key);
  }
}
