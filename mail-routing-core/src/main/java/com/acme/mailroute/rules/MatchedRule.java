package com.acme.mailroute.rules;

import java.util.List;

/** A rule that matched, with its actions already materialized. */
public record MatchedRule(
    String ruleId, String ruleName, int priority, List<Action> actions, boolean stopProcessing) {

  public MatchedRule {
    actions = List.copyOf(actions);
  }
}
