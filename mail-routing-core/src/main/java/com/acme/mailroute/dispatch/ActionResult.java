package com.acme.mailroute.dispatch;

import com.acme.mailroute.rules.ActionType;
import java.time.Instant;

/**
 * Outcome of one action, as stored in the message's action log.
 *
 * @param ruleId rule that produced the action, or {@link FallbackActionTable#RULE_ID}
 */
public record ActionResult(
    ActionType type,
    String value,
    ActionStatus status,
    String error,
    String ruleId,
    Instant timestamp) {

  public boolean failed() {
    return status == ActionStatus.FAILED;
  }
}
