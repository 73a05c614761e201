package com.acme.mailroute.dispatch;

import com.acme.mailroute.rules.Action;
import com.acme.mailroute.rules.MatchedRule;
import com.acme.mailroute.spi.CustomActionHandler;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes actions through the capability interfaces. Each action is isolated: a failure is
 * recorded as {@link ActionStatus#FAILED} and the remaining actions still run.
 */
public class ActionDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(ActionDispatcher.class);

  private final Capabilities capabilities;
  private final FallbackActionTable fallback;
  private final Clock clock;

  public ActionDispatcher(Capabilities capabilities, FallbackActionTable fallback) {
    this(capabilities, fallback, Clock.systemUTC());
  }

  public ActionDispatcher(Capabilities capabilities, FallbackActionTable fallback, Clock clock) {
    this.capabilities = capabilities;
    this.fallback = fallback;
    this.clock = clock;
  }

  /**
   * Applies every action of every matched rule in order. When the rules yield no action at all the
   * fallback table's actions for the category are applied instead.
   */
  public List<ActionResult> dispatch(DispatchContext ctx, List<MatchedRule> matched) {
    List<ActionResult> results = new ArrayList<>();
    for (MatchedRule rule : matched) {
      for (Action action : rule.actions()) {
        results.add(apply(ctx, action, rule.ruleId()));
      }
    }
    if (results.isEmpty()) {
      LOG.debug("No rule actions for {}, using fallback table", ctx.recordId());
      for (Action action : fallback.actionsFor(ctx.classification())) {
        results.add(apply(ctx, action, FallbackActionTable.RULE_ID));
      }
    }
    return results;
  }

  public ActionResult apply(DispatchContext ctx, Action action, String ruleId) {
    try {
      Runnable call = bind(ctx, action);
      if (call == null) {
        LOG.debug("No capability for {} action, skipped", action.type());
        return result(action, ActionStatus.SKIPPED, "No handler for " + action.type(), ruleId);
      }
      call.run();
      return result(action, ActionStatus.COMPLETED, null, ruleId);
    } catch (RuntimeException e) {
      LOG.warn("Action {} failed for {}: {}", action.type(), ctx.recordId(), e.getMessage());
      String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
      return result(action, ActionStatus.FAILED, error, ruleId);
    }
  }

  /** Returns null when the capability for the action is not wired. */
  private Runnable bind(DispatchContext ctx, Action a) {
    var mailbox = capabilities.mailbox();
    return switch (a.type()) {
      case ROUTE -> mailbox == null ? null : () -> mailbox.route(ctx, required(a));
      case TAG -> mailbox == null ? null : () -> mailbox.tag(ctx, required(a));
      case PRIORITY -> mailbox == null ? null : () -> mailbox.setPriority(ctx, required(a));
      case ARCHIVE -> mailbox == null ? null : () -> mailbox.archive(ctx);
      case DELETE -> mailbox == null ? null : () -> mailbox.delete(ctx);
      case STAR -> mailbox == null ? null : () -> mailbox.star(ctx);
      case SNOOZE -> mailbox == null ? null : () -> mailbox.snooze(ctx, required(a));
      case MARK_AS_SPAM -> mailbox == null ? null : () -> mailbox.markAsSpam(ctx);
      case FORWARD -> {
        var forwarder = capabilities.forwarder();
        yield forwarder == null ? null : () -> forwarder.forward(ctx, required(a));
      }
      case NOTIFY -> {
        var notifier = capabilities.notifier();
        yield notifier == null ? null : () -> notifier.notify(ctx, a.value(), a.params());
      }
      case CREATE_TASK -> {
        var tasks = capabilities.tasks();
        yield tasks == null ? null : () -> tasks.createTask(ctx, taskTitle(ctx, a), a.params());
      }
      case BLOCK_SENDER -> {
        var lists = capabilities.senderLists();
        yield lists == null ? null : () -> lists.blockSender(senderOf(ctx, a));
      }
      case WHITELIST_SENDER -> {
        var lists = capabilities.senderLists();
        yield lists == null ? null : () -> lists.whitelistSender(senderOf(ctx, a));
      }
      case CUSTOM -> {
        CustomActionHandler handler = capabilities.customHandlers().get(a.value());
        yield handler == null ? null : () -> handler.handle(ctx, a);
      }
    };
  }

  private ActionResult result(Action a, ActionStatus status, String error, String ruleId) {
    return new ActionResult(a.type(), a.value(), status, error, ruleId, clock.instant());
  }

  private static String required(Action a) {
    if (a.value() == null || a.value().isBlank()) {
      throw new IllegalArgumentException(a.type() + " action needs a value");
    }
    return a.value();
  }

  private static String taskTitle(DispatchContext ctx, Action a) {
    return a.value() != null && !a.value().isBlank() ? a.value() : ctx.message().subject();
  }

  private static String senderOf(DispatchContext ctx, Action a) {
    return a.value() != null && !a.value().isBlank() ? a.value() : ctx.message().senderAddress();
  }
}
