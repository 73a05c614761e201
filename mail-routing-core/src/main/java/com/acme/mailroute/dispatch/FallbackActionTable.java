package com.acme.mailroute.dispatch;

import com.acme.mailroute.classify.MailboxCategory;
import com.acme.mailroute.domain.ClassificationResult;
import com.acme.mailroute.rules.Action;
import com.acme.mailroute.rules.ActionType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Minimum action set used when no rule produced any action. */
public class FallbackActionTable {

  public static final String RULE_ID = "fallback";

  static final double SPAM_THRESHOLD = 0.8;
  static final double IMPORTANT_THRESHOLD = 0.7;

  private record Entry(String route, String tag, String priority) {}

  private static final Entry DEFAULT = new Entry("inbox", "unclassified", "medium");

  private static final Map<String, Entry> TABLE =
      Map.of(
          MailboxCategory.SPAM, new Entry("spam", "spam", "low"),
          MailboxCategory.IMPORTANT, new Entry("inbox", "important", "high"),
          MailboxCategory.PROMOTION, new Entry("promotions", "promotion", "medium"),
          MailboxCategory.SOCIAL, new Entry("social", "social", "low"),
          MailboxCategory.UPDATES, new Entry("updates", "update", "medium"));

  public List<Action> actionsFor(ClassificationResult classification) {
    String category =
        classification.category() == null
            ? ""
            : classification.category().toLowerCase(Locale.ROOT);
    Entry e = TABLE.getOrDefault(category, DEFAULT);

    List<Action> actions = new ArrayList<>();
    actions.add(Action.route(e.route()));
    actions.add(Action.tag(e.tag()));
    actions.add(Action.priority(e.priority()));

    double confidence = classification.confidence();
    if (MailboxCategory.SPAM.equals(category) && confidence > SPAM_THRESHOLD) {
      actions.add(Action.of(ActionType.MARK_AS_SPAM));
    }
    if (MailboxCategory.IMPORTANT.equals(category) && confidence > IMPORTANT_THRESHOLD) {
      actions.add(Action.priority("high"));
    }
    return actions;
  }
}
