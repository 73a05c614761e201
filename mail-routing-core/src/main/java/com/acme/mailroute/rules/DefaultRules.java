package com.acme.mailroute.rules;

import static com.acme.mailroute.rules.ConditionType.CATEGORY;
import static com.acme.mailroute.rules.ConditionType.CONFIDENCE;
import static com.acme.mailroute.rules.ConditionType.DEPARTMENT;
import static com.acme.mailroute.rules.ConditionType.KEYWORDS;
import static com.acme.mailroute.rules.ConditionType.SENDER;
import static com.acme.mailroute.rules.ConditionType.SENTIMENT;
import static com.acme.mailroute.rules.ConditionType.SUBJECT;

import com.acme.mailroute.classify.Department;
import com.acme.mailroute.classify.MailboxCategory;
import com.acme.mailroute.classify.PriorityDetector;
import com.acme.mailroute.classify.SentimentDetector;
import java.util.List;
import java.util.Map;

/** The rule base loaded at startup. Priorities leave room for site-specific rules in between. */
public final class DefaultRules {

  public static final String LEGAL_FAILSAFE = "legal_failsafe";
  public static final String WHITELIST_OVERRIDE = "whitelist_override";
  public static final String BLACKLIST_SENDER = "blacklist_sender";
  public static final String URGENT_ESCALATION = "urgent_escalation";
  public static final String LOW_CONFIDENCE_TRIAGE = "low_confidence_triage";
  public static final String NEGATIVE_FEEDBACK = "negative_feedback";
  public static final String SUPPORT_ROUTE = "support_route";
  public static final String EXECUTIVE_ROUTE = "executive_route";
  public static final String BILLING_ROUTE = "billing_route";
  public static final String SALES_ROUTE = "sales_route";
  public static final String HR_ROUTE = "hr_route";
  public static final String LEGAL_ROUTE = "legal_route";
  public static final String OPERATIONS_ROUTE = "operations_route";
  public static final String MARKETING_ROUTE = "marketing_route";
  public static final String PROMOTIONS_ARCHIVE = "promotions_archive";
  public static final String SPAM_HIGH_CONFIDENCE = "spam_high_confidence";
  public static final String SPAM_JUNK = "spam_junk";
  public static final String MEETING_TASK = "meeting_task";

  private DefaultRules() {}

  public static List<Rule> create(double triageConfidence) {
    return List.of(
        Rule.builder(LEGAL_FAILSAFE)
            .name("Legal Failsafe Override")
            .description("Legal keywords always go to legal, whatever the classifier says")
            .priority(1000)
            .when(
                KEYWORDS,
                Operator.CONTAINS,
                List.of("legal notice", "cease and desist", "court order", "subpoena"))
            .then(
                Action.forward("legal@company.com"),
                Action.tag("LEGAL_HOLD"),
                Action.priority("critical"))
            .stopProcessing()
            .build(),
        Rule.builder(WHITELIST_OVERRIDE)
            .name("Whitelist Sender Override")
            .priority(960)
            .when(Condition.onList(SENDER, Operator.IN, ListRef.SENDER_WHITELIST))
            .then(Action.priority("high"), Action.of(ActionType.STAR), Action.route("inbox"))
            .build(),
        Rule.builder(BLACKLIST_SENDER)
            .name("Block Blacklisted Senders")
            .priority(940)
            .when(Condition.onList(SENDER, Operator.IN, ListRef.SENDER_BLACKLIST))
            .then(Action.route("spam"), Action.of(ActionType.DELETE))
            .stopProcessing()
            .build(),
        Rule.builder(URGENT_ESCALATION)
            .name("Urgent Escalation")
            .priority(900)
            .when(SUBJECT, Operator.REGEX, "\\b(urgent|asap|emergency|critical)\\b")
            .when(CATEGORY, Operator.NOT_EQUALS, MailboxCategory.SPAM)
            .then(
                Action.priority("critical"),
                Action.tag("Escalated"),
                Action.of(ActionType.NOTIFY, "urgent"),
                new Action(
                    ActionType.CREATE_TASK, "Urgent: follow up", Map.of("assignee", "on-call")))
            .stopProcessing()
            .build(),
        Rule.builder(LOW_CONFIDENCE_TRIAGE)
            .name("Low Confidence Triage")
            .priority(850)
            .when(CONFIDENCE, Operator.LESS_THAN, triageConfidence)
            .then(
                Action.forward("manual-review@company.com"),
                Action.tag("Needs_Review"),
                Action.route("review_queue"))
            .stopProcessing()
            .build(),
        Rule.builder(EXECUTIVE_ROUTE)
            .name("Executive Route")
            .priority(750)
            .when(DEPARTMENT, Operator.EQUALS, Department.EXECUTIVE.label())
            .then(Action.tag("Executive"), Action.of(ActionType.STAR), Action.priority("high"))
            .stopProcessing()
            .build(),
        Rule.builder(NEGATIVE_FEEDBACK)
            .name("Customer Retention - Negative Feedback")
            .priority(720)
            .when(CATEGORY, Operator.EQUALS, "customer_service")
            .when(SENTIMENT, Operator.EQUALS, SentimentDetector.NEGATIVE)
            .then(
                Action.forward("customer-retention@company.com"),
                Action.tag("Unhappy_Customer"),
                Action.priority("high"),
                Action.of(ActionType.NOTIFY, "customer-success-manager"))
            .stopProcessing()
            .build(),
        Rule.builder(SUPPORT_ROUTE)
            .name("Support Request Route")
            .priority(700)
            .when(CATEGORY, Operator.IN, List.of("customer_service", "it_support"))
            .then(
                Action.forward("support@company.com"),
                Action.tag("Support"),
                Action.priority("high"),
                new Action(
                    ActionType.CREATE_TASK, "Support request", Map.of("assignee", "support-team")))
            .stopProcessing()
            .build(),
        Rule.builder(BILLING_ROUTE)
            .name("Billing Support Route")
            .priority(600)
            .when(DEPARTMENT, Operator.EQUALS, Department.FINANCE.label())
            .then(
                ActionSource.computed(
                    c ->
                        List.of(
                            Action.forward("billing-support@company.com"),
                            Action.tag("Billing"),
                            Action.priority(isUrgent(c.priority()) ? "high" : "medium"))))
            .stopProcessing()
            .build(),
        Rule.builder(SALES_ROUTE)
            .name("Sales Lead Route")
            .priority(500)
            .when(DEPARTMENT, Operator.EQUALS, Department.SALES.label())
            .then(
                Action.forward("sales@company.com"),
                Action.tag("Sales_Lead"),
                Action.priority("high"),
                new Action(
                    ActionType.CREATE_TASK,
                    "Follow up lead",
                    Map.of("assignee", "sales-team", "due_hours", "24")))
            .stopProcessing()
            .build(),
        Rule.builder(HR_ROUTE)
            .name("HR Route")
            .priority(450)
            .when(DEPARTMENT, Operator.EQUALS, Department.HR.label())
            .then(Action.forward("hr@company.com"), Action.tag("HR"), Action.priority("medium"))
            .stopProcessing()
            .build(),
        Rule.builder(LEGAL_ROUTE)
            .name("Legal Department Route")
            .priority(400)
            .when(DEPARTMENT, Operator.EQUALS, Department.LEGAL.label())
            .then(Action.forward("legal@company.com"), Action.tag("Legal"), Action.priority("high"))
            .stopProcessing()
            .build(),
        Rule.builder(OPERATIONS_ROUTE)
            .name("Operations Route")
            .priority(350)
            .when(DEPARTMENT, Operator.EQUALS, Department.OPERATIONS.label())
            .then(
                Action.forward("operations@company.com"),
                Action.tag("Operations"),
                Action.priority("medium"))
            .stopProcessing()
            .build(),
        Rule.builder(MARKETING_ROUTE)
            .name("Marketing Department Route")
            .priority(320)
            .when(CATEGORY, Operator.EQUALS, "marketing")
            .then(Action.forward("marketing@company.com"), Action.tag("Marketing"))
            .stopProcessing()
            .build(),
        Rule.builder(PROMOTIONS_ARCHIVE)
            .name("Archive Promotions")
            .priority(300)
            .when(CATEGORY, Operator.EQUALS, MailboxCategory.PROMOTION)
            .then(
                Action.route("promotions"),
                Action.of(ActionType.ARCHIVE),
                Action.tag("promotion"),
                Action.priority("low"))
            .stopProcessing()
            .build(),
        Rule.builder(SPAM_HIGH_CONFIDENCE)
            .name("High Confidence Spam")
            .priority(210)
            .when(CATEGORY, Operator.EQUALS, MailboxCategory.SPAM)
            .when(CONFIDENCE, Operator.GREATER_THAN, 0.9)
            .then(
                Action.route("spam"),
                Action.of(ActionType.DELETE),
                Action.of(ActionType.BLOCK_SENDER))
            .stopProcessing()
            .build(),
        Rule.builder(SPAM_JUNK)
            .name("Spam Handling")
            .priority(200)
            .when(CATEGORY, Operator.EQUALS, MailboxCategory.SPAM)
            .then(Action.route("Junk"), Action.tag("Spam"))
            .stopProcessing()
            .build(),
        Rule.builder(MEETING_TASK)
            .name("Meeting Follow-up")
            .priority(100)
            .when(KEYWORDS, Operator.CONTAINS, List.of("meeting", "calendar", "appointment"))
            .then(
                new Action(ActionType.CREATE_TASK, "Prepare for meeting", Map.of()),
                Action.of(ActionType.STAR))
            .build());
  }

  private static boolean isUrgent(String priority) {
    return PriorityDetector.CRITICAL.equals(priority) || PriorityDetector.HIGH.equals(priority);
  }
}
