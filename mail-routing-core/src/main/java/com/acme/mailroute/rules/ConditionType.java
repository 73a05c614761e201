package com.acme.mailroute.rules;

/** What part of the message or classification a condition looks at. */
public enum ConditionType {
  CATEGORY,
  DEPARTMENT,
  CONFIDENCE,
  /** Probability of the category named by {@link Condition#category()}. */
  PROBABILITY,
  /** Detected tone: positive, negative, neutral or mixed. */
  SENTIMENT,
  SENDER,
  SUBJECT,
  BODY,
  /** Subject and body together; a list value matches when any entry is present. */
  KEYWORDS,
  /** Received time as {@code HH:mm} in the engine's zone. */
  TIME_OF_DAY,
  DAY_OF_WEEK,
  HAS_ATTACHMENT,
  /** Sender domain. */
  DOMAIN
}
