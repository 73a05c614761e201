package com.acme.mailroute.rules;

public enum Operator {
  EQUALS,
  NOT_EQUALS,
  CONTAINS,
  NOT_CONTAINS,
  STARTS_WITH,
  ENDS_WITH,
  GREATER_THAN,
  LESS_THAN,
  GREATER_OR_EQUAL,
  LESS_OR_EQUAL,
  REGEX,
  IN,
  NOT_IN;

  public boolean isOrdering() {
    return this == GREATER_THAN
        || this == LESS_THAN
        || this == GREATER_OR_EQUAL
        || this == LESS_OR_EQUAL;
  }
}
