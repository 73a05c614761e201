package com.acme.mailroute.rules;

public enum ActionType {
  ROUTE,
  TAG,
  PRIORITY,
  FORWARD,
  ARCHIVE,
  DELETE,
  STAR,
  SNOOZE,
  MARK_AS_SPAM,
  CREATE_TASK,
  NOTIFY,
  BLOCK_SENDER,
  WHITELIST_SENDER,
  CUSTOM
}
