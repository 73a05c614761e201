package com.acme.mailroute.dispatch;

public enum ActionStatus {
  COMPLETED,
  FAILED,
  /** No capability is wired for the action type. */
  SKIPPED
}
