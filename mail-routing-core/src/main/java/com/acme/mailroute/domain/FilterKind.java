package com.acme.mailroute.domain;

/** Which field an ignore-filter entry is matched against. */
public enum FilterKind {
  SENDER,
  SUBJECT
}
