package com.acme.mailroute.rules;

/** Live sender lists a condition can take its value from. */
public enum ListRef {
  SENDER_WHITELIST,
  SENDER_BLACKLIST
}
