package com.acme.mailroute.classify;

/** Canonical routing destinations. */
public enum Department {
  SALES("Sales"),
  HR("HR"),
  FINANCE("Finance"),
  SUPPORT("Support"),
  IT("IT"),
  LEGAL("Legal"),
  MARKETING("Marketing"),
  OPERATIONS("Operations"),
  EXECUTIVE("Executive");

  private final String label;

  Department(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
