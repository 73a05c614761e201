package com.acme.mailroute.config;

/** Classification and routing settings. Pure POJO - no framework dependencies. */
public class ClassificationConfig {

  private int cacheCapacity = 1000;
  private boolean rulesEnabled = true;
  // below this the triage rule takes the message
  private double triageConfidence = 0.4;

  public int getCacheCapacity() {
    return cacheCapacity;
  }

  public void setCacheCapacity(int cacheCapacity) {
    this.cacheCapacity = cacheCapacity;
  }

  public boolean isRulesEnabled() {
    return rulesEnabled;
  }

  public void setRulesEnabled(boolean rulesEnabled) {
    this.rulesEnabled = rulesEnabled;
  }

  public double getTriageConfidence() {
    return triageConfidence;
  }

  public void setTriageConfidence(double triageConfidence) {
    this.triageConfidence = triageConfidence;
  }
}
