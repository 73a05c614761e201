package com.acme.mailroute.classify;

import java.util.LinkedHashMap;
import java.util.Map;

final class Scores {
  private Scores() {}

  static double clamp(double v) {
    return Math.max(0.0, Math.min(1.0, v));
  }

  /** Scales to sum 1; an all-zero map becomes uniform. Iteration order is kept. */
  static Map<String, Double> normalize(Map<String, Double> scores) {
    double total = scores.values().stream().mapToDouble(Double::doubleValue).sum();
    Map<String, Double> out = new LinkedHashMap<>();
    for (var e : scores.entrySet()) {
      out.put(e.getKey(), total > 0 ? e.getValue() / total : 1.0 / scores.size());
    }
    return out;
  }

  /** Highest-scoring label; the first one in iteration order wins ties. */
  static String argMax(Map<String, Double> scores) {
    String best = null;
    double bestScore = Double.NEGATIVE_INFINITY;
    for (var e : scores.entrySet()) {
      if (e.getValue() > bestScore) {
        best = e.getKey();
        bestScore = e.getValue();
      }
    }
    return best;
  }
}
