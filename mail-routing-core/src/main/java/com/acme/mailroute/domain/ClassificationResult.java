package com.acme.mailroute.domain;

import java.util.List;
import java.util.Map;

/**
 * Output of a classifier stage. {@code probabilities} sum to 1 within rounding; {@code confidence}
 * is the probability of {@code category}.
 *
 * @param stage name of the classifier that produced the result
 * @param keywords keyword evidence per label, empty when the stage does not use keywords
 */
public record ClassificationResult(
    String category,
    double confidence,
    Map<String, Double> probabilities,
    String department,
    String explanation,
    String stage,
    String sentiment,
    String priority,
    Map<String, List<String>> keywords) {

  public static final String UNKNOWN = "unknown";

  public ClassificationResult {
    probabilities = probabilities == null ? Map.of() : Map.copyOf(probabilities);
    keywords = keywords == null ? Map.of() : Map.copyOf(keywords);
  }

  public static ClassificationResult of(
      String category, Map<String, Double> probabilities, String stage, String explanation) {
    return new ClassificationResult(
        category,
        probabilities.getOrDefault(category, 0.0),
        probabilities,
        null,
        explanation,
        stage,
        null,
        null,
        Map.of());
  }

  public static ClassificationResult unknown(String stage, String explanation) {
    return new ClassificationResult(
        UNKNOWN, 0.0, Map.of(), null, explanation, stage, null, null, Map.of());
  }

  /** A stage answered when it is confident at all and named a real category. */
  public boolean isAnswer() {
    return confidence > 0 && !UNKNOWN.equalsIgnoreCase(category);
  }

  public double probabilityOf(String label) {
    return probabilities.getOrDefault(label, 0.0);
  }

  public ClassificationResult withDepartment(String department) {
    return new ClassificationResult(
        category,
        confidence,
        probabilities,
        department,
        explanation,
        stage,
        sentiment,
        priority,
        keywords);
  }

  public ClassificationResult withPriority(String priority) {
    return new ClassificationResult(
        category,
        confidence,
        probabilities,
        department,
        explanation,
        stage,
        sentiment,
        priority,
        keywords);
  }

  public ClassificationResult withSentiment(String sentiment) {
    return new ClassificationResult(
        category,
        confidence,
        probabilities,
        department,
        explanation,
        stage,
        sentiment,
        priority,
        keywords);
  }

  public ClassificationResult withKeywords(Map<String, List<String>> keywords) {
    return new ClassificationResult(
        category,
        confidence,
        probabilities,
        department,
        explanation,
        stage,
        sentiment,
        priority,
        keywords);
  }
}
