package com.acme.mailroute.classify;

import com.acme.mailroute.domain.ClassificationResult;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last stage: multinomial naive Bayes over the mailbox vocabulary, trained at construction on a
 * small built-in corpus. It always answers; text with no usable tokens, or any internal failure,
 * gives {@link #lowConfidence}.
 */
public class StatisticalBaselineClassifier implements Classifier {
  private static final Logger LOG = LoggerFactory.getLogger(StatisticalBaselineClassifier.class);

  public static final String NAME = "baseline";

  /** Labelled examples as (subject, body, category). */
  public record Example(String subject, String body, String category) {}

  static final List<Example> DEFAULT_CORPUS =
      List.of(
          new Example("win free money now", "click here to claim your prize", "spam"),
          new Example(
              "urgent action required",
              "verify your account immediately or it will be closed",
              "spam"),
          new Example("congratulations you won", "you have been selected for a prize", "spam"),
          new Example("act now limited offer", "buy now and save 90 percent", "spam"),
          new Example(
              "meeting tomorrow at 10am",
              "please confirm your attendance for the team meeting",
              "important"),
          new Example(
              "project deadline reminder", "the quarterly report is due by friday", "important"),
          new Example(
              "invoice payment required", "please process payment for invoice 12345", "important"),
          new Example(
              "security alert login detected",
              "we detected a new login to your account",
              "important"),
          new Example(
              "sale up to 50 off",
              "get amazing discounts on all products this weekend only",
              "promotion"),
          new Example(
              "new product launch", "check out our latest collection of items", "promotion"),
          new Example(
              "special offer for you", "exclusive deal just for our valued customers", "promotion"),
          new Example("flash sale today only", "dont miss out on incredible savings", "promotion"),
          new Example(
              "birthday party invitation", "you are invited to celebrate with us", "social"),
          new Example(
              "friend request on social media", "someone wants to connect with you", "social"),
          new Example(
              "event reminder", "dont forget about the concert this saturday", "social"),
          new Example(
              "photo shared with you", "check out these amazing photos from the trip", "social"),
          new Example("order confirmation", "your order has been successfully placed", "updates"),
          new Example("password reset request", "click here to reset your password", "updates"),
          new Example(
              "newsletter subscription",
              "thank you for subscribing to our newsletter",
              "updates"),
          new Example("account verification", "please verify your email address", "updates"));

  private final List<String> labels;
  private final Map<String, Double> logPrior = new HashMap<>();
  private final Map<String, Map<String, Integer>> tokenCounts = new HashMap<>();
  private final Map<String, Integer> totalTokens = new HashMap<>();
  private final Set<String> vocabulary = new HashSet<>();

  public StatisticalBaselineClassifier() {
    this(DEFAULT_CORPUS);
  }

  public StatisticalBaselineClassifier(List<Example> corpus) {
    this.labels = MailboxCategory.ALL;
    train(corpus);
  }

  @Override
  public String name() {
    return NAME;
  }

  /** Uniform result over the mailbox vocabulary, reported as {@code updates}. */
  public static ClassificationResult lowConfidence(String explanation) {
    Map<String, Double> uniform = new LinkedHashMap<>();
    MailboxCategory.ALL.forEach(l -> uniform.put(l, 1.0 / MailboxCategory.ALL.size()));
    return ClassificationResult.of(MailboxCategory.UPDATES, uniform, NAME, explanation);
  }

  @Override
  public ClassificationResult classify(String subject, String body, String sender) {
    try {
      String text = (subject == null ? "" : subject) + " " + (body == null ? "" : body);
      List<String> tokens = tokenize(text);
      List<String> known = tokens.stream().filter(vocabulary::contains).toList();
      if (known.isEmpty()) {
        return lowConfidence("No known tokens");
      }
      Map<String, Double> logPosterior = new LinkedHashMap<>();
      for (String label : labels) {
        double lp = logPrior.get(label);
        Map<String, Integer> counts = tokenCounts.get(label);
        double denominator = totalTokens.get(label) + vocabulary.size();
        for (String token : known) {
          lp += Math.log((counts.getOrDefault(token, 0) + 1) / denominator);
        }
        logPosterior.put(label, lp);
      }
      Map<String, Double> probabilities = softmax(logPosterior);
      String category = Scores.argMax(probabilities);
      return ClassificationResult.of(
          category, probabilities, NAME, "Naive Bayes over " + known.size() + " tokens");
    } catch (RuntimeException e) {
      LOG.warn("Baseline classifier failed, answering with uniform result", e);
      return lowConfidence("Baseline failure: " + e.getMessage());
    }
  }

  private void train(List<Example> corpus) {
    Map<String, Integer> docs = new HashMap<>();
    for (String label : labels) {
      tokenCounts.put(label, new HashMap<>());
      totalTokens.put(label, 0);
      docs.put(label, 0);
    }
    for (Example ex : corpus) {
      if (!tokenCounts.containsKey(ex.category())) {
        throw new IllegalArgumentException("Unknown training label: " + ex.category());
      }
      docs.merge(ex.category(), 1, Integer::sum);
      for (String token : tokenize(ex.subject() + " " + ex.body())) {
        tokenCounts.get(ex.category()).merge(token, 1, Integer::sum);
        totalTokens.merge(ex.category(), 1, Integer::sum);
        vocabulary.add(token);
      }
    }
    // add-one on the prior so labels without examples stay possible
    int total = corpus.size() + labels.size();
    for (String label : labels) {
      logPrior.put(label, Math.log((docs.get(label) + 1.0) / total));
    }
  }

  static List<String> tokenize(String text) {
    return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
        .filter(t -> t.length() > 1)
        .toList();
  }

  private static Map<String, Double> softmax(Map<String, Double> logs) {
    double max = logs.values().stream().mapToDouble(Double::doubleValue).max().orElse(0);
    Map<String, Double> exp = new LinkedHashMap<>();
    logs.forEach((k, v) -> exp.put(k, Math.exp(v - max)));
    return Scores.normalize(exp);
  }
}
