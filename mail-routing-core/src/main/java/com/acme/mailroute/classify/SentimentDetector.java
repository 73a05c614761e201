package com.acme.mailroute.classify;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexicon-based tone of a message: {@code positive}, {@code negative}, {@code neutral} or {@code
 * mixed}.
 *
 * <p>Each sentiment word scores 1, or 1.5 after an intensifier. A negator flips a positive word to
 * negative and turns a negative word into half a positive point. Stock phrases score 2, and two or
 * more exclamation marks add 1 to an already negative text. When the two totals are less than 1
 * apart the text is neutral, or mixed if they add up to 2 or more.
 */
public class SentimentDetector {
  public static final String POSITIVE = "positive";
  public static final String NEGATIVE = "negative";
  public static final String NEUTRAL = "neutral";
  public static final String MIXED = "mixed";

  private static final Pattern TOKEN = Pattern.compile("[a-z]+(?:'[a-z]+)?");

  private static final Set<String> POSITIVE_WORDS =
      Set.of(
          "thank", "thanks", "grateful", "appreciate", "appreciated", "excellent", "great",
          "amazing", "wonderful", "fantastic", "perfect", "love", "loved", "happy", "pleased",
          "delighted", "satisfied", "impressed", "awesome", "brilliant", "outstanding",
          "exceptional", "superb", "terrific", "helpful", "kind", "friendly", "professional",
          "efficient", "quick", "best", "congratulations", "congrats");
  private static final Set<String> NEGATIVE_WORDS =
      Set.of(
          "angry", "furious", "frustrated", "annoyed", "disappointed", "upset", "terrible",
          "horrible", "awful", "worst", "bad", "poor", "unacceptable", "ridiculous", "outrageous",
          "disgusted", "hate", "hated", "useless", "incompetent", "unprofessional", "rude", "slow",
          "delayed", "broken", "failed", "failure", "problem", "issue", "complaint", "complain",
          "refund", "cancel", "waste", "scam", "fraud", "liar", "unresponsive", "ignored",
          "waiting");
  private static final Set<String> INTENSIFIERS =
      Set.of("very", "extremely", "incredibly", "absolutely", "totally", "completely", "really",
          "so");
  private static final Set<String> NEGATORS =
      Set.of("not", "never", "no", "none", "neither", "doesn't", "don't", "didn't", "won't",
          "can't");

  private static final List<String> POSITIVE_PHRASES =
      List.of(
          "thank you for", "i appreciate", "great job", "well done", "good job", "keep up",
          "looking forward", "happy to help", "exceeded expectations", "highly recommend");
  private static final List<String> NEGATIVE_PHRASES =
      List.of(
          "worst experience", "never again", "very disappointed", "extremely frustrated",
          "waste of time", "waste of money", "total disaster", "absolutely terrible",
          "still waiting", "no response", "demand a refund", "speak to manager",
          "file a complaint", "taking legal action");

  public String detect(String subject, String body) {
    String text =
        ((subject == null ? "" : subject) + ". " + (body == null ? "" : body))
            .toLowerCase(Locale.ROOT);

    List<String> words = new ArrayList<>();
    Matcher m = TOKEN.matcher(text);
    while (m.find()) {
      words.add(m.group());
    }

    double positive = 0;
    double negative = 0;
    for (int i = 0; i < words.size(); i++) {
      String word = words.get(i);
      String previous = i > 0 ? words.get(i - 1) : "";
      boolean negated = NEGATORS.contains(previous);
      double weight = INTENSIFIERS.contains(previous) ? 1.5 : 1.0;
      if (POSITIVE_WORDS.contains(word)) {
        if (negated) {
          negative += weight;
        } else {
          positive += weight;
        }
      } else if (NEGATIVE_WORDS.contains(word)) {
        if (negated) {
          positive += 0.5 * weight;
        } else {
          negative += weight;
        }
      }
    }
    for (String phrase : POSITIVE_PHRASES) {
      if (text.contains(phrase)) {
        positive += 2;
      }
    }
    for (String phrase : NEGATIVE_PHRASES) {
      if (text.contains(phrase)) {
        negative += 2;
      }
    }
    if (negative > 0 && text.chars().filter(c -> c == '!').count() >= 2) {
      negative += 1;
    }

    if (Math.abs(positive - negative) < 1) {
      return positive + negative < 2 ? NEUTRAL : MIXED;
    }
    return positive > negative ? POSITIVE : NEGATIVE;
  }
}
