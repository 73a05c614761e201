package com.acme.mailroute.classify;

import com.acme.mailroute.domain.ClassificationResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Second stage: weighted lexicon over the mailbox vocabulary. Every pattern that matches adds its
 * weight to its category; the scores are smoothed and normalized. No match at all yields {@code
 * unknown}.
 */
public class GeneralPurposeClassifier implements Classifier {

  public static final String NAME = "general";

  // keeps a single weak match from claiming certainty
  static final double SMOOTHING = 0.1;

  private record Term(Pattern pattern, double weight) {}

  private static final Map<String, List<Term>> LEXICON = new LinkedHashMap<>();

  static {
    LEXICON.put(
        MailboxCategory.SPAM,
        List.of(
            term("\\b(win|won|winner|congratulations|prize|claim|lottery)\\b", 1.5),
            term("\\b(click here|act now|limited offer|risk free|100% free)\\b", 1.5),
            term("\\b(verify your account|suspended|unusual activity)\\b", 1.0),
            term("\\$\\d{3,}", 0.5),
            term("\\d{3,}%", 0.5),
            term("!!+", 0.5)));
    LEXICON.put(
        MailboxCategory.IMPORTANT,
        List.of(
            term("\\b(meeting|deadline|urgent|asap|important|critical|action required)\\b", 1.5),
            term("\\b(invoice|payment|contract|agreement|legal)\\b", 1.0),
            term("\\b(security|alert|warning)\\b", 1.0),
            term("\\b(approve|approval|review|confirm)\\b", 0.5)));
    LEXICON.put(
        MailboxCategory.PROMOTION,
        List.of(
            term("\\b(sale|discount|offer|deal|save|coupon|special)\\b", 1.0),
            term("\\d+%\\s*off\\b", 1.5),
            term("\\b(buy now|shop now|order now)\\b", 1.0),
            term("\\b(exclusive|limited time|today only|flash sale)\\b", 1.0),
            term("\\b(new product|launch|collection)\\b", 0.5)));
    LEXICON.put(
        MailboxCategory.SOCIAL,
        List.of(
            term("\\b(invitation|invited|party|birthday|celebrate)\\b", 1.5),
            term("\\b(friend request|followed you|tagged you|connect with you)\\b", 1.5),
            term("\\b(photo|photos|concert|event)\\b", 0.5)));
    LEXICON.put(
        MailboxCategory.UPDATES,
        List.of(
            term("\\b(order confirmation|has shipped|tracking number|receipt)\\b", 1.5),
            term("\\b(password reset|verify your email|account verification)\\b", 1.5),
            term("\\b(newsletter|subscription|digest|weekly update)\\b", 1.0)));
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public ClassificationResult classify(String subject, String body, String sender) {
    String text = (subject == null ? "" : subject) + "\n" + (body == null ? "" : body);

    Map<String, Double> raw = new LinkedHashMap<>();
    Map<String, List<String>> evidence = new LinkedHashMap<>();
    double total = 0;
    for (var e : LEXICON.entrySet()) {
      double score = 0;
      List<String> hits = new ArrayList<>();
      for (Term t : e.getValue()) {
        var m = t.pattern().matcher(text);
        if (m.find()) {
          score += t.weight();
          hits.add(m.group());
        }
      }
      raw.put(e.getKey(), score);
      total += score;
      if (!hits.isEmpty()) {
        evidence.put(e.getKey(), List.copyOf(hits));
      }
    }
    if (total == 0) {
      return ClassificationResult.unknown(NAME, "No lexicon terms matched");
    }

    Map<String, Double> smoothed = new LinkedHashMap<>();
    raw.forEach((k, v) -> smoothed.put(k, v + SMOOTHING));
    Map<String, Double> probabilities = Scores.normalize(smoothed);
    String category = Scores.argMax(probabilities);
    return ClassificationResult.of(
            category, probabilities, NAME, "Lexicon terms " + evidence.get(category))
        .withKeywords(evidence);
  }

  private static Term term(String regex, double weight) {
    return new Term(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), weight);
  }
}
