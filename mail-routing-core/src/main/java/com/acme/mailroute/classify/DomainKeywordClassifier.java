package com.acme.mailroute.classify;

import com.acme.mailroute.core.ClassifierUnavailableException;
import com.acme.mailroute.domain.ClassificationResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage: department vocabulary scored by an optional {@link ScoringModel} and adjusted by
 * keyword evidence.
 *
 * <p>Each label with {@code n > 0} keyword hits gets {@code min(0.12 * n, 0.4)} added to its base
 * score; when any label has hits, labels without hits lose 0.05. Scores are clamped to [0, 1] and
 * then renormalized. Without a model the base is a uniform prior, and a message with no keyword
 * evidence gets an {@code unknown} answer so the chain moves on. A failing model surfaces as
 * {@link ClassifierUnavailableException}.
 */
public class DomainKeywordClassifier implements Classifier {
  private static final Logger LOG = LoggerFactory.getLogger(DomainKeywordClassifier.class);

  public static final String NAME = "domain";
  public static final int MAX_TEXT = 2000;

  static final double BOOST_PER_HIT = 0.12;
  static final double MAX_BOOST = 0.4;
  static final double PENALTY = -0.05;

  public static final List<String> LABELS =
      List.of(
          "sales",
          "hr",
          "finance",
          "it_support",
          "legal",
          "marketing",
          "customer_service",
          "operations",
          "executive",
          "general");

  private static final Map<String, List<String>> KEYWORDS = new LinkedHashMap<>();

  static {
    KEYWORDS.put(
        "sales",
        List.of(
            "quote", "pricing", "demo", "purchase", "proposal", "sales", "order", "subscription",
            "upgrade", "renew", "interested in", "looking to buy", "price list", "roi", "trial",
            "pilot", "poc", "proof of concept", "budget approved"));
    KEYWORDS.put(
        "hr",
        List.of(
            "job", "resume", "cv", "application", "interview", "hiring", "recruit", "salary",
            "benefits", "vacation", "leave", "pto", "sick", "payroll", "performance review",
            "onboarding", "handbook", "termination", "resignation", "retire", "promotion",
            "raise"));
    KEYWORDS.put(
        "finance",
        List.of(
            "invoice", "payment", "bill", "billing", "receipt", "expense", "reimburse", "budget",
            "accounting", "tax", "audit", "payable", "receivable", "purchase order", "po number",
            "credit", "debit", "refund", "wire transfer", "bank", "financial", "quarterly",
            "fiscal", "revenue", "profit"));
    KEYWORDS.put(
        "it_support",
        List.of(
            "password", "reset", "login", "access", "system", "computer", "laptop", "software",
            "hardware", "install", "network", "wifi", "vpn", "email setup", "outlook", "printer",
            "server", "server down", "outage", "downtime", "crash", "error", "bug", "not working",
            "help desk"));
    KEYWORDS.put(
        "legal",
        List.of(
            "contract", "agreement", "nda", "legal", "lawyer", "attorney", "lawsuit",
            "compliance", "regulation", "gdpr", "privacy", "terms and conditions",
            "intellectual property", "trademark", "copyright", "patent", "liability",
            "indemnification", "arbitration", "dispute", "court", "litigation", "subpoena"));
    KEYWORDS.put(
        "marketing",
        List.of(
            "campaign", "marketing", "advertising", "brand", "logo", "press release",
            "social media", "linkedin", "content", "blog", "webinar", "conference", "seo", "ppc",
            "lead generation", "conversion"));
    KEYWORDS.put(
        "customer_service",
        List.of(
            "complaint", "unhappy", "dissatisfied", "frustrated", "problem with", "issue with",
            "not satisfied", "return", "exchange", "broken", "defective", "damaged", "missing",
            "late delivery", "poor service", "bad experience", "feedback"));
    KEYWORDS.put(
        "operations",
        List.of(
            "shipping", "delivery", "tracking", "warehouse", "inventory", "stock", "supply chain",
            "supplier", "vendor", "procurement", "logistics", "facility", "maintenance",
            "equipment", "fleet", "manufacturing", "production", "quality control", "shipment",
            "freight", "customs"));
    KEYWORDS.put(
        "executive",
        List.of(
            "ceo", "cfo", "cto", "coo", "board", "chairman", "investor", "shareholder",
            "strategic", "merger", "acquisition", "ipo", "annual report", "earnings",
            "board meeting", "executive summary"));
  }

  private static final Map<String, List<Pattern>> PATTERNS = compile(KEYWORDS);

  private final ScoringModel model;

  public DomainKeywordClassifier() {
    this(null);
  }

  public DomainKeywordClassifier(ScoringModel model) {
    this.model = model;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public ClassificationResult classify(String subject, String body, String sender) {
    String text = text(subject, body);
    if (text.isBlank()) {
      return ClassificationResult.unknown(NAME, "Empty email content");
    }

    Map<String, List<String>> found = findKeywords(text);
    if (found.isEmpty() && model == null) {
      return ClassificationResult.unknown(NAME, "No department keywords found");
    }

    Map<String, Double> base = baseScores(text);
    Map<String, Double> boosts = boosts(found);
    Map<String, Double> adjusted = new LinkedHashMap<>();
    for (String label : LABELS) {
      adjusted.put(label, Scores.clamp(base.get(label) + boosts.get(label)));
    }
    Map<String, Double> probabilities = Scores.normalize(adjusted);
    String category = Scores.argMax(probabilities);

    String explanation =
        found.containsKey(category)
            ? "Matched keywords " + found.get(category)
            : "Model score without keyword evidence";
    LOG.debug("Domain stage picked {} from {}", category, found.keySet());
    return ClassificationResult.of(category, probabilities, NAME, explanation).withKeywords(found);
  }

  Map<String, Double> baseScores(String text) {
    Map<String, Double> base = new LinkedHashMap<>();
    if (model == null) {
      LABELS.forEach(l -> base.put(l, 1.0 / LABELS.size()));
      return base;
    }
    Map<String, Double> raw;
    try {
      raw = model.score(text);
    } catch (RuntimeException e) {
      throw new ClassifierUnavailableException("Scoring model failed: " + e.getMessage(), e);
    }
    LABELS.forEach(l -> base.put(l, raw == null ? 0.0 : raw.getOrDefault(l, 0.0)));
    return Scores.normalize(base);
  }

  static Map<String, Double> boosts(Map<String, List<String>> found) {
    Map<String, Double> boosts = new LinkedHashMap<>();
    for (String label : LABELS) {
      int hits = found.getOrDefault(label, List.of()).size();
      if (hits > 0) {
        boosts.put(label, Math.min(hits * BOOST_PER_HIT, MAX_BOOST));
      } else {
        boosts.put(label, found.isEmpty() ? 0.0 : PENALTY);
      }
    }
    return boosts;
  }

  static Map<String, List<String>> findKeywords(String text) {
    Map<String, List<String>> found = new LinkedHashMap<>();
    for (var e : PATTERNS.entrySet()) {
      List<String> hits = new ArrayList<>();
      List<String> words = KEYWORDS.get(e.getKey());
      for (int i = 0; i < words.size(); i++) {
        if (e.getValue().get(i).matcher(text).find()) {
          hits.add(words.get(i));
        }
      }
      if (!hits.isEmpty()) {
        found.put(e.getKey(), List.copyOf(hits));
      }
    }
    return found;
  }

  private static String text(String subject, String body) {
    String s = subject == null ? "" : subject;
    String b = body == null ? "" : body;
    String text = (s + "\n" + b).toLowerCase(Locale.ROOT);
    return text.length() > MAX_TEXT ? text.substring(0, MAX_TEXT) : text;
  }

  // Keywords match on word boundaries so short ones do not fire inside longer words.
  private static Map<String, List<Pattern>> compile(Map<String, List<String>> keywords) {
    Map<String, List<Pattern>> out = new LinkedHashMap<>();
    keywords.forEach(
        (label, words) ->
            out.put(
                label,
                words.stream()
                    .map(w -> Pattern.compile("(?<![a-z0-9])" + Pattern.quote(w) + "(?![a-z0-9])"))
                    .toList()));
    return out;
  }
}
