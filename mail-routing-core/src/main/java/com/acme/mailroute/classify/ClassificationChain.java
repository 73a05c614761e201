package com.acme.mailroute.classify;

import com.acme.mailroute.domain.ClassificationResult;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries classifier stages in order and keeps the first answer (confidence above zero, category not
 * {@code unknown}). A stage that throws is treated as having no answer. The accepted result is
 * stamped with its department, a detected priority and a detected sentiment. A detector that fails
 * leaves its field unset.
 *
 * <p>{@link #classify} never throws. If no stage answers, the result is the baseline's uniform
 * low-confidence answer.
 */
public class ClassificationChain {
  private static final Logger LOG = LoggerFactory.getLogger(ClassificationChain.class);

  private final List<Classifier> stages;
  private final DepartmentDirectory departments;
  private final PriorityDetector priorities;
  private final SentimentDetector sentiments;

  public ClassificationChain(
      List<Classifier> stages, DepartmentDirectory departments, PriorityDetector priorities) {
    this(stages, departments, priorities, new SentimentDetector());
  }

  public ClassificationChain(
      List<Classifier> stages,
      DepartmentDirectory departments,
      PriorityDetector priorities,
      SentimentDetector sentiments) {
    if (stages.isEmpty()) {
      throw new IllegalArgumentException("At least one classifier stage is required");
    }
    this.stages = List.copyOf(stages);
    this.departments = departments;
    this.priorities = priorities;
    this.sentiments = sentiments;
  }

  /** Domain keyword, general-purpose and baseline stages with the default department tables. */
  public static ClassificationChain standard(ScoringModel model) {
    return new ClassificationChain(
        List.of(
            new DomainKeywordClassifier(model),
            new GeneralPurposeClassifier(),
            new StatisticalBaselineClassifier()),
        DepartmentDirectory.defaults(),
        new PriorityDetector(),
        new SentimentDetector());
  }

  public ClassificationResult classify(String subject, String body, String sender) {
    ClassificationResult accepted = null;
    for (Classifier stage : stages) {
      try {
        ClassificationResult r = stage.classify(subject, body, sender);
        if (r != null && r.isAnswer()) {
          accepted = r;
          break;
        }
        LOG.debug("Stage {} had no answer, trying next", stage.name());
      } catch (RuntimeException e) {
        LOG.warn("Stage {} failed: {}", stage.name(), e.getMessage());
      }
    }
    if (accepted == null) {
      LOG.warn("No classifier stage answered, using low-confidence fallback");
      accepted = StatisticalBaselineClassifier.lowConfidence("All classifier stages failed");
    }

    String department = departments.departmentFor(accepted.stage(), accepted.category()).label();
    return accepted
        .withDepartment(department)
        .withPriority(safePriority(subject, body))
        .withSentiment(safeSentiment(subject, body));
  }

  public List<Classifier> stages() {
    return stages;
  }

  private String safePriority(String subject, String body) {
    try {
      return priorities.detect(subject, body);
    } catch (RuntimeException e) {
      LOG.warn("Priority detection failed: {}", e.getMessage());
      return null;
    }
  }

  private String safeSentiment(String subject, String body) {
    try {
      return sentiments.detect(subject, body);
    } catch (RuntimeException e) {
      LOG.warn("Sentiment detection failed: {}", e.getMessage());
      return null;
    }
  }
}
