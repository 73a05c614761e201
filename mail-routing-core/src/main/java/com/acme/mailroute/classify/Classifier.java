package com.acme.mailroute.classify;

import com.acme.mailroute.domain.ClassificationResult;

/**
 * One stage of the classification chain. A stage either answers, returns an {@link
 * ClassificationResult#unknown unknown} result, or throws; the chain treats the last two the same.
 */
public interface Classifier {

  /** Stable stage name, recorded on results and used for the department lookup. */
  String name();

  ClassificationResult classify(String subject, String body, String sender);
}
