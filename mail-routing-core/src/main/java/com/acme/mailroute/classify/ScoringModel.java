package com.acme.mailroute.classify;

import java.util.Map;

/**
 * Opaque base scorer behind the domain keyword stage, for example a fine-tuned model served by
 * another process. Scores need not be normalized; labels outside the stage vocabulary are ignored.
 */
@FunctionalInterface
public interface ScoringModel {
  Map<String, Double> score(String text);
}
