package com.acme.mailroute.processor;

import com.acme.mailroute.cache.CacheLookup;
import com.acme.mailroute.cache.Fingerprints;
import com.acme.mailroute.cache.ResultCache;
import com.acme.mailroute.classify.ClassificationChain;
import com.acme.mailroute.config.ClassificationConfig;
import com.acme.mailroute.dispatch.ActionDispatcher;
import com.acme.mailroute.dispatch.ActionResult;
import com.acme.mailroute.dispatch.DispatchContext;
import com.acme.mailroute.domain.ClassificationResult;
import com.acme.mailroute.domain.Message;
import com.acme.mailroute.repository.MessageRepository;
import com.acme.mailroute.rules.MatchedRule;
import com.acme.mailroute.rules.RuleEngine;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies and routes one stored message: mark PROCESSING, classify through the result cache,
 * persist the classification, evaluate rules, dispatch actions, persist the action log. Any failure
 * marks the record FAILED and is not propagated.
 */
@Slf4j
@Singleton
public class RoutingPipeline {

  private final MessageRepository messages;
  private final ClassificationChain chain;
  private final ResultCache cache;
  private final RuleEngine rules;
  private final ActionDispatcher dispatcher;
  private final ClassificationConfig config;

  public RoutingPipeline(
      MessageRepository messages,
      ClassificationChain chain,
      ResultCache cache,
      RuleEngine rules,
      ActionDispatcher dispatcher,
      ClassificationConfig config) {
    this.messages = messages;
    this.chain = chain;
    this.cache = cache;
    this.rules = rules;
    this.dispatcher = dispatcher;
    this.config = config;
  }

  /**
   * @return the classification, or empty if any step failed and the record was marked FAILED
   */
  public Optional<ClassificationResult> process(UUID recordId, Message message) {
    try {
      messages.markProcessing(recordId);

      String fingerprint = Fingerprints.of(message.subject(), message.body());
      CacheLookup lookup =
          cache.getOrCompute(
              fingerprint,
              () -> chain.classify(message.subject(), message.body(), message.sender()));
      ClassificationResult classification = lookup.result();
      messages.saveClassification(recordId, classification);

      List<MatchedRule> matched =
          config.isRulesEnabled() ? rules.evaluate(message, classification) : List.of();
      List<ActionResult> actions =
          dispatcher.dispatch(new DispatchContext(recordId, message, classification), matched);
      messages.markProcessed(recordId, actions);

      long failed = actions.stream().filter(ActionResult::failed).count();
      log.info(
          "Routed message {} as {}/{} ({}, cached={}): {} rules, {} actions, {} failed",
          recordId,
          classification.category(),
          classification.department(),
          classification.stage(),
          lookup.fromCache(),
          matched.size(),
          actions.size(),
          failed);
      return Optional.of(classification);

    } catch (RuntimeException e) {
      log.error("Routing failed for message {}: {}", recordId, e.getMessage(), e);
      markFailed(recordId, e);
      return Optional.empty();
    }
  }

  private void markFailed(UUID recordId, RuntimeException cause) {
    String error =
        cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    try {
      messages.markFailed(recordId, error);
    } catch (RuntimeException e) {
      log.error("Could not mark message {} as FAILED: {}", recordId, e.getMessage(), e);
    }
  }
}
