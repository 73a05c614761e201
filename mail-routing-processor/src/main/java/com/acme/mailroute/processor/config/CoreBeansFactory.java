package com.acme.mailroute.processor.config;

import com.acme.mailroute.cache.ResultCache;
import com.acme.mailroute.classify.ClassificationChain;
import com.acme.mailroute.classify.ScoringModel;
import com.acme.mailroute.config.ClassificationConfig;
import com.acme.mailroute.config.IngestionConfig;
import com.acme.mailroute.config.PollingConfig;
import com.acme.mailroute.dispatch.ActionDispatcher;
import com.acme.mailroute.dispatch.Capabilities;
import com.acme.mailroute.dispatch.FallbackActionTable;
import com.acme.mailroute.rules.ConditionEvaluator;
import com.acme.mailroute.rules.DefaultRules;
import com.acme.mailroute.rules.RuleEngine;
import com.acme.mailroute.rules.SenderLists;
import com.acme.mailroute.spi.CustomActionHandler;
import com.acme.mailroute.spi.MailboxOperations;
import com.acme.mailroute.spi.MessageForwarder;
import com.acme.mailroute.spi.Notifier;
import com.acme.mailroute.spi.TaskTracker;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import java.time.ZoneId;
import java.util.List;

/**
 * Factory for creating core domain beans with framework-specific configuration.
 *
 * <p>The core module stays free of framework dependencies; this factory does the DI wiring.
 */
@Factory
public class CoreBeansFactory {

  /** Creates IngestionConfig bean populated from application.yml ingestion.* properties */
  @Singleton
  @ConfigurationProperties("ingestion")
  public IngestionConfig ingestionConfig() {
    return new IngestionConfig();
  }

  /** Creates PollingConfig bean populated from application.yml polling.* properties */
  @Singleton
  @ConfigurationProperties("polling")
  public PollingConfig pollingConfig() {
    return new PollingConfig();
  }

  /** Creates ClassificationConfig bean populated from application.yml classification.* */
  @Singleton
  @ConfigurationProperties("classification")
  public ClassificationConfig classificationConfig() {
    return new ClassificationConfig();
  }

  @Singleton
  public ResultCache resultCache(ClassificationConfig config) {
    return new ResultCache(config.getCacheCapacity());
  }

  /** Standard three-stage chain; a ScoringModel bean, when deployed, feeds the domain stage. */
  @Singleton
  public ClassificationChain classificationChain(@Nullable ScoringModel model) {
    return ClassificationChain.standard(model);
  }

  @Singleton
  public SenderLists senderLists() {
    return new SenderLists();
  }

  /** Rule engine preloaded with the default rule base. */
  @Singleton
  public RuleEngine ruleEngine(SenderLists senderLists, ClassificationConfig config) {
    RuleEngine engine = new RuleEngine(new ConditionEvaluator(ZoneId.systemDefault()), senderLists);
    engine.replaceAll(DefaultRules.create(config.getTriageConfidence()));
    return engine;
  }

  @Singleton
  public ActionDispatcher actionDispatcher(
      @Nullable MailboxOperations mailbox,
      @Nullable MessageForwarder forwarder,
      @Nullable Notifier notifier,
      @Nullable TaskTracker tasks,
      SenderLists senderLists,
      List<CustomActionHandler> customHandlers) {
    Capabilities capabilities =
        new Capabilities(
            mailbox,
            forwarder,
            notifier,
            tasks,
            senderLists,
            Capabilities.byName(customHandlers));
    return new ActionDispatcher(capabilities, new FallbackActionTable());
  }
}
