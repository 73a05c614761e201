package com.acme.mailroute.processor.config;

import com.acme.mailroute.config.ClassificationConfig;
import com.acme.mailroute.config.IngestionConfig;
import com.acme.mailroute.config.PollingConfig;
import com.acme.mailroute.rules.RuleEngine;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

  private final IngestionConfig ingestion;
  private final PollingConfig polling;
  private final ClassificationConfig classification;
  private final RuleEngine rules;

  @Value("${datasources.default.url:}")
  String datasourceUrl;

  @Value("${datasources.default.maximum-pool-size:10}")
  int maxPoolSize;

  @Value("${db.dialect:H2}")
  String dialect;

  public ConfigurationLogger(
      IngestionConfig ingestion,
      PollingConfig polling,
      ClassificationConfig classification,
      RuleEngine rules) {
    this.ingestion = ingestion;
    this.polling = polling;
    this.classification = classification;
    this.rules = rules;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("                         EFFECTIVE CONFIGURATION                                ");
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");

    LOG.info("━━━ Database ━━━");
    LOG.info("  Dialect:            {}", dialect);
    LOG.info("  JDBC URL:           {}", datasourceUrl);
    LOG.info("  Max Pool Size:      {} (HikariCP maximum connections)", maxPoolSize);

    LOG.info("━━━ Ingestion ━━━");
    LOG.info("  Mode:               {}", ingestion.getMode());
    LOG.info("  Worker Threads:     {} (background classification)", ingestion.getWorkerThreads());
    LOG.info("  Drain Timeout:      {}", ingestion.getDrainTimeout());
    LOG.info(
        "  Startup Reprocess:  {} (limit {})",
        ingestion.isReprocessOnStartup(),
        ingestion.getReprocessLimit());
    LOG.info("  Stale Processing:   {}", ingestion.getStaleProcessingAfter());

    LOG.info("━━━ Classification & Routing ━━━");
    LOG.info("  Cache Capacity:     {} (FIFO eviction)", classification.getCacheCapacity());
    LOG.info("  Rules Enabled:      {}", classification.isRulesEnabled());
    LOG.info("  Triage Below:       {}", classification.getTriageConfidence());
    LOG.info("  Loaded Rules:       {}", rules.listRules().size());

    LOG.info("━━━ Polling ━━━");
    LOG.info("  Enabled:            {}", polling.isEnabled());
    LOG.info("  Interval:           {}", polling.getIntervalString());
    LOG.info("  Batch Size:         {}", polling.getBatchSize());
    LOG.info("  Poll Query:         {}", polling.getPollQuery());
    LOG.info("  Backfill Query:     {}", polling.getBackfillQuery());
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
  }
}
