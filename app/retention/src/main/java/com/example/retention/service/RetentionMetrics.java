/*
 * Where: Retention service layer
 * What: Records removed/failed rows, skips, errors and round outcomes per entity type
 * Why: A capped or erroring purge is only visible if someone can graph it
 */
package com.example.retention.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class RetentionMetrics {

  private static final String METRIC_CLEANUP_ROWS = "retention.cleanup.rows";
  private static final String METRIC_CLEANUP_SKIPPED = "retention.cleanup.skipped";
  private static final String METRIC_CLEANUP_ERRORS = "retention.cleanup.errors";
  private static final String METRIC_PURGE_ROUNDS = "retention.purge.rounds";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public RetentionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordCleanup(String entityType, CleanupResult result) {
    if (result.dryRun() || result.skipped()) {
      return;
    }
    increment(
        METRIC_CLEANUP_ROWS,
        "Rows handled by retention cleanup",
        Tags.of("entity_type", entityType, "outcome", "removed"),
        result.count());
    if (result.failed() != null) {
      increment(
          METRIC_CLEANUP_ROWS,
          "Rows handled by retention cleanup",
          Tags.of("entity_type", entityType, "outcome", "failed"),
          result.failed());
    }
  }

  public void recordSkipped(String entityType) {
    increment(
        METRIC_CLEANUP_SKIPPED,
        "Cleanups skipped because the lock was held",
        Tags.of("entity_type", entityType),
        1);
  }

  public void recordError(String entityType) {
    increment(
        METRIC_CLEANUP_ERRORS,
        "Cleanups that ended with an exception",
        Tags.of("entity_type", entityType),
        1);
  }

  public void recordRound(PurgeOutcome outcome) {
    increment(
        METRIC_PURGE_ROUNDS,
        "Backlog purge rounds by outcome",
        Tags.of("outcome", outcome.name().toLowerCase(Locale.ROOT)),
        1);
  }

  private void increment(String name, String description, Tags tags, double amount) {
    final String key = name + tags;
    counters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(name).description(description).tags(tags).register(meterRegistry))
        .increment(amount);
  }
}
