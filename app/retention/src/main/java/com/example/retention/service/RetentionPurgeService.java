/*
 * Where: Retention backlog purge
 * What: Runs every registered policy once per round and re-triggers while backlog remains
 * Why: A large backlog drains over several short rounds, capped so a runaway chain stops
 */
package com.example.retention.service;

import com.example.common.TraceIds;
import com.example.retention.policy.RetentionPolicy;
import com.example.retention.policy.RetentionPolicyRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RetentionPurgeService {

  private static final Logger logger = LoggerFactory.getLogger(RetentionPurgeService.class);

  public static final int MAX_ROUNDS = 10;

  static final String MDC_RUN_ID = "retention_run_id";
  static final String MDC_ROUND = "retention_round";

  private final RetentionPolicyRegistry registry;
  private final RetentionCleanupService cleanupService;
  private final PurgeRoundTrigger roundTrigger;
  private final RetentionMetrics metrics;

  /**
   * Runs one round of a new purge chain.
   *
   * @param round 1 for a fresh chain; at most {@link #MAX_ROUNDS}
   */
  public PurgeRoundResult runBacklogRound(int round) {
    return runRound(round, TraceIds.newShortId());
  }

  private PurgeRoundResult runRound(int round, String runId) {
    if (round < 1 || round > MAX_ROUNDS) {
      throw new IllegalArgumentException(
          "round must be between 1 and " + MAX_ROUNDS + ", got " + round);
    }
    MDC.put(MDC_RUN_ID, runId);
    MDC.put(MDC_ROUND, Integer.toString(round));
    try {
      return purge(round, runId);
    } finally {
      MDC.remove(MDC_RUN_ID);
      MDC.remove(MDC_ROUND);
    }
  }

  private PurgeRoundResult purge(int round, String runId) {
    final Map<String, CleanupResult> results = new LinkedHashMap<>();
    final Map<String, String> errors = new LinkedHashMap<>();
    boolean hasRemaining = false;

    for (RetentionPolicy policy : registry.policies()) {
      final String entityType = policy.entityType();
      try {
        final CleanupResult result = cleanupService.cleanup(policy, false);
        results.put(entityType, result);
        // A skipped entity is someone else's work right now, not backlog of this chain.
        if (!result.skipped() && result.hasRemaining()) {
          hasRemaining = true;
        }
      } catch (RuntimeException ex) {
        logger.error(
            "retention purge entity failed entityType={} round={} error={}",
            entityType,
            round,
            ex.getMessage(),
            ex);
        errors.put(entityType, ex.getClass().getSimpleName() + ": " + ex.getMessage());
      }
    }

    final PurgeOutcome outcome;
    if (!hasRemaining) {
      outcome = PurgeOutcome.DRAINED;
      logger.info("retention purge drained round={} entities={}", round, results.size());
    } else if (round < MAX_ROUNDS) {
      outcome = PurgeOutcome.RETRIGGERED;
      logger.info("retention purge re-triggering round={} nextRound={}", round, round + 1);
      final int nextRound = round + 1;
      roundTrigger.schedule(nextRound, () -> runRound(nextRound, runId));
    } else {
      outcome = PurgeOutcome.CAPPED;
      logger.warn(
          "retention purge reached max rounds round={} maxRounds={}; backlog remains until the"
              + " next scheduled run",
          round,
          MAX_ROUNDS);
    }
    metrics.recordRound(outcome);
    return new PurgeRoundResult(round, hasRemaining, results, errors, outcome);
  }
}
