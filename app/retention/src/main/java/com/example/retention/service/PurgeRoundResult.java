/*
 * Where: Retention backlog purge
 * What: Summary of one round across every registered entity type
 * Why: Returned by the admin API and used by tests to follow the round chain
 */
package com.example.retention.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PurgeRoundResult(
    int round,
    boolean hasRemaining,
    Map<String, CleanupResult> perEntityResults,
    Map<String, String> errors,
    PurgeOutcome outcome) {

  public PurgeRoundResult {
    perEntityResults = Map.copyOf(perEntityResults);
    errors = Map.copyOf(errors);
  }
}
