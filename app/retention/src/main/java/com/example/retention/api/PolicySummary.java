/*
 * Where: Retention admin API
 * What: Read-only view of a registered policy
 * Why: Operators check what the purge will touch before enabling it
 */
package com.example.retention.api;

import com.example.retention.policy.RetentionPolicy;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PolicySummary(
    String entityType,
    String table,
    String idColumn,
    String column,
    String period,
    String strategy,
    String filter,
    int batchLimit) {

  public static PolicySummary from(RetentionPolicy policy) {
    return new PolicySummary(
        policy.entityType(),
        policy.entity().table(),
        policy.entity().idColumn(),
        policy.column(),
        policy.period().toString(),
        policy.strategy().configName(),
        policy.hasFilter() ? policy.filter().clause() : null,
        policy.batchLimit());
  }
}
