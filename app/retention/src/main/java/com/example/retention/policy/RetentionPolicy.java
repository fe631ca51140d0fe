/*
 * Where: Retention policy model
 * What: A validated, immutable retention rule for one entity type
 * Why: Only RetentionPolicyRegistry creates these, after every check has passed
 */
package com.example.retention.policy;

import java.time.Duration;

public record RetentionPolicy(
    EntityDescriptor entity,
    Duration period,
    CleanupStrategy strategy,
    String column,
    RetentionFilter filter,
    int batchLimit) {

  public static final Duration MINIMUM_PERIOD = Duration.ofHours(1);
  public static final int DEFAULT_BATCH_LIMIT = 10_000;
  public static final String DEFAULT_COLUMN = "created_at";

  public String entityType() {
    return entity.entityType();
  }

  public boolean hasFilter() {
    return filter != null;
  }
}
