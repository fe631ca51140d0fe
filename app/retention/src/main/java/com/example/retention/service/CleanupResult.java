/*
 * Where: Retention service layer
 * What: Outcome of one cleanup invocation for one entity type
 * Why: The purge round decides on re-triggering from remaining; the admin API returns it as JSON
 */
package com.example.retention.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Field presence is part of the contract:
 *
 * <ul>
 *   <li>{@code failed} only for the destroy strategy;
 *   <li>{@code remaining} only when a strategy actually ran (not for dry runs or skips);
 *   <li>{@code skipped}/{@code reason} only when the lock was busy.
 * </ul>
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CleanupResult(
    long count,
    Long failed,
    Boolean remaining,
    boolean dryRun,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean skipped,
    SkipReason reason) {

  public static CleanupResult dryRun(long totalExpired) {
    return new CleanupResult(totalExpired, null, null, true, false, null);
  }

  public static CleanupResult lockSkipped() {
    return new CleanupResult(0, null, null, false, true, SkipReason.LOCKED);
  }

  public static CleanupResult destroyed(long count, long failed, long totalExpired) {
    return new CleanupResult(count, failed, totalExpired > count, false, false, null);
  }

  /** Delete-all and archive results; they carry no failure count. */
  public static CleanupResult removed(long count, long totalExpired) {
    return new CleanupResult(count, null, totalExpired > count, false, false, null);
  }

  @JsonIgnore
  public boolean hasRemaining() {
    return Boolean.TRUE.equals(remaining);
  }
}
