/*
 * Where: Retention policy model
 * What: Entity-level veto consulted by the destroy strategy before each row is removed
 * Why: Some rows must survive their age (legal hold, open disputes) and are counted as failed
 */
package com.example.retention.policy;

import java.util.Map;

@FunctionalInterface
public interface RowRemovalGuard {

  /**
   * Decides whether the given row may be removed.
   *
   * @param row column values of the loaded row, keyed case-insensitively by column name
   * @return {@code false} to decline; the row stays in place and counts as failed
   */
  boolean allowsRemoval(Map<String, Object> row);

  static RowRemovalGuard acceptAll() {
    return row -> true;
  }
}
