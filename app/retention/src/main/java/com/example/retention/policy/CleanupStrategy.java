/*
 * Where: Retention policy model
 * What: The three ways an expired row can leave its table
 * Why: Strategy names arrive as strings from configuration and must map to one value
 */
package com.example.retention.policy;

import java.util.Locale;

public enum CleanupStrategy {
  /** Row-by-row removal that honours the entity's {@link RowRemovalGuard}. */
  DESTROY("destroy"),
  /** One bulk delete by identifier; guards are not consulted. */
  DELETE_ALL("delete_all"),
  /** Copy into {@code <table>_archive}, then delete, one transaction per chunk. */
  ARCHIVE("archive");

  private final String configName;

  CleanupStrategy(String configName) {
    this.configName = configName;
  }

  public String configName() {
    return configName;
  }

  public static CleanupStrategy fromName(String name) {
    if (name != null) {
      final String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
      for (CleanupStrategy strategy : values()) {
        if (strategy.configName.equals(normalized)) {
          return strategy;
        }
      }
    }
    throw new RetentionConfigurationException(
        "Unknown strategy '" + name + "'. Must be destroy, delete_all, or archive");
  }
}
