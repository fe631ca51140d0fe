/*
 * Where: Retention application configuration binding
 * What: Schedule of the backlog purge chain
 * Why: Keep the purge cadence and re-trigger delay tunable per environment
 */
package com.example.retention.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "retention.purge")
@Validated
public record RetentionPurgeProperties(
    boolean enabled, @NotNull Duration cleanupInterval, @NotNull Duration retriggerDelay) {

  @AssertTrue(message = "retention.purge.cleanup-interval must be positive")
  public boolean isCleanupIntervalPositive() {
    // @Positive does not apply to Duration; null is reported by @NotNull.
    return cleanupInterval != null && !cleanupInterval.isZero() && !cleanupInterval.isNegative();
  }

  @AssertTrue(message = "retention.purge.retrigger-delay must not be negative")
  public boolean isRetriggerDelayNonNegative() {
    return retriggerDelay != null && !retriggerDelay.isNegative();
  }
}
