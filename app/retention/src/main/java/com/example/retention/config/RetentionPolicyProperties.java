/*
 * Where: Retention application configuration binding
 * What: Policies declared in application.yml under retention.policies
 * Why: Operators add retention to a table without a code change
 */
package com.example.retention.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "retention")
@Validated
public record RetentionPolicyProperties(@Valid List<PolicyDefinition> policies) {

  public RetentionPolicyProperties {
    policies = policies == null ? List.of() : List.copyOf(policies);
  }

  /**
   * One declared policy. Everything except the entity type and table is optional here; the
   * registry applies defaults and rejects invalid combinations.
   */
  public record PolicyDefinition(
      @NotBlank String entityType,
      @NotBlank String table,
      String idColumn,
      String column,
      Duration period,
      String strategy,
      String filter,
      Integer batchLimit) {}
}
