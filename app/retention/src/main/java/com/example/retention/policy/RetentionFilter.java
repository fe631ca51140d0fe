/*
 * Where: Retention policy model
 * What: Extra SQL restriction AND-ed with the age predicate
 * Why: Lets a policy expire only a subset of old rows (e.g. delivered notifications)
 */
package com.example.retention.policy;

import java.util.Map;
import java.util.Objects;

public record RetentionFilter(String clause, Map<String, Object> parameters) {

  public RetentionFilter {
    Objects.requireNonNull(clause, "clause");
    if (clause.isBlank()) {
      throw new RetentionConfigurationException("filter clause must not be blank");
    }
    if (parameters == null) {
      parameters = Map.of();
    } else {
      parameters.forEach(
          (name, value) -> {
            if (name == null || value == null) {
              throw new RetentionConfigurationException(
                  "filter parameter " + name + " must have a value");
            }
          });
      parameters = Map.copyOf(parameters);
    }
  }

  public static RetentionFilter of(String clause) {
    return new RetentionFilter(clause, Map.of());
  }

  public static RetentionFilter of(String clause, Map<String, Object> parameters) {
    return new RetentionFilter(clause, parameters);
  }
}
