/*
 * Where: Retention policy registration
 * What: Holds one validated RetentionPolicy per entity type
 * Why: Replaces class scanning with an explicit, injectable mapping owned by the application
 */
package com.example.retention.policy;

import com.example.retention.query.ExpirationQueryBuilder;
import com.example.retention.repository.SchemaInspector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RetentionPolicyRegistry {

  private static final Logger logger = LoggerFactory.getLogger(RetentionPolicyRegistry.class);

  private final SchemaInspector schemaInspector;

  // Insertion order is kept so that purge rounds log in a stable order; it is not a contract.
  private final Map<String, RetentionPolicy> policies = new LinkedHashMap<>();

  public RetentionPolicy register(
      EntityDescriptor entity,
      Duration period,
      CleanupStrategy strategy,
      String column,
      RetentionFilter filter,
      Integer batchLimit) {
    final String strategyName = strategy == null ? null : strategy.configName();
    return register(entity, period, strategyName, column, filter, batchLimit);
  }

  /**
   * Validates and stores a policy, replacing any previous policy of the same entity type.
   *
   * <p>Checks run in a fixed order: column, strategy, period, batch limit, filter parameters. The
   * first failure throws and nothing is stored.
   *
   * @throws RetentionConfigurationException when any check fails
   */
  public RetentionPolicy register(
      EntityDescriptor entity,
      Duration period,
      String strategyName,
      String column,
      RetentionFilter filter,
      Integer batchLimit) {
    if (entity == null) {
      throw new RetentionConfigurationException("entity must not be null");
    }
    final String resolvedColumn = column == null ? RetentionPolicy.DEFAULT_COLUMN : column;
    requireColumn(entity, resolvedColumn);
    final CleanupStrategy strategy =
        strategyName == null ? CleanupStrategy.DESTROY : CleanupStrategy.fromName(strategyName);
    requirePeriod(period);
    final int resolvedLimit = requireBatchLimit(batchLimit);
    requireFilterParameters(filter);

    final RetentionPolicy policy =
        new RetentionPolicy(entity, period, strategy, resolvedColumn, filter, resolvedLimit);
    final RetentionPolicy previous;
    synchronized (policies) {
      previous = policies.put(entity.entityType(), policy);
    }
    logger.info(
        "retention policy {} entityType={} table={} strategy={} column={} period={} batchLimit={}",
        previous == null ? "registered" : "replaced",
        entity.entityType(),
        entity.table(),
        strategy,
        resolvedColumn,
        period,
        resolvedLimit);
    return policy;
  }

  public Optional<RetentionPolicy> lookup(String entityType) {
    synchronized (policies) {
      return Optional.ofNullable(policies.get(entityType));
    }
  }

  public List<RetentionPolicy> policies() {
    synchronized (policies) {
      return new ArrayList<>(policies.values());
    }
  }

  private void requireColumn(EntityDescriptor entity, String column) {
    final boolean valid =
        column.matches("[A-Za-z_][A-Za-z0-9_]*")
            && schemaInspector.columnExists(entity.table(), column);
    if (!valid) {
      throw new RetentionConfigurationException(
          "Unknown column '" + column + "' for " + entity.table());
    }
  }

  private void requirePeriod(Duration period) {
    if (period == null || period.compareTo(RetentionPolicy.MINIMUM_PERIOD) < 0) {
      throw new RetentionConfigurationException(
          "Retention period must be at least "
              + RetentionPolicy.MINIMUM_PERIOD
              + ", got "
              + period
              + ". A very short period risks accidental mass deletion.");
    }
  }

  private int requireBatchLimit(Integer batchLimit) {
    if (batchLimit == null) {
      return RetentionPolicy.DEFAULT_BATCH_LIMIT;
    }
    if (batchLimit <= 0) {
      throw new RetentionConfigurationException(
          "batch_limit must be a positive integer, got " + batchLimit);
    }
    return batchLimit;
  }

  private void requireFilterParameters(RetentionFilter filter) {
    if (filter == null) {
      return;
    }
    for (String name : filter.parameters().keySet()) {
      if (ExpirationQueryBuilder.RESERVED_PARAMETERS.contains(name)) {
        throw new RetentionConfigurationException(
            "filter parameter '" + name + "' collides with a reserved parameter name");
      }
    }
  }
}
