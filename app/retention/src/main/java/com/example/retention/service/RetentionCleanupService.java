/*
 * Where: Retention cleanup executor
 * What: Runs one cleanup for one entity type under its lock: count, dry-run, then the strategy
 * Why: Hosts and the backlog purge share a single entry point with one result shape
 */
package com.example.retention.service;

import com.example.retention.lock.RetentionLockCoordinator;
import com.example.retention.policy.EntityDescriptor;
import com.example.retention.policy.RetentionPolicy;
import com.example.retention.policy.RetentionPolicyRegistry;
import com.example.retention.query.ExpirationQuery;
import com.example.retention.query.ExpirationQueryBuilder;
import com.example.retention.repository.RetentionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class RetentionCleanupService {

  private static final Logger logger = LoggerFactory.getLogger(RetentionCleanupService.class);

  static final int DESTROY_PAGE_SIZE = 1_000;

  private final RetentionPolicyRegistry registry;
  private final ExpirationQueryBuilder queryBuilder;
  private final RetentionRepository repository;
  private final RetentionArchiveService archiveService;
  private final RetentionLockCoordinator lockCoordinator;
  private final RetentionMetrics metrics;
  private final Clock clock;
  private final TransactionTemplate transactionTemplate;

  public RetentionCleanupService(
      RetentionPolicyRegistry registry,
      ExpirationQueryBuilder queryBuilder,
      RetentionRepository repository,
      RetentionArchiveService archiveService,
      RetentionLockCoordinator lockCoordinator,
      RetentionMetrics metrics,
      Clock clock,
      PlatformTransactionManager transactionManager) {
    this.registry = registry;
    this.queryBuilder = queryBuilder;
    this.repository = repository;
    this.archiveService = archiveService;
    this.lockCoordinator = lockCoordinator;
    this.metrics = metrics;
    this.clock = clock;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /**
   * Cleans up the expired rows of one entity type.
   *
   * <p>When another worker holds the entity type's lock nothing is queried and a skipped result
   * is returned. Strategy failures propagate after the lock has been released.
   *
   * @return empty when no policy is registered for {@code entityType}
   */
  public Optional<CleanupResult> cleanup(String entityType, boolean dryRun) {
    final Optional<RetentionPolicy> policy = registry.lookup(entityType);
    if (policy.isEmpty()) {
      logger.debug("retention cleanup without policy entityType={}", entityType);
      return Optional.empty();
    }
    return Optional.of(cleanup(policy.get(), dryRun));
  }

  public CleanupResult cleanup(RetentionPolicy policy, boolean dryRun) {
    final Optional<CleanupResult> result =
        lockCoordinator.tryWithLock(policy.entity(), () -> cleanupLocked(policy, dryRun));
    if (result.isEmpty()) {
      logger.info(
          "retention cleanup skipped entityType={} reason={}",
          policy.entityType(),
          SkipReason.LOCKED);
      metrics.recordSkipped(policy.entityType());
      return CleanupResult.lockSkipped();
    }
    return result.get();
  }

  private CleanupResult cleanupLocked(RetentionPolicy policy, boolean dryRun) {
    // One threshold for the whole invocation; row membership is re-read page by page.
    final Instant now = clock.instant();
    final ExpirationQuery query = queryBuilder.expiredQuery(policy, now);
    logger.info(
        "retention cleanup started entityType={} strategy={} threshold={} batchLimit={} dryRun={}",
        policy.entityType(),
        policy.strategy(),
        query.threshold(),
        policy.batchLimit(),
        dryRun);

    final CleanupResult result;
    try {
      final long totalExpired = repository.count(query);
      if (dryRun) {
        result = CleanupResult.dryRun(totalExpired);
      } else {
        result =
            switch (policy.strategy()) {
              case DESTROY -> destroy(policy, query, totalExpired);
              case DELETE_ALL ->
                  CleanupResult.removed(deleteAll(policy, query), totalExpired);
              case ARCHIVE ->
                  CleanupResult.removed(archiveService.archive(policy, query), totalExpired);
            };
      }
    } catch (RuntimeException ex) {
      metrics.recordError(policy.entityType());
      throw ex;
    }

    metrics.recordCleanup(policy.entityType(), result);
    logger.info(
        "retention cleanup completed entityType={} count={} failed={} remaining={} dryRun={}",
        policy.entityType(),
        result.count(),
        result.failed(),
        result.remaining(),
        result.dryRun());
    return result;
  }

  private CleanupResult destroy(RetentionPolicy policy, ExpirationQuery query, long totalExpired) {
    final EntityDescriptor entity = policy.entity();
    final int batchLimit = policy.batchLimit();
    final int pageSize = Math.min(DESTROY_PAGE_SIZE, batchLimit);
    long count = 0;
    long failed = 0;
    Object cursor = null;
    while (count + failed < batchLimit) {
      final List<Map<String, Object>> page = repository.fetchBatch(query, cursor, pageSize);
      for (Map<String, Object> row : page) {
        if (count + failed >= batchLimit) {
          break;
        }
        final Object id = row.get(entity.idColumn());
        cursor = id;
        if (!entity.removalGuard().allowsRemoval(row)) {
          logger.debug(
              "retention destroy declined by guard entityType={} id={}", entity.entityType(), id);
          failed++;
        } else if (repository.deleteById(entity, id) == 0) {
          failed++;
        } else {
          count++;
        }
      }
      if (page.size() < pageSize) {
        break;
      }
    }
    return CleanupResult.destroyed(count, failed, totalExpired);
  }

  private long deleteAll(RetentionPolicy policy, ExpirationQuery query) {
    final List<Object> ids = repository.fetchIds(query, policy.batchLimit());
    if (ids.isEmpty()) {
      return 0;
    }
    final Integer deleted =
        transactionTemplate.execute(status -> repository.deleteByIds(policy.entity(), ids));
    return deleted == null ? 0 : deleted;
  }
}
