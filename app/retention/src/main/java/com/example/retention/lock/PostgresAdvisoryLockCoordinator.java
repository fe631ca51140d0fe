/*
 * Where: Retention locking (PostgreSQL)
 * What: Session-level advisory locks keyed by a 31-bit hash of the table name
 * Why: pg_try_advisory_lock returns immediately, so a busy table is skipped instead of awaited
 */
package com.example.retention.lock;

import com.example.retention.policy.EntityDescriptor;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcOperations;

public class PostgresAdvisoryLockCoordinator extends SessionLockCoordinator {

  private static final Logger logger =
      LoggerFactory.getLogger(PostgresAdvisoryLockCoordinator.class);

  private final RetentionLockKeyGenerator keyGenerator;

  public PostgresAdvisoryLockCoordinator(
      DataSource dataSource, RetentionLockKeyGenerator keyGenerator) {
    super(dataSource);
    this.keyGenerator = keyGenerator;
  }

  @Override
  protected boolean tryAcquire(JdbcOperations session, EntityDescriptor entity) {
    final Boolean locked =
        session.queryForObject(
            "SELECT pg_try_advisory_lock(?)", Boolean.class, keyGenerator.generate(entity.table()));
    return Boolean.TRUE.equals(locked);
  }

  @Override
  protected void release(JdbcOperations session, EntityDescriptor entity) {
    final int key = keyGenerator.generate(entity.table());
    final Boolean released =
        session.queryForObject("SELECT pg_advisory_unlock(?)", Boolean.class, key);
    if (!Boolean.TRUE.equals(released)) {
      logger.warn(
          "retention advisory lock was not held at release entityType={} key={}",
          entity.entityType(),
          key);
    }
  }
}
