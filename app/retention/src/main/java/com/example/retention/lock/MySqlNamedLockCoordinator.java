/*
 * Where: Retention locking (MySQL / MariaDB)
 * What: GET_LOCK with a zero timeout, released with RELEASE_LOCK
 * Why: MySQL has no integer advisory locks; named locks give the same try-once semantics
 */
package com.example.retention.lock;

import com.example.retention.policy.EntityDescriptor;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcOperations;

public class MySqlNamedLockCoordinator extends SessionLockCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(MySqlNamedLockCoordinator.class);
  private static final int ACQUIRED = 1;

  private final RetentionLockKeyGenerator keyGenerator;

  public MySqlNamedLockCoordinator(DataSource dataSource, RetentionLockKeyGenerator keyGenerator) {
    super(dataSource);
    this.keyGenerator = keyGenerator;
  }

  @Override
  protected boolean tryAcquire(JdbcOperations session, EntityDescriptor entity) {
    // GET_LOCK returns 1 on success, 0 on timeout and NULL on error; all but 1 mean "skip".
    final Integer result =
        session.queryForObject(
            "SELECT GET_LOCK(?, 0)", Integer.class, keyGenerator.lockName(entity.table()));
    return result != null && result == ACQUIRED;
  }

  @Override
  protected void release(JdbcOperations session, EntityDescriptor entity) {
    final String name = keyGenerator.lockName(entity.table());
    final Integer result = session.queryForObject("SELECT RELEASE_LOCK(?)", Integer.class, name);
    if (result == null || result != ACQUIRED) {
      logger.warn(
          "retention named lock was not held at release entityType={} name={}",
          entity.entityType(),
          name);
    }
  }
}
