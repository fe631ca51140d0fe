/*
 * Where: Retention locking
 * What: Base class for database locks that belong to a session (connection)
 * Why: Lock and unlock must run on one connection; a pooled JdbcTemplate does not promise that
 */
package com.example.retention.lock;

import com.example.retention.policy.EntityDescriptor;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;
import java.util.function.Supplier;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

public abstract class SessionLockCoordinator implements RetentionLockCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(SessionLockCoordinator.class);

  private final DataSource dataSource;

  protected SessionLockCoordinator(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  @Override
  public <T> Optional<T> tryWithLock(EntityDescriptor entity, Supplier<T> body) {
    // The lock connection is held open for the whole body; closing it would drop the lock.
    try (Connection connection = dataSource.getConnection()) {
      final JdbcOperations session =
          new JdbcTemplate(new SingleConnectionDataSource(connection, true));
      if (!tryAcquire(session, entity)) {
        logger.debug("retention lock busy entityType={}", entity.entityType());
        return Optional.empty();
      }
      final T result;
      try {
        result = body.get();
      } catch (RuntimeException | Error ex) {
        releaseAfterFailure(session, entity, ex);
        throw ex;
      }
      release(session, entity);
      return Optional.of(result);
    } catch (SQLException ex) {
      throw new CannotGetJdbcConnectionException("failed to open retention lock session", ex);
    }
  }

  @Override
  public LockGuarantee guarantee() {
    return LockGuarantee.CROSS_PROCESS;
  }

  /** Single, non-waiting attempt. */
  protected abstract boolean tryAcquire(JdbcOperations session, EntityDescriptor entity);

  protected abstract void release(JdbcOperations session, EntityDescriptor entity);

  private void releaseAfterFailure(
      JdbcOperations session, EntityDescriptor entity, Throwable failure) {
    try {
      release(session, entity);
    } catch (RuntimeException releaseFailure) {
      failure.addSuppressed(releaseFailure);
    }
  }
}
