/*
 * Where: Retention locking
 * What: Non-blocking, entity-type-scoped mutual exclusion around one cleanup
 * Why: Two workers cleaning the same table would double-count and fight over rows
 */
package com.example.retention.lock;

import com.example.retention.policy.EntityDescriptor;
import java.util.Optional;
import java.util.function.Supplier;

public interface RetentionLockCoordinator {

  /**
   * Runs {@code body} while holding the entity type's lock.
   *
   * <p>Acquisition is tried exactly once and never waits. The lock is released on every exit
   * path of {@code body}, including exceptions, which propagate unchanged.
   *
   * @return the body's result, or empty when the lock is held elsewhere
   */
  <T> Optional<T> tryWithLock(EntityDescriptor entity, Supplier<T> body);

  LockGuarantee guarantee();
}
