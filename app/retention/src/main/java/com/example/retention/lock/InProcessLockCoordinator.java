/*
 * Where: Retention locking (fallback)
 * What: In-memory lock table keyed by entity type, for stores without advisory locks
 * Why: Still stops overlapping cleanups inside one JVM; says so through guarantee()
 */
package com.example.retention.lock;

import com.example.retention.policy.EntityDescriptor;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

public class InProcessLockCoordinator implements RetentionLockCoordinator {

  // Not reentrant: a nested cleanup of the same entity type is skipped like any other.
  private final Set<String> held = ConcurrentHashMap.newKeySet();

  @Override
  public <T> Optional<T> tryWithLock(EntityDescriptor entity, Supplier<T> body) {
    final String key = entity.entityType();
    if (!held.add(key)) {
      return Optional.empty();
    }
    try {
      return Optional.of(body.get());
    } finally {
      held.remove(key);
    }
  }

  @Override
  public LockGuarantee guarantee() {
    return LockGuarantee.PROCESS_LOCAL;
  }

  public boolean isHeld(String entityType) {
    return held.contains(entityType);
  }
}
