package com.example.retention.lock;

/** What a {@link RetentionLockCoordinator} actually protects against. */
public enum LockGuarantee {
  /** Held in the database; excludes every process that shares the store. */
  CROSS_PROCESS,
  /** Held in this JVM only; two service instances can still clean the same table at once. */
  PROCESS_LOCAL
}
