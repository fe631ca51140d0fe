package com.example.retention.service;

/**
 * Hands the next purge round to whatever runs background work in the host.
 *
 * <p>Implementations must not run the round on the caller's stack; the current round finishes
 * (and releases its locks) before the next one starts.
 */
@FunctionalInterface
public interface PurgeRoundTrigger {

  void schedule(int round, Runnable roundTask);
}
