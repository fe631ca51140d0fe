package com.example.retention.service;

public enum PurgeOutcome {
  /** No entity type reported remaining work; the chain ends. */
  DRAINED,
  /** Work remains and the next round has been handed to the trigger. */
  RETRIGGERED,
  /** Work remains but the round limit was reached; the next scheduler tick starts over. */
  CAPPED
}
