package com.example.retention.service;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SkipReason {
  /** Another invocation holds the entity type's lock. */
  @JsonProperty("locked")
  LOCKED
}
