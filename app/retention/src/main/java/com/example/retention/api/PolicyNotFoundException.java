package com.example.retention.api;

public class PolicyNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public PolicyNotFoundException(String entityType) {
    super("no retention policy registered for entity type " + entityType);
  }
}
