package com.example.retention.config;

public enum LockMode {
  /** Pick from the JDBC product name, falling back to {@link #IN_PROCESS}. */
  AUTO,
  POSTGRES,
  MYSQL,
  IN_PROCESS
}
