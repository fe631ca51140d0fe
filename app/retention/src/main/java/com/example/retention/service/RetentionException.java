/*
 * Where: Retention service layer
 * What: Base type for failures raised while a cleanup runs
 * Why: Lets the purge round and the admin API treat engine failures uniformly
 */
package com.example.retention.service;

public class RetentionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public RetentionException(String message) {
    super(message);
  }

  public RetentionException(String message, Throwable cause) {
    super(message, cause);
  }
}
