/*
 * Where: Retention policy registration
 * What: Raised when a policy cannot be registered as declared
 * Why: A policy is either fully valid or absent; callers see the first failing check
 */
package com.example.retention.policy;

public class RetentionConfigurationException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public RetentionConfigurationException(String message) {
    super(message);
  }
}
