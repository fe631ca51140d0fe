/*
 * Where: Retention admin API
 * What: Error codes returned in ApiErrorResponse
 * Why: Callers can tell an unknown entity type from a broken archive table without parsing text
 */
package com.example.retention.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  POLICY_NOT_FOUND,
  ARCHIVE_DESTINATION_INVALID
}
