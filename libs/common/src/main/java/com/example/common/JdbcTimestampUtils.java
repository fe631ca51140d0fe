/*
 * Where: Shared JDBC helpers
 * What: Converts Instant to java.sql.Timestamp at the JDBC boundary
 * Why: Drivers disagree on how to infer a bind type for Instant, so binds stay explicit
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is always UTC; Timestamp.from keeps the same point on the time line.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }
}
