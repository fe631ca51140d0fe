package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private static final int SHORT_ID_LENGTH = 12;

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** Compact id for log correlation where a full UUID is noise, e.g. a purge run. */
  public static String newShortId() {
    return newTraceId().replace("-", "").substring(0, SHORT_ID_LENGTH);
  }
}
