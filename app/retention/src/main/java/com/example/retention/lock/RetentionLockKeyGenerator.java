/*
 * Where: Retention locking
 * What: Derives advisory lock keys and names from a table name
 * Why: Every process must compute the same key for the same table without coordination
 */
package com.example.retention.lock;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

public class RetentionLockKeyGenerator {

  // MySQL rejects lock names longer than 64 characters.
  static final int MAX_LOCK_NAME_LENGTH = 64;
  private static final int NON_NEGATIVE_31_BIT = 0x7FFFFFFF;

  private final String namespace;

  public RetentionLockKeyGenerator(String namespace) {
    this.namespace = namespace;
  }

  /**
   * 31-bit non-negative CRC32 of {@code "<namespace>:<table>"}. Collisions are accepted: a false
   * conflict only postpones a cleanup.
   */
  public int generate(String table) {
    final CRC32 crc = new CRC32();
    crc.update((namespace + ":" + table).getBytes(StandardCharsets.UTF_8));
    return (int) (crc.getValue() & NON_NEGATIVE_31_BIT);
  }

  /** Named-lock form, {@code "<namespace>_<table>"}, hashed when it would be too long. */
  public String lockName(String table) {
    final String name = namespace + "_" + table;
    if (name.length() <= MAX_LOCK_NAME_LENGTH) {
      return name;
    }
    return namespace + "_" + Integer.toHexString(generate(table));
  }
}
