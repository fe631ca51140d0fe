/*
 * Where: Retention policy model
 * What: The minimal view of a host entity the engine needs: name, table, identifier, guard
 * Why: Table and column names are spliced into SQL, so they are checked once here
 */
package com.example.retention.policy;

import java.util.Objects;
import java.util.regex.Pattern;

public record EntityDescriptor(
    String entityType, String table, String idColumn, RowRemovalGuard removalGuard) {

  public static final String DEFAULT_ID_COLUMN = "id";
  public static final String ARCHIVE_SUFFIX = "_archive";

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern QUALIFIED_IDENTIFIER =
      Pattern.compile("([A-Za-z_][A-Za-z0-9_]*\\.)?[A-Za-z_][A-Za-z0-9_]*");

  public EntityDescriptor {
    if (entityType == null || entityType.isBlank()) {
      throw new RetentionConfigurationException("entityType must not be blank");
    }
    requireTable(table);
    idColumn = idColumn == null ? DEFAULT_ID_COLUMN : idColumn;
    requireIdentifier(idColumn, "idColumn");
    removalGuard = removalGuard == null ? RowRemovalGuard.acceptAll() : removalGuard;
  }

  public static EntityDescriptor of(String entityType, String table) {
    return new EntityDescriptor(entityType, table, DEFAULT_ID_COLUMN, null);
  }

  public EntityDescriptor withIdColumn(String column) {
    return new EntityDescriptor(entityType, table, column, removalGuard);
  }

  public EntityDescriptor withRemovalGuard(RowRemovalGuard guard) {
    Objects.requireNonNull(guard, "guard");
    return new EntityDescriptor(entityType, table, idColumn, guard);
  }

  /** Sibling table that receives archived rows, e.g. {@code audit_events_archive}. */
  public String archiveTable() {
    return table + ARCHIVE_SUFFIX;
  }

  public static void requireIdentifier(String value, String name) {
    if (value == null || !IDENTIFIER.matcher(value).matches()) {
      throw new RetentionConfigurationException(name + " is not a valid SQL identifier: " + value);
    }
  }

  private static void requireTable(String value) {
    if (value == null || !QUALIFIED_IDENTIFIER.matcher(value).matches()) {
      throw new RetentionConfigurationException("table is not a valid SQL identifier: " + value);
    }
  }
}
