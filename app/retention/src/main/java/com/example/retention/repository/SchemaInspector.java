/*
 * Where: Retention data access
 * What: Answers schema questions (does this table / column exist) through JDBC metadata
 * Why: Policies are validated against the live schema before they are stored
 */
package com.example.retention.repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class SchemaInspector {

  private final JdbcOperations jdbcOperations;

  public SchemaInspector(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcOperations = jdbcTemplate.getJdbcOperations();
  }

  public boolean tableExists(String table) {
    final Boolean exists =
        jdbcOperations.execute(
            (ConnectionCallback<Boolean>)
                connection -> {
                  final DatabaseMetaData metaData = connection.getMetaData();
                  for (String schema : schemaCandidates(connection, table)) {
                    for (String name : nameCandidates(metaData, tableName(table))) {
                      try (ResultSet rs =
                          metaData.getTables(connection.getCatalog(), schema, name, null)) {
                        if (rs.next()) {
                          return true;
                        }
                      }
                    }
                  }
                  return false;
                });
    return Boolean.TRUE.equals(exists);
  }

  public boolean columnExists(String table, String column) {
    return columnNames(table).contains(column.toLowerCase(Locale.ROOT));
  }

  /** Lower-cased column names of the table, empty when the table does not exist. */
  public Set<String> columnNames(String table) {
    final Set<String> columns =
        jdbcOperations.execute(
            (ConnectionCallback<Set<String>>)
                connection -> {
                  final DatabaseMetaData metaData = connection.getMetaData();
                  for (String schema : schemaCandidates(connection, table)) {
                    for (String name : nameCandidates(metaData, tableName(table))) {
                      final Set<String> found = readColumns(metaData, connection, schema, name);
                      if (!found.isEmpty()) {
                        return found;
                      }
                    }
                  }
                  return Set.of();
                });
    return columns == null ? Set.of() : columns;
  }

  public String databaseProductName() {
    return jdbcOperations.execute(
        (ConnectionCallback<String>)
            connection -> connection.getMetaData().getDatabaseProductName());
  }

  private Set<String> readColumns(
      DatabaseMetaData metaData, Connection connection, String schema, String name)
      throws SQLException {
    final Set<String> columns = new LinkedHashSet<>();
    try (ResultSet rs = metaData.getColumns(connection.getCatalog(), schema, name, null)) {
      while (rs.next()) {
        columns.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
      }
    }
    return columns;
  }

  // Unquoted identifiers fold to lower case in PostgreSQL and to upper case in H2.
  private List<String> nameCandidates(DatabaseMetaData metaData, String name) throws SQLException {
    final String escape = metaData.getSearchStringEscape();
    final Set<String> candidates = new LinkedHashSet<>();
    for (String variant :
        List.of(name, name.toLowerCase(Locale.ROOT), name.toUpperCase(Locale.ROOT))) {
      candidates.add(escapePattern(variant, escape));
    }
    return List.copyOf(candidates);
  }

  private List<String> schemaCandidates(Connection connection, String table) throws SQLException {
    final int dot = table.indexOf('.');
    final String schema = dot < 0 ? connection.getSchema() : table.substring(0, dot);
    if (schema == null) {
      // MySQL has no schemas below the catalog; a null pattern means "do not filter".
      return Collections.singletonList(null);
    }
    final Set<String> candidates = new LinkedHashSet<>();
    candidates.add(schema);
    candidates.add(schema.toLowerCase(Locale.ROOT));
    candidates.add(schema.toUpperCase(Locale.ROOT));
    return List.copyOf(candidates);
  }

  private String tableName(String table) {
    final int dot = table.indexOf('.');
    return dot < 0 ? table : table.substring(dot + 1);
  }

  private String escapePattern(String value, String escape) {
    if (escape == null || escape.isEmpty()) {
      return value;
    }
    return value.replace("_", escape + "_").replace("%", escape + "%");
  }
}
