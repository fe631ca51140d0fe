/*
 * Where: Retention data access
 * What: Counts, pages, deletes and archives rows selected by an ExpirationQuery
 * Why: Every strategy talks to the store through these few statements
 */
package com.example.retention.repository;

import com.example.retention.policy.EntityDescriptor;
import com.example.retention.query.ExpirationQuery;
import com.example.retention.query.ExpirationQueryBuilder;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RetentionRepository {

  // Keeps IN lists well below driver bind limits (PostgreSQL allows 65535 binds per statement).
  static final int DELETE_IDS_PER_STATEMENT = 1_000;

  public static final String ARCHIVED_AT_COLUMN = "archived_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public RetentionRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs EI_EXPOSE_REP2: keep our own wrapper instead of the shared reference.
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public long count(ExpirationQuery query) {
    final String sql = "SELECT COUNT(*) FROM " + query.table() + " WHERE " + query.whereClause();
    final Long count = jdbcTemplate.queryForObject(sql, query.parameterSource(), Long.class);
    return count == null ? 0 : count;
  }

  /**
   * Next page of expired rows in identifier order.
   *
   * @param afterId keyset cursor; {@code null} starts from the lowest identifier
   */
  public List<Map<String, Object>> fetchBatch(ExpirationQuery query, Object afterId, int size) {
    final MapSqlParameterSource params = query.parameterSource();
    final StringBuilder sql =
        new StringBuilder("SELECT * FROM ")
            .append(query.table())
            .append(" WHERE (")
            .append(query.whereClause())
            .append(')');
    if (afterId != null) {
      sql.append(" AND ")
          .append(query.idColumn())
          .append(" > :")
          .append(ExpirationQueryBuilder.CURSOR_PARAMETER);
      params.addValue(ExpirationQueryBuilder.CURSOR_PARAMETER, afterId);
    }
    sql.append(" ORDER BY ")
        .append(query.idColumn())
        .append(" LIMIT :")
        .append(ExpirationQueryBuilder.LIMIT_PARAMETER);
    params.addValue(ExpirationQueryBuilder.LIMIT_PARAMETER, size);
    return jdbcTemplate.queryForList(sql.toString(), params);
  }

  public List<Object> fetchIds(ExpirationQuery query, int limit) {
    final String sql =
        "SELECT "
            + query.idColumn()
            + " FROM "
            + query.table()
            + " WHERE "
            + query.whereClause()
            + " ORDER BY "
            + query.idColumn()
            + " LIMIT :"
            + ExpirationQueryBuilder.LIMIT_PARAMETER;
    final MapSqlParameterSource params =
        query.parameterSource().addValue(ExpirationQueryBuilder.LIMIT_PARAMETER, limit);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getObject(1));
  }

  public int deleteById(EntityDescriptor entity, Object id) {
    final String sql =
        "DELETE FROM " + entity.table() + " WHERE " + entity.idColumn() + " = :id";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("id", id));
  }

  /**
   * Deletes the given identifiers. Large sets are split into several IN lists; callers that need
   * all-or-nothing run this inside a transaction.
   */
  public int deleteByIds(EntityDescriptor entity, Collection<?> ids) {
    if (ids.isEmpty()) {
      return 0;
    }
    final String sql =
        "DELETE FROM "
            + entity.table()
            + " WHERE "
            + entity.idColumn()
            + " IN (:"
            + ExpirationQueryBuilder.IDS_PARAMETER
            + ")";
    int deleted = 0;
    for (List<?> partition : Lists.partition(new ArrayList<>(ids), DELETE_IDS_PER_STATEMENT)) {
      final MapSqlParameterSource params =
          new MapSqlParameterSource().addValue(ExpirationQueryBuilder.IDS_PARAMETER, partition);
      deleted += jdbcTemplate.update(sql, params);
    }
    return deleted;
  }

  /**
   * One multi-row INSERT into the archive table. {@code archived_at} is assigned by the database
   * and is not part of {@code columns}.
   */
  public int insertArchiveRows(
      String archiveTable, List<String> columns, List<Map<String, Object>> rows) {
    if (rows.isEmpty()) {
      return 0;
    }
    final List<String> targetColumns = new ArrayList<>(columns);
    targetColumns.add(ARCHIVED_AT_COLUMN);
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final StringBuilder sql =
        new StringBuilder("INSERT INTO ")
            .append(archiveTable)
            .append(" (")
            .append(String.join(", ", targetColumns))
            .append(") VALUES ");
    for (int r = 0; r < rows.size(); r++) {
      if (r > 0) {
        sql.append(", ");
      }
      sql.append('(');
      for (int c = 0; c < columns.size(); c++) {
        final String name = "r" + r + "c" + c;
        sql.append(':').append(name).append(", ");
        params.addValue(name, rows.get(r).get(columns.get(c)));
      }
      sql.append("CURRENT_TIMESTAMP)");
    }
    return jdbcTemplate.update(sql.toString(), params);
  }
}
