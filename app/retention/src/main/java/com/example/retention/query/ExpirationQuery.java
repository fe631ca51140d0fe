/*
 * Where: Expiration predicate
 * What: A store query selecting the expired rows of one table
 * Why: Count, fetch and delete all share the same WHERE clause and binds
 */
package com.example.retention.query;

import java.time.Instant;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

public record ExpirationQuery(
    String table,
    String idColumn,
    String whereClause,
    Map<String, Object> parameters,
    Instant threshold) {

  public ExpirationQuery {
    parameters = Map.copyOf(parameters);
  }

  /** Fresh parameter source; callers add their own paging binds to it. */
  public MapSqlParameterSource parameterSource() {
    return new MapSqlParameterSource(parameters);
  }
}
