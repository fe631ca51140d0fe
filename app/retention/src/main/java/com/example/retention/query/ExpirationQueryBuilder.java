/*
 * Where: Expiration predicate
 * What: Turns a policy and a point in time into the query that selects expired rows
 * Why: The age boundary (strict less-than) and filter composition live in one place
 */
package com.example.retention.query;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.retention.policy.RetentionPolicy;
import com.example.retention.repository.RetentionRepository;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ExpirationQueryBuilder {

  public static final String THRESHOLD_PARAMETER = "retentionThreshold";
  public static final String CURSOR_PARAMETER = "retentionCursor";
  public static final String LIMIT_PARAMETER = "retentionLimit";
  public static final String IDS_PARAMETER = "retentionIds";

  /** Bind names the engine adds itself; filters may not reuse them. */
  public static final Set<String> RESERVED_PARAMETERS =
      Set.of(THRESHOLD_PARAMETER, CURSOR_PARAMETER, LIMIT_PARAMETER, IDS_PARAMETER);

  private final RetentionRepository repository;

  public ExpirationQuery expiredQuery(RetentionPolicy policy, Instant now) {
    final Instant threshold = now.minus(policy.period());
    final Map<String, Object> parameters = new HashMap<>();
    parameters.put(THRESHOLD_PARAMETER, toTimestamp(threshold));

    String where = policy.column() + " < :" + THRESHOLD_PARAMETER;
    if (policy.hasFilter()) {
      where = "(" + where + ") AND (" + policy.filter().clause() + ")";
      parameters.putAll(policy.filter().parameters());
    }
    return new ExpirationQuery(
        policy.entity().table(), policy.entity().idColumn(), where, parameters, threshold);
  }

  /** Every row matching the expiration query, ignoring the batch limit. */
  public long expiredCount(RetentionPolicy policy, Instant now) {
    return repository.count(expiredQuery(policy, now));
  }
}
