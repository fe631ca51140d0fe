package com.example.retention.query;

import static com.example.common.JdbcTimestampUtils.toTimestamp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.example.retention.policy.CleanupStrategy;
import com.example.retention.policy.EntityDescriptor;
import com.example.retention.policy.RetentionFilter;
import com.example.retention.policy.RetentionPolicy;
import com.example.retention.repository.RetentionRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExpirationQueryBuilderTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final EntityDescriptor DELIVERY_LOG =
      EntityDescriptor.of("DeliveryLog", "delivery_logs");

  @Mock private RetentionRepository repository;

  @Test
  void selectsRowsStrictlyOlderThanThreshold() {
    final RetentionPolicy policy =
        new RetentionPolicy(
            DELIVERY_LOG, Duration.ofDays(30), CleanupStrategy.DESTROY, "created_at", null, 100);

    final ExpirationQuery query =
        new ExpirationQueryBuilder(repository).expiredQuery(policy, FIXED_NOW);

    assertThat(query.table()).isEqualTo("delivery_logs");
    assertThat(query.idColumn()).isEqualTo("id");
    assertThat(query.whereClause()).isEqualTo("created_at < :retentionThreshold");
    assertThat(query.threshold()).isEqualTo(Instant.parse("2025-12-18T00:00:00Z"));
    assertThat(query.parameters())
        .containsEntry("retentionThreshold", toTimestamp(query.threshold()));
  }

  @Test
  void andsFilterWithAgePredicate() {
    final RetentionFilter filter =
        RetentionFilter.of("status = :status", Map.<String, Object>of("status", "DELIVERED"));
    final RetentionPolicy policy =
        new RetentionPolicy(
            DELIVERY_LOG,
            Duration.ofHours(1),
            CleanupStrategy.DELETE_ALL,
            "created_at",
            filter,
            100);

    final ExpirationQuery query =
        new ExpirationQueryBuilder(repository).expiredQuery(policy, FIXED_NOW);

    assertThat(query.whereClause())
        .isEqualTo("(created_at < :retentionThreshold) AND (status = :status)");
    assertThat(query.parameters()).containsEntry("status", "DELIVERED").hasSize(2);
  }

  @Test
  void expiredCountIgnoresBatchLimit() {
    final RetentionPolicy policy =
        new RetentionPolicy(
            DELIVERY_LOG, Duration.ofDays(1), CleanupStrategy.DESTROY, "created_at", null, 2);
    when(repository.count(any(ExpirationQuery.class))).thenReturn(5L);

    assertThat(new ExpirationQueryBuilder(repository).expiredCount(policy, FIXED_NOW)).isEqualTo(5);
  }
}
