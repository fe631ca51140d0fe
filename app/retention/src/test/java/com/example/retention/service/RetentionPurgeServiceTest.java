/*
 * Where: Retention backlog purge tests
 * What: Verifies round transitions, the round cap and per-entity error isolation
 * Why: A purge chain that never stops, or stops on the first bad table, is an outage either way
 */
package com.example.retention.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.retention.policy.CleanupStrategy;
import com.example.retention.policy.EntityDescriptor;
import com.example.retention.policy.RetentionPolicy;
import com.example.retention.policy.RetentionPolicyRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class RetentionPurgeServiceTest {

  private static final RetentionPolicy AUDIT_EVENT = policy("AuditEvent", "audit_events");
  private static final RetentionPolicy DELIVERY_LOG = policy("DeliveryLog", "delivery_logs");

  @Mock private RetentionPolicyRegistry registry;
  @Mock private RetentionCleanupService cleanupService;

  private final QueuedRoundTrigger trigger = new QueuedRoundTrigger();
  private SimpleMeterRegistry meterRegistry;
  private RetentionPurgeService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service =
        new RetentionPurgeService(
            registry, cleanupService, trigger, new RetentionMetrics(meterRegistry));
  }

  @Test
  void drainedRoundDoesNotRetrigger() {
    when(registry.policies()).thenReturn(List.of(AUDIT_EVENT));
    when(cleanupService.cleanup(AUDIT_EVENT, false)).thenReturn(CleanupResult.removed(3, 3));

    final PurgeRoundResult result = service.runBacklogRound(1);

    assertThat(result.outcome()).isEqualTo(PurgeOutcome.DRAINED);
    assertThat(result.hasRemaining()).isFalse();
    assertThat(result.perEntityResults()).containsKey("AuditEvent");
    assertThat(trigger.scheduledRounds).isEmpty();
  }

  @Test
  void remainingWorkSchedulesNextRoundUntilDrained() {
    when(registry.policies()).thenReturn(List.of(AUDIT_EVENT));
    when(cleanupService.cleanup(AUDIT_EVENT, false))
        .thenReturn(
            CleanupResult.removed(2, 5), CleanupResult.removed(2, 3), CleanupResult.removed(1, 1));

    final PurgeRoundResult first = service.runBacklogRound(1);
    trigger.runAll();

    assertThat(first.outcome()).isEqualTo(PurgeOutcome.RETRIGGERED);
    assertThat(trigger.scheduledRounds).containsExactly(2, 3);
    assertThat(roundCount("retriggered")).isEqualTo(2.0d);
    assertThat(roundCount("drained")).isEqualTo(1.0d);
  }

  @Test
  void chainStopsAtMaxRounds() {
    when(registry.policies()).thenReturn(List.of(AUDIT_EVENT));
    when(cleanupService.cleanup(AUDIT_EVENT, false)).thenReturn(CleanupResult.removed(10, 100));

    service.runBacklogRound(1);
    trigger.runAll();

    assertThat(trigger.scheduledRounds).containsExactly(2, 3, 4, 5, 6, 7, 8, 9, 10);
    assertThat(roundCount("capped")).isEqualTo(1.0d);
    assertThat(roundCount("retriggered")).isEqualTo(9.0d);
  }

  @Test
  void lastRoundWithRemainingWorkIsCapped() {
    when(registry.policies()).thenReturn(List.of(AUDIT_EVENT));
    when(cleanupService.cleanup(AUDIT_EVENT, false)).thenReturn(CleanupResult.removed(10, 100));

    final PurgeRoundResult result = service.runBacklogRound(RetentionPurgeService.MAX_ROUNDS);

    assertThat(result.outcome()).isEqualTo(PurgeOutcome.CAPPED);
    assertThat(result.hasRemaining()).isTrue();
    assertThat(trigger.scheduledRounds).isEmpty();
  }

  @Test
  void failingEntityDoesNotStopOthers() {
    when(registry.policies()).thenReturn(List.of(AUDIT_EVENT, DELIVERY_LOG));
    when(cleanupService.cleanup(AUDIT_EVENT, false))
        .thenThrow(new DataAccessResourceFailureException("connection reset"));
    when(cleanupService.cleanup(DELIVERY_LOG, false)).thenReturn(CleanupResult.removed(4, 4));

    final PurgeRoundResult result = service.runBacklogRound(1);

    assertThat(result.errors()).containsOnlyKeys("AuditEvent");
    assertThat(result.errors().get("AuditEvent")).contains("connection reset");
    assertThat(result.perEntityResults()).containsOnlyKeys("DeliveryLog");
    assertThat(result.outcome()).isEqualTo(PurgeOutcome.DRAINED);
    verify(cleanupService).cleanup(DELIVERY_LOG, false);
  }

  @Test
  void skippedEntityIsNotRemainingWork() {
    when(registry.policies()).thenReturn(List.of(AUDIT_EVENT));
    when(cleanupService.cleanup(any(RetentionPolicy.class), anyBoolean()))
        .thenReturn(CleanupResult.lockSkipped());

    final PurgeRoundResult result = service.runBacklogRound(1);

    assertThat(result.hasRemaining()).isFalse();
    assertThat(result.outcome()).isEqualTo(PurgeOutcome.DRAINED);
    assertThat(result.perEntityResults().get("AuditEvent").skipped()).isTrue();
  }

  @Test
  void rejectsRoundOutsideChainBounds() {
    assertThatThrownBy(() -> service.runBacklogRound(0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.runBacklogRound(RetentionPurgeService.MAX_ROUNDS + 1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private double roundCount(String outcome) {
    return meterRegistry.get("retention.purge.rounds").tag("outcome", outcome).counter().count();
  }

  private static RetentionPolicy policy(String entityType, String table) {
    return new RetentionPolicy(
        EntityDescriptor.of(entityType, table),
        Duration.ofDays(30),
        CleanupStrategy.DELETE_ALL,
        "created_at",
        null,
        10);
  }

  /** Collects scheduled rounds and runs them on demand, in order. */
  private static final class QueuedRoundTrigger implements PurgeRoundTrigger {

    private final List<Integer> scheduledRounds = new ArrayList<>();
    private final Deque<Runnable> pending = new ArrayDeque<>();

    @Override
    public void schedule(int round, Runnable roundTask) {
      scheduledRounds.add(round);
      pending.add(roundTask);
    }

    void runAll() {
      while (!pending.isEmpty()) {
        pending.poll().run();
      }
    }
  }
}
