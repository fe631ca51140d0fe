/*
 * Where: Retention locking tests (fallback)
 * What: Verifies skip-on-contention, release on failure and the reported guarantee
 */
package com.example.retention.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.retention.policy.EntityDescriptor;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InProcessLockCoordinatorTest {

  private static final EntityDescriptor AUDIT_EVENT =
      EntityDescriptor.of("AuditEvent", "audit_events");
  private static final EntityDescriptor DELIVERY_LOG =
      EntityDescriptor.of("DeliveryLog", "delivery_logs");

  private final InProcessLockCoordinator coordinator = new InProcessLockCoordinator();

  @Test
  void secondAttemptWhileHeldIsSkipped() {
    final Optional<Optional<String>> nested =
        coordinator.tryWithLock(AUDIT_EVENT, () -> coordinator.tryWithLock(AUDIT_EVENT, () -> "x"));

    assertThat(nested).contains(Optional.empty());
    assertThat(coordinator.isHeld("AuditEvent")).isFalse();
  }

  @Test
  void differentEntityTypesDoNotConflict() {
    final Optional<Optional<String>> nested =
        coordinator.tryWithLock(
            AUDIT_EVENT, () -> coordinator.tryWithLock(DELIVERY_LOG, () -> "ran"));

    assertThat(nested).contains(Optional.of("ran"));
  }

  @Test
  void lockIsReleasedWhenBodyThrows() {
    assertThatThrownBy(
            () ->
                coordinator.tryWithLock(
                    AUDIT_EVENT,
                    () -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("boom");

    assertThat(coordinator.isHeld("AuditEvent")).isFalse();
    assertThat(coordinator.tryWithLock(AUDIT_EVENT, () -> 1)).contains(1);
  }

  @Test
  void concurrentWorkerIsSkippedWithoutWaiting() throws Exception {
    final CountDownLatch acquired = new CountDownLatch(1);
    final CountDownLatch finish = new CountDownLatch(1);
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<Optional<Boolean>> holder =
          executor.submit(
              () ->
                  coordinator.tryWithLock(
                      AUDIT_EVENT,
                      () -> {
                        acquired.countDown();
                        try {
                          return finish.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException ex) {
                          Thread.currentThread().interrupt();
                          return false;
                        }
                      }));
      assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();

      assertThat(coordinator.tryWithLock(AUDIT_EVENT, () -> "second")).isEmpty();

      finish.countDown();
      assertThat(holder.get(5, TimeUnit.SECONDS)).contains(true);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void reportsProcessLocalGuarantee() {
    assertThat(coordinator.guarantee()).isEqualTo(LockGuarantee.PROCESS_LOCAL);
  }
}
