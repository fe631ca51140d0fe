/*
 * Where: Retention configuration binding tests
 * What: Verifies Duration binding, policy lists and validation failures
 * Why: A misbound interval or policy only shows up at the first scheduled run otherwise
 */
package com.example.retention.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.retention.config.RetentionPolicyProperties.PolicyDefinition;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class RetentionPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "retention.purge.enabled=true",
              "retention.purge.cleanup-interval=1h",
              "retention.purge.retrigger-delay=5s",
              "retention.lock.mode=auto",
              "retention.lock.namespace=retention");

  @Test
  void bindsDurationsAndLockSettings() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final RetentionPurgeProperties purge = context.getBean(RetentionPurgeProperties.class);
          final RetentionLockProperties lock = context.getBean(RetentionLockProperties.class);

          assertThat(purge.enabled()).isTrue();
          assertThat(purge.cleanupInterval()).isEqualTo(Duration.ofHours(1));
          assertThat(purge.retriggerDelay()).isEqualTo(Duration.ofSeconds(5));
          assertThat(lock.mode()).isEqualTo(LockMode.AUTO);
          assertThat(lock.namespace()).isEqualTo("retention");
          assertThat(context.getBean(RetentionPolicyProperties.class).policies()).isEmpty();
        });
  }

  @Test
  void bindsDeclaredPolicies() {
    contextRunner
        .withPropertyValues(
            "retention.policies[0].entity-type=AuditEvent",
            "retention.policies[0].table=audit_events",
            "retention.policies[0].period=P90D",
            "retention.policies[0].strategy=archive",
            "retention.policies[0].batch-limit=500",
            "retention.policies[1].entity-type=LoginAttempt",
            "retention.policies[1].table=login_attempts",
            "retention.policies[1].column=attempted_at",
            "retention.policies[1].period=14d")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final PolicyDefinition audit =
                  context.getBean(RetentionPolicyProperties.class).policies().get(0);
              final PolicyDefinition login =
                  context.getBean(RetentionPolicyProperties.class).policies().get(1);

              assertThat(audit.period()).isEqualTo(Duration.ofDays(90));
              assertThat(audit.strategy()).isEqualTo("archive");
              assertThat(audit.batchLimit()).isEqualTo(500);
              assertThat(login.column()).isEqualTo("attempted_at");
              assertThat(login.period()).isEqualTo(Duration.ofDays(14));
              assertThat(login.strategy()).isNull();
            });
  }

  @Test
  void rejectsNonPositiveCleanupInterval() {
    contextRunner
        .withPropertyValues("retention.purge.cleanup-interval=0s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void rejectsNegativeRetriggerDelay() {
    contextRunner
        .withPropertyValues("retention.purge.retrigger-delay=-1s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void rejectsBlankLockNamespace() {
    contextRunner
        .withPropertyValues("retention.lock.namespace= ")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void rejectsPolicyWithoutTable() {
    contextRunner
        .withPropertyValues("retention.policies[0].entity-type=AuditEvent")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    RetentionPurgeProperties.class,
    RetentionLockProperties.class,
    RetentionPolicyProperties.class
  })
  static class TestConfiguration {
    // Minimal context for ApplicationContextRunner
  }
}
