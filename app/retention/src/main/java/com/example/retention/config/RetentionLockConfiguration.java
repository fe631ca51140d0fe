/*
 * Where: Retention application configuration
 * What: Chooses the lock coordinator for the connected database
 * Why: Advisory locks are backend-specific; unknown backends get the in-process fallback
 */
package com.example.retention.config;

import com.example.retention.lock.InProcessLockCoordinator;
import com.example.retention.lock.LockGuarantee;
import com.example.retention.lock.MySqlNamedLockCoordinator;
import com.example.retention.lock.PostgresAdvisoryLockCoordinator;
import com.example.retention.lock.RetentionLockCoordinator;
import com.example.retention.lock.RetentionLockKeyGenerator;
import com.example.retention.repository.SchemaInspector;
import com.google.common.annotations.VisibleForTesting;
import java.util.Locale;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RetentionLockConfiguration {

  private static final Logger logger = LoggerFactory.getLogger(RetentionLockConfiguration.class);

  @Bean
  public RetentionLockKeyGenerator retentionLockKeyGenerator(RetentionLockProperties properties) {
    return new RetentionLockKeyGenerator(properties.namespace());
  }

  @Bean
  public RetentionLockCoordinator retentionLockCoordinator(
      RetentionLockProperties properties,
      DataSource dataSource,
      SchemaInspector schemaInspector,
      RetentionLockKeyGenerator keyGenerator) {
    final LockMode mode =
        properties.mode() == LockMode.AUTO
            ? resolveMode(schemaInspector.databaseProductName())
            : properties.mode();
    final RetentionLockCoordinator coordinator =
        switch (mode) {
          case POSTGRES -> new PostgresAdvisoryLockCoordinator(dataSource, keyGenerator);
          case MYSQL -> new MySqlNamedLockCoordinator(dataSource, keyGenerator);
          case IN_PROCESS, AUTO -> new InProcessLockCoordinator();
        };
    if (coordinator.guarantee() == LockGuarantee.PROCESS_LOCAL) {
      logger.warn(
          "retention locks are process-local mode={}; run a single instance or concurrent"
              + " cleanups of the same table may overlap",
          mode);
    } else {
      logger.info("retention locks use database advisory locks mode={}", mode);
    }
    return coordinator;
  }

  @VisibleForTesting
  static LockMode resolveMode(String databaseProductName) {
    final String product =
        databaseProductName == null ? "" : databaseProductName.toLowerCase(Locale.ROOT);
    if (product.contains("postgres")) {
      return LockMode.POSTGRES;
    }
    if (product.contains("mysql") || product.contains("mariadb")) {
      return LockMode.MYSQL;
    }
    return LockMode.IN_PROCESS;
  }
}
