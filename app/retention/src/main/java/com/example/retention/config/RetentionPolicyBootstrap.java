/*
 * Where: Retention application startup
 * What: Registers the policies declared in application.yml
 * Why: Registration must finish before the first scheduled purge round runs
 */
package com.example.retention.config;

import com.example.retention.config.RetentionPolicyProperties.PolicyDefinition;
import com.example.retention.policy.EntityDescriptor;
import com.example.retention.policy.RetentionFilter;
import com.example.retention.policy.RetentionPolicyRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RetentionPolicyBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(RetentionPolicyBootstrap.class);

  private final RetentionPolicyProperties properties;
  private final RetentionPolicyRegistry registry;

  @PostConstruct
  public void registerDeclaredPolicies() {
    // A bad declaration fails startup; running with half the policies would silently keep data.
    for (PolicyDefinition definition : properties.policies()) {
      final EntityDescriptor entity =
          new EntityDescriptor(
              definition.entityType(), definition.table(), definition.idColumn(), null);
      registry.register(
          entity,
          definition.period(),
          definition.strategy(),
          definition.column(),
          definition.filter() == null ? null : RetentionFilter.of(definition.filter()),
          definition.batchLimit());
    }
    logger.info(
        "retention policies declared in configuration count={}", properties.policies().size());
  }
}
