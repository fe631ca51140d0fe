/*
 * Where: Retention application configuration binding
 * What: Lock backend selection and the namespace mixed into lock keys
 * Why: Services sharing one database need distinct namespaces to avoid false conflicts
 */
package com.example.retention.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "retention.lock")
@Validated
public record RetentionLockProperties(@NotNull LockMode mode, @NotBlank String namespace) {}
