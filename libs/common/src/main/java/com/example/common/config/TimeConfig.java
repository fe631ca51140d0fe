/*
 * Where: Shared Spring configuration
 * What: Exposes the UTC Clock used to compute retention thresholds
 * Why: Tests replace it with a fixed clock so that age boundaries are deterministic
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
