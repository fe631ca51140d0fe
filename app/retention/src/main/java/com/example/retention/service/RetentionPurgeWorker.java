/*
 * Where: Retention backlog purge
 * What: Starts a purge chain on a fixed delay
 * Why: Each tick opens a fresh round chain; follow-up rounds come from the purge service itself
 */
package com.example.retention.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "retention.purge.enabled", havingValue = "true")
public class RetentionPurgeWorker {

  private final RetentionPurgeService purgeService;

  @Scheduled(fixedDelayString = "${retention.purge.cleanup-interval}")
  public void run() {
    purgeService.runBacklogRound(1);
  }
}
