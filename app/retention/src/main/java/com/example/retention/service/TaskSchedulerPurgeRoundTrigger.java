/*
 * Where: Retention backlog purge
 * What: Re-submits the next purge round to Spring's TaskScheduler after a short delay
 * Why: The engine owns no threads; the host scheduler already does
 */
package com.example.retention.service;

import com.example.retention.config.RetentionPurgeProperties;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TaskSchedulerPurgeRoundTrigger implements PurgeRoundTrigger {

  private static final Logger logger =
      LoggerFactory.getLogger(TaskSchedulerPurgeRoundTrigger.class);

  private final TaskScheduler taskScheduler;
  private final RetentionPurgeProperties properties;
  private final Clock clock;

  @Override
  public void schedule(int round, Runnable roundTask) {
    final Instant startAt = Instant.now(clock).plus(properties.retriggerDelay());
    taskScheduler.schedule(roundTask, startAt);
    logger.debug("retention purge round scheduled round={} startAt={}", round, startAt);
  }
}
