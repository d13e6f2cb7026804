/*
 * Where: Notification cleanup worker
 * What: Triggers retention cleanup at startup and on a schedule
 * Why: Automate dead-letter expiry without manual intervention
 */
package com.changewatch.scheduler.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.retention.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationRetentionWorker {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionWorker.class);

  private final NotificationRetentionService retentionService;

  @EventListener(ApplicationReadyEvent.class)
  public void onStartup() {
    run();
  }

  @Scheduled(
      initialDelayString = "${notification.retention.cleanup-interval:1h}",
      fixedDelayString = "${notification.retention.cleanup-interval:1h}")
  public void run() {
    try {
      retentionService.cleanup();
    } catch (RuntimeException ex) {
      logger.error("notification retention cleanup failed", ex);
    }
  }
}
