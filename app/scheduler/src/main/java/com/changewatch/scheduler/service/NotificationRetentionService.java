/*
 * Where: Notification service layer
 * What: Purges aged dead letters and audit attempt records
 * Why: Keep the dead-letter list and audit directory bounded without manual cleanup
 */
package com.changewatch.scheduler.service;

import com.changewatch.scheduler.config.NotificationRetentionProperties;
import com.changewatch.scheduler.repository.NotificationAuditRepository;
import com.changewatch.scheduler.repository.NotificationQueueStorage;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationQueueStorage storage;
  private final NotificationAuditRepository auditRepository;
  private final NotificationRetentionProperties properties;
  private final Clock clock;

  /** @return number of removed dead letters */
  public int cleanup() {
    final Instant threshold = Instant.now(clock).minus(properties.deadLetterMaxAge());
    final int deletedDeadLetters = storage.purgeDeadLettersOlderThan(threshold);
    final int deletedAttempts = auditRepository.purgeOlderThan(threshold);
    logger.info(
        "notification retention cleanup deleted deadLetters={} attemptRecords={} threshold={}",
        deletedDeadLetters,
        deletedAttempts,
        threshold);
    return deletedDeadLetters;
  }
}
