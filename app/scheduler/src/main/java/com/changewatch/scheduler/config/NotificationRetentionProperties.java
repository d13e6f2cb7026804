/*
 * Where: Notification application configuration binding
 * What: Holds dead-letter and audit retention settings
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.changewatch.scheduler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.retention")
public record NotificationRetentionProperties(
    Boolean enabled,
    Duration deadLetterMaxAge,
    Duration cleanupInterval,
    Integer deliveredHistoryLimit) {

  public NotificationRetentionProperties {
    enabled = enabled == null || enabled;
    deadLetterMaxAge = deadLetterMaxAge == null ? Duration.ofDays(30) : deadLetterMaxAge;
    cleanupInterval = cleanupInterval == null ? Duration.ofHours(1) : cleanupInterval;
    deliveredHistoryLimit = deliveredHistoryLimit == null ? 100 : deliveredHistoryLimit;
  }
}
