package com.changewatch.scheduler.worker;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** {@link RecheckTicker} を定期起動する。 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "watch.recheck.enabled", havingValue = "true", matchIfMissing = true)
public class RecheckTickerWorker {

  private static final Logger logger = LoggerFactory.getLogger(RecheckTickerWorker.class);

  private final RecheckTicker ticker;

  @Scheduled(fixedDelayString = "${watch.recheck.interval:1s}")
  public void run() {
    try {
      ticker.tick();
    } catch (RuntimeException ex) {
      logger.warn("recheck tick failed", ex);
    }
  }
}
