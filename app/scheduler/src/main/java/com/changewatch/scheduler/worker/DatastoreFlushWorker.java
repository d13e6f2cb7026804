package com.changewatch.scheduler.worker;

import com.changewatch.scheduler.repository.JsonFileWatchStore;
import com.changewatch.scheduler.repository.WatchPersistenceException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** watch の変更をまとめてディスクへ書き出す。ワーカーは 1 件ごとに書き込まない。 */
@Component
@RequiredArgsConstructor
public class DatastoreFlushWorker {

  private static final Logger logger = LoggerFactory.getLogger(DatastoreFlushWorker.class);

  private final JsonFileWatchStore watchStore;

  @Scheduled(fixedDelayString = "${watch.datastore.flush-interval:30s}")
  public void run() {
    try {
      watchStore.flush();
    } catch (WatchPersistenceException ex) {
      logger.error("datastore flush failed, will retry on next interval", ex);
    }
  }
}
