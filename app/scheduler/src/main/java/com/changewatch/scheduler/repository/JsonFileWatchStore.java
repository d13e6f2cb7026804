/*
 * どこで: Scheduler データストア
 * 何を: watch 定義をメモリに保持し、まとめて JSON ファイルへ書き出す
 * なぜ: ワーカーの書き込みを都度 I/O にせず、データストア側で集約するため
 */
package com.changewatch.scheduler.repository;

import com.changewatch.scheduler.config.DatastoreProperties;
import com.changewatch.scheduler.model.NotificationSettings;
import com.changewatch.scheduler.model.Watch;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

@Repository
public class JsonFileWatchStore implements WatchStore {

  private static final Logger logger = LoggerFactory.getLogger(JsonFileWatchStore.class);
  private static final String FILE_NAME = "watches.json";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final Path file;
  private final ConcurrentMap<String, Watch> watches = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, ReentrantLock> recordLocks = new ConcurrentHashMap<>();
  private final AtomicBoolean dirty = new AtomicBoolean(false);
  private volatile NotificationSettings notificationSettings = NotificationSettings.empty();

  public JsonFileWatchStore(ObjectMapper objectMapper, DatastoreProperties properties) {
    this.objectMapper = objectMapper;
    this.file = Path.of(properties.path()).resolve(FILE_NAME);
    load();
  }

  @Override
  public Optional<Watch> find(String uuid) {
    return Optional.ofNullable(watches.get(uuid));
  }

  @Override
  public List<Watch> findAll() {
    final List<Watch> all = new ArrayList<>(watches.values());
    all.sort(Comparator.comparing(Watch::uuid));
    return all;
  }

  @Override
  public Watch save(Watch watch) {
    final ReentrantLock lock = lockFor(watch.uuid());
    lock.lock();
    try {
      watches.put(watch.uuid(), watch);
      dirty.set(true);
      return watch;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean delete(String uuid) {
    final ReentrantLock lock = lockFor(uuid);
    lock.lock();
    try {
      final boolean removed = watches.remove(uuid) != null;
      if (removed) {
        dirty.set(true);
      }
      return removed;
    } finally {
      lock.unlock();
      recordLocks.remove(uuid, lock);
    }
  }

  @Override
  public Optional<Watch> update(String uuid, UnaryOperator<Watch> mutation) {
    final ReentrantLock lock = lockFor(uuid);
    lock.lock();
    try {
      final Watch current = watches.get(uuid);
      if (current == null) {
        return Optional.empty();
      }
      final Watch updated = mutation.apply(current);
      watches.put(uuid, updated);
      dirty.set(true);
      return Optional.of(updated);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public NotificationSettings notificationSettings() {
    return notificationSettings;
  }

  @Override
  public void updateNotificationSettings(NotificationSettings settings) {
    this.notificationSettings = settings == null ? NotificationSettings.empty() : settings;
    dirty.set(true);
  }

  /** 変更があればファイルへ書き出す。書き出した場合 true。 */
  public boolean flush() {
    if (!dirty.getAndSet(false)) {
      return false;
    }
    final DatastoreFile snapshot = new DatastoreFile(notificationSettings, findAll());
    try {
      JsonFiles.writeAtomically(objectMapper, file, snapshot);
      return true;
    } catch (IOException ex) {
      dirty.set(true);
      throw new WatchPersistenceException("failed to write datastore file " + file, ex);
    }
  }

  @PreDestroy
  void flushOnShutdown() {
    try {
      flush();
    } catch (WatchPersistenceException ex) {
      logger.error("datastore flush on shutdown failed path={}", file, ex);
    }
  }

  private void load() {
    if (!Files.exists(file)) {
      logger.info("datastore file not found, starting empty path={}", file);
      return;
    }
    try {
      final DatastoreFile stored = objectMapper.readValue(file.toFile(), DatastoreFile.class);
      if (stored.settings() != null) {
        notificationSettings = stored.settings();
      }
      if (stored.watches() != null) {
        stored.watches().forEach(watch -> watches.put(watch.uuid(), watch));
      }
      logger.info("datastore loaded watches={} path={}", watches.size(), file);
    } catch (IOException ex) {
      throw new WatchPersistenceException("failed to read datastore file " + file, ex);
    }
  }

  private ReentrantLock lockFor(String uuid) {
    return recordLocks.computeIfAbsent(uuid, ignored -> new ReentrantLock());
  }

  record DatastoreFile(NotificationSettings settings, List<Watch> watches) {}
}
