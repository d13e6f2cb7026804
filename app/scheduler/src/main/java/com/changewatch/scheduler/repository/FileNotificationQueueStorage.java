/*
 * どこで: Notification キュー保存 (file)
 * 何を: タスク 1 件を JSON ファイル 1 つとして pending/dead ディレクトリに保存する
 * なぜ: 外部依存なしでプロセス再起動をまたいで未配信通知を保持するため
 */
package com.changewatch.scheduler.repository;

import com.changewatch.scheduler.model.DeadLetterEntry;
import com.changewatch.scheduler.model.NotificationTask;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FileNotificationQueueStorage implements NotificationQueueStorage {

  private static final Logger logger = LoggerFactory.getLogger(FileNotificationQueueStorage.class);
  private static final String SUFFIX = ".json";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final Path pendingDir;
  private final Path deadDir;
  // claim の読み取りと lease 書き込みを 1 プロセス内で直列化する
  private final ReentrantLock lock = new ReentrantLock();

  public FileNotificationQueueStorage(ObjectMapper objectMapper, Path root) {
    this.objectMapper = objectMapper;
    this.pendingDir = root.resolve("pending");
    this.deadDir = root.resolve("dead");
    try {
      Files.createDirectories(pendingDir);
      Files.createDirectories(deadDir);
    } catch (IOException ex) {
      throw new NotificationQueueStorageException("failed to create queue directories " + root, ex);
    }
  }

  @Override
  public QueueStorageKind kind() {
    return QueueStorageKind.FILE;
  }

  @Override
  public void save(NotificationTask task) {
    write(pendingDir.resolve(task.taskId() + SUFFIX), task);
  }

  @Override
  public List<NotificationTask> claimDue(Instant now, Instant leaseUntil, int limit) {
    lock.lock();
    try {
      final List<NotificationTask> due =
          readAll(pendingDir, NotificationTask.class).stream()
              .filter(task -> !task.nextAttemptAt().isAfter(now))
              .filter(task -> task.leaseUntil() == null || !task.leaseUntil().isAfter(now))
              .sorted(Comparator.comparing(NotificationTask::nextAttemptAt))
              .limit(limit)
              .toList();
      final List<NotificationTask> claimed = new ArrayList<>(due.size());
      for (NotificationTask task : due) {
        final NotificationTask leased = task.leased(leaseUntil);
        save(leased);
        claimed.add(leased);
      }
      return claimed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void reschedule(NotificationTask task) {
    lock.lock();
    try {
      save(task.leased(null));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void complete(String taskId) {
    delete(pendingDir.resolve(taskId + SUFFIX));
  }

  @Override
  public void moveToDeadLetter(DeadLetterEntry entry) {
    lock.lock();
    try {
      // dead を先に書くことで、途中で落ちても通知が消えない (重複はあり得る)
      write(deadDir.resolve(entry.taskId() + SUFFIX), entry);
      delete(pendingDir.resolve(entry.taskId() + SUFFIX));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void saveDeadLetter(DeadLetterEntry entry) {
    write(deadDir.resolve(entry.taskId() + SUFFIX), entry);
  }

  @Override
  public List<DeadLetterEntry> listDeadLetters() {
    return readAll(deadDir, DeadLetterEntry.class).stream()
        .sorted(Comparator.comparing(DeadLetterEntry::failedAt).reversed())
        .toList();
  }

  @Override
  public Optional<DeadLetterEntry> findDeadLetter(String taskId) {
    return read(deadDir.resolve(taskId + SUFFIX), DeadLetterEntry.class);
  }

  @Override
  public boolean deleteDeadLetter(String taskId) {
    return delete(deadDir.resolve(taskId + SUFFIX));
  }

  @Override
  public int purgeDeadLettersOlderThan(Instant threshold) {
    int purged = 0;
    for (DeadLetterEntry entry : readAll(deadDir, DeadLetterEntry.class)) {
      if (entry.failedAt().isBefore(threshold) && deleteDeadLetter(entry.taskId())) {
        purged++;
      }
    }
    return purged;
  }

  @Override
  public List<NotificationTask> findPending() {
    return readAll(pendingDir, NotificationTask.class).stream()
        .sorted(Comparator.comparing(NotificationTask::nextAttemptAt))
        .toList();
  }

  @Override
  public int countPending() {
    return listFiles(pendingDir).size();
  }

  @Override
  public int clearAll() {
    lock.lock();
    try {
      int removed = 0;
      for (Path path : listFiles(pendingDir)) {
        removed += delete(path) ? 1 : 0;
      }
      for (Path path : listFiles(deadDir)) {
        removed += delete(path) ? 1 : 0;
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  private void write(Path path, Object value) {
    try {
      JsonFiles.writeAtomically(objectMapper, path, value);
    } catch (IOException ex) {
      throw new NotificationQueueStorageException("failed to write queue file " + path, ex);
    }
  }

  private <T> Optional<T> read(Path path, Class<T> type) {
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(path.toFile(), type));
    } catch (IOException ex) {
      // 壊れたファイル 1 つでキュー全体を止めない
      logger.warn("skipping unreadable queue file path={}", path, ex);
      return Optional.empty();
    }
  }

  private <T> List<T> readAll(Path dir, Class<T> type) {
    final List<T> values = new ArrayList<>();
    for (Path path : listFiles(dir)) {
      read(path, type).ifPresent(values::add);
    }
    return values;
  }

  private List<Path> listFiles(Path dir) {
    try (Stream<Path> paths = Files.list(dir)) {
      return paths.filter(path -> path.getFileName().toString().endsWith(SUFFIX)).toList();
    } catch (IOException ex) {
      throw new NotificationQueueStorageException("failed to list queue directory " + dir, ex);
    }
  }

  private boolean delete(Path path) {
    try {
      return Files.deleteIfExists(path);
    } catch (IOException ex) {
      throw new NotificationQueueStorageException("failed to delete queue file " + path, ex);
    }
  }
}
