/*
 * どこで: Notification 監査記録
 * 何を: 配信失敗の試行記録と配信成功記録を JSON ファイルで保存する
 * なぜ: キューの保存バックエンドを切り替えても監査履歴が残るよう、キューとは別に持つため
 */
package com.changewatch.scheduler.repository;

import com.changewatch.scheduler.config.DatastoreProperties;
import com.changewatch.scheduler.config.NotificationRetentionProperties;
import com.changewatch.scheduler.model.DeliveryRecord;
import com.changewatch.scheduler.model.RetryAttemptRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import org.springframework.stereotype.Repository;

@Repository
public class NotificationAuditRepository {

  private static final TypeReference<List<RetryAttemptRecord>> ATTEMPTS_TYPE =
      new TypeReference<>() {};
  private static final TypeReference<List<DeliveryRecord>> DELIVERIES_TYPE =
      new TypeReference<>() {};
  private static final String SUFFIX = ".json";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final Path attemptsDir;
  private final Path lastSuccessDir;
  private final Path deliveredFile;
  private final int deliveredHistoryLimit;
  private final ReentrantLock lock = new ReentrantLock();

  public NotificationAuditRepository(
      ObjectMapper objectMapper,
      DatastoreProperties datastoreProperties,
      NotificationRetentionProperties retentionProperties) {
    this.objectMapper = objectMapper;
    final Path root = Path.of(datastoreProperties.path()).resolve("notification-audit");
    this.attemptsDir = root.resolve("attempts");
    this.lastSuccessDir = root.resolve("last-success");
    this.deliveredFile = root.resolve("delivered.json");
    this.deliveredHistoryLimit = retentionProperties.deliveredHistoryLimit();
  }

  /** watch に紐づかないテスト通知はタスク ID を監査キーにする。 */
  public static String auditKey(String watchId, String taskId) {
    return watchId == null || watchId.isBlank() ? "task-" + taskId : watchId;
  }

  public void recordAttempt(RetryAttemptRecord record) {
    final Path file = attemptsFile(auditKey(record.watchId(), record.taskId()));
    lock.lock();
    try {
      final List<RetryAttemptRecord> records = new ArrayList<>(readList(file, ATTEMPTS_TYPE));
      records.add(record);
      write(file, records);
    } finally {
      lock.unlock();
    }
  }

  /** 試行番号順 (記録順)。 */
  public List<RetryAttemptRecord> attemptsFor(String key) {
    lock.lock();
    try {
      return readList(attemptsFile(key), ATTEMPTS_TYPE);
    } finally {
      lock.unlock();
    }
  }

  public int clearAttempts(String key) {
    final Path file = attemptsFile(key);
    lock.lock();
    try {
      final int count = readList(file, ATTEMPTS_TYPE).size();
      delete(file);
      return count;
    } finally {
      lock.unlock();
    }
  }

  /** 成功記録を追記し、キーごとの「最後の成功」も置き換える。履歴は上限件数まで保持する。 */
  public void recordDelivery(DeliveryRecord record) {
    lock.lock();
    try {
      final List<DeliveryRecord> records = new ArrayList<>(readList(deliveredFile, DELIVERIES_TYPE));
      records.add(record);
      final int overflow = records.size() - deliveredHistoryLimit;
      if (overflow > 0) {
        records.subList(0, overflow).clear();
      }
      write(deliveredFile, records);
      write(lastSuccessFile(auditKey(record.watchId(), record.taskId())), record);
    } finally {
      lock.unlock();
    }
  }

  /** 新しい順に最大 limit 件。 */
  public List<DeliveryRecord> deliveries(int limit) {
    lock.lock();
    try {
      final List<DeliveryRecord> records = new ArrayList<>(readList(deliveredFile, DELIVERIES_TYPE));
      Collections.reverse(records);
      return records.size() <= limit ? records : List.copyOf(records.subList(0, limit));
    } finally {
      lock.unlock();
    }
  }

  public Optional<DeliveryRecord> lastSuccessful(String key) {
    final Path file = lastSuccessFile(key);
    lock.lock();
    try {
      if (!Files.exists(file)) {
        return Optional.empty();
      }
      return Optional.of(objectMapper.readValue(file.toFile(), DeliveryRecord.class));
    } catch (IOException ex) {
      throw new NotificationQueueStorageException("failed to read audit file " + file, ex);
    } finally {
      lock.unlock();
    }
  }

  /** threshold より古い試行記録と成功記録を消す。消した件数を返す。 */
  public int purgeOlderThan(Instant threshold) {
    lock.lock();
    try {
      int purged = 0;
      for (Path file : listFiles(attemptsDir)) {
        final List<RetryAttemptRecord> records = readList(file, ATTEMPTS_TYPE);
        final List<RetryAttemptRecord> kept =
            records.stream().filter(record -> !record.timestamp().isBefore(threshold)).toList();
        purged += records.size() - kept.size();
        if (kept.isEmpty()) {
          delete(file);
        } else if (kept.size() != records.size()) {
          write(file, kept);
        }
      }
      final List<DeliveryRecord> deliveries = readList(deliveredFile, DELIVERIES_TYPE);
      final List<DeliveryRecord> keptDeliveries =
          deliveries.stream().filter(record -> !record.deliveredAt().isBefore(threshold)).toList();
      if (keptDeliveries.size() != deliveries.size()) {
        purged += deliveries.size() - keptDeliveries.size();
        write(deliveredFile, keptDeliveries);
      }
      return purged;
    } finally {
      lock.unlock();
    }
  }

  private Path attemptsFile(String key) {
    return attemptsDir.resolve(sanitize(key) + SUFFIX);
  }

  private Path lastSuccessFile(String key) {
    return lastSuccessDir.resolve(sanitize(key) + SUFFIX);
  }

  // キーはファイル名になるため区切り文字を潰す
  private static String sanitize(String key) {
    return key.replaceAll("[^A-Za-z0-9._-]", "_");
  }

  private <T> List<T> readList(Path file, TypeReference<List<T>> type) {
    if (!Files.exists(file)) {
      return List.of();
    }
    try {
      final List<T> values = objectMapper.readValue(file.toFile(), type);
      return values == null ? List.of() : values;
    } catch (IOException ex) {
      throw new NotificationQueueStorageException("failed to read audit file " + file, ex);
    }
  }

  private void write(Path file, Object value) {
    try {
      JsonFiles.writeAtomically(objectMapper, file, value);
    } catch (IOException ex) {
      throw new NotificationQueueStorageException("failed to write audit file " + file, ex);
    }
  }

  private void delete(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      throw new NotificationQueueStorageException("failed to delete audit file " + file, ex);
    }
  }

  private List<Path> listFiles(Path dir) {
    if (!Files.exists(dir)) {
      return List.of();
    }
    try (Stream<Path> paths = Files.list(dir)) {
      return paths.filter(path -> path.getFileName().toString().endsWith(SUFFIX)).toList();
    } catch (IOException ex) {
      throw new NotificationQueueStorageException("failed to list audit directory " + dir, ex);
    }
  }
}
