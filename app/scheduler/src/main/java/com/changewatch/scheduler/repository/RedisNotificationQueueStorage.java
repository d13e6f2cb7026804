/*
 * どこで: Notification キュー保存 (remote)
 * 何を: Redis の文字列キーと sorted set で未配信タスク・処理中 lease・dead letter を保持する
 * なぜ: アプリのディスクに依存せず、外部キャッシュ上でキューを永続化するため
 */
package com.changewatch.scheduler.repository;

import static com.changewatch.common.EpochMillis.toScore;

import com.changewatch.scheduler.model.DeadLetterEntry;
import com.changewatch.scheduler.model.NotificationTask;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

public class RedisNotificationQueueStorage implements NotificationQueueStorage {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final String keyPrefix;
  private final ReentrantLock claimLock = new ReentrantLock();

  public RedisNotificationQueueStorage(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.keyPrefix = keyPrefix;
  }

  @Override
  public QueueStorageKind kind() {
    return QueueStorageKind.REMOTE;
  }

  @Override
  public void save(NotificationTask task) {
    try {
      redisTemplate.opsForValue().set(taskKey(task.taskId()), toJson(task));
      if (task.leaseUntil() == null) {
        redisTemplate.opsForZSet().remove(processingKey(), task.taskId());
        redisTemplate.opsForZSet().add(scheduleKey(), task.taskId(), toScore(task.nextAttemptAt()));
      } else {
        redisTemplate.opsForZSet().remove(scheduleKey(), task.taskId());
        redisTemplate.opsForZSet().add(processingKey(), task.taskId(), toScore(task.leaseUntil()));
      }
    } catch (DataAccessException ex) {
      throw new NotificationQueueStorageException("redis save task failed", ex);
    }
  }

  @Override
  public List<NotificationTask> claimDue(Instant now, Instant leaseUntil, int limit) {
    claimLock.lock();
    try {
      final ZSetOperations<String, String> zset = redisTemplate.opsForZSet();
      final Set<String> candidates = new LinkedHashSet<>();
      // lease 切れ (配信中に落ちたもの) を先に拾う
      addAll(candidates, zset.rangeByScore(processingKey(), 0, toScore(now), 0, limit));
      addAll(candidates, zset.rangeByScore(scheduleKey(), 0, toScore(now), 0, limit));
      final List<NotificationTask> claimed = new ArrayList<>();
      for (String taskId : candidates) {
        if (claimed.size() >= limit) {
          break;
        }
        final Optional<NotificationTask> task = readTask(taskId);
        if (task.isEmpty()) {
          zset.remove(scheduleKey(), taskId);
          zset.remove(processingKey(), taskId);
          continue;
        }
        final NotificationTask leased = task.get().leased(leaseUntil);
        save(leased);
        claimed.add(leased);
      }
      claimed.sort(Comparator.comparing(NotificationTask::nextAttemptAt));
      return claimed;
    } catch (DataAccessException ex) {
      throw new NotificationQueueStorageException("redis claim failed", ex);
    } finally {
      claimLock.unlock();
    }
  }

  @Override
  public void reschedule(NotificationTask task) {
    save(task.leased(null));
  }

  @Override
  public void complete(String taskId) {
    try {
      redisTemplate.opsForZSet().remove(scheduleKey(), taskId);
      redisTemplate.opsForZSet().remove(processingKey(), taskId);
      redisTemplate.delete(taskKey(taskId));
    } catch (DataAccessException ex) {
      throw new NotificationQueueStorageException("redis complete task failed", ex);
    }
  }

  @Override
  public void moveToDeadLetter(DeadLetterEntry entry) {
    saveDeadLetter(entry);
    complete(entry.taskId());
  }

  @Override
  public void saveDeadLetter(DeadLetterEntry entry) {
    try {
      redisTemplate.opsForValue().set(deadKey(entry.taskId()), toJson(entry));
      redisTemplate.opsForZSet().add(deadIndexKey(), entry.taskId(), toScore(entry.failedAt()));
    } catch (DataAccessException ex) {
      throw new NotificationQueueStorageException("redis save dead letter failed", ex);
    }
  }

  @Override
  public List<DeadLetterEntry> listDeadLetters() {
    try {
      final Set<String> ids = redisTemplate.opsForZSet().reverseRange(deadIndexKey(), 0, -1);
      final List<DeadLetterEntry> entries = new ArrayList<>();
      if (ids != null) {
        ids.forEach(id -> findDeadLetter(id).ifPresent(entries::add));
      }
      return entries;
    } catch (DataAccessException ex) {
      throw new NotificationQueueStorageException("redis list dead letters failed", ex);
    }
  }

  @Override
  public Optional<DeadLetterEntry> findDeadLetter(String taskId) {
    try {
      final String json = redisTemplate.opsForValue().get(deadKey(taskId));
      return json == null ? Optional.empty() : Optional.of(fromJson(json, DeadLetterEntry.class));
    } catch (DataAccessException ex) {
      throw new NotificationQueueStorageException("redis find dead letter failed", ex);
    }
  }

  @Override
  public boolean deleteDeadLetter(String taskId) {
    try {
      redisTemplate.opsForZSet().remove(deadIndexKey(), taskId);
      return Boolean.TRUE.equals(redisTemplate.delete(deadKey(taskId)));
    } catch (DataAccessException ex) {
      throw new NotificationQueueStorageException("redis delete dead letter failed", ex);
    }
  }

  @Override
  public int purgeDeadLettersOlderThan(Instant threshold) {
    try {
      // threshold ちょうどは残す (failedAt < threshold のみ削除)
      final Set<String> expired =
          redisTemplate.opsForZSet().rangeByScore(deadIndexKey(), 0, toScore(threshold) - 1);
      if (expired == null) {
        return 0;
      }
      int purged = 0;
      for (String taskId : expired) {
        purged += deleteDeadLetter(taskId) ? 1 : 0;
      }
      return purged;
    } catch (DataAccessException ex) {
      throw new NotificationQueueStorageException("redis purge dead letters failed", ex);
    }
  }

  @Override
  public List<NotificationTask> findPending() {
    try {
      final Set<String> ids = new LinkedHashSet<>();
      addAll(ids, redisTemplate.opsForZSet().range(processingKey(), 0, -1));
      addAll(ids, redisTemplate.opsForZSet().range(scheduleKey(), 0, -1));
      final List<NotificationTask> tasks = new ArrayList<>();
      ids.forEach(id -> readTask(id).ifPresent(tasks::add));
      tasks.sort(Comparator.comparing(NotificationTask::nextAttemptAt));
      return tasks;
    } catch (DataAccessException ex) {
      throw new NotificationQueueStorageException("redis find pending failed", ex);
    }
  }

  @Override
  public int countPending() {
    try {
      final Long scheduled = redisTemplate.opsForZSet().zCard(scheduleKey());
      final Long processing = redisTemplate.opsForZSet().zCard(processingKey());
      return (int) ((scheduled == null ? 0 : scheduled) + (processing == null ? 0 : processing));
    } catch (DataAccessException ex) {
      throw new NotificationQueueStorageException("redis count pending failed", ex);
    }
  }

  @Override
  public int clearAll() {
    final List<NotificationTask> pending = findPending();
    final List<DeadLetterEntry> deadLetters = listDeadLetters();
    pending.forEach(task -> complete(task.taskId()));
    deadLetters.forEach(entry -> deleteDeadLetter(entry.taskId()));
    return pending.size() + deadLetters.size();
  }

  private Optional<NotificationTask> readTask(String taskId) {
    final String json = redisTemplate.opsForValue().get(taskKey(taskId));
    return json == null ? Optional.empty() : Optional.of(fromJson(json, NotificationTask.class));
  }

  private static void addAll(Set<String> target, Set<String> values) {
    if (values != null) {
      target.addAll(values);
    }
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new NotificationQueueStorageException("failed to serialize queue entry", ex);
    }
  }

  private <T> T fromJson(String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new NotificationQueueStorageException("failed to deserialize queue entry", ex);
    }
  }

  private String taskKey(String taskId) {
    return keyPrefix + "task:" + taskId;
  }

  private String deadKey(String taskId) {
    return keyPrefix + "dead:" + taskId;
  }

  private String scheduleKey() {
    return keyPrefix + "schedule";
  }

  private String processingKey() {
    return keyPrefix + "processing";
  }

  private String deadIndexKey() {
    return keyPrefix + "dead-index";
  }
}
