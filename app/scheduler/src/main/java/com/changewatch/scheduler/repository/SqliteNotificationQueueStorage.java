/*
 * どこで: Notification キュー保存 (embedded)
 * 何を: 組み込み SQLite のテーブル行として未配信タスクと dead letter を保存する
 * なぜ: 件数が増えてもファイル走査をせずに予定時刻順で取り出すため
 */
package com.changewatch.scheduler.repository;

import static com.changewatch.common.EpochMillis.toEpochMillis;

import com.changewatch.scheduler.model.DeadLetterEntry;
import com.changewatch.scheduler.model.NotificationTask;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

public class SqliteNotificationQueueStorage implements NotificationQueueStorage {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper/JdbcTemplate は共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper/JdbcTemplate は共有コンポーネントで防御的コピーが不可能なため")
  private final NamedParameterJdbcTemplate jdbcTemplate;

  private final TransactionTemplate transactionTemplate;
  // SQLite は書き込みが単一なので、claim の select/update を Java 側でも直列化する
  private final ReentrantLock claimLock = new ReentrantLock();

  public SqliteNotificationQueueStorage(
      ObjectMapper objectMapper,
      NamedParameterJdbcTemplate jdbcTemplate,
      PlatformTransactionManager transactionManager) {
    this.objectMapper = objectMapper;
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    initializeSchema();
  }

  private void initializeSchema() {
    final String createTasks =
        """
        CREATE TABLE IF NOT EXISTS notification_tasks (
          task_id TEXT PRIMARY KEY,
          payload TEXT NOT NULL,
          next_attempt_at INTEGER NOT NULL,
          lease_until INTEGER,
          created_at INTEGER NOT NULL
        )
        """;
    final String createTasksIndex =
        """
        CREATE INDEX IF NOT EXISTS idx_notification_tasks_due
        ON notification_tasks(next_attempt_at)
        """;
    final String createDeadLetters =
        """
        CREATE TABLE IF NOT EXISTS notification_dead_letters (
          task_id TEXT PRIMARY KEY,
          payload TEXT NOT NULL,
          failed_at INTEGER NOT NULL
        )
        """;
    run(
        () -> {
          jdbcTemplate.getJdbcTemplate().execute(createTasks);
          jdbcTemplate.getJdbcTemplate().execute(createTasksIndex);
          jdbcTemplate.getJdbcTemplate().execute(createDeadLetters);
          return null;
        },
        "initialize schema");
  }

  @Override
  public QueueStorageKind kind() {
    return QueueStorageKind.EMBEDDED;
  }

  @Override
  public void save(NotificationTask task) {
    final String sql =
        """
        INSERT INTO notification_tasks (task_id, payload, next_attempt_at, lease_until, created_at)
        VALUES (:taskId, :payload, :nextAttemptAt, :leaseUntil, :createdAt)
        ON CONFLICT(task_id) DO UPDATE SET
          payload = excluded.payload,
          next_attempt_at = excluded.next_attempt_at,
          lease_until = excluded.lease_until
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("taskId", task.taskId())
            .addValue("payload", toJson(task))
            .addValue("nextAttemptAt", toEpochMillis(task.nextAttemptAt()))
            .addValue("leaseUntil", toEpochMillis(task.leaseUntil()))
            .addValue("createdAt", toEpochMillis(task.createdAt()));
    run(() -> jdbcTemplate.update(sql, params), "save task");
  }

  @Override
  public List<NotificationTask> claimDue(Instant now, Instant leaseUntil, int limit) {
    final String selectSql =
        """
        SELECT payload FROM notification_tasks
        WHERE next_attempt_at <= :now
          AND (lease_until IS NULL OR lease_until <= :now)
        ORDER BY next_attempt_at, created_at
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toEpochMillis(now))
            .addValue("limit", limit);
    claimLock.lock();
    try {
      final List<NotificationTask> claimed =
          transactionTemplate.execute(
              status -> {
                final List<NotificationTask> due =
                    jdbcTemplate.query(selectSql, params, (rs, rowNum) -> taskFrom(rs));
                final List<NotificationTask> leased = new ArrayList<>(due.size());
                for (NotificationTask task : due) {
                  final NotificationTask withLease = task.leased(leaseUntil);
                  save(withLease);
                  leased.add(withLease);
                }
                return leased;
              });
      return claimed == null ? List.of() : claimed;
    } catch (DataAccessException ex) {
      throw new NotificationQueueStorageException("sqlite claim failed", ex);
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
    final String sql = "DELETE FROM notification_tasks WHERE task_id = :taskId";
    run(
        () -> jdbcTemplate.update(sql, new MapSqlParameterSource("taskId", taskId)),
        "complete task");
  }

  @Override
  public void moveToDeadLetter(DeadLetterEntry entry) {
    try {
      transactionTemplate.executeWithoutResult(
          status -> {
            saveDeadLetter(entry);
            complete(entry.taskId());
          });
    } catch (DataAccessException ex) {
      throw new NotificationQueueStorageException("sqlite dead letter move failed", ex);
    }
  }

  @Override
  public void saveDeadLetter(DeadLetterEntry entry) {
    final String sql =
        """
        INSERT INTO notification_dead_letters (task_id, payload, failed_at)
        VALUES (:taskId, :payload, :failedAt)
        ON CONFLICT(task_id) DO UPDATE SET
          payload = excluded.payload,
          failed_at = excluded.failed_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("taskId", entry.taskId())
            .addValue("payload", toJson(entry))
            .addValue("failedAt", toEpochMillis(entry.failedAt()));
    run(() -> jdbcTemplate.update(sql, params), "save dead letter");
  }

  @Override
  public List<DeadLetterEntry> listDeadLetters() {
    final String sql =
        "SELECT payload FROM notification_dead_letters ORDER BY failed_at DESC, task_id";
    return run(
        () ->
            jdbcTemplate.query(
                sql, new MapSqlParameterSource(), (rs, rowNum) -> deadLetterFrom(rs)),
        "list dead letters");
  }

  @Override
  public Optional<DeadLetterEntry> findDeadLetter(String taskId) {
    final String sql = "SELECT payload FROM notification_dead_letters WHERE task_id = :taskId";
    final List<DeadLetterEntry> found =
        run(
            () ->
                jdbcTemplate.query(
                    sql,
                    new MapSqlParameterSource("taskId", taskId),
                    (rs, rowNum) -> deadLetterFrom(rs)),
            "find dead letter");
    return found.stream().findFirst();
  }

  @Override
  public boolean deleteDeadLetter(String taskId) {
    final String sql = "DELETE FROM notification_dead_letters WHERE task_id = :taskId";
    final Integer deleted =
        run(
            () -> jdbcTemplate.update(sql, new MapSqlParameterSource("taskId", taskId)),
            "delete dead letter");
    return deleted != null && deleted > 0;
  }

  @Override
  public int purgeDeadLettersOlderThan(Instant threshold) {
    final String sql = "DELETE FROM notification_dead_letters WHERE failed_at < :threshold";
    return run(
        () ->
            jdbcTemplate.update(
                sql, new MapSqlParameterSource("threshold", toEpochMillis(threshold))),
        "purge dead letters");
  }

  @Override
  public List<NotificationTask> findPending() {
    final String sql =
        "SELECT payload FROM notification_tasks ORDER BY next_attempt_at, created_at";
    return run(
        () -> jdbcTemplate.query(sql, new MapSqlParameterSource(), (rs, rowNum) -> taskFrom(rs)),
        "find pending");
  }

  @Override
  public int countPending() {
    final String sql = "SELECT COUNT(*) FROM notification_tasks";
    final Integer count =
        run(
            () -> jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class),
            "count pending");
    return count == null ? 0 : count;
  }

  @Override
  public int clearAll() {
    final Integer removed =
        transactionTemplate.execute(
            status ->
                jdbcTemplate.update("DELETE FROM notification_tasks", new MapSqlParameterSource())
                    + jdbcTemplate.update(
                        "DELETE FROM notification_dead_letters", new MapSqlParameterSource()));
    return removed == null ? 0 : removed;
  }

  private NotificationTask taskFrom(ResultSet rs) throws SQLException {
    return fromJson(rs.getString("payload"), NotificationTask.class);
  }

  private DeadLetterEntry deadLetterFrom(ResultSet rs) throws SQLException {
    return fromJson(rs.getString("payload"), DeadLetterEntry.class);
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

  private <T> T run(Supplier<T> action, String operation) {
    try {
      return action.get();
    } catch (DataAccessException ex) {
      throw new NotificationQueueStorageException("sqlite " + operation + " failed", ex);
    }
  }
}
