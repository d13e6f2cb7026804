/*
 * どこで: Notification キュー保存のテスト
 * 何を: file/embedded の各バックエンドが同じ取り出し順・lease・dead letter の振る舞いをすることを検証する
 * なぜ: バックエンドを切り替えても配信サービス側の前提が崩れないようにするため
 */
package com.changewatch.scheduler.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.changewatch.scheduler.model.DeadLetterEntry;
import com.changewatch.scheduler.model.NotificationTask;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

abstract class NotificationQueueStorageContractTest {

  protected static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  protected final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

  @TempDir Path tempDir;

  private NotificationQueueStorage storage;

  protected abstract NotificationQueueStorage createStorage(Path root);

  @BeforeEach
  void setUpStorage() {
    storage = createStorage(tempDir);
  }

  @Test
  void claimDueReturnsDueTasksInScheduleOrderWithLease() {
    storage.save(task("later", NOW.minusSeconds(10)));
    storage.save(task("earlier", NOW.minusSeconds(60)));
    storage.save(task("future", NOW.plusSeconds(60)));

    final List<NotificationTask> claimed = storage.claimDue(NOW, NOW.plusSeconds(300), 10);

    assertThat(claimed).extracting(NotificationTask::taskId).containsExactly("earlier", "later");
    assertThat(claimed).allSatisfy(task -> assertThat(task.leaseUntil()).isEqualTo(NOW.plusSeconds(300)));
    assertThat(storage.countPending()).isEqualTo(3);
  }

  @Test
  void claimDueRespectsLimit() {
    storage.save(task("a", NOW.minusSeconds(3)));
    storage.save(task("b", NOW.minusSeconds(2)));
    storage.save(task("c", NOW.minusSeconds(1)));

    assertThat(storage.claimDue(NOW, NOW.plusSeconds(300), 2))
        .extracting(NotificationTask::taskId)
        .containsExactly("a", "b");
  }

  @Test
  void leasedTaskIsNotClaimedAgainUntilLeaseExpires() {
    storage.save(task("a", NOW));
    storage.claimDue(NOW, NOW.plusSeconds(300), 10);

    assertThat(storage.claimDue(NOW.plusSeconds(10), NOW.plusSeconds(310), 10)).isEmpty();
    assertThat(storage.claimDue(NOW.plusSeconds(300), NOW.plusSeconds(600), 10))
        .extracting(NotificationTask::taskId)
        .containsExactly("a");
  }

  @Test
  void rescheduleClearsLeaseAndMovesNextAttempt() {
    storage.save(task("a", NOW));
    final NotificationTask claimed = storage.claimDue(NOW, NOW.plusSeconds(300), 10).get(0);

    storage.reschedule(claimed.retryAt(1, NOW.plusSeconds(60), "HTTP 500"));

    assertThat(storage.claimDue(NOW.plusSeconds(59), NOW.plusSeconds(400), 10)).isEmpty();
    final List<NotificationTask> due = storage.claimDue(NOW.plusSeconds(60), NOW.plusSeconds(400), 10);
    assertThat(due).singleElement().satisfies(
        task -> {
          assertThat(task.attemptCount()).isEqualTo(1);
          assertThat(task.lastError()).isEqualTo("HTTP 500");
          assertThat(task.title()).isEqualTo("title a");
        });
  }

  @Test
  void completeRemovesTask() {
    storage.save(task("a", NOW));

    storage.complete("a");

    assertThat(storage.findPending()).isEmpty();
    assertThat(storage.countPending()).isZero();
  }

  @Test
  void moveToDeadLetterRemovesPendingAndSurvivesReopen() {
    storage.save(task("a", NOW));

    storage.moveToDeadLetter(deadLetter("a", NOW));

    assertThat(storage.findPending()).isEmpty();
    final NotificationQueueStorage reopened = createStorage(tempDir);
    assertThat(reopened.findDeadLetter("a"))
        .get()
        .satisfies(
            entry -> {
              assertThat(entry.attempts()).isEqualTo(4);
              assertThat(entry.lastError()).isEqualTo("HTTP 500");
              assertThat(entry.task().body()).isEqualTo("body a");
            });
  }

  @Test
  void deadLettersAreListedNewestFirst() {
    storage.moveToDeadLetter(deadLetter("old", NOW.minusSeconds(60)));
    storage.moveToDeadLetter(deadLetter("new", NOW));

    assertThat(storage.listDeadLetters())
        .extracting(DeadLetterEntry::taskId)
        .containsExactly("new", "old");
  }

  @Test
  void deleteDeadLetterReportsWhetherEntryExisted() {
    storage.moveToDeadLetter(deadLetter("a", NOW));

    assertThat(storage.deleteDeadLetter("a")).isTrue();
    assertThat(storage.deleteDeadLetter("a")).isFalse();
    assertThat(storage.findDeadLetter("a")).isEmpty();
  }

  @Test
  void purgeRemovesOnlyOlderDeadLetters() {
    storage.moveToDeadLetter(deadLetter("old", NOW.minus(Duration.ofDays(31))));
    storage.moveToDeadLetter(deadLetter("edge", NOW.minus(Duration.ofDays(30))));

    final int purged = storage.purgeDeadLettersOlderThan(NOW.minus(Duration.ofDays(30)));

    assertThat(purged).isEqualTo(1);
    assertThat(storage.listDeadLetters()).extracting(DeadLetterEntry::taskId).containsExactly("edge");
  }

  @Test
  void clearAllRemovesPendingAndDeadLetters() {
    storage.save(task("a", NOW));
    storage.save(task("b", NOW));
    storage.moveToDeadLetter(deadLetter("c", NOW));

    assertThat(storage.clearAll()).isEqualTo(3);
    assertThat(storage.findPending()).isEmpty();
    assertThat(storage.listDeadLetters()).isEmpty();
  }

  protected static NotificationTask task(String taskId, Instant nextAttemptAt) {
    return NotificationTask.create(
            taskId, "watch-1", "title " + taskId, "body " + taskId, "https://example.com", null,
            null, NOW.minusSeconds(3600))
        .retryAt(0, nextAttemptAt, null);
  }

  protected static DeadLetterEntry deadLetter(String taskId, Instant failedAt) {
    return new DeadLetterEntry(
        task(taskId, failedAt).retryAt(4, failedAt, "HTTP 500"), failedAt, "HTTP 500", 4, null);
  }
}
