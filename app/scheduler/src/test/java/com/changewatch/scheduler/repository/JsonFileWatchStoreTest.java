package com.changewatch.scheduler.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.changewatch.scheduler.config.DatastoreProperties;
import com.changewatch.scheduler.model.HistoryEntry;
import com.changewatch.scheduler.model.NotificationSettings;
import com.changewatch.scheduler.model.Watch;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileWatchStoreTest {

  private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

  @TempDir Path tempDir;

  @Test
  void flushWritesOnlyWhenDirtyAndReloads() {
    final JsonFileWatchStore store = newStore();
    assertThat(store.flush()).isFalse();

    store.save(
        Watch.builder()
            .uuid("w1")
            .url("https://example.com")
            .checkInterval(Duration.ofMinutes(5))
            .lastChecked(Instant.parse("2026-03-01T00:00:00Z"))
            .history(List.of(new HistoryEntry(1_772_323_200L, "w1/1772323200.txt")))
            .build());
    store.updateNotificationSettings(
        new NotificationSettings(List.of("https://hooks.example"), "markdown"));

    assertThat(store.flush()).isTrue();
    assertThat(store.flush()).isFalse();
    assertThat(Files.exists(tempDir.resolve("watches.json"))).isTrue();

    final JsonFileWatchStore reloaded = newStore();
    final Watch watch = reloaded.find("w1").orElseThrow();
    assertThat(watch.checkInterval()).isEqualTo(Duration.ofMinutes(5));
    assertThat(watch.history()).extracting(HistoryEntry::snapshotRef).containsExactly("w1/1772323200.txt");
    assertThat(reloaded.notificationSettings().notificationFormat()).isEqualTo("markdown");
  }

  @Test
  void updateOfMissingWatchIsEmpty() {
    final JsonFileWatchStore store = newStore();

    assertThat(store.update("missing", watch -> watch)).isEmpty();
    assertThat(store.delete("missing")).isFalse();
  }

  @Test
  void concurrentUpdatesOfOneWatchAreNotLost() throws InterruptedException {
    final JsonFileWatchStore store = newStore();
    store.save(Watch.builder().uuid("w1").url("https://example.com").build());
    final ExecutorService executor = Executors.newFixedThreadPool(8);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Runnable> tasks = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      tasks.add(
          () -> {
            try {
              start.await();
            } catch (InterruptedException ex) {
              Thread.currentThread().interrupt();
              return;
            }
            store.update(
                "w1", watch -> watch.toBuilder().checkCount(watch.checkCount() + 1).build());
          });
    }
    tasks.forEach(executor::execute);

    start.countDown();
    executor.shutdown();
    assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

    assertThat(store.find("w1").orElseThrow().checkCount()).isEqualTo(200);
  }

  @Test
  void corruptFileFailsLoad() throws Exception {
    Files.writeString(tempDir.resolve("watches.json"), "{not json");

    assertThatThrownBy(this::newStore).isInstanceOf(WatchPersistenceException.class);
  }

  private JsonFileWatchStore newStore() {
    return new JsonFileWatchStore(
        objectMapper, new DatastoreProperties(tempDir.toString(), null, null));
  }
}
