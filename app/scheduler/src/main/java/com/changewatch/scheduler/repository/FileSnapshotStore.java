/*
 * どこで: Scheduler データストア
 * 何を: スナップショットを watch ごとのディレクトリにテキストファイルで保存する
 * なぜ: 履歴参照だけを watch に持たせ、大きな本文をメモリに抱えないため
 */
package com.changewatch.scheduler.repository;

import com.changewatch.scheduler.config.DatastoreProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

@Repository
public class FileSnapshotStore implements SnapshotStore {

  private static final Logger logger = LoggerFactory.getLogger(FileSnapshotStore.class);
  private static final String SCREENSHOT_FILE = "last-screenshot.jpg";

  private final Path root;

  public FileSnapshotStore(DatastoreProperties properties) {
    this.root = Path.of(properties.path()).resolve("snapshots");
  }

  @Override
  public String save(String watchId, long timestamp, String content) {
    final String ref = watchId + "/" + timestamp + ".txt";
    try {
      JsonFiles.writeAtomically(root.resolve(ref), content.getBytes(StandardCharsets.UTF_8));
      return ref;
    } catch (IOException ex) {
      throw new WatchPersistenceException("failed to write snapshot " + ref, ex);
    }
  }

  @Override
  public Optional<String> load(String snapshotRef) {
    if (snapshotRef == null) {
      return Optional.empty();
    }
    final Path path = root.resolve(snapshotRef);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
    } catch (IOException ex) {
      throw new WatchPersistenceException("failed to read snapshot " + snapshotRef, ex);
    }
  }

  @Override
  public void saveScreenshot(String watchId, byte[] image) {
    try {
      JsonFiles.writeAtomically(root.resolve(watchId).resolve(SCREENSHOT_FILE), image);
    } catch (IOException ex) {
      throw new WatchPersistenceException("failed to write screenshot watchId=" + watchId, ex);
    }
  }

  @Override
  public void deleteAll(String watchId) {
    final Path dir = root.resolve(watchId);
    if (!Files.exists(dir)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(FileSnapshotStore::deleteOrThrow);
    } catch (IOException | UncheckedIOException ex) {
      throw new WatchPersistenceException("failed to delete snapshots watchId=" + watchId, ex);
    }
    logger.info("snapshots deleted watchId={}", watchId);
  }

  private static void deleteOrThrow(Path path) {
    try {
      Files.delete(path);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }
}
