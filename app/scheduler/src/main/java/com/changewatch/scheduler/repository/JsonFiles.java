/*
 * どこで: Scheduler 永続化ユーティリティ
 * 何を: JSON を一時ファイル経由でアトミックに書き出す
 * なぜ: 書き込み中にプロセスが落ちても壊れたファイルを残さないため
 */
package com.changewatch.scheduler.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

final class JsonFiles {
  private JsonFiles() {}

  static void writeAtomically(ObjectMapper objectMapper, Path target, Object value)
      throws IOException {
    writeAtomically(target, objectMapper.writeValueAsBytes(value));
  }

  static void writeAtomically(Path target, byte[] bytes) throws IOException {
    final Path parent = target.toAbsolutePath().getParent();
    Files.createDirectories(parent);
    final Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
    try {
      Files.write(temp, bytes);
      try {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
