/*
 * どこで: Notification サービス層
 * 何を: 変化検知・フィルタ失敗の通知件名と本文 (追加/削除行) を組み立てる
 * なぜ: 本文は投入時に確定させ、再送時に設定が変わっても同じ内容を届けるため
 */
package com.changewatch.scheduler.service;

import com.changewatch.scheduler.model.Watch;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class NotificationComposer {

  static final int MAX_DIFF_LINES = 50;

  public NotificationMessage composeChange(
      Watch watch, String previousText, String currentText, Instant detectedAt) {
    final List<String> added = linesOnlyIn(currentText, previousText);
    final List<String> removed = linesOnlyIn(previousText, currentText);
    final StringBuilder body = new StringBuilder();
    body.append(watch.url()).append(" changed at ").append(detectedAt).append('\n');
    appendSection(body, "Added", "+ ", added);
    appendSection(body, "Removed", "- ", removed);
    return new NotificationMessage("Change detected: " + watch.url(), body.toString());
  }

  public NotificationMessage composeFilterFailure(Watch watch, int consecutiveFailures) {
    final String body =
        watch.url()
            + " : the expected text \""
            + watch.requiredText()
            + "\" was not found "
            + consecutiveFailures
            + " times in a row. Check whether the page layout changed.";
    return new NotificationMessage("Filter not found: " + watch.url(), body);
  }

  private void appendSection(StringBuilder body, String label, String prefix, List<String> lines) {
    if (lines.isEmpty()) {
      return;
    }
    body.append('\n').append(label).append(":\n");
    final int shown = Math.min(lines.size(), MAX_DIFF_LINES);
    for (int i = 0; i < shown; i++) {
      body.append(prefix).append(lines.get(i)).append('\n');
    }
    if (lines.size() > shown) {
      body.append("... ").append(lines.size() - shown).append(" more lines\n");
    }
  }

  // 行の集合差。順序は source 側の出現順
  private static List<String> linesOnlyIn(String source, String other) {
    if (source == null || source.isEmpty()) {
      return List.of();
    }
    final Set<String> otherLines =
        other == null ? Set.of() : new LinkedHashSet<>(List.of(other.split("\n")));
    final List<String> result = new ArrayList<>();
    for (String line : new LinkedHashSet<>(List.of(source.split("\n")))) {
      if (!otherLines.contains(line)) {
        result.add(line);
      }
    }
    return result;
  }
}
