/*
 * どこで: Diff processor
 * 何を: HTML/テキストを正規化し、MD5 と必須文言でページの変化を判定する
 * なぜ: 空白やタグの揺れで誤検知せず、本文の変化だけを通知するため
 */
package com.changewatch.scheduler.fetch;

import com.changewatch.scheduler.model.Watch;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

@Component
public class TextChangeDetector implements ChangeDetector {

  public static final String PROCESSOR = "text_json_diff";

  private static final Pattern SCRIPT_OR_STYLE =
      Pattern.compile("(?is)<(script|style|noscript)[^>]*>.*?</\\1\\s*>");
  private static final Pattern BLOCK_BREAK =
      Pattern.compile("(?i)<\\s*(br|/p|/div|/li|/h[1-6]|/tr|/title)[^>]*>");
  private static final Pattern TAG = Pattern.compile("(?s)<[^>]+>");
  private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");

  @Override
  public String processor() {
    return PROCESSOR;
  }

  @Override
  public DetectionResult detectChange(String previousSnapshot, FetchedContent current, Watch watch) {
    final String text = extractText(current);
    if (text.isEmpty()) {
      return DetectionResult.failed(DetectionStatus.NO_TEXT_CONTENT);
    }
    final String requiredText = watch.requiredText();
    if (requiredText != null
        && !requiredText.isBlank()
        && !text.toLowerCase(Locale.ROOT).contains(requiredText.toLowerCase(Locale.ROOT))) {
      return DetectionResult.failed(DetectionStatus.FILTER_NOT_FOUND);
    }
    final String checksum = DigestUtils.md5DigestAsHex(text.getBytes(StandardCharsets.UTF_8));
    if (checksum.equals(watch.previousMd5())) {
      return DetectionResult.of(DetectionStatus.CHECKSUM_UNCHANGED, checksum, text);
    }
    if (previousSnapshot != null && previousSnapshot.equals(text)) {
      return DetectionResult.of(DetectionStatus.UNCHANGED, checksum, text);
    }
    return DetectionResult.of(DetectionStatus.CHANGED, checksum, text);
  }

  String extractText(FetchedContent current) {
    final String raw = current.content() == null ? "" : current.content();
    String text = raw;
    if (looksLikeHtml(current.contentType(), raw)) {
      text = SCRIPT_OR_STYLE.matcher(text).replaceAll(" ");
      text = BLOCK_BREAK.matcher(text).replaceAll("\n");
      text = TAG.matcher(text).replaceAll(" ");
      text = unescapeEntities(text);
    }
    return Arrays.stream(text.split("\\R"))
        .map(line -> HORIZONTAL_SPACE.matcher(line).replaceAll(" ").trim())
        .filter(line -> !line.isEmpty())
        .collect(Collectors.joining("\n"));
  }

  private boolean looksLikeHtml(String contentType, String raw) {
    if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("html")) {
      return true;
    }
    final String head = raw.stripLeading().toLowerCase(Locale.ROOT);
    return head.startsWith("<!doctype html") || head.startsWith("<html");
  }

  private String unescapeEntities(String text) {
    return text.replace("&nbsp;", " ")
        .replace("&lt;", "<")
        .replace("&gt;", ">")
        .replace("&quot;", "\"")
        .replace("&#39;", "'")
        .replace("&amp;", "&");
  }
}
