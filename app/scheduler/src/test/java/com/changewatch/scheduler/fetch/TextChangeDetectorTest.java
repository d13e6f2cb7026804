package com.changewatch.scheduler.fetch;

import static org.assertj.core.api.Assertions.assertThat;

import com.changewatch.scheduler.model.Watch;
import org.junit.jupiter.api.Test;

class TextChangeDetectorTest {

  private final TextChangeDetector detector = new TextChangeDetector();
  private final Watch watch = Watch.builder().uuid("w1").url("https://example.com").build();

  @Test
  void htmlIsReducedToVisibleTextLines() {
    final String text =
        detector.extractText(
            FetchedContent.of(
                "<html><head><style>p{}</style><script>var x=1;</script></head>"
                    + "<body><p>Hello &amp;   world</p><div>second</div></body></html>",
                200,
                "text/html; charset=UTF-8"));

    assertThat(text).isEqualTo("Hello & world\nsecond");
  }

  @Test
  void plainTextKeepsAngleBrackets() {
    final String text =
        detector.extractText(FetchedContent.of("  a < b  \n\n c > d ", 200, "text/plain"));

    assertThat(text).isEqualTo("a < b\nc > d");
  }

  @Test
  void firstSightIsChangedAgainstNoSnapshot() {
    final DetectionResult result =
        detector.detectChange(null, FetchedContent.of("hello", 200, "text/plain"), watch);

    assertThat(result.status()).isEqualTo(DetectionStatus.CHANGED);
    assertThat(result.checksum()).hasSize(32);
    assertThat(result.text()).isEqualTo("hello");
  }

  @Test
  void matchingChecksumShortCircuits() {
    final DetectionResult first =
        detector.detectChange(null, FetchedContent.of("hello", 200, "text/plain"), watch);
    final Watch checked = watch.toBuilder().previousMd5(first.checksum()).build();

    final DetectionResult second =
        detector.detectChange("hello", FetchedContent.of(" hello ", 200, "text/plain"), checked);

    assertThat(second.status()).isEqualTo(DetectionStatus.CHECKSUM_UNCHANGED);
  }

  @Test
  void sameTextWithoutStoredChecksumIsUnchanged() {
    final DetectionResult result =
        detector.detectChange("hello", FetchedContent.of("hello", 200, "text/plain"), watch);

    assertThat(result.status()).isEqualTo(DetectionStatus.UNCHANGED);
    assertThat(result.changed()).isFalse();
  }

  @Test
  void missingRequiredTextIsFilterNotFound() {
    final Watch filtered = watch.toBuilder().requiredText("In Stock").build();

    assertThat(
            detector
                .detectChange(null, FetchedContent.of("sold out", 200, "text/plain"), filtered)
                .status())
        .isEqualTo(DetectionStatus.FILTER_NOT_FOUND);
    assertThat(
            detector
                .detectChange(null, FetchedContent.of("item in stock", 200, "text/plain"), filtered)
                .status())
        .isEqualTo(DetectionStatus.CHANGED);
  }

  @Test
  void emptyTextIsNoTextContent() {
    final DetectionResult result =
        detector.detectChange(
            null, FetchedContent.of("<html><body></body></html>", 200, null), watch);

    assertThat(result.status()).isEqualTo(DetectionStatus.NO_TEXT_CONTENT);
    assertThat(result.checksum()).isNull();
  }
}
