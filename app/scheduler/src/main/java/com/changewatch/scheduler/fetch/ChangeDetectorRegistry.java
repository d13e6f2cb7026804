package com.changewatch.scheduler.fetch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** watch の processor 設定から {@link ChangeDetector} を選ぶ。未知の値はテキスト差分にする。 */
@Component
public class ChangeDetectorRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ChangeDetectorRegistry.class);

  private final Map<String, ChangeDetector> detectors = new LinkedHashMap<>();

  public ChangeDetectorRegistry(List<ChangeDetector> detectors) {
    detectors.forEach(detector -> this.detectors.put(detector.processor(), detector));
  }

  public ChangeDetector resolve(String processor) {
    if (processor == null || processor.isBlank()) {
      return detectors.get(TextChangeDetector.PROCESSOR);
    }
    final ChangeDetector detector = detectors.get(processor);
    if (detector == null) {
      logger.warn("unknown processor, using text diff processor={}", processor);
      return detectors.get(TextChangeDetector.PROCESSOR);
    }
    return detector;
  }
}
