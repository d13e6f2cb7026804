/*
 * どこで: Fetch 契約
 * 何を: 設定文字列から取得バックエンドを解決する
 * なぜ: バックエンドの切り替えを watch 設定だけで行えるようにするため
 */
package com.changewatch.scheduler.fetch;

import com.changewatch.scheduler.config.FetchProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ContentFetcherRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ContentFetcherRegistry.class);

  private final Map<String, ContentFetcher> fetchers = new LinkedHashMap<>();
  private final String defaultBackend;

  public ContentFetcherRegistry(List<ContentFetcher> fetchers, FetchProperties properties) {
    for (ContentFetcher fetcher : fetchers) {
      this.fetchers.put(fetcher.name().toLowerCase(Locale.ROOT), fetcher);
    }
    this.defaultBackend = properties.defaultBackend().toLowerCase(Locale.ROOT);
    if (!this.fetchers.containsKey(defaultBackend)) {
      throw new IllegalStateException("default fetch backend is not registered: " + defaultBackend);
    }
  }

  /** 未指定 (null/空/"system") は既定バックエンド。未知の名前も警告の上で既定へ落とす。 */
  public ContentFetcher resolve(String backend) {
    if (backend == null || backend.isBlank() || "system".equalsIgnoreCase(backend)) {
      return fetchers.get(defaultBackend);
    }
    final ContentFetcher fetcher = fetchers.get(backend.toLowerCase(Locale.ROOT));
    if (fetcher == null) {
      logger.warn(
          "unknown fetch backend, falling back to default backend={} default={}",
          backend,
          defaultBackend);
      return fetchers.get(defaultBackend);
    }
    return fetcher;
  }

  public List<String> names() {
    return List.copyOf(fetchers.keySet());
  }
}
