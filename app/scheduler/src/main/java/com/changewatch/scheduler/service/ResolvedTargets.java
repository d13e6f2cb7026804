package com.changewatch.scheduler.service;

import java.util.List;

/**
 * 試行時点で解決した配信先と書式。
 *
 * @param source watch / global / none
 */
public record ResolvedTargets(List<String> urls, String format, String source) {

  public ResolvedTargets {
    urls = urls == null ? List.of() : List.copyOf(urls);
  }

  public boolean isEmpty() {
    return urls.isEmpty();
  }
}
