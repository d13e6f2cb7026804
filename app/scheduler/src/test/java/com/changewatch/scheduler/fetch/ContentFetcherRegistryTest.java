package com.changewatch.scheduler.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.changewatch.scheduler.config.FetchProperties;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContentFetcherRegistryTest {

  private final ContentFetcher http = new NamedFetcher("http");
  private final ContentFetcher browser = new NamedFetcher("browser");

  @Test
  void resolvesByNameAndFallsBackToDefault() {
    final ContentFetcherRegistry registry =
        new ContentFetcherRegistry(
            List.of(http, browser), new FetchProperties("http", null, null, null));

    assertThat(registry.resolve("browser")).isSameAs(browser);
    assertThat(registry.resolve("BROWSER")).isSameAs(browser);
    assertThat(registry.resolve(null)).isSameAs(http);
    assertThat(registry.resolve("system")).isSameAs(http);
    assertThat(registry.resolve("unknown")).isSameAs(http);
    assertThat(registry.names()).containsExactly("http", "browser");
  }

  @Test
  void unregisteredDefaultBackendFailsFast() {
    assertThatThrownBy(
            () ->
                new ContentFetcherRegistry(
                    List.of(http), new FetchProperties("browser", null, null, null)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("browser");
  }

  private record NamedFetcher(String name) implements ContentFetcher {
    @Override
    public FetchedContent fetch(FetchRequest request) {
      return FetchedContent.of("content", 200, "text/plain");
    }
  }
}
