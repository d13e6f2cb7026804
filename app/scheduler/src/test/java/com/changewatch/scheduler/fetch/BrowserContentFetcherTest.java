package com.changewatch.scheduler.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.changewatch.scheduler.config.FetchProperties;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class BrowserContentFetcherTest {

  private static final String URL = "https://example.com/app";

  @Test
  void fetchReturnsRenderedHtml() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://browser.test/content"))
        .andExpect(jsonPath("$.url").value(URL))
        .andExpect(jsonPath("$.gotoOptions.timeout").value(5000))
        .andRespond(withSuccess("<html><body>rendered</body></html>", MediaType.TEXT_HTML));

    final FetchedContent content = fixture.fetcher.fetch(request(false));

    assertThat(content.content()).contains("rendered");
    assertThat(content.contentType()).isEqualTo(MediaType.TEXT_HTML_VALUE);
    assertThat(content.hasScreenshot()).isFalse();
    fixture.server.verify();
  }

  @Test
  void fetchAttachesScreenshotWhenRequested() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://browser.test/content"))
        .andRespond(withSuccess("<html>page</html>", MediaType.TEXT_HTML));
    fixture
        .server
        .expect(requestTo("http://browser.test/screenshot"))
        .andRespond(withSuccess(new byte[] {1, 2, 3}, MediaType.IMAGE_JPEG));

    final FetchedContent content = fixture.fetcher.fetch(request(true));

    assertThat(content.screenshot()).containsExactly(1, 2, 3);
  }

  @Test
  void screenshotFailureDoesNotFailFetch() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://browser.test/content"))
        .andRespond(withSuccess("<html>page</html>", MediaType.TEXT_HTML));
    fixture.server.expect(requestTo("http://browser.test/screenshot")).andRespond(withServerError());

    final FetchedContent content = fixture.fetcher.fetch(request(true));

    assertThat(content.content()).isEqualTo("<html>page</html>");
    assertThat(content.hasScreenshot()).isFalse();
  }

  @Test
  void browserServiceErrorMapsToPageUnloadable() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo("http://browser.test/content")).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.fetcher.fetch(request(false)))
        .isInstanceOf(FetchException.class)
        .extracting(ex -> ((FetchException) ex).kind())
        .isEqualTo(FetchErrorKind.PAGE_UNLOADABLE);
  }

  @Test
  void browserTimeoutMapsToBrowserTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://browser.test/content"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.fetcher.fetch(request(false)))
        .isInstanceOf(FetchException.class)
        .extracting(ex -> ((FetchException) ex).kind())
        .isEqualTo(FetchErrorKind.BROWSER_TIMEOUT);
  }

  private static FetchRequest request(boolean screenshot) {
    return new FetchRequest(URL, Map.of(), Duration.ofSeconds(5), "GET", null, screenshot);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder().baseUrl("http://browser.test");
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final BrowserContentFetcher fetcher =
        new BrowserContentFetcher(
            builder.build(), new FetchProperties("http", null, "http://browser.test", null));
    return new ClientFixture(fetcher, server);
  }

  private record ClientFixture(BrowserContentFetcher fetcher, MockRestServiceServer server) {}
}
