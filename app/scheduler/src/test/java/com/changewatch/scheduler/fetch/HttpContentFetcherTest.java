package com.changewatch.scheduler.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.changewatch.scheduler.config.FetchProperties;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class HttpContentFetcherTest {

  private static final String URL = "https://example.com/page";

  @Test
  void fetchSendsConfiguredHeadersAndReturnsBody() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andExpect(method(GET))
        .andExpect(header("User-Agent", "change-watch-test"))
        .andExpect(header("X-Api-Key", "k1"))
        .andRespond(withSuccess("<html><body>hi</body></html>", MediaType.TEXT_HTML));

    final FetchedContent content =
        fixture.fetcher.fetch(
            new FetchRequest(URL, Map.of("X-Api-Key", "k1"), Duration.ofSeconds(5), null, null,
                false));

    assertThat(content.content()).contains("hi");
    assertThat(content.statusCode()).isEqualTo(200);
    assertThat(content.contentType()).startsWith("text/html");
    assertThat(content.hasScreenshot()).isFalse();
    fixture.server.verify();
  }

  @Test
  void fetchSendsBodyWithConfiguredMethod() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andExpect(method(POST))
        .andExpect(content().string("q=1"))
        .andRespond(withSuccess("ok", MediaType.TEXT_PLAIN));

    fixture.fetcher.fetch(new FetchRequest(URL, Map.of(), null, "post", "q=1", false));

    fixture.server.verify();
  }

  @Test
  void notFoundMapsToHttpError() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThatThrownBy(() -> fixture.fetcher.fetch(request()))
        .isInstanceOf(FetchException.class)
        .satisfies(
            ex -> {
              final FetchException fetchException = (FetchException) ex;
              assertThat(fetchException.kind()).isEqualTo(FetchErrorKind.HTTP_ERROR);
              assertThat(fetchException.statusCode()).isEqualTo(404);
              assertThat(fetchException.lastErrorText())
                  .isEqualTo("Error - 404 (Page not found) received");
            });
  }

  @Test
  void blankBodyMapsToEmptyReply() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(URL)).andRespond(withSuccess("  ", MediaType.TEXT_PLAIN));

    assertThatThrownBy(() -> fixture.fetcher.fetch(request()))
        .isInstanceOf(FetchException.class)
        .extracting(ex -> ((FetchException) ex).kind())
        .isEqualTo(FetchErrorKind.EMPTY_REPLY);
  }

  @Test
  void socketTimeoutMapsToTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.fetcher.fetch(request()))
        .isInstanceOf(FetchException.class)
        .extracting(ex -> ((FetchException) ex).kind())
        .isEqualTo(FetchErrorKind.TIMEOUT);
  }

  @Test
  void connectionRefusedMapsToConnectionWithRootCause() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertThatThrownBy(() -> fixture.fetcher.fetch(request()))
        .isInstanceOf(FetchException.class)
        .extracting(ex -> ((FetchException) ex).lastErrorText())
        .isEqualTo("Connection failed: Connection refused");
  }

  @Test
  void nonHttpUrlIsUnsupported() {
    final ClientFixture fixture = newFixture();

    assertThatThrownBy(
            () ->
                fixture.fetcher.fetch(
                    new FetchRequest("file:///etc/passwd", null, null, null, null, false)))
        .isInstanceOf(FetchException.class)
        .extracting(ex -> ((FetchException) ex).kind())
        .isEqualTo(FetchErrorKind.UNSUPPORTED);
  }

  private static FetchRequest request() {
    return new FetchRequest(URL, Map.of(), Duration.ofSeconds(5), "GET", null, false);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final HttpContentFetcher fetcher =
        new HttpContentFetcher(
            builder.build(), new FetchProperties("http", null, null, "change-watch-test"));
    return new ClientFixture(fetcher, server);
  }

  private record ClientFixture(HttpContentFetcher fetcher, MockRestServiceServer server) {}
}
