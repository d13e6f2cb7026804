package com.changewatch.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class WebhookNotificationDispatcherTest {

  @Test
  void postsSnakeCaseJsonToEveryTarget() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("https://hooks.example/a"))
        .andExpect(method(POST))
        .andExpect(
            content()
                .json(
                    """
                    {"task_id":"task-1","title":"Change detected: https://example.com",
                     "body":"+ new","format":"text","watch_url":"https://example.com"}
                    """))
        .andRespond(withSuccess());
    fixture.server.expect(requestTo("https://hooks.example/b")).andRespond(withSuccess());

    final DispatchResult result =
        fixture.dispatcher.dispatch(
            dispatch(List.of("https://hooks.example/a", "https://hooks.example/b")));

    assertThat(result.success()).isTrue();
    fixture.server.verify();
  }

  @Test
  void serverErrorFailsWithRedactedTarget() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("https://hooks.example/a?token=secret"))
        .andRespond(withServerError());

    final DispatchResult result =
        fixture.dispatcher.dispatch(dispatch(List.of("https://hooks.example/a?token=secret")));

    assertThat(result.success()).isFalse();
    assertThat(result.error())
        .isEqualTo("HTTP 500 from https://hooks.example/a?***")
        .doesNotContain("secret");
  }

  @Test
  void oneFailingTargetFailsWholeDispatch() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo("https://hooks.example/a")).andRespond(withSuccess());
    fixture
        .server
        .expect(requestTo("https://hooks.example/b"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    final DispatchResult result =
        fixture.dispatcher.dispatch(
            dispatch(List.of("https://hooks.example/a", "https://hooks.example/b")));

    assertThat(result.success()).isFalse();
    assertThat(result.error()).isEqualTo("connection failed for https://hooks.example/b");
  }

  @Test
  void timeoutIsReportedAsTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("https://hooks.example/a"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    final DispatchResult result =
        fixture.dispatcher.dispatch(dispatch(List.of("https://hooks.example/a")));

    assertThat(result.error()).isEqualTo("timeout for https://hooks.example/a");
  }

  @Test
  void nonHttpTargetIsRejectedWithoutRequest() {
    final ClientFixture fixture = newFixture();

    final DispatchResult result =
        fixture.dispatcher.dispatch(dispatch(List.of("mailto://ops@example.com")));

    assertThat(result.success()).isFalse();
    assertThat(result.error()).startsWith("unsupported notification url");
    fixture.server.verify();
  }

  @Test
  void redactKeepsUrlsWithoutQuery() {
    assertThat(WebhookNotificationDispatcher.redact("https://hooks.example/a"))
        .isEqualTo("https://hooks.example/a");
  }

  private static NotificationDispatch dispatch(List<String> targets) {
    return new NotificationDispatch(
        "task-1",
        targets,
        "text",
        "Change detected: https://example.com",
        "+ new",
        "https://example.com");
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final WebhookNotificationDispatcher dispatcher =
        new WebhookNotificationDispatcher(builder.build());
    return new ClientFixture(dispatcher, server);
  }

  private record ClientFixture(
      WebhookNotificationDispatcher dispatcher, MockRestServiceServer server) {}
}
