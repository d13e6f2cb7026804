/*
 * どこで: Fetch バックエンド
 * 何を: 素の HTTP クライアントで監視対象を取得する
 * なぜ: JavaScript 実行が不要なページを軽量に取得するため
 */
package com.changewatch.scheduler.fetch;

import com.changewatch.scheduler.config.FetchProperties;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
public class HttpContentFetcher implements ContentFetcher {

  public static final String NAME = "http";

  private static final Logger logger = LoggerFactory.getLogger(HttpContentFetcher.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient.Builder は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient.Builder restClientBuilder;

  private final FetchProperties properties;
  // タイムアウト値ごとに RestClient を使い回す
  private final Map<Duration, RestClient> clientsByTimeout = new ConcurrentHashMap<>();
  private final RestClient fixedClient;

  @Autowired
  public HttpContentFetcher(RestClient.Builder restClientBuilder, FetchProperties properties) {
    this.restClientBuilder = restClientBuilder;
    this.properties = properties;
    this.fixedClient = null;
  }

  @VisibleForTesting
  HttpContentFetcher(RestClient fixedClient, FetchProperties properties) {
    this.restClientBuilder = null;
    this.properties = properties;
    this.fixedClient = fixedClient;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public FetchedContent fetch(FetchRequest request) {
    validateUrl(request.url());
    final Duration timeout = request.timeout() == null ? properties.timeout() : request.timeout();
    try {
      RestClient.RequestBodySpec spec =
          clientFor(timeout)
              .method(HttpMethod.valueOf(request.method().toUpperCase(Locale.ROOT)))
              .uri(URI.create(request.url()))
              .header(HttpHeaders.USER_AGENT, properties.userAgent())
              .headers(headers -> request.headers().forEach(headers::set));
      if (request.body() != null && !request.body().isEmpty()) {
        spec = spec.body(request.body());
      }
      final ResponseEntity<String> response = spec.retrieve().toEntity(String.class);
      final String body = response.getBody();
      final int status = response.getStatusCode().value();
      if (body == null || body.isBlank()) {
        throw new FetchException(FetchErrorKind.EMPTY_REPLY, status, "empty reply");
      }
      final MediaType contentType = response.getHeaders().getContentType();
      return FetchedContent.of(body, status, contentType == null ? null : contentType.toString());
    } catch (RestClientResponseException ex) {
      logger.warn(
          "http fetch failed with http status={} url={}", ex.getStatusCode().value(), request.url());
      throw new FetchException(
          FetchErrorKind.HTTP_ERROR, ex.getStatusCode().value(), ex.getStatusText(), ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("http fetch timed out url={} timeout={}", request.url(), timeout);
        throw new FetchException(FetchErrorKind.TIMEOUT, 0, "timeout", ex);
      }
      logger.warn("http fetch connection failed url={}", request.url(), ex);
      throw new FetchException(FetchErrorKind.CONNECTION, 0, rootMessage(ex), ex);
    } catch (IllegalArgumentException ex) {
      throw new FetchException(FetchErrorKind.UNSUPPORTED, 0, ex.getMessage(), ex);
    }
  }

  private RestClient clientFor(Duration timeout) {
    if (fixedClient != null) {
      return fixedClient;
    }
    return clientsByTimeout.computeIfAbsent(
        timeout,
        value -> {
          final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
          requestFactory.setConnectTimeout(value);
          requestFactory.setReadTimeout(value);
          return restClientBuilder.clone().requestFactory(requestFactory).build();
        });
  }

  private void validateUrl(String url) {
    if (url == null || url.isBlank()) {
      throw new FetchException(FetchErrorKind.UNSUPPORTED, 0, "url is required");
    }
    final String lower = url.toLowerCase(Locale.ROOT);
    if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
      throw new FetchException(FetchErrorKind.UNSUPPORTED, 0, "only http(s) urls are supported");
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  static String rootMessage(Throwable ex) {
    Throwable current = ex;
    while (current.getCause() != null) {
      current = current.getCause();
    }
    return current.getMessage();
  }
}
