/*
 * どこで: Fetch バックエンド
 * 何を: リモートのヘッドレスブラウザサービス経由で描画後の HTML とスクリーンショットを取得する
 * なぜ: JavaScript で描画されるページを監視するため (ブラウザ操作自体はサービス側の責務)
 */
package com.changewatch.scheduler.fetch;

import com.changewatch.scheduler.config.FetchProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class BrowserContentFetcher implements ContentFetcher {

  public static final String NAME = "browser";

  private static final Logger logger = LoggerFactory.getLogger(BrowserContentFetcher.class);
  private static final String CONTENT_PATH = "/content";
  private static final String SCREENSHOT_PATH = "/screenshot";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient browserRestClient;

  private final FetchProperties properties;

  public BrowserContentFetcher(
      @Qualifier("browserRestClient") RestClient browserRestClient, FetchProperties properties) {
    this.browserRestClient = browserRestClient;
    this.properties = properties;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean supportsScreenshot() {
    return true;
  }

  @Override
  public FetchedContent fetch(FetchRequest request) {
    final Duration timeout = request.timeout() == null ? properties.timeout() : request.timeout();
    final FetchedContent content;
    try {
      final ResponseEntity<String> response =
          browserRestClient
              .post()
              .uri(CONTENT_PATH)
              .contentType(MediaType.APPLICATION_JSON)
              .body(contentRequest(request, timeout))
              .retrieve()
              .toEntity(String.class);
      final String body = response.getBody();
      if (body == null || body.isBlank()) {
        throw new FetchException(
            FetchErrorKind.EMPTY_REPLY, response.getStatusCode().value(), "empty reply");
      }
      content = FetchedContent.of(body, response.getStatusCode().value(), MediaType.TEXT_HTML_VALUE);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "browser fetch failed with http status={} url={}",
          ex.getStatusCode().value(),
          request.url());
      throw new FetchException(
          FetchErrorKind.PAGE_UNLOADABLE,
          ex.getStatusCode().value(),
          "browser service returned " + ex.getStatusCode().value(),
          ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("browser fetch timed out url={} timeout={}", request.url(), timeout);
        throw new FetchException(FetchErrorKind.BROWSER_TIMEOUT, 0, "timeout", ex);
      }
      logger.warn("browser service connection failed url={}", request.url(), ex);
      throw new FetchException(
          FetchErrorKind.BROWSER_CONNECT, 0, HttpContentFetcher.rootMessage(ex), ex);
    }
    if (!request.includeScreenshot()) {
      return content;
    }
    return content.withScreenshot(captureScreenshot(request, timeout));
  }

  // スクリーンショットは任意機能。失敗してもチェック自体は続行する
  private byte[] captureScreenshot(FetchRequest request, Duration timeout) {
    try {
      return browserRestClient
          .post()
          .uri(SCREENSHOT_PATH)
          .contentType(MediaType.APPLICATION_JSON)
          .body(screenshotRequest(request, timeout))
          .retrieve()
          .body(byte[].class);
    } catch (RestClientException ex) {
      logger.warn("browser screenshot unavailable url={}", request.url(), ex);
      return null;
    }
  }

  private Map<String, Object> contentRequest(FetchRequest request, Duration timeout) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("url", request.url());
    body.put("gotoOptions", Map.of("timeout", timeout.toMillis(), "waitUntil", "networkidle2"));
    if (!request.headers().isEmpty()) {
      body.put("setExtraHTTPHeaders", request.headers());
    }
    return body;
  }

  private Map<String, Object> screenshotRequest(FetchRequest request, Duration timeout) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("url", request.url());
    body.put("gotoOptions", Map.of("timeout", timeout.toMillis()));
    body.put("options", Map.of("fullPage", true, "type", "jpeg", "quality", 72));
    return body;
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
}
