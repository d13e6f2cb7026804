/*
 * どこで: Scheduler 設定
 * 何を: ブラウザサービス呼び出しと webhook 配信の RestClient を提供する
 * なぜ: 接続先ごとに baseUrl とタイムアウトの責務を分離するため
 */
package com.changewatch.scheduler.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class HttpClientConfig {

  @Bean
  RestClient browserRestClient(RestClient.Builder builder, FetchProperties properties) {
    return builder
        .baseUrl(properties.browserBaseUrl())
        .requestFactory(requestFactory(properties.timeout().plusSeconds(5)))
        .build();
  }

  @Bean
  RestClient webhookRestClient(
      RestClient.Builder builder, NotificationDispatchProperties properties) {
    return builder.requestFactory(requestFactory(properties.timeout())).build();
  }

  private SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(timeout);
    requestFactory.setReadTimeout(timeout);
    return requestFactory;
  }
}
