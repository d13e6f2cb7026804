/*
 * どこで: Scheduler Web 設定
 * 何を: 管理 API リクエストの相関キーを MDC に積み、応答ヘッダへ request_id を返す
 * なぜ: ワーカー数変更や dead letter 再投入など運用操作のログを後から辿れるようにするため
 */
package com.changewatch.scheduler.config;

import com.changewatch.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String requestId = blankToNull(request.getHeader(REQUEST_ID_HEADER));
    final Map<String, String> values = new LinkedHashMap<>();
    values.put("request_id", requestId == null ? TraceIds.newTraceId() : requestId);
    values.put("http_method", request.getMethod());
    values.put("http_path", request.getRequestURI());
    values.put("client_ip", clientIp(request));
    values.forEach(
        (key, value) -> {
          if (value != null && !value.isBlank()) {
            MDC.put(key, value);
          }
        });
    response.setHeader(REQUEST_ID_HEADER, values.get("request_id"));
    request.setAttribute(ATTRIBUTE_KEYS, values.keySet());
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof Iterable<?> keys) {
      for (Object key : keys) {
        MDC.remove(String.valueOf(key));
      }
    }
  }

  // プロキシ経由では X-Forwarded-For の先頭がクライアント
  private String clientIp(HttpServletRequest request) {
    final String forwarded = blankToNull(request.getHeader("X-Forwarded-For"));
    if (forwarded == null) {
      return request.getRemoteAddr();
    }
    final int comma = forwarded.indexOf(',');
    return (comma < 0 ? forwarded : forwarded.substring(0, comma)).trim();
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
