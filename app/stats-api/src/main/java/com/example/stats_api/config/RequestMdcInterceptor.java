/*
 * どこで: Stats API Web 層
 * 何を: リクエスト ID・HTTP 情報・パス上のプレイヤー識別子/期間を MDC へ載せ、完了時に外す
 * なぜ: 同じキーの計算ログをリクエスト単位で追跡できるようにするため
 */
package com.example.stats_api.config;

import com.example.common.RequestIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String HEADER_REQUEST_ID = "X-Request-Id";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";
  private static final Map<String, String> PATH_VARIABLE_KEYS =
      Map.of("identifier", "player_identifier", "period", "stats_period");

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    final String requestId = RequestIds.acceptOrGenerate(request.getHeader(HEADER_REQUEST_ID));
    put(keys, "request_id", requestId);
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", resolveClientIp(request));
    putPathVariables(keys, request);
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    response.setHeader(HEADER_REQUEST_ID, requestId);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> rawKeys) {
      rawKeys.stream().filter(String.class::isInstance).map(String.class::cast).forEach(MDC::remove);
    }
  }

  private void putPathVariables(List<String> keys, HttpServletRequest request) {
    if (!(request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE)
        instanceof Map<?, ?> variables)) {
      return;
    }
    PATH_VARIABLE_KEYS.forEach(
        (variable, mdcKey) -> {
          if (variables.get(variable) instanceof String value) {
            put(keys, mdcKey, value);
          }
        });
  }

  private String resolveClientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    // 先頭がクライアント、以降はプロキシ。
    return forwarded.split(",", 2)[0].trim();
  }

  private void put(List<String> keys, String key, String value) {
    if (value != null && !value.isBlank()) {
      MDC.put(key, value);
      keys.add(key);
    }
  }
}
