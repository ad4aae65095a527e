/*
 * どこで: Stats API Web 設定
 * 何を: 統計 API (/v1/**) にだけ RequestMdcInterceptor を適用する
 * なぜ: ヘルスチェックや liveness の呼び出しでリクエストログの MDC を汚さないため
 */
package com.example.stats_api.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class StatsWebConfig implements WebMvcConfigurer {

  static final String STATS_API_PATTERN = "/v1/**";

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns(STATS_API_PATTERN);
  }
}
