/*
 * どこで: Stats API 設定
 * 何を: 結果ストア(S3)の bucket/prefix/region/タイムアウトを保持する
 * なぜ: 環境ごとの bucket や互換エンドポイントを外部化するため
 */
package com.example.stats_api.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "result-store")
public record ResultStoreProperties(
    String bucket,
    String keyPrefix,
    String region,
    String endpointOverride,
    boolean forcePathStyle,
    Duration readTimeout) {

  public ResultStoreProperties {
    bucket = bucket == null ? "" : bucket.trim();
    keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? "kpis" : trimSlashes(keyPrefix);
    region = region == null || region.isBlank() ? "us-east-1" : region;
    endpointOverride =
        endpointOverride == null || endpointOverride.isBlank() ? null : endpointOverride;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }

  private static String trimSlashes(String value) {
    String trimmed = value.trim();
    while (trimmed.startsWith("/")) {
      trimmed = trimmed.substring(1);
    }
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }
}
