package com.example.stats_api.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** パイプライン段階ごとの追加リトライ回数。既定は 0(リトライしない)。 */
@ConfigurationProperties(prefix = "pipeline")
public record PipelineProperties(
    int resolveMaxRetries, int fetchMaxRetries, Duration retryBackoff) {

  public PipelineProperties {
    resolveMaxRetries = Math.max(0, resolveMaxRetries);
    fetchMaxRetries = Math.max(0, fetchMaxRetries);
    retryBackoff = retryBackoff == null ? Duration.ofMillis(500) : retryBackoff;
  }
}
