/*
 * どこで: Stats API 設定
 * 何を: 外部計算ステージのコマンド/タイムアウト/リトライと多重起動抑止の再利用窓を保持する
 * なぜ: ステージ実体の差し替えと運用パラメータ調整を設定だけで行い、起動時に妥当性を検証するため
 */
package com.example.stats_api.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "dispatch")
@Validated
public record DispatchProperties(
    @NotNull @Valid StageProperties ingestion,
    @NotNull @Valid StageProperties aggregation,
    String workingDirectory,
    Duration dedupWindow,
    Duration retryBackoff,
    Duration retryBackoffMax,
    @Positive Integer executorPoolSize,
    @PositiveOrZero Integer executorQueueCapacity,
    @Positive Integer diagnosticMaxLength) {

  /** タイムアウトで強制終了したプロセスの終了を待つ上限。 */
  public static final Duration STAGE_TERMINATION_GRACE = Duration.ofSeconds(1);

  public DispatchProperties {
    workingDirectory =
        workingDirectory == null || workingDirectory.isBlank() ? null : workingDirectory;
    dedupWindow = dedupWindow == null ? Duration.ZERO : dedupWindow;
    retryBackoff = retryBackoff == null ? Duration.ofSeconds(1) : retryBackoff;
    retryBackoffMax = retryBackoffMax == null ? Duration.ofSeconds(30) : retryBackoffMax;
    executorPoolSize = executorPoolSize == null ? 4 : executorPoolSize;
    executorQueueCapacity = executorQueueCapacity == null ? 16 : executorQueueCapacity;
    diagnosticMaxLength = diagnosticMaxLength == null ? 4000 : diagnosticMaxLength;
  }

  @AssertTrue(message = "dispatch.dedup-window must not be negative")
  public boolean isDedupWindowValid() {
    return !dedupWindow.isNegative();
  }

  /**
   * 役割: 取り込み/集計の 1 組が終わるまでの最長時間を返す。
   * 動作: ステージごとに (リトライ回数 + 1) × (タイムアウト + 終了待ち) にリトライ回数 × バックオフ上限を足し、全ステージ分を合計する。
   */
  public Duration dispatchBound() {
    return ingestion.worstCase(retryBackoffMax).plus(aggregation.worstCase(retryBackoffMax));
  }

  public record StageProperties(
      @NotEmpty List<String> command, @NotNull Duration timeout, @PositiveOrZero int maxRetries) {

    public StageProperties {
      command = command == null ? List.of() : List.copyOf(command);
    }

    Duration worstCase(Duration backoffMax) {
      final long attempts = maxRetries + 1L;
      return timeout
          .plus(STAGE_TERMINATION_GRACE)
          .multipliedBy(attempts)
          .plus(backoffMax.multipliedBy(maxRetries));
    }

    @AssertTrue(message = "dispatch stage timeout must be positive")
    public boolean isTimeoutPositive() {
      // null は @NotNull で検出する前提。
      return timeout == null || (!timeout.isZero() && !timeout.isNegative());
    }
  }
}
