/*
 * どこで: Stats API サービス層
 * 何を: パイプライン結果・段階所要時間・ステージ起動回数・エラーコードのメトリクスを記録する
 * なぜ: 外部計算の起動回数と失敗段階を Prometheus から直接観測できるようにするため
 */
package com.example.stats_api.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class StatsMetrics {

  private static final String METRIC_PIPELINE_TOTAL = "stats.pipeline.total";
  private static final String METRIC_PIPELINE_STAGE_DURATION = "stats.pipeline.stage.duration";
  private static final String METRIC_DISPATCH_STAGE_LAUNCH_TOTAL =
      "stats.dispatch.stage.launch.total";
  private static final String METRIC_DISPATCH_REUSE_TOTAL = "stats.dispatch.reuse.total";
  private static final String METRIC_API_ERROR_TOTAL = "stats.api.error.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> pipelineCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> stageTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> launchCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> reuseCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> apiErrorCounters = new ConcurrentHashMap<>();

  public StatsMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordPipelineResult(String result, String stage) {
    final String key = result + "|" + stage;
    pipelineCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_PIPELINE_TOTAL)
                    .description("Stats pipeline outcomes by final stage")
                    .tags(Tags.of("result", result, "stage", stage))
                    .register(meterRegistry))
        .increment();
  }

  public void recordStageDuration(String stage, String result, Duration duration) {
    final String key = stage + "|" + result;
    stageTimers
        .computeIfAbsent(
            key,
            ignored ->
                Timer.builder(METRIC_PIPELINE_STAGE_DURATION)
                    .description("Stats pipeline stage duration")
                    .tags(Tags.of("stage", stage, "result", result))
                    .register(meterRegistry))
        .record(duration);
  }

  public void recordStageLaunch(String stage) {
    launchCounters
        .computeIfAbsent(
            stage,
            ignored ->
                Counter.builder(METRIC_DISPATCH_STAGE_LAUNCH_TOTAL)
                    .description("External compute stage launches")
                    .tags(Tags.of("stage", stage))
                    .register(meterRegistry))
        .increment();
  }

  /** kind は in_flight(実行中の結果を共有) か recent(再利用窓内の完了結果) のいずれか。 */
  public void recordDispatchReuse(String kind) {
    reuseCounters
        .computeIfAbsent(
            kind,
            ignored ->
                Counter.builder(METRIC_DISPATCH_REUSE_TOTAL)
                    .description("Dispatches served without launching a new computation")
                    .tags(Tags.of("kind", kind))
                    .register(meterRegistry))
        .increment();
  }

  public void recordApiError(String code) {
    apiErrorCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_API_ERROR_TOTAL)
                    .description("Stats API errors by code")
                    .tags(Tags.of("code", code))
                    .register(meterRegistry))
        .increment();
  }
}
