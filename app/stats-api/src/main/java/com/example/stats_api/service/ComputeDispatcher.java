/*
 * どこで: Stats API サービス層
 * 何を: 取り込み→集計の 2 ステージを順に起動し、結果ストアへの書き込みを外部ジョブに委ねる
 * なぜ: 「ジョブが走ったか」と「結果が読めるか」を分離し、読み取りは結果ストア側で行うため
 */
package com.example.stats_api.service;

import com.example.stats_api.config.DispatchProperties;
import com.example.stats_api.model.DispatchKey;
import com.example.stats_api.model.DispatchRequest;
import com.example.stats_api.model.DispatchStage;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ComputeDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(ComputeDispatcher.class);

  private final StageRunner stageRunner;
  private final DispatchProperties properties;
  private final StatsMetrics statsMetrics;

  /**
   * 役割: キーに対する統計ドキュメントを外部ジョブで(再)計算させる。
   * 動作: 取り込みが失敗した場合は集計を起動せず DispatchException を送出する。ドキュメントは返さない。
   * 前提: 外部ジョブは同一キーで再実行しても安全(冪等)であること。
   */
  public void ensureComputed(DispatchRequest request) {
    final DispatchKey key = request.key();
    runStage(DispatchStage.INGESTION, properties.ingestion(), ingestionArguments(request), key);
    runStage(
        DispatchStage.AGGREGATION, properties.aggregation(), aggregationArguments(request), key);
  }

  @VisibleForTesting
  List<String> ingestionArguments(DispatchRequest request) {
    final List<String> arguments = new ArrayList<>();
    arguments.add(request.handle().asHandleString());
    arguments.add(request.handle().region());
    arguments.add(request.key().period().value());
    if (request.limit() != null) {
      arguments.add(String.valueOf(request.limit()));
    }
    return arguments;
  }

  @VisibleForTesting
  List<String> aggregationArguments(DispatchRequest request) {
    final List<String> arguments = new ArrayList<>();
    arguments.add(request.key().identifier().value());
    arguments.add(request.key().period().value());
    if (request.limit() != null) {
      arguments.add(String.valueOf(request.limit()));
    }
    return arguments;
  }

  private void runStage(
      DispatchStage stage,
      DispatchProperties.StageProperties stageProperties,
      List<String> arguments,
      DispatchKey key) {
    final StageInvocation invocation =
        new StageInvocation(stage, stageProperties.command(), arguments, stageProperties.timeout());
    final int maxAttempts = stageProperties.maxRetries() + 1;
    for (int attempt = 1; ; attempt++) {
      statsMetrics.recordStageLaunch(stage.value());
      logger.info("dispatch stage started stage={} key={} attempt={}", stage.value(), key, attempt);
      final StageOutcome outcome = stageRunner.run(invocation);
      if (outcome.isSuccess()) {
        return;
      }
      final DispatchException failure = toException(stage, outcome);
      if (attempt >= maxAttempts || !isRetryable(outcome)) {
        logger.warn(
            "dispatch stage failed stage={} key={} reason={} exitStatus={}",
            stage.value(),
            key,
            failure.reason(),
            failure.exitStatus());
        throw failure;
      }
      final Duration backoff = computeBackoffDuration(attempt);
      logger.warn(
          "dispatch stage retry scheduled stage={} key={} attempt={} backoffMs={}",
          stage.value(),
          key,
          attempt,
          backoff.toMillis());
      sleep(stage, backoff);
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.retryBackoff().toMillis();
    final double exp = baseMillis * Math.pow(2.0d, attempt - 1);
    final double capped = Math.min(exp, properties.retryBackoffMax().toMillis());
    return Duration.ofMillis((long) Math.ceil(capped));
  }

  private boolean isRetryable(StageOutcome outcome) {
    return outcome.status() == StageOutcome.Status.FAILED
        || outcome.status() == StageOutcome.Status.TIMED_OUT;
  }

  private DispatchException toException(DispatchStage stage, StageOutcome outcome) {
    final String stageName = stage.value();
    return switch (outcome.status()) {
      case FAILED -> new DispatchException(
          stage,
          DispatchException.Reason.NON_ZERO_EXIT,
          outcome.exitStatus(),
          outcome.diagnostic(),
          stageName + " exited with status " + outcome.exitStatus() + ": " + outcome.diagnostic(),
          null);
      case LAUNCH_FAILED -> new DispatchException(
          stage,
          DispatchException.Reason.LAUNCH_FAILED,
          null,
          outcome.diagnostic(),
          stageName + " could not be launched: " + outcome.diagnostic(),
          outcome.failure());
      case TIMED_OUT -> new DispatchException(
          stage,
          DispatchException.Reason.TIMEOUT,
          null,
          outcome.diagnostic(),
          stageName + " timed out: " + outcome.diagnostic(),
          null);
      case INTERRUPTED -> new DispatchException(
          stage,
          DispatchException.Reason.INTERRUPTED,
          null,
          outcome.diagnostic(),
          stageName + " was interrupted",
          null);
      case SUCCEEDED -> throw new IllegalStateException("successful outcome is not a failure");
    };
  }

  private void sleep(DispatchStage stage, Duration backoff) {
    try {
      Thread.sleep(backoff.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new DispatchException(
          stage,
          DispatchException.Reason.INTERRUPTED,
          null,
          "",
          stage.value() + " retry wait was interrupted",
          ex);
    }
  }
}
