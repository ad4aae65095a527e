/*
 * どこで: Stats API サービス層
 * 何を: 同一 DispatchKey への外部計算を同時に 1 つだけ走らせ、後続の呼び出しへ結果を共有する
 * なぜ: 同じキーで取り込み/集計が重なって起動し、結果ストアの 1 キー 1 ドキュメントを壊さないようにするため
 */
package com.example.stats_api.service;

import com.example.stats_api.config.DispatchProperties;
import com.example.stats_api.model.DispatchKey;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class DispatchSingleFlight {

  private static final Logger logger = LoggerFactory.getLogger(DispatchSingleFlight.class);

  private final ConcurrentMap<DispatchKey, CompletableFuture<Void>> inFlight =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<DispatchKey, Instant> completedAt = new ConcurrentHashMap<>();
  private final Executor dispatchExecutor;
  private final DispatchProperties properties;
  private final Clock clock;
  private final StatsMetrics statsMetrics;

  public DispatchSingleFlight(
      @Qualifier("dispatchExecutor") Executor dispatchExecutor,
      DispatchProperties properties,
      Clock clock,
      StatsMetrics statsMetrics) {
    this.dispatchExecutor = dispatchExecutor;
    this.properties = properties;
    this.clock = clock;
    this.statsMetrics = statsMetrics;
  }

  /**
   * 役割: キーに対する dispatch を高々 1 つだけ実行し、その完了まで呼び出し元を待たせる。
   * 動作:
   * - 実行中の dispatch があれば新たに起動せず、その結果(成功/例外)を共有する。
   * - dedup-window 内に成功済みの場合は起動せずに戻る。既定の 0s では常に再実行する。
   * - dispatch は専用 Executor 上で動くため、待機側が中断されても実行は最後まで続く。
   * - 待機はステージのタイムアウトとリトライから求めた上限まで。超えた場合は TIMEOUT とし、dispatch 自体は止めない。
   */
  public void execute(DispatchKey key, Runnable dispatch) {
    if (isRecentlyCompleted(key)) {
      statsMetrics.recordDispatchReuse("recent");
      logger.info("dispatch skipped within dedup window key={}", key);
      return;
    }
    final CompletableFuture<Void> candidate = new CompletableFuture<>();
    final CompletableFuture<Void> existing = inFlight.putIfAbsent(key, candidate);
    if (existing != null) {
      statsMetrics.recordDispatchReuse("in_flight");
      logger.info("dispatch already in flight, awaiting shared outcome key={}", key);
      await(key, existing);
      return;
    }
    launch(key, candidate, dispatch);
    await(key, candidate);
  }

  @VisibleForTesting
  boolean isInFlight(DispatchKey key) {
    return inFlight.containsKey(key);
  }

  private void launch(DispatchKey key, CompletableFuture<Void> future, Runnable dispatch) {
    try {
      dispatchExecutor.execute(() -> runDispatch(key, future, dispatch));
    } catch (RejectedExecutionException ex) {
      inFlight.remove(key, future);
      logger.warn("dispatch executor rejected key={}", key, ex);
      future.completeExceptionally(
          new DispatchException(
              null,
              DispatchException.Reason.LAUNCH_FAILED,
              null,
              ex.getMessage(),
              "dispatch could not be scheduled",
              ex));
    }
  }

  private void runDispatch(DispatchKey key, CompletableFuture<Void> future, Runnable dispatch) {
    try {
      dispatch.run();
      recordCompletion(key);
      settle(key, future, null);
    } catch (RuntimeException ex) {
      settle(key, future, ex);
    } finally {
      if (!future.isDone()) {
        settle(key, future, new IllegalStateException("dispatch aborted for " + key));
      }
    }
  }

  // エントリの削除は完了通知より先。完了後に来た呼び出しは新しい dispatch を起動する。
  private void settle(DispatchKey key, CompletableFuture<Void> future, RuntimeException failure) {
    inFlight.remove(key, future);
    if (failure == null) {
      future.complete(null);
    } else {
      future.completeExceptionally(failure);
    }
  }

  private void await(DispatchKey key, CompletableFuture<Void> future) {
    final Duration bound = properties.dispatchBound();
    try {
      future.get(bound.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      logger.warn(
          "dispatch wait exceeded bound, computation continues key={} boundMs={}",
          key,
          bound.toMillis());
      throw new DispatchException(
          null,
          DispatchException.Reason.TIMEOUT,
          null,
          "",
          "dispatch did not finish within " + bound,
          ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("dispatch wait interrupted, computation continues key={}", key);
      throw new DispatchException(
          null,
          DispatchException.Reason.INTERRUPTED,
          null,
          "",
          "dispatch wait was interrupted",
          ex);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new IllegalStateException("dispatch failed for " + key, ex.getCause());
    }
  }

  private boolean isRecentlyCompleted(DispatchKey key) {
    final Duration window = properties.dedupWindow();
    if (window.isZero()) {
      return false;
    }
    final Instant completed = completedAt.get(key);
    if (completed == null) {
      return false;
    }
    if (clock.instant().isBefore(completed.plus(window))) {
      return true;
    }
    completedAt.remove(key, completed);
    return false;
  }

  private void recordCompletion(DispatchKey key) {
    final Duration window = properties.dedupWindow();
    if (window.isZero()) {
      return;
    }
    final Instant now = clock.instant();
    completedAt.put(key, now);
    completedAt.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().plus(window)));
  }
}
