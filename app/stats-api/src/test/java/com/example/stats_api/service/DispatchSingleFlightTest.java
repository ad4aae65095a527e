/*
 * どこで: Stats API サービス層テスト
 * 何を: 同一キーの同時ディスパッチが 1 回に集約され、結果(成功/失敗)が共有されることを検証する
 * なぜ: 取り込み/集計の多重起動で結果ストアが競合書き込みされる回帰を防ぐため
 */
package com.example.stats_api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.stats_api.config.DispatchProperties;
import com.example.stats_api.model.DispatchKey;
import com.example.stats_api.model.DispatchStage;
import com.example.stats_api.model.Period;
import com.example.stats_api.model.PlayerIdentifier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class DispatchSingleFlightTest {

  private static final DispatchKey KEY =
      new DispatchKey(new PlayerIdentifier("P-123"), new Period("2024"));

  private final ExecutorService dispatchExecutor = Executors.newFixedThreadPool(4);
  private final ExecutorService callers = Executors.newFixedThreadPool(4);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

  @AfterEach
  void shutdown() {
    dispatchExecutor.shutdownNow();
    callers.shutdownNow();
  }

  @Test
  void concurrentCallersForSameKeyShareOneDispatch() throws Exception {
    final DispatchSingleFlight singleFlight = newSingleFlight(Duration.ZERO, fixedClock());
    final AtomicInteger launches = new AtomicInteger();
    final CountDownLatch release = new CountDownLatch(1);
    final Runnable dispatch =
        () -> {
          launches.incrementAndGet();
          awaitLatch(release);
        };

    final CompletableFuture<Void> first =
        CompletableFuture.runAsync(() -> singleFlight.execute(KEY, dispatch), callers);
    waitUntil(() -> singleFlight.isInFlight(KEY));
    final CompletableFuture<Void> second =
        CompletableFuture.runAsync(() -> singleFlight.execute(KEY, dispatch), callers);
    waitUntil(() -> reuseCount("in_flight") == 1.0d);

    release.countDown();
    first.get(5, TimeUnit.SECONDS);
    second.get(5, TimeUnit.SECONDS);

    assertThat(launches.get()).isEqualTo(1);
    assertThat(singleFlight.isInFlight(KEY)).isFalse();
  }

  @Test
  void concurrentCallersShareDispatchFailure() throws Exception {
    final DispatchSingleFlight singleFlight = newSingleFlight(Duration.ZERO, fixedClock());
    final CountDownLatch release = new CountDownLatch(1);
    final Runnable dispatch =
        () -> {
          awaitLatch(release);
          throw new DispatchException(
              DispatchStage.INGESTION,
              DispatchException.Reason.NON_ZERO_EXIT,
              1,
              "boom",
              "ingestion exited with status 1: boom",
              null);
        };

    final AtomicReference<RuntimeException> firstFailure = new AtomicReference<>();
    final AtomicReference<RuntimeException> secondFailure = new AtomicReference<>();
    final CompletableFuture<Void> first =
        CompletableFuture.runAsync(() -> captureFailure(singleFlight, dispatch, firstFailure), callers);
    waitUntil(() -> singleFlight.isInFlight(KEY));
    final CompletableFuture<Void> second =
        CompletableFuture.runAsync(
            () -> captureFailure(singleFlight, dispatch, secondFailure), callers);
    waitUntil(() -> reuseCount("in_flight") == 1.0d);

    release.countDown();
    first.get(5, TimeUnit.SECONDS);
    second.get(5, TimeUnit.SECONDS);

    assertThat(firstFailure.get()).isInstanceOf(DispatchException.class);
    assertThat(secondFailure.get()).isSameAs(firstFailure.get());
  }

  @Test
  void sequentialCallsRedispatchWhenWindowIsZero() {
    final DispatchSingleFlight singleFlight = newSingleFlight(Duration.ZERO, fixedClock());
    final AtomicInteger launches = new AtomicInteger();

    singleFlight.execute(KEY, launches::incrementAndGet);
    singleFlight.execute(KEY, launches::incrementAndGet);

    assertThat(launches.get()).isEqualTo(2);
  }

  @Test
  void callWithinDedupWindowSkipsDispatch() {
    final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    final DispatchSingleFlight singleFlight = newSingleFlight(Duration.ofMinutes(5), clock);
    final AtomicInteger launches = new AtomicInteger();

    singleFlight.execute(KEY, launches::incrementAndGet);
    clock.advance(Duration.ofMinutes(1));
    singleFlight.execute(KEY, launches::incrementAndGet);

    assertThat(launches.get()).isEqualTo(1);
    assertThat(reuseCount("recent")).isEqualTo(1.0d);

    clock.advance(Duration.ofMinutes(5));
    singleFlight.execute(KEY, launches::incrementAndGet);

    assertThat(launches.get()).isEqualTo(2);
  }

  @Test
  void failedDispatchIsNotReusedWithinWindow() {
    final DispatchSingleFlight singleFlight =
        newSingleFlight(Duration.ofMinutes(5), fixedClock());
    final AtomicInteger launches = new AtomicInteger();

    assertThatThrownBy(
            () ->
                singleFlight.execute(
                    KEY,
                    () -> {
                      launches.incrementAndGet();
                      throw new IllegalStateException("stage crashed");
                    }))
        .isInstanceOf(IllegalStateException.class);
    singleFlight.execute(KEY, launches::incrementAndGet);

    assertThat(launches.get()).isEqualTo(2);
  }

  @Test
  void differentKeysDispatchIndependently() throws Exception {
    final DispatchSingleFlight singleFlight = newSingleFlight(Duration.ZERO, fixedClock());
    final DispatchKey otherKey = new DispatchKey(new PlayerIdentifier("P-456"), new Period("2024"));
    final AtomicInteger launches = new AtomicInteger();
    final CountDownLatch bothStarted = new CountDownLatch(2);
    final Runnable dispatch =
        () -> {
          launches.incrementAndGet();
          bothStarted.countDown();
          awaitLatch(bothStarted);
        };

    final CompletableFuture<Void> first =
        CompletableFuture.runAsync(() -> singleFlight.execute(KEY, dispatch), callers);
    final CompletableFuture<Void> second =
        CompletableFuture.runAsync(() -> singleFlight.execute(otherKey, dispatch), callers);
    first.get(5, TimeUnit.SECONDS);
    second.get(5, TimeUnit.SECONDS);

    assertThat(launches.get()).isEqualTo(2);
  }

  @Test
  void interruptedCallerStopsWaitingWhileDispatchContinues() throws Exception {
    final DispatchSingleFlight singleFlight = newSingleFlight(Duration.ZERO, fixedClock());
    final CountDownLatch release = new CountDownLatch(1);
    final CountDownLatch finished = new CountDownLatch(1);
    final AtomicReference<RuntimeException> failure = new AtomicReference<>();
    final Thread caller =
        new Thread(
            () ->
                captureFailure(
                    singleFlight,
                    () -> {
                      awaitLatch(release);
                      finished.countDown();
                    },
                    failure));
    caller.start();
    waitUntil(() -> singleFlight.isInFlight(KEY));

    caller.interrupt();
    caller.join(5000);

    assertThat(failure.get())
        .isInstanceOfSatisfying(
            DispatchException.class,
            ex -> assertThat(ex.reason()).isEqualTo(DispatchException.Reason.INTERRUPTED));
    assertThat(singleFlight.isInFlight(KEY)).isTrue();

    release.countDown();
    assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
    waitUntil(() -> !singleFlight.isInFlight(KEY));
  }

  @Test
  void rejectedScheduleIsReportedAsLaunchFailure() {
    final DispatchSingleFlight singleFlight =
        new DispatchSingleFlight(
            command -> {
              throw new RejectedExecutionException("queue full");
            },
            properties(Duration.ZERO),
            fixedClock(),
            new StatsMetrics(registry));

    assertThatThrownBy(() -> singleFlight.execute(KEY, () -> {}))
        .isInstanceOfSatisfying(
            DispatchException.class,
            ex -> assertThat(ex.reason()).isEqualTo(DispatchException.Reason.LAUNCH_FAILED));
    assertThat(singleFlight.isInFlight(KEY)).isFalse();
  }

  @Test
  void waitForQueuedDispatchIsBoundedByStageTimeouts() throws Exception {
    final ExecutorService singleThread = Executors.newSingleThreadExecutor();
    final CountDownLatch release = new CountDownLatch(1);
    try {
      final DispatchSingleFlight singleFlight =
          new DispatchSingleFlight(
              singleThread,
              properties(Duration.ZERO, Duration.ofMillis(100)),
              fixedClock(),
              new StatsMetrics(registry));
      final DispatchKey other =
          new DispatchKey(new PlayerIdentifier("P-999"), new Period("2024"));
      CompletableFuture.runAsync(
          () -> singleFlight.execute(other, () -> awaitLatch(release)), callers);
      waitUntil(() -> singleFlight.isInFlight(other));

      final CompletableFuture<Void> queued =
          CompletableFuture.runAsync(() -> singleFlight.execute(KEY, () -> {}), callers);

      assertThatThrownBy(() -> queued.get(5, TimeUnit.SECONDS))
          .hasCauseInstanceOf(DispatchException.class)
          .cause()
          .satisfies(
              ex ->
                  assertThat(((DispatchException) ex).reason())
                      .isEqualTo(DispatchException.Reason.TIMEOUT));
    } finally {
      release.countDown();
      singleThread.shutdownNow();
    }
  }

  @Test
  void saturatedExecutorIsReportedAsLaunchFailure() throws Exception {
    final ThreadPoolTaskExecutor saturated = new ThreadPoolTaskExecutor();
    saturated.setCorePoolSize(1);
    saturated.setMaxPoolSize(1);
    saturated.setQueueCapacity(0);
    saturated.initialize();
    final CountDownLatch release = new CountDownLatch(1);
    try {
      final DispatchSingleFlight singleFlight =
          new DispatchSingleFlight(
              saturated, properties(Duration.ZERO), fixedClock(), new StatsMetrics(registry));
      final DispatchKey other =
          new DispatchKey(new PlayerIdentifier("P-999"), new Period("2024"));
      CompletableFuture.runAsync(
          () -> singleFlight.execute(other, () -> awaitLatch(release)), callers);
      waitUntil(() -> saturated.getActiveCount() == 1);

      assertThatThrownBy(() -> singleFlight.execute(KEY, () -> {}))
          .isInstanceOfSatisfying(
              DispatchException.class,
              ex -> assertThat(ex.reason()).isEqualTo(DispatchException.Reason.LAUNCH_FAILED));
      assertThat(singleFlight.isInFlight(KEY)).isFalse();
    } finally {
      release.countDown();
      saturated.shutdown();
    }
  }

  private void captureFailure(
      DispatchSingleFlight singleFlight, Runnable dispatch, AtomicReference<RuntimeException> sink) {
    try {
      singleFlight.execute(KEY, dispatch);
    } catch (RuntimeException ex) {
      sink.set(ex);
    }
  }

  private double reuseCount(String kind) {
    final Counter counter = registry.find("stats.dispatch.reuse.total").tag("kind", kind).counter();
    return counter == null ? 0.0d : counter.count();
  }

  private DispatchSingleFlight newSingleFlight(Duration dedupWindow, Clock clock) {
    return new DispatchSingleFlight(
        dispatchExecutor, properties(dedupWindow), clock, new StatsMetrics(registry));
  }

  private static DispatchProperties properties(Duration dedupWindow) {
    return properties(dedupWindow, Duration.ofSeconds(10));
  }

  private static DispatchProperties properties(Duration dedupWindow, Duration stageTimeout) {
    final DispatchProperties.StageProperties stage =
        new DispatchProperties.StageProperties(List.of("true"), stageTimeout, 0);
    return new DispatchProperties(stage, stage, null, dedupWindow, null, null, 4, 16, 4000);
  }

  private static Clock fixedClock() {
    return Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
  }

  private static void awaitLatch(CountDownLatch latch) {
    try {
      if (!latch.await(5, TimeUnit.SECONDS)) {
        throw new IllegalStateException("latch was not released");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted", ex);
    }
  }

  private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition was not met within 5s");
      }
      Thread.sleep(10);
    }
  }

  private static final class MutableClock extends Clock {

    private volatile Instant now;

    private MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
