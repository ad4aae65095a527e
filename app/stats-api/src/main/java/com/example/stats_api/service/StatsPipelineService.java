package com.example.stats_api.service;

import com.example.stats_api.config.PipelineProperties;
import com.example.stats_api.model.DispatchKey;
import com.example.stats_api.model.DispatchRequest;
import com.example.stats_api.model.Period;
import com.example.stats_api.model.PipelineStage;
import com.example.stats_api.model.PlayerHandle;
import com.example.stats_api.model.PlayerIdentifier;
import com.example.stats_api.model.ResultDocument;
import com.example.stats_api.model.StatsResult;
import com.example.stats_api.repository.ResultDocumentRepository;
import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * handle 解決 → 外部計算ディスパッチ → 結果ストア読み取りを 1 リクエスト内で順に実行するオーケストレータ。
 *
 * <p>読み取り前に必ず再計算を起動する(常時リフレッシュ)。鮮度に応じてディスパッチを省く場合は、RESOLVING と DISPATCHING の間に結果の計算時刻を確認する段階を追加する。
 */
@Service
@RequiredArgsConstructor
public class StatsPipelineService {

  private static final Logger logger = LoggerFactory.getLogger(StatsPipelineService.class);

  private final PlayerIdentityClient playerIdentityClient;
  private final ComputeDispatcher computeDispatcher;
  private final DispatchSingleFlight dispatchSingleFlight;
  private final ResultDocumentRepository resultDocumentRepository;
  private final PipelineProperties properties;
  private final StatsMetrics statsMetrics;

  /**
   * 役割: handle/region/period から統計ドキュメントを返す。
   * 動作: 各段階の失敗は StatsPipelineException(段階, 原因) として送出し、以降の段階は実行しない。
   * ディスパッチ成功後に結果が存在しない場合は InconsistentResultException とし、空ドキュメントで代替しない。
   */
  public StatsResult compute(String handle, String region, String period, Integer limit) {
    try {
      final ResolvedPlayer resolved =
          inStage(PipelineStage.RESOLVING, () -> resolve(handle, region, period, limit));
      final DispatchKey key = new DispatchKey(resolved.identifier(), resolved.period());
      try (MDC.MDCCloseable ignored = MDC.putCloseable("dispatch_key", key.toString())) {
        inStage(
            PipelineStage.DISPATCHING,
            () -> {
              dispatchSingleFlight.execute(
                  key,
                  () ->
                      computeDispatcher.ensureComputed(
                          new DispatchRequest(key, resolved.handle(), limit)));
              return null;
            });
        final ResultDocument document =
            inStage(PipelineStage.FETCHING, () -> fetchAfterDispatch(key));
        statsMetrics.recordPipelineResult("success", PipelineStage.DONE.value());
        logger.info("stats pipeline done key={}", key);
        return new StatsResult(key.identifier(), key.period(), document);
      }
    } catch (StatsPipelineException ex) {
      statsMetrics.recordPipelineResult("error", ex.stage().value());
      throw ex;
    }
  }

  /** ディスパッチせずに保存済みドキュメントだけを返す。存在しない場合は NOT_FOUND のまま送出する。 */
  public StatsResult findStored(String identifier, String period) {
    try {
      final StatsResult result =
          inStage(
              PipelineStage.FETCHING,
              () -> {
                if (identifier == null || identifier.isBlank()) {
                  throw new MalformedPlayerInputException("identifier is required");
                }
                final DispatchKey key =
                    new DispatchKey(new PlayerIdentifier(identifier.trim()), Period.parse(period));
                final ResultDocument document =
                    withRetries(
                        properties.fetchMaxRetries(),
                        StatsPipelineService::isRetryableStoreFailure,
                        () -> resultDocumentRepository.get(key),
                        "result store read");
                return new StatsResult(key.identifier(), key.period(), document);
              });
      statsMetrics.recordPipelineResult("success", "stored");
      return result;
    } catch (StatsPipelineException ex) {
      statsMetrics.recordPipelineResult("error", ex.stage().value());
      throw ex;
    }
  }

  private ResolvedPlayer resolve(String handle, String region, String period, Integer limit) {
    if (limit != null && limit <= 0) {
      throw new MalformedPlayerInputException("limit must be a positive integer");
    }
    final PlayerHandle playerHandle = PlayerHandle.parse(handle, region);
    final Period parsedPeriod = Period.parse(period);
    final PlayerIdentifier identifier =
        withRetries(
            properties.resolveMaxRetries(),
            StatsPipelineService::isRetryableIdentityFailure,
            () -> playerIdentityClient.resolve(playerHandle),
            "identity resolve");
    return new ResolvedPlayer(playerHandle, parsedPeriod, identifier);
  }

  private ResultDocument fetchAfterDispatch(DispatchKey key) {
    try {
      return withRetries(
          properties.fetchMaxRetries(),
          StatsPipelineService::isRetryableStoreFailure,
          () -> resultDocumentRepository.get(key),
          "result store read");
    } catch (ResultStoreException ex) {
      if (ex.reason() == ResultStoreException.Reason.NOT_FOUND) {
        logger.error("dispatch reported success but result is missing key={}", key);
        throw new InconsistentResultException(key, ex);
      }
      throw ex;
    }
  }

  private <T> T inStage(PipelineStage stage, Supplier<T> action) {
    final long startedAt = System.nanoTime();
    try {
      final T value = action.get();
      statsMetrics.recordStageDuration(stage.value(), "success", elapsedSince(startedAt));
      return value;
    } catch (RuntimeException ex) {
      statsMetrics.recordStageDuration(stage.value(), "error", elapsedSince(startedAt));
      logger.warn("stats pipeline failed stage={} cause={}", stage.value(), ex.getMessage());
      throw new StatsPipelineException(stage, ex);
    }
  }

  private <T> T withRetries(
      int maxRetries, Predicate<RuntimeException> retryable, Supplier<T> action, String operation) {
    for (int attempt = 1; ; attempt++) {
      try {
        return action.get();
      } catch (RuntimeException ex) {
        if (attempt > maxRetries || !retryable.test(ex)) {
          throw ex;
        }
        final Duration backoff = properties.retryBackoff().multipliedBy(attempt);
        logger.warn(
            "{} failed, retrying attempt={} backoffMs={} cause={}",
            operation,
            attempt,
            backoff.toMillis(),
            ex.getMessage());
        if (!sleep(backoff)) {
          throw ex;
        }
      }
    }
  }

  private boolean sleep(Duration backoff) {
    try {
      Thread.sleep(backoff.toMillis());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static Duration elapsedSince(long startedAt) {
    return Duration.ofNanos(System.nanoTime() - startedAt);
  }

  private static boolean isRetryableIdentityFailure(RuntimeException ex) {
    return ex instanceof IdentityIntegrationException identityFailure
        && identityFailure.isRetryable();
  }

  private static boolean isRetryableStoreFailure(RuntimeException ex) {
    return ex instanceof ResultStoreException storeFailure
        && storeFailure.reason() == ResultStoreException.Reason.TRANSPORT;
  }

  private record ResolvedPlayer(PlayerHandle handle, Period period, PlayerIdentifier identifier) {}
}
