/*
 * どこで: Stats API 設定
 * 何を: 外部計算ディスパッチ専用のスレッドプールを提供する
 * なぜ: 待機中の呼び出し元が離脱しても実行中のステージを最後まで走らせるため
 */
package com.example.stats_api.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties({DispatchProperties.class, PipelineProperties.class})
public class DispatchConfig {

  @Bean
  ThreadPoolTaskExecutor dispatchExecutor(DispatchProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("stats-dispatch-");
    executor.setCorePoolSize(properties.executorPoolSize());
    executor.setMaxPoolSize(properties.executorPoolSize());
    // 待ち行列が溢れた場合は RejectedExecutionException となり LAUNCH_FAILED として返る。
    executor.setQueueCapacity(properties.executorQueueCapacity());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(properties.dispatchBound().toMillis());
    return executor;
  }
}
