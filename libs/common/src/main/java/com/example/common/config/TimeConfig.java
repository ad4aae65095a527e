/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を DI 可能にする
 * なぜ: ディスパッチ再利用窓などの時刻判定をテストで固定時刻へ差し替えるため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
