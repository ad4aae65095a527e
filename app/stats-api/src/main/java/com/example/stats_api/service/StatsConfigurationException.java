package com.example.stats_api.service;

/** 必須の認証情報や接続先が未設定。リトライせず運用者へそのまま伝える。 */
public class StatsConfigurationException extends RuntimeException {
  public StatsConfigurationException(String message) {
    super(message);
  }
}
