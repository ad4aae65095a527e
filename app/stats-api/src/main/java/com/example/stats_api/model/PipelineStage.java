/*
 * どこで: Stats API ドメインモデル
 * 何を: 1 リクエスト内のパイプライン状態を定義する
 * なぜ: 失敗時にどの段階で止まったかを応答とメトリクスへ載せるため
 */
package com.example.stats_api.model;

public enum PipelineStage {
  RESOLVING("resolving"),
  DISPATCHING("dispatching"),
  FETCHING("fetching"),
  DONE("done");

  private final String value;

  PipelineStage(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
