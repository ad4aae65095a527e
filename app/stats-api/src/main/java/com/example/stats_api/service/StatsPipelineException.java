/*
 * どこで: Stats API サービス層
 * 何を: パイプラインの FAILED 状態(失敗段階と原因)を表現する
 * なぜ: 応答に段階と原因の両方を載せて正確なメッセージを返すため
 */
package com.example.stats_api.service;

import com.example.stats_api.model.PipelineStage;

public class StatsPipelineException extends RuntimeException {

  private final PipelineStage stage;

  public StatsPipelineException(PipelineStage stage, RuntimeException cause) {
    super(stage.value() + " failed: " + cause.getMessage(), cause);
    this.stage = stage;
  }

  public PipelineStage stage() {
    return stage;
  }

  @Override
  public synchronized RuntimeException getCause() {
    return (RuntimeException) super.getCause();
  }
}
