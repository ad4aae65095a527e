/*
 * どこで: Stats API サービス層
 * 何を: 外部計算ステージの失敗を段階付きで表現する
 * なぜ: 非ゼロ終了・起動失敗・タイムアウトを呼び出し側で区別できるようにするため
 */
package com.example.stats_api.service;

import com.example.stats_api.model.DispatchStage;

public class DispatchException extends RuntimeException {

  public enum Reason {
    NON_ZERO_EXIT,
    LAUNCH_FAILED,
    TIMEOUT,
    INTERRUPTED
  }

  private final DispatchStage stage;
  private final Reason reason;
  private final Integer exitStatus;
  private final String diagnostic;

  public DispatchException(
      DispatchStage stage,
      Reason reason,
      Integer exitStatus,
      String diagnostic,
      String message,
      Throwable cause) {
    super(message, cause);
    this.stage = stage;
    this.reason = reason;
    this.exitStatus = exitStatus;
    this.diagnostic = diagnostic;
  }

  /** 呼び出し側の待機中断やスケジュール失敗など、特定ステージに属さない失敗では null。 */
  public DispatchStage stage() {
    return stage;
  }

  public Reason reason() {
    return reason;
  }

  public Integer exitStatus() {
    return exitStatus;
  }

  public String diagnostic() {
    return diagnostic;
  }
}
