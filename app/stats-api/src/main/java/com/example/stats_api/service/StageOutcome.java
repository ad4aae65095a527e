/*
 * どこで: Stats API サービス層
 * 何を: 外部ステージ実行の結果(成功/非ゼロ終了/起動失敗/タイムアウト/中断)を表現する
 * なぜ: 実行基盤(ローカルプロセス/コンテナ/RPC)に依らず同じ結果契約で扱うため
 */
package com.example.stats_api.service;

public record StageOutcome(Status status, Integer exitStatus, String diagnostic, Throwable failure) {

  public enum Status {
    SUCCEEDED,
    FAILED,
    LAUNCH_FAILED,
    TIMED_OUT,
    INTERRUPTED
  }

  public static StageOutcome succeeded() {
    return new StageOutcome(Status.SUCCEEDED, 0, "", null);
  }

  public static StageOutcome failed(int exitStatus, String diagnostic) {
    return new StageOutcome(Status.FAILED, exitStatus, diagnostic, null);
  }

  public static StageOutcome launchFailed(Throwable failure) {
    return new StageOutcome(Status.LAUNCH_FAILED, null, failure.getMessage(), failure);
  }

  public static StageOutcome timedOut(String diagnostic) {
    return new StageOutcome(Status.TIMED_OUT, null, diagnostic, null);
  }

  public static StageOutcome interrupted() {
    return new StageOutcome(Status.INTERRUPTED, null, "stage wait was interrupted", null);
  }

  public boolean isSuccess() {
    return status == Status.SUCCEEDED;
  }
}
