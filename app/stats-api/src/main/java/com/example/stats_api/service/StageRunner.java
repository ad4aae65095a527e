package com.example.stats_api.service;

/**
 * 外部計算ステージを 1 回起動し、完了まで待って結果を返す。
 *
 * <p>実装は例外を送出せず、起動できなかった場合も {@link StageOutcome.Status#LAUNCH_FAILED} として返す。
 */
public interface StageRunner {

  StageOutcome run(StageInvocation invocation);
}
