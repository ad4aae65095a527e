package com.example.stats_api.service;

import com.example.stats_api.model.DispatchKey;

/** ディスパッチが成功を報告したのに結果オブジェクトが読めない状態。自動リトライしない。 */
public class InconsistentResultException extends RuntimeException {

  private final DispatchKey key;

  public InconsistentResultException(DispatchKey key, Throwable cause) {
    super("dispatch reported success but no result exists for " + key, cause);
    this.key = key;
  }

  public DispatchKey key() {
    return key;
  }
}
