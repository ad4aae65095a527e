package com.example.stats_api.model;

import java.util.Objects;

/**
 * 外部計算 1 回分の入力。
 *
 * <p>{@code limit} は取り込みステージが扱う生データ件数の上限で、null の場合は上限なし。
 */
public record DispatchRequest(DispatchKey key, PlayerHandle handle, Integer limit) {

  public DispatchRequest {
    Objects.requireNonNull(key, "key is required");
    Objects.requireNonNull(handle, "handle is required");
    if (limit != null && limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
  }
}
