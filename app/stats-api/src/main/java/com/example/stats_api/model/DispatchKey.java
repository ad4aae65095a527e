/*
 * どこで: Stats API ドメインモデル
 * 何を: (識別子, 期間) の組を表現する
 * なぜ: 結果ストアのアドレスと多重ディスパッチ抑止のキーを同じ値で扱うため
 */
package com.example.stats_api.model;

import java.util.Objects;

public record DispatchKey(PlayerIdentifier identifier, Period period) {

  public DispatchKey {
    Objects.requireNonNull(identifier, "identifier is required");
    Objects.requireNonNull(period, "period is required");
  }

  @Override
  public String toString() {
    return identifier.value() + "/" + period.value();
  }
}
