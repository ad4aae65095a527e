/*
 * どこで: Stats API ドメインモデル
 * 何を: ID ディレクトリサービスの地域クラスタを定義する
 * なぜ: region からエンドポイントを決める単位を列挙型で固定するため
 */
package com.example.stats_api.model;

public enum Cluster {
  AMERICAS("americas"),
  EUROPE("europe"),
  ASIA("asia"),
  SEA("sea");

  private final String value;

  Cluster(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
