package com.example.stats_api.model;

/** 外部計算の 2 段階。INGESTION が成功した場合のみ AGGREGATION を起動する。 */
public enum DispatchStage {
  INGESTION("ingestion"),
  AGGREGATION("aggregation");

  private final String value;

  DispatchStage(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
