package com.example.stats_api.model;

/** ID ディレクトリサービスが返す不透明なプレイヤー識別子。解析も加工もしない。 */
public record PlayerIdentifier(String value) {

  public PlayerIdentifier {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("identifier is required");
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
