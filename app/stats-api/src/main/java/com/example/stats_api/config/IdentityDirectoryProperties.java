/*
 * どこで: Stats API 設定
 * 何を: ID ディレクトリサービス呼び出し設定(クラスタ別エンドポイント/認証情報/タイムアウト)を保持する
 * なぜ: クラスタ表と認証情報をコード外へ出し、リクエスト単位では変更させないため
 */
package com.example.stats_api.config;

import com.example.stats_api.model.Cluster;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "identity")
public record IdentityDirectoryProperties(
    Map<Cluster, String> endpoints,
    String credential,
    String credentialHeaderName,
    String resolvePath,
    Duration connectTimeout,
    Duration readTimeout) {

  public IdentityDirectoryProperties {
    final Map<Cluster, String> resolved = new EnumMap<>(Cluster.class);
    for (Cluster cluster : Cluster.values()) {
      final String configured = endpoints == null ? null : endpoints.get(cluster);
      resolved.put(
          cluster,
          configured == null || configured.isBlank()
              ? "https://" + cluster.value() + ".api.riotgames.com"
              : stripTrailingSlash(configured));
    }
    endpoints = Map.copyOf(resolved);
    credential = credential == null ? "" : credential.trim();
    credentialHeaderName =
        credentialHeaderName == null || credentialHeaderName.isBlank()
            ? "X-Riot-Token"
            : credentialHeaderName;
    resolvePath =
        resolvePath == null || resolvePath.isBlank()
            ? "/riot/account/v1/accounts/by-riot-id/{gameName}/{tagLine}"
            : resolvePath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }

  public String endpointFor(Cluster cluster) {
    return endpoints.get(cluster);
  }

  public boolean hasCredential() {
    return !credential.isBlank();
  }

  private static String stripTrailingSlash(String value) {
    final String trimmed = value.trim();
    return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
  }
}
