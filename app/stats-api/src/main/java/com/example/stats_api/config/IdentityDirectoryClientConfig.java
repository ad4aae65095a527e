/*
 * どこで: Stats API 設定
 * 何を: ID ディレクトリ呼び出し専用 RestClient を提供する
 * なぜ: クラスタごとに接続先が変わるため baseUrl を持たせず、タイムアウトだけを固定するため
 */
package com.example.stats_api.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(IdentityDirectoryProperties.class)
public class IdentityDirectoryClientConfig {

  @Bean
  RestClient identityRestClient(
      RestClient.Builder builder, IdentityDirectoryProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout((int) properties.connectTimeout().toMillis());
    requestFactory.setReadTimeout((int) properties.readTimeout().toMillis());
    return builder.requestFactory(requestFactory).build();
  }
}
