package com.example.stats_api.config;

import java.net.URI;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

@Configuration
@EnableConfigurationProperties(ResultStoreProperties.class)
public class ResultStoreConfig {

  @Bean(destroyMethod = "close")
  S3Client resultStoreS3Client(ResultStoreProperties properties) {
    // 読み取り 1 回ごとの上限を apiCallTimeout で固定する。
    final S3ClientBuilder builder =
        S3Client.builder()
            .region(Region.of(properties.region()))
            .forcePathStyle(properties.forcePathStyle())
            .overrideConfiguration(
                ClientOverrideConfiguration.builder()
                    .apiCallTimeout(properties.readTimeout())
                    .build());
    if (properties.endpointOverride() != null) {
      builder.endpointOverride(URI.create(properties.endpointOverride()));
    }
    return builder.build();
  }
}
