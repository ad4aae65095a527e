package com.example.stats_api.service;

import com.example.stats_api.config.IdentityDirectoryProperties;
import com.example.stats_api.model.Cluster;
import com.example.stats_api.model.PlayerHandle;
import com.example.stats_api.model.PlayerIdentifier;
import com.example.stats_api.model.RegionClusters;
import com.example.stats_api.service.dto.IdentityDirectoryAccountResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * handle と region から不透明なプレイヤー識別子を引く ID ディレクトリクライアント。
 *
 * <p>未知の region は {@link RegionClusters#DEFAULT_CLUSTER} のエンドポイントへ問い合わせる。呼び出しは 1 回だけで、
 * リトライは呼び出し側の責務とする。
 */
@Service
public class PlayerIdentityClient {

  private static final Logger logger = LoggerFactory.getLogger(PlayerIdentityClient.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient identityRestClient;

  private final IdentityDirectoryProperties properties;

  public PlayerIdentityClient(
      RestClient identityRestClient, IdentityDirectoryProperties properties) {
    this.identityRestClient = identityRestClient;
    this.properties = properties;
  }

  public PlayerIdentifier resolve(PlayerHandle handle) {
    if (handle == null) {
      throw new MalformedPlayerInputException("handle is required");
    }
    if (!properties.hasCredential()) {
      throw new StatsConfigurationException("identity directory credential is not configured");
    }
    final Cluster cluster = handle.cluster();
    if (!RegionClusters.isKnown(handle.region())) {
      logger.info(
          "unknown region={} resolved with default cluster={}", handle.region(), cluster.value());
    }
    final IdentityDirectoryAccountResponse response = callDirectory(cluster, handle);
    if (response == null || response.puuid() == null || response.puuid().isBlank()) {
      logger.warn("identity directory response validation failed cluster={}", cluster.value());
      throw new IdentityIntegrationException(
          IdentityIntegrationException.Reason.INVALID_RESPONSE,
          "identity directory response has no identifier");
    }
    return new PlayerIdentifier(response.puuid());
  }

  private IdentityDirectoryAccountResponse callDirectory(Cluster cluster, PlayerHandle handle) {
    try {
      return identityRestClient
          .get()
          .uri(
              properties.endpointFor(cluster) + properties.resolvePath(),
              handle.gameName(),
              handle.tag())
          .header(properties.credentialHeaderName(), properties.credential())
          .retrieve()
          .body(IdentityDirectoryAccountResponse.class);
    } catch (RestClientResponseException ex) {
      final int status = ex.getStatusCode().value();
      logger.warn(
          "identity directory lookup failed with http status={} cluster={}",
          status,
          cluster.value());
      throw new IdentityIntegrationException(
          IdentityIntegrationException.Reason.HTTP_STATUS,
          "identity directory returned status " + status,
          status,
          ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("identity directory lookup timed out cluster={}", cluster.value());
        throw new IdentityIntegrationException(
            IdentityIntegrationException.Reason.TIMEOUT, "identity directory request timeout", ex);
      }
      logger.warn("identity directory connection failed cluster={}", cluster.value(), ex);
      throw new IdentityIntegrationException(
          IdentityIntegrationException.Reason.TRANSPORT,
          "identity directory connection failed",
          ex);
    } catch (RuntimeException ex) {
      logger.warn("identity directory response parse failed cluster={}", cluster.value(), ex);
      throw new IdentityIntegrationException(
          IdentityIntegrationException.Reason.INVALID_RESPONSE,
          "identity directory response parse failed",
          ex);
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
