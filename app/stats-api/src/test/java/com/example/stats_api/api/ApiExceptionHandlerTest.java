/*
 * どこで: Stats API 層テスト
 * 何を: 失敗段階と原因がステータス/コード/段階名へ正しく変換されることを検証する
 * なぜ: 上流障害と入力不正の区別が応答で失われないようにするため
 */
package com.example.stats_api.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.example.stats_api.model.DispatchKey;
import com.example.stats_api.model.DispatchStage;
import com.example.stats_api.model.Period;
import com.example.stats_api.model.PipelineStage;
import com.example.stats_api.model.PlayerIdentifier;
import com.example.stats_api.service.DispatchException;
import com.example.stats_api.service.IdentityIntegrationException;
import com.example.stats_api.service.InconsistentResultException;
import com.example.stats_api.service.MalformedPlayerInputException;
import com.example.stats_api.service.ResultStoreException;
import com.example.stats_api.service.StatsConfigurationException;
import com.example.stats_api.service.StatsMetrics;
import com.example.stats_api.service.StatsPipelineException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class ApiExceptionHandlerTest {

  private final StatsMetrics metrics = Mockito.mock(StatsMetrics.class);
  private final ApiExceptionHandler handler = new ApiExceptionHandler(metrics);

  @Test
  void malformedInputMapsToBadRequestWithStage() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handlePipelineFailure(
            new StatsPipelineException(
                PipelineStage.RESOLVING,
                new MalformedPlayerInputException("handle must contain exactly one '#'")));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .isEqualTo(
            new ApiErrorResponse(
                "STATS_BAD_REQUEST", "handle must contain exactly one '#'", "resolving"));
    verify(metrics).recordApiError("STATS_BAD_REQUEST");
  }

  @Test
  void identityFailuresMapToGatewayStatuses() {
    final ResponseEntity<ApiErrorResponse> notFound =
        handler.handlePipelineFailure(
            new StatsPipelineException(
                PipelineStage.RESOLVING,
                new IdentityIntegrationException(
                    IdentityIntegrationException.Reason.HTTP_STATUS,
                    "identity directory returned status 404",
                    404,
                    null)));
    final ResponseEntity<ApiErrorResponse> timeout =
        handler.handlePipelineFailure(
            new StatsPipelineException(
                PipelineStage.RESOLVING,
                new IdentityIntegrationException(
                    IdentityIntegrationException.Reason.TIMEOUT,
                    "identity directory request timeout")));

    assertThat(notFound.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(notFound.getBody().message()).contains("404");
    assertThat(timeout.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
    verify(metrics).recordApiError("IDENTITY_UPSTREAM_STATUS");
    verify(metrics).recordApiError("IDENTITY_TIMEOUT");
  }

  @Test
  void dispatchFailuresCarryDiagnosticAndStage() {
    final ResponseEntity<ApiErrorResponse> failed =
        handler.handlePipelineFailure(
            new StatsPipelineException(
                PipelineStage.DISPATCHING,
                new DispatchException(
                    DispatchStage.INGESTION,
                    DispatchException.Reason.NON_ZERO_EXIT,
                    1,
                    "riot api returned 403",
                    "ingestion exited with status 1: riot api returned 403",
                    null)));
    final ResponseEntity<ApiErrorResponse> timedOut =
        handler.handlePipelineFailure(
            new StatsPipelineException(
                PipelineStage.DISPATCHING,
                new DispatchException(
                    DispatchStage.AGGREGATION,
                    DispatchException.Reason.TIMEOUT,
                    null,
                    "",
                    "aggregation timed out",
                    null)));

    assertThat(failed.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(failed.getBody().stage()).isEqualTo("dispatching");
    assertThat(failed.getBody().message()).contains("riot api returned 403");
    assertThat(timedOut.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
    verify(metrics).recordApiError("DISPATCH_FAILED");
    verify(metrics).recordApiError("DISPATCH_TIMEOUT");
  }

  @Test
  void storeFailuresMapByReason() {
    final ResponseEntity<ApiErrorResponse> notFound =
        handler.handlePipelineFailure(
            new StatsPipelineException(
                PipelineStage.FETCHING,
                new ResultStoreException(
                    ResultStoreException.Reason.NOT_FOUND, "result object not found")));
    final ResponseEntity<ApiErrorResponse> broken =
        handler.handlePipelineFailure(
            new StatsPipelineException(
                PipelineStage.FETCHING,
                new ResultStoreException(
                    ResultStoreException.Reason.DESERIALIZATION, "result object could not be parsed")));
    final ResponseEntity<ApiErrorResponse> inconsistent =
        handler.handlePipelineFailure(
            new StatsPipelineException(
                PipelineStage.FETCHING,
                new InconsistentResultException(
                    new DispatchKey(new PlayerIdentifier("P-123"), new Period("2024")), null)));

    assertThat(notFound.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(broken.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(inconsistent.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(inconsistent.getBody().message()).contains("P-123/2024");
    verify(metrics).recordApiError("STORE_NOT_FOUND");
    verify(metrics).recordApiError("STORE_DESERIALIZATION");
    verify(metrics).recordApiError("STORE_INCONSISTENT");
  }

  @Test
  void configurationFailureMapsToInternalError() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handlePipelineFailure(
            new StatsPipelineException(
                PipelineStage.RESOLVING,
                new StatsConfigurationException("identity directory credential is not configured")));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo("STATS_CONFIGURATION_ERROR");
    verify(metrics).recordApiError("STATS_CONFIGURATION_ERROR");
  }
}
