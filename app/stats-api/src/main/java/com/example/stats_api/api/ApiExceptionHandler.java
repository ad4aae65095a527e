package com.example.stats_api.api;

import com.example.stats_api.service.DispatchException;
import com.example.stats_api.service.IdentityIntegrationException;
import com.example.stats_api.service.InconsistentResultException;
import com.example.stats_api.service.MalformedPlayerInputException;
import com.example.stats_api.service.ResultStoreException;
import com.example.stats_api.service.StatsConfigurationException;
import com.example.stats_api.service.StatsMetrics;
import com.example.stats_api.service.StatsPipelineException;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private final StatsMetrics statsMetrics;

  @ExceptionHandler(StatsPipelineException.class)
  public ResponseEntity<ApiErrorResponse> handlePipelineFailure(StatsPipelineException ex) {
    final RuntimeException cause = ex.getCause();
    final ErrorMapping mapping = mapCause(cause);
    if (mapping.status().is5xxServerError()) {
      logger.warn(
          "stats request failed stage={} code={}", ex.stage().value(), mapping.code(), cause);
    }
    statsMetrics.recordApiError(mapping.code());
    return ResponseEntity.status(mapping.status())
        .body(new ApiErrorResponse(mapping.code(), cause.getMessage(), ex.stage().value()));
  }

  @ExceptionHandler(MalformedPlayerInputException.class)
  public ResponseEntity<ApiErrorResponse> handleMalformedInput(MalformedPlayerInputException ex) {
    statsMetrics.recordApiError("STATS_BAD_REQUEST");
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("STATS_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining(", "));
    statsMetrics.recordApiError("STATS_VALIDATION_ERROR");
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            new ApiErrorResponse(
                "STATS_VALIDATION_ERROR",
                message.isEmpty() ? "request validation failed" : message));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    statsMetrics.recordApiError("STATS_VALIDATION_ERROR");
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("STATS_VALIDATION_ERROR", "request body is not readable"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unexpected stats api failure", ex);
    statsMetrics.recordApiError("STATS_INTERNAL_ERROR");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("STATS_INTERNAL_ERROR", ex.getMessage()));
  }

  private ErrorMapping mapCause(RuntimeException cause) {
    if (cause instanceof MalformedPlayerInputException) {
      return new ErrorMapping(HttpStatus.BAD_REQUEST, "STATS_BAD_REQUEST");
    }
    if (cause instanceof StatsConfigurationException) {
      return new ErrorMapping(HttpStatus.INTERNAL_SERVER_ERROR, "STATS_CONFIGURATION_ERROR");
    }
    if (cause instanceof IdentityIntegrationException identityFailure) {
      return switch (identityFailure.reason()) {
        case HTTP_STATUS -> new ErrorMapping(HttpStatus.BAD_GATEWAY, "IDENTITY_UPSTREAM_STATUS");
        case TIMEOUT -> new ErrorMapping(HttpStatus.GATEWAY_TIMEOUT, "IDENTITY_TIMEOUT");
        case TRANSPORT -> new ErrorMapping(HttpStatus.BAD_GATEWAY, "IDENTITY_TRANSPORT");
        case INVALID_RESPONSE -> new ErrorMapping(
            HttpStatus.BAD_GATEWAY, "IDENTITY_INVALID_RESPONSE");
      };
    }
    if (cause instanceof DispatchException dispatchFailure) {
      return switch (dispatchFailure.reason()) {
        case NON_ZERO_EXIT -> new ErrorMapping(HttpStatus.BAD_GATEWAY, "DISPATCH_FAILED");
        case LAUNCH_FAILED -> new ErrorMapping(
            HttpStatus.INTERNAL_SERVER_ERROR, "DISPATCH_LAUNCH_FAILED");
        case TIMEOUT -> new ErrorMapping(HttpStatus.GATEWAY_TIMEOUT, "DISPATCH_TIMEOUT");
        case INTERRUPTED -> new ErrorMapping(
            HttpStatus.SERVICE_UNAVAILABLE, "DISPATCH_INTERRUPTED");
      };
    }
    if (cause instanceof InconsistentResultException) {
      return new ErrorMapping(HttpStatus.INTERNAL_SERVER_ERROR, "STORE_INCONSISTENT");
    }
    if (cause instanceof ResultStoreException storeFailure) {
      return switch (storeFailure.reason()) {
        case NOT_FOUND -> new ErrorMapping(HttpStatus.NOT_FOUND, "STORE_NOT_FOUND");
        case DESERIALIZATION -> new ErrorMapping(HttpStatus.BAD_GATEWAY, "STORE_DESERIALIZATION");
        case TRANSPORT -> new ErrorMapping(HttpStatus.BAD_GATEWAY, "STORE_TRANSPORT");
      };
    }
    return new ErrorMapping(HttpStatus.INTERNAL_SERVER_ERROR, "STATS_INTERNAL_ERROR");
  }

  private record ErrorMapping(HttpStatus status, String code) {}
}
