package com.example.stats_api.service;

public class IdentityIntegrationException extends RuntimeException {

  public enum Reason {
    HTTP_STATUS,
    TIMEOUT,
    TRANSPORT,
    INVALID_RESPONSE
  }

  private final Reason reason;
  private final Integer upstreamStatus;

  public IdentityIntegrationException(Reason reason, String message) {
    this(reason, message, null, null);
  }

  public IdentityIntegrationException(Reason reason, String message, Throwable cause) {
    this(reason, message, null, cause);
  }

  public IdentityIntegrationException(
      Reason reason, String message, Integer upstreamStatus, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.upstreamStatus = upstreamStatus;
  }

  public Reason reason() {
    return reason;
  }

  /** HTTP_STATUS の場合のみ値を持つ。 */
  public Integer upstreamStatus() {
    return upstreamStatus;
  }

  public boolean isRetryable() {
    return switch (reason) {
      case TIMEOUT, TRANSPORT -> true;
      case HTTP_STATUS -> upstreamStatus != null && (upstreamStatus == 429 || upstreamStatus >= 500);
      case INVALID_RESPONSE -> false;
    };
  }
}
