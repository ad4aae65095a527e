package com.example.stats_api.service;

public class ResultStoreException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    DESERIALIZATION,
    TRANSPORT
  }

  private final Reason reason;

  public ResultStoreException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ResultStoreException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
