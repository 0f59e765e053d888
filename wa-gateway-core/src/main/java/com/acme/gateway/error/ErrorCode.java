package com.acme.gateway.error;

/**
 * Closed set of error codes shared by the REST and agent adapters. Callers branch on the code
 * only; message text is not part of the contract.
 */
public enum ErrorCode {
  DENIED(403, false),
  NOT_FOUND(404, false),
  VALIDATION_ERROR(400, false),
  RATE_LIMITED(429, true),
  CIRCUIT_OPEN(503, true),
  TRANSIENT(503, true),
  INTERNAL(500, false);

  private final int httpStatus;
  private final boolean retryable;

  ErrorCode(int httpStatus, boolean retryable) {
    this.httpStatus = httpStatus;
    this.retryable = retryable;
  }

  public int httpStatus() {
    return httpStatus;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
