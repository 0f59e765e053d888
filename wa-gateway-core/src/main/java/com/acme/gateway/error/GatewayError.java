package com.acme.gateway.error;

/**
 * Safe, caller-facing description of a failure. Never carries stack traces or internal
 * identifiers.
 */
public record GatewayError(ErrorCode code, String message, Long retryAfterSeconds) {

  public static GatewayError of(ErrorCode code, String message) {
    return new GatewayError(code, message, null);
  }

  public int httpStatus() {
    return code.httpStatus();
  }

  public boolean isTransient() {
    return code.isRetryable();
  }
}
