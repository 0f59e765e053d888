package com.acme.gateway.error;

/** Unchecked failure tagged with an {@link ErrorCode}; the message must be safe to return. */
public class GatewayException extends RuntimeException {
  private final ErrorCode code;
  private final Long retryAfterSeconds;

  public GatewayException(ErrorCode code, String message) {
    this(code, message, null);
  }

  public GatewayException(ErrorCode code, String message, Long retryAfterSeconds) {
    super(message);
    this.code = code;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public ErrorCode getCode() {
    return code;
  }

  public Long getRetryAfterSeconds() {
    return retryAfterSeconds;
  }

  public GatewayError toError() {
    return new GatewayError(code, getMessage(), retryAfterSeconds);
  }

  public static GatewayException denied() {
    return new GatewayException(ErrorCode.DENIED, ErrorMapper.DENIED_MESSAGE);
  }

  public static GatewayException notFound(String what) {
    return new GatewayException(ErrorCode.NOT_FOUND, what + " not found");
  }

  public static GatewayException validation(String message) {
    return new GatewayException(ErrorCode.VALIDATION_ERROR, message);
  }

  public static GatewayException rateLimited(long retryAfterSeconds) {
    return new GatewayException(
        ErrorCode.RATE_LIMITED, "Too many requests. Please try again later.", retryAfterSeconds);
  }

  public static GatewayException unavailable(String message) {
    return new GatewayException(ErrorCode.TRANSIENT, message);
  }
}
