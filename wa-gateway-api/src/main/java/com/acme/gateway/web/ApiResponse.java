package com.acme.gateway.web;

import com.acme.gateway.error.GatewayError;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/** Response envelope shared by every endpoint: either {@code data} or {@code error}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, ErrorBody error, Meta meta) {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ErrorBody(String code, String message, Long retryAfter) {}

  public record Meta(String timestamp) {}

  public static <T> ApiResponse<T> ok(T data) {
    return new ApiResponse<>(true, data, null, now());
  }

  public static ApiResponse<Void> error(GatewayError error) {
    return new ApiResponse<>(
        false,
        null,
        new ErrorBody(error.code().name(), error.message(), error.retryAfterSeconds()),
        now());
  }

  private static Meta now() {
    return new Meta(Instant.now().toString());
  }
}
