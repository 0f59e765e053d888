package com.acme.gateway.web;

import com.acme.gateway.error.GatewayError;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MutableHttpResponse;

/** Builds envelope responses with the status and headers the error taxonomy prescribes. */
final class Responses {

  private Responses() {}

  static MutableHttpResponse<ApiResponse<Void>> error(GatewayError error) {
    MutableHttpResponse<ApiResponse<Void>> response =
        HttpResponse.<ApiResponse<Void>>status(HttpStatus.valueOf(error.httpStatus()))
            .body(ApiResponse.error(error));
    if (error.retryAfterSeconds() != null) {
      response.header(HttpHeaders.RETRY_AFTER, String.valueOf(error.retryAfterSeconds()));
    }
    return response;
  }

  static <T> MutableHttpResponse<ApiResponse<T>> ok(T data) {
    return HttpResponse.ok(ApiResponse.ok(data));
  }

  static <T> MutableHttpResponse<ApiResponse<T>> created(T data) {
    return HttpResponse.created(ApiResponse.ok(data));
  }

  static <T> MutableHttpResponse<ApiResponse<T>> accepted(T data) {
    return HttpResponse.<ApiResponse<T>>accepted().body(ApiResponse.ok(data));
  }
}
