package com.acme.gateway.web;

import io.micronaut.core.async.publisher.Publishers;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.Filter;
import io.micronaut.http.filter.HttpServerFilter;
import io.micronaut.http.filter.ServerFilterChain;
import java.util.UUID;
import org.reactivestreams.Publisher;

/** Hardening headers plus a request correlation id on every response. */
@Filter("/**")
public class SecurityHeadersFilter implements HttpServerFilter {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  private static final int MAX_REQUEST_ID_LENGTH = 128;

  @Override
  public Publisher<MutableHttpResponse<?>> doFilter(
      HttpRequest<?> request, ServerFilterChain chain) {
    String requestId = requestId(request);
    return Publishers.map(
        chain.proceed(request),
        response -> {
          response.header("X-Frame-Options", "DENY");
          response.header("X-Content-Type-Options", "nosniff");
          response.header("X-XSS-Protection", "1; mode=block");
          response.header("Referrer-Policy", "strict-origin-when-cross-origin");
          response.header("Content-Security-Policy", "default-src 'none'; frame-ancestors 'none'");
          response.header(REQUEST_ID_HEADER, requestId);
          return response;
        });
  }

  private static String requestId(HttpRequest<?> request) {
    String supplied = request.getHeaders().get(REQUEST_ID_HEADER);
    if (supplied != null && !supplied.isBlank() && supplied.length() <= MAX_REQUEST_ID_LENGTH) {
      return supplied;
    }
    return UUID.randomUUID().toString();
  }
}
