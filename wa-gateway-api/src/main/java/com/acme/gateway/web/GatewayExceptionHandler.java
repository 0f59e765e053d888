package com.acme.gateway.web;

import com.acme.gateway.error.GatewayException;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps {@link GatewayException} to its taxonomy status: DENIED 403, NOT_FOUND 404,
 * VALIDATION_ERROR 400, RATE_LIMITED 429, CIRCUIT_OPEN and TRANSIENT 503. Retry-After is set
 * when the error carries one.
 */
@Produces
@Singleton
public class GatewayExceptionHandler
    implements ExceptionHandler<GatewayException, HttpResponse<ApiResponse<Void>>> {
  private static final Logger LOG = LoggerFactory.getLogger(GatewayExceptionHandler.class);

  @Override
  public HttpResponse<ApiResponse<Void>> handle(HttpRequest request, GatewayException exception) {
    LOG.debug("{} {} -> {}", request.getMethod(), request.getPath(), exception.getCode());
    return Responses.error(exception.toError());
  }
}
