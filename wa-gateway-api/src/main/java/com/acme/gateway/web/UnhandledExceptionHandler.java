package com.acme.gateway.web;

import com.acme.gateway.error.ErrorMapper;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/**
 * Last-resort handler. The stack trace is logged by {@link ErrorMapper}; the caller only sees
 * the taxonomy code and a fixed message.
 */
@Produces
@Singleton
public class UnhandledExceptionHandler
    implements ExceptionHandler<RuntimeException, HttpResponse<ApiResponse<Void>>> {

  @Override
  public HttpResponse<ApiResponse<Void>> handle(HttpRequest request, RuntimeException exception) {
    return Responses.error(ErrorMapper.map(exception));
  }
}
