package com.acme.gateway.web;

import com.acme.gateway.processor.admin.OperationsService;
import com.acme.gateway.resilience.CircuitStats;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.List;

@Controller("/api/breakers")
@ExecuteOn(TaskExecutors.BLOCKING)
public class BreakerController {

  private final OperationsService operations;
  private final IdentityResolver identities;

  public BreakerController(OperationsService operations, IdentityResolver identities) {
    this.operations = operations;
    this.identities = identities;
  }

  @Get
  public HttpResponse<ApiResponse<List<CircuitStats>>> stats() {
    return Responses.ok(operations.breakerStats());
  }

  @Post("/{name}/reset")
  public HttpResponse<ApiResponse<CircuitStats>> reset(
      HttpRequest<?> request, @PathVariable String name) {
    return Responses.ok(operations.resetBreaker(name, identities.resolve(request)));
  }
}
