package com.acme.gateway.web;

import com.acme.gateway.processor.queue.QueueManager;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import com.acme.gateway.resilience.CircuitState;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import java.util.Map;

@Controller("/health")
public class HealthController {

  private final CircuitBreakerRegistry breakers;
  private final QueueManager queues;

  public HealthController(CircuitBreakerRegistry breakers, QueueManager queues) {
    this.breakers = breakers;
    this.queues = queues;
  }

  @Get
  public HttpResponse<Map<String, Object>> health() {
    return HttpResponse.ok(Map.of("status", "UP", "breakers", breakers.stats(), "queues", queues.stats()));
  }

  @Get("/live")
  public HttpResponse<Map<String, String>> live() {
    return HttpResponse.ok(Map.of("status", "UP"));
  }

  /** Not ready while the messaging breaker is open. */
  @Get("/ready")
  public HttpResponse<Map<String, String>> ready() {
    boolean messagingOpen =
        breakers.get(CircuitBreakerRegistry.WHATSAPP).getState() == CircuitState.OPEN;
    if (messagingOpen) {
      return HttpResponse.<Map<String, String>>status(HttpStatus.SERVICE_UNAVAILABLE)
          .body(Map.of("status", "DEGRADED"));
    }
    return HttpResponse.ok(Map.of("status", "UP"));
  }
}
