package com.acme.gateway.web;

import com.acme.gateway.processor.webhook.WebhookRequest;
import com.acme.gateway.processor.webhook.WebhookService;
import com.acme.gateway.webhook.Webhook;
import com.acme.gateway.webhook.WebhookDeliveryStats;
import com.acme.gateway.webhook.WebhookRegistry;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Patch;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Controller("/api/webhooks")
@ExecuteOn(TaskExecutors.BLOCKING)
public class WebhookController {

  private final WebhookService webhooks;
  private final WebhookRegistry registry;
  private final IdentityResolver identities;

  public WebhookController(
      WebhookService webhooks, WebhookRegistry registry, IdentityResolver identities) {
    this.webhooks = webhooks;
    this.registry = registry;
    this.identities = identities;
  }

  /** Secrets are never listed; callers see them only in this response. */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record WebhookView(
      String id,
      String name,
      String url,
      String secret,
      List<String> events,
      List<String> sessionIds,
      boolean active,
      int maxAttempts,
      long timeoutMs,
      Instant createdAt,
      Instant updatedAt,
      WebhookDeliveryStats delivery) {

    static WebhookView of(Webhook w, String secret, WebhookDeliveryStats stats) {
      return new WebhookView(
          w.id(),
          w.name(),
          w.url(),
          secret,
          w.events(),
          w.sessionIds(),
          w.active(),
          w.maxAttempts(),
          w.timeout().toMillis(),
          w.createdAt(),
          w.updatedAt(),
          stats);
    }
  }

  @Post
  public HttpResponse<ApiResponse<WebhookView>> create(
      HttpRequest<?> request, @Body WebhookRequest body) {
    Webhook created = webhooks.create(body, identities.resolve(request));
    return Responses.created(WebhookView.of(created, created.secret(), null));
  }

  @Get
  public HttpResponse<ApiResponse<List<WebhookView>>> list() {
    return Responses.ok(
        webhooks.list().stream().map(w -> WebhookView.of(w, null, registry.stats(w.id()))).toList());
  }

  @Get("/{id}")
  public HttpResponse<ApiResponse<WebhookView>> get(@PathVariable String id) {
    return Responses.ok(WebhookView.of(webhooks.get(id), null, registry.stats(id)));
  }

  @Patch("/{id}")
  public HttpResponse<ApiResponse<WebhookView>> update(
      HttpRequest<?> request, @PathVariable String id, @Body WebhookRequest body) {
    Webhook updated = webhooks.update(id, body, identities.resolve(request));
    return Responses.ok(WebhookView.of(updated, null, registry.stats(id)));
  }

  @Delete("/{id}")
  public HttpResponse<ApiResponse<Map<String, Object>>> delete(
      HttpRequest<?> request, @PathVariable String id) {
    webhooks.delete(id, identities.resolve(request));
    return Responses.ok(Map.of("deleted", true, "id", id));
  }
}
