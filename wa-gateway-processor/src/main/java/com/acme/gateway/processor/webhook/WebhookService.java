package com.acme.gateway.processor.webhook;

import com.acme.gateway.config.QueuesConfig;
import com.acme.gateway.config.WebhookConfig;
import com.acme.gateway.error.GatewayException;
import com.acme.gateway.events.EventNames;
import com.acme.gateway.processor.queue.QueueManager;
import com.acme.gateway.queue.JobPayload.WebhookDelivery;
import com.acme.gateway.queue.JobPriority;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import com.acme.gateway.spi.AuditSink;
import com.acme.gateway.webhook.Webhook;
import com.acme.gateway.webhook.WebhookRegistry;
import com.acme.gateway.webhook.WebhookSigner;
import jakarta.inject.Singleton;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/** Webhook registration and event fan-out onto the webhook-delivery queue. */
@Slf4j
@Singleton
public class WebhookService {

  private static final int MAX_NAME_LENGTH = 100;
  private static final int MAX_URL_LENGTH = 2048;
  private static final int MAX_ATTEMPTS = 10;
  private static final long MIN_TIMEOUT_MS = 1000;
  private static final long MAX_TIMEOUT_MS = 30_000;

  private final WebhookRegistry registry;
  private final QueueManager queues;
  private final AuditSink audit;
  private final CircuitBreakerRegistry breakers;
  private final WebhookConfig config;
  private final QueuesConfig queuesConfig;
  private final Clock clock;

  public WebhookService(
      WebhookRegistry registry,
      QueueManager queues,
      AuditSink audit,
      CircuitBreakerRegistry breakers,
      WebhookConfig config,
      QueuesConfig queuesConfig,
      Clock clock) {
    this.registry = registry;
    this.queues = queues;
    this.audit = audit;
    this.breakers = breakers;
    this.config = config;
    this.queuesConfig = queuesConfig;
    this.clock = clock;
  }

  /** The returned webhook carries the generated secret; this is the only time it is exposed. */
  public Webhook create(WebhookRequest request, String actor) {
    if (registry.count() >= config.getMaxWebhooks()) {
      throw GatewayException.validation("Webhook limit reached");
    }
    requireText(request.name(), "name");
    requireText(request.url(), "url");
    Instant now = clock.instant();
    Webhook webhook =
        validated(
            new Webhook(
                UUID.randomUUID().toString(),
                request.name(),
                request.url(),
                WebhookSigner.newSecret(),
                request.events(),
                request.sessionIds(),
                request.active() == null || request.active(),
                request.maxAttempts() != null
                    ? request.maxAttempts()
                    : queuesConfig.getWebhook().getMaxAttempts(),
                request.timeoutMs() != null
                    ? Duration.ofMillis(request.timeoutMs())
                    : config.getTimeout(),
                now,
                now));
    registry.save(webhook);
    log.info("Webhook created id={} name={} url={}", webhook.id(), webhook.name(), webhook.url());
    audit.success("webhook.created", actor, Map.of("webhookId", webhook.id(), "url", webhook.url()));
    return webhook;
  }

  public Webhook update(String id, WebhookRequest request, String actor) {
    Webhook current = get(id);
    Webhook updated =
        validated(
            new Webhook(
                id,
                request.name() != null ? request.name() : current.name(),
                request.url() != null ? request.url() : current.url(),
                current.secret(),
                request.events() != null ? request.events() : current.events(),
                request.sessionIds() != null ? request.sessionIds() : current.sessionIds(),
                request.active() != null ? request.active() : current.active(),
                request.maxAttempts() != null ? request.maxAttempts() : current.maxAttempts(),
                request.timeoutMs() != null
                    ? Duration.ofMillis(request.timeoutMs())
                    : current.timeout(),
                current.createdAt(),
                clock.instant()));
    registry.save(updated);
    audit.success("webhook.updated", actor, Map.of("webhookId", id));
    return updated;
  }

  public void delete(String id, String actor) {
    if (!registry.delete(id)) {
      throw GatewayException.notFound("Webhook");
    }
    breakers.remove(CircuitBreakerRegistry.WEBHOOK, id);
    log.info("Webhook deleted id={}", id);
    audit.success("webhook.deleted", actor, Map.of("webhookId", id));
  }

  public Webhook get(String id) {
    return registry.find(id).orElseThrow(() -> GatewayException.notFound("Webhook"));
  }

  public List<Webhook> list() {
    return registry.list();
  }

  /** Enqueues one delivery per active webhook whose event and session filters match. */
  public int dispatch(String event, String sessionId, Map<String, Object> data) {
    int enqueued = 0;
    for (Webhook webhook : registry.list()) {
      if (!webhook.matches(event, sessionId)) {
        continue;
      }
      Map<String, Object> envelope = new LinkedHashMap<>();
      envelope.put("id", UUID.randomUUID().toString());
      envelope.put("event", event);
      envelope.put("timestamp", clock.instant().toString());
      envelope.put("sessionId", sessionId);
      envelope.put("data", data);
      queues
          .webhooks()
          .enqueue(
              new WebhookDelivery(
                  webhook.id(), webhook.url(), webhook.secret(), envelope, webhook.timeout()),
              JobPriority.NORMAL,
              webhook.maxAttempts());
      enqueued++;
    }
    if (enqueued > 0) {
      log.debug("Dispatched event={} sessionId={} to {} webhook(s)", event, sessionId, enqueued);
    }
    return enqueued;
  }

  private Webhook validated(Webhook webhook) {
    if (webhook.name().isBlank() || webhook.name().length() > MAX_NAME_LENGTH) {
      throw GatewayException.validation("name must be 1-" + MAX_NAME_LENGTH + " characters");
    }
    validateUrl(webhook.url());
    for (String event : webhook.events()) {
      if (!EventNames.WEBHOOK_EVENTS.contains(event)) {
        throw GatewayException.validation("Unsupported event: " + event);
      }
    }
    if (webhook.maxAttempts() < 1 || webhook.maxAttempts() > MAX_ATTEMPTS) {
      throw GatewayException.validation("maxAttempts must be between 1 and " + MAX_ATTEMPTS);
    }
    long timeoutMs = webhook.timeout().toMillis();
    if (timeoutMs < MIN_TIMEOUT_MS || timeoutMs > MAX_TIMEOUT_MS) {
      throw GatewayException.validation(
          "timeoutMs must be between " + MIN_TIMEOUT_MS + " and " + MAX_TIMEOUT_MS);
    }
    return webhook;
  }

  private static void validateUrl(String url) {
    if (url.length() > MAX_URL_LENGTH) {
      throw GatewayException.validation("url too long");
    }
    try {
      URI uri = new URI(url);
      String scheme = uri.getScheme();
      if (scheme == null
          || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
          || uri.getHost() == null) {
        throw GatewayException.validation("url must be an absolute http(s) URL");
      }
    } catch (URISyntaxException e) {
      throw GatewayException.validation("url must be an absolute http(s) URL");
    }
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw GatewayException.validation(field + " required");
    }
  }
}
