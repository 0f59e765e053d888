package com.acme.gateway.processor.webhook;

import com.acme.gateway.config.WebhookConfig;
import com.acme.gateway.core.Jsons;
import com.acme.gateway.core.TransientException;
import com.acme.gateway.queue.Job;
import com.acme.gateway.queue.JobHandler;
import com.acme.gateway.queue.JobPayload.WebhookDelivery;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import com.acme.gateway.webhook.WebhookRegistry;
import com.acme.gateway.webhook.WebhookSigner;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signed POST of one event envelope. Each attempt is bounded by the webhook's own call timeout
 * and guarded by a breaker per endpoint; non-2xx responses and I/O errors are retryable.
 */
@Singleton
public class WebhookDeliveryHandler implements JobHandler<WebhookDelivery> {
  private static final Logger LOG = LoggerFactory.getLogger(WebhookDeliveryHandler.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient client;
  private final WebhookRegistry registry;
  private final CircuitBreakerRegistry breakers;
  private final Clock clock;
  private final String userAgent;

  public WebhookDeliveryHandler(
      OkHttpClient client,
      WebhookRegistry registry,
      CircuitBreakerRegistry breakers,
      WebhookConfig config,
      Clock clock) {
    this.client = client;
    this.registry = registry;
    this.breakers = breakers;
    this.clock = clock;
    this.userAgent = config.getUserAgent();
  }

  @Override
  public Object handle(Job<WebhookDelivery> job) {
    WebhookDelivery delivery = job.getPayload();
    if (registry.find(delivery.webhookId()).isEmpty()) {
      LOG.info("Skipping delivery for deleted webhook id={}", delivery.webhookId());
      return Map.of("skipped", true);
    }
    String body = Jsons.toJson(delivery.envelope());
    try {
      int status =
          breakers
              .get(CircuitBreakerRegistry.WEBHOOK, delivery.webhookId())
              .execute(() -> post(delivery, body));
      registry.recordSuccess(delivery.webhookId(), clock.instant());
      LOG.debug("Webhook delivered id={} status={}", delivery.webhookId(), status);
      return Map.of("status", status);
    } catch (RuntimeException e) {
      registry.recordFailure(delivery.webhookId(), clock.instant(), e.getMessage());
      LOG.warn(
          "Webhook delivery failed id={} attempt={}: {}",
          delivery.webhookId(),
          job.getAttempts(),
          e.getMessage());
      throw e;
    }
  }

  private int post(WebhookDelivery delivery, String body) {
    Request request =
        new Request.Builder()
            .url(delivery.url())
            .post(RequestBody.create(body, JSON))
            .header("User-Agent", userAgent)
            .header(WebhookSigner.SIGNATURE_HEADER, WebhookSigner.sign(body, delivery.secret()))
            .header(WebhookSigner.ID_HEADER, delivery.webhookId())
            .header(WebhookSigner.EVENT_HEADER, String.valueOf(delivery.envelope().get("event")))
            .build();
    OkHttpClient timed = client.newBuilder().callTimeout(delivery.timeout()).build();
    try (Response response = timed.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new TransientException("HTTP " + response.code());
      }
      return response.code();
    } catch (IOException e) {
      throw new TransientException("Webhook request failed: " + e.getMessage(), e);
    }
  }
}
