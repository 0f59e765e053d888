package com.acme.gateway.processor.webhook;

import com.acme.gateway.webhook.Webhook;
import com.acme.gateway.webhook.WebhookDeliveryStats;
import com.acme.gateway.webhook.WebhookRegistry;
import jakarta.inject.Singleton;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Singleton
public class InMemoryWebhookRegistry implements WebhookRegistry {

  private final Map<String, Webhook> webhooks = new ConcurrentHashMap<>();
  private final Map<String, WebhookDeliveryStats> stats = new ConcurrentHashMap<>();

  @Override
  public Webhook save(Webhook webhook) {
    webhooks.put(webhook.id(), webhook);
    return webhook;
  }

  @Override
  public Optional<Webhook> find(String id) {
    return Optional.ofNullable(webhooks.get(id));
  }

  @Override
  public List<Webhook> list() {
    return webhooks.values().stream().sorted(Comparator.comparing(Webhook::createdAt)).toList();
  }

  @Override
  public boolean delete(String id) {
    stats.remove(id);
    return webhooks.remove(id) != null;
  }

  @Override
  public int count() {
    return webhooks.size();
  }

  @Override
  public void recordSuccess(String id, Instant at) {
    if (webhooks.containsKey(id)) {
      stats.merge(id, WebhookDeliveryStats.EMPTY.succeeded(at), (old, n) -> old.succeeded(at));
    }
  }

  @Override
  public void recordFailure(String id, Instant at, String reason) {
    if (webhooks.containsKey(id)) {
      stats.merge(
          id, WebhookDeliveryStats.EMPTY.failed(at, reason), (old, n) -> old.failed(at, reason));
    }
  }

  @Override
  public WebhookDeliveryStats stats(String id) {
    return stats.getOrDefault(id, WebhookDeliveryStats.EMPTY);
  }
}
