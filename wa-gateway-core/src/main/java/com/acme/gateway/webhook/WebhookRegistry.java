package com.acme.gateway.webhook;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Storage for webhook registrations and their delivery counters. */
public interface WebhookRegistry {

  Webhook save(Webhook webhook);

  Optional<Webhook> find(String id);

  List<Webhook> list();

  boolean delete(String id);

  int count();

  void recordSuccess(String id, Instant at);

  void recordFailure(String id, Instant at, String reason);

  WebhookDeliveryStats stats(String id);
}
