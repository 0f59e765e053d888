package com.acme.gateway.webhook;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A registered event receiver. Empty {@code events} or {@code sessionIds} lists match
 * everything.
 */
public record Webhook(
    String id,
    String name,
    String url,
    String secret,
    List<String> events,
    List<String> sessionIds,
    boolean active,
    int maxAttempts,
    Duration timeout,
    Instant createdAt,
    Instant updatedAt) {

  public Webhook {
    events = events == null ? List.of() : List.copyOf(events);
    sessionIds = sessionIds == null ? List.of() : List.copyOf(sessionIds);
  }

  public boolean matches(String event, String sessionId) {
    if (!active) {
      return false;
    }
    if (!events.isEmpty() && !events.contains(event)) {
      return false;
    }
    return sessionIds.isEmpty() || sessionIds.contains(sessionId);
  }

  @Override
  public String toString() {
    return "Webhook[id=" + id + ", name=" + name + ", url=" + url + ", active=" + active + "]";
  }
}
