package com.acme.gateway.events;

import java.time.Instant;
import java.util.Map;

/** Something that happened in a session, fanned out to in-process listeners and webhooks. */
public record DomainEvent(String name, Map<String, Object> payload, Instant timestamp) {

  public String sessionId() {
    Object id = payload.get("sessionId");
    return id == null ? null : id.toString();
  }
}
