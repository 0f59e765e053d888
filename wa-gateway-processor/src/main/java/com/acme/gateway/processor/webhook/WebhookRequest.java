package com.acme.gateway.processor.webhook;

import java.util.List;

/** Create or update input. On update, null fields keep their current value. */
public record WebhookRequest(
    String name,
    String url,
    List<String> events,
    List<String> sessionIds,
    Integer maxAttempts,
    Long timeoutMs,
    Boolean active) {}
