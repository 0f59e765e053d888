package com.acme.gateway.webhook;

import java.time.Instant;

public record WebhookDeliveryStats(
    long deliveryCount, long failureCount, Instant lastDeliveryAt, String lastDeliveryStatus) {

  public static final WebhookDeliveryStats EMPTY = new WebhookDeliveryStats(0, 0, null, null);

  public WebhookDeliveryStats succeeded(Instant at) {
    return new WebhookDeliveryStats(deliveryCount + 1, failureCount, at, "success");
  }

  public WebhookDeliveryStats failed(Instant at, String reason) {
    return new WebhookDeliveryStats(deliveryCount, failureCount + 1, at, "failed: " + reason);
  }
}
