package com.acme.gateway.config;

import java.time.Duration;

/** Outbound webhook delivery settings. Pure POJO - no framework dependencies. */
public class WebhookConfig {

  private Duration timeout = Duration.ofSeconds(10);
  private String userAgent = "WhatsApp-Gateway-Webhook/1.0";
  private int maxWebhooks = 100;

  /** Hard per-delivery timeout covering connect, write and read. */
  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public void setUserAgent(String userAgent) {
    this.userAgent = userAgent;
  }

  /** Upper bound on registered webhooks; creation beyond it is rejected. */
  public int getMaxWebhooks() {
    return maxWebhooks;
  }

  public void setMaxWebhooks(int maxWebhooks) {
    this.maxWebhooks = maxWebhooks;
  }

  @Override
  public String toString() {
    return "WebhookConfig{timeout=" + timeout + ", maxWebhooks=" + maxWebhooks + "}";
  }
}
