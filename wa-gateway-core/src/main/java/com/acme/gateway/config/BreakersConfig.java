package com.acme.gateway.config;

import com.acme.gateway.resilience.CircuitBreakerConfig;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import java.util.LinkedHashMap;
import java.util.Map;

/** Circuit breaker thresholds per protected dependency. Pure POJO - no framework dependencies. */
public class BreakersConfig {

  private final Map<String, CircuitBreakerConfig> defaults = CircuitBreakerRegistry.defaultConfigs();

  private CircuitBreakerConfig database = defaults.get(CircuitBreakerRegistry.DATABASE);
  private CircuitBreakerConfig whatsapp = defaults.get(CircuitBreakerRegistry.WHATSAPP);
  private CircuitBreakerConfig webhook = defaults.get(CircuitBreakerRegistry.WEBHOOK);

  public CircuitBreakerConfig getDatabase() {
    return database;
  }

  public void setDatabase(CircuitBreakerConfig database) {
    this.database = database;
  }

  public CircuitBreakerConfig getWhatsapp() {
    return whatsapp;
  }

  public void setWhatsapp(CircuitBreakerConfig whatsapp) {
    this.whatsapp = whatsapp;
  }

  public CircuitBreakerConfig getWebhook() {
    return webhook;
  }

  public void setWebhook(CircuitBreakerConfig webhook) {
    this.webhook = webhook;
  }

  public Map<String, CircuitBreakerConfig> toMap() {
    Map<String, CircuitBreakerConfig> map = new LinkedHashMap<>();
    map.put(CircuitBreakerRegistry.DATABASE, database);
    map.put(CircuitBreakerRegistry.WHATSAPP, whatsapp);
    map.put(CircuitBreakerRegistry.WEBHOOK, webhook);
    return map;
  }
}
