package com.acme.gateway.resilience;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One independent breaker per protected dependency. Breakers for dependencies without explicit
 * configuration are created on first use. A name of the form {@code family:key} (for example
 * {@code webhook:<id>}) takes the configuration of its family, so each endpoint gets its own
 * breaker with shared thresholds.
 */
public class CircuitBreakerRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

  public static final String DATABASE = "database";
  public static final String WHATSAPP = "whatsapp";
  public static final String WEBHOOK = "webhook";

  private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
  private final Map<String, CircuitBreakerConfig> configs;
  private final Clock clock;

  public CircuitBreakerRegistry(Map<String, CircuitBreakerConfig> configs, Clock clock) {
    this.configs = Map.copyOf(configs);
    this.clock = clock;
    this.configs.forEach(
        (name, config) -> {
          breakers.put(name, new CircuitBreaker(name, config, clock));
          LOG.info("Circuit breaker registered: {} ({})", name, config);
        });
  }

  /** Defaults for the dependencies this gateway talks to. */
  public static Map<String, CircuitBreakerConfig> defaultConfigs() {
    return Map.of(
        DATABASE, new CircuitBreakerConfig(5, Duration.ofSeconds(30), 3),
        WHATSAPP, new CircuitBreakerConfig(5, Duration.ofSeconds(60), 1),
        WEBHOOK, new CircuitBreakerConfig(5, Duration.ofSeconds(30), 1));
  }

  public CircuitBreaker get(String name) {
    return breakers.computeIfAbsent(
        name,
        n -> {
          LOG.info("Circuit breaker created with defaults: {}", n);
          return new CircuitBreaker(n, configFor(n), clock);
        });
  }

  public CircuitBreaker get(String family, String key) {
    return get(family + ":" + key);
  }

  private CircuitBreakerConfig configFor(String name) {
    CircuitBreakerConfig config = configs.get(name);
    if (config != null) {
      return config;
    }
    int sep = name.indexOf(':');
    if (sep > 0) {
      config = configs.get(name.substring(0, sep));
    }
    return config != null ? config : new CircuitBreakerConfig();
  }

  /** Drops a keyed breaker, e.g. when the endpoint it guards is deleted. */
  public void remove(String family, String key) {
    breakers.remove(family + ":" + key);
  }

  public Optional<CircuitBreaker> find(String name) {
    return Optional.ofNullable(breakers.get(name));
  }

  public Collection<CircuitBreaker> all() {
    return List.copyOf(breakers.values());
  }

  public List<CircuitStats> stats() {
    return breakers.values().stream().map(CircuitBreaker::getStats).toList();
  }
}
