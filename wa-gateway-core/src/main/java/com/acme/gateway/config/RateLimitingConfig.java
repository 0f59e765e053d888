package com.acme.gateway.config;

import com.acme.gateway.ratelimit.RateLimitConfig;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Rate limit tiers per adapter. The agent tier may never be more permissive than the REST tier;
 * {@link #validate()} enforces that at startup. Pure POJO - no framework dependencies.
 */
public class RateLimitingConfig {

  private RateLimitConfig rest = RateLimitConfig.restDefaults();
  private RateLimitConfig agent = RateLimitConfig.agentDefaults();
  private Duration cleanupInterval = Duration.ofMinutes(1);
  private Map<String, Integer> keyLimits = new HashMap<>();

  public RateLimitConfig getRest() {
    return rest;
  }

  public void setRest(RateLimitConfig rest) {
    rest.setName("rest");
    this.rest = rest;
  }

  public RateLimitConfig getAgent() {
    return agent;
  }

  public void setAgent(RateLimitConfig agent) {
    agent.setName("agent");
    this.agent = agent;
  }

  public Duration getCleanupInterval() {
    return cleanupInterval;
  }

  public void setCleanupInterval(Duration cleanupInterval) {
    this.cleanupInterval = cleanupInterval;
  }

  /** Sustained REST limits per API key id, replacing the tier default for that key. */
  public Map<String, Integer> getKeyLimits() {
    return keyLimits;
  }

  public void setKeyLimits(Map<String, Integer> keyLimits) {
    this.keyLimits = keyLimits == null ? new HashMap<>() : new HashMap<>(keyLimits);
  }

  /** REST tier for a caller; the burst settings are never overridden. */
  public RateLimitConfig restFor(String apiKeyId) {
    Integer limit = apiKeyId == null ? null : keyLimits.get(apiKeyId);
    return limit == null ? rest : rest.withLimit(limit);
  }

  /**
   * @throws IllegalStateException if the agent tier admits more than the REST tier, either the
   *     default one or the one any API key override produces
   */
  public RateLimitingConfig validate() {
    if (!agent.isNoMorePermissiveThan(rest)) {
      throw new IllegalStateException(
          "Agent rate limit " + agent + " must not be more permissive than REST limit " + rest);
    }
    keyLimits.forEach(
        (key, limit) -> {
          if (limit == null || limit < 1) {
            throw new IllegalStateException("Rate limit for key " + key + " must be positive");
          }
          if (!agent.isNoMorePermissiveThan(restFor(key))) {
            throw new IllegalStateException(
                "Rate limit " + limit + " for key " + key + " is below the agent limit " + agent);
          }
        });
    return this;
  }
}
