package com.acme.gateway.processor.config;

import com.acme.gateway.capability.CapabilityPolicy;
import com.acme.gateway.config.BreakersConfig;
import com.acme.gateway.config.QueuesConfig;
import com.acme.gateway.config.RateLimitingConfig;
import com.acme.gateway.config.WebhookConfig;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

  private final RateLimitingConfig rateLimiting;
  private final BreakersConfig breakers;
  private final QueuesConfig queues;
  private final WebhookConfig webhooks;
  private final CapabilityPolicy policy;

  @Property(name = "micronaut.server.port", defaultValue = "8080")
  private int serverPort;

  public ConfigurationLogger(
      RateLimitingConfig rateLimiting,
      BreakersConfig breakers,
      QueuesConfig queues,
      WebhookConfig webhooks,
      CapabilityPolicy policy) {
    this.rateLimiting = rateLimiting;
    this.breakers = breakers;
    this.queues = queues;
    this.webhooks = webhooks;
    this.policy = policy;
  }

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("                         EFFECTIVE CONFIGURATION                                ");
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("");

    LOG.info("━━━ Server ━━━");
    LOG.info("  Port:               {} (HTTP endpoint listening port)", serverPort);
    LOG.info("");

    LOG.info("━━━ Rate Limiting ━━━");
    LOG.info("  REST tier:          {}", rateLimiting.getRest());
    LOG.info("  Key overrides:      {} (API keys with their own REST limit)", rateLimiting.getKeyLimits().size());
    LOG.info("  Agent tier:         {} (never more permissive than REST)", rateLimiting.getAgent());
    LOG.info("  Cleanup Interval:   {} (Eviction sweep for idle identities)", rateLimiting.getCleanupInterval());
    LOG.info("");

    LOG.info("━━━ Circuit Breakers ━━━");
    breakers.toMap().forEach((name, config) -> LOG.info("  {}: {}", pad(name), config));
    LOG.info("");

    LOG.info("━━━ Queues ━━━");
    LOG.info("  Outgoing:           {}", queues.getOutgoing());
    LOG.info("  Webhook:            {}", queues.getWebhook());
    LOG.info("  Webhook Timeout:    {} (Hard per-delivery timeout)", webhooks.getTimeout());
    LOG.info("");

    LOG.info("━━━ Agent Capability Policy ━━━");
    LOG.info("  Allowlist:          {} entries", policy.getAllowed().size());
    LOG.info("  Denylist:           {} entries", policy.getDenied().size());
    LOG.info("");

    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("                      APPLICATION READY FOR TRAFFIC                             ");
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
  }

  private static String pad(String name) {
    return String.format("%-17s", name);
  }
}
