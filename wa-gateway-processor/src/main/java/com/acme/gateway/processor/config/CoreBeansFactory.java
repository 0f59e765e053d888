package com.acme.gateway.processor.config;

import com.acme.gateway.capability.CapabilityGateway;
import com.acme.gateway.capability.CapabilityPolicy;
import com.acme.gateway.capability.CapabilityRegistry;
import com.acme.gateway.config.BreakersConfig;
import com.acme.gateway.config.ConversationConfig;
import com.acme.gateway.config.GatewayPolicyConfig;
import com.acme.gateway.config.IdentityConfig;
import com.acme.gateway.config.QueuesConfig;
import com.acme.gateway.config.RateLimitingConfig;
import com.acme.gateway.config.WebhookConfig;
import com.acme.gateway.processor.capabilities.CapabilityProvider;
import com.acme.gateway.ratelimit.RateLimiter;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.List;
import okhttp3.OkHttpClient;

/**
 * Factory for creating core gateway beans with framework-specific configuration.
 *
 * <p>The core module stays free of framework dependencies; this factory binds its POJO
 * configuration to application.yml and wires the shared state objects (limiter table, breaker
 * registry, capability registry) as process-wide singletons.
 */
@Factory
public class CoreBeansFactory {

  /** Creates RateLimitingConfig bean populated from application.yml rate-limiting.* properties */
  @Singleton
  @ConfigurationProperties("rate-limiting")
  public RateLimitingConfig rateLimitingConfig() {
    return new RateLimitingConfig();
  }

  /** Creates BreakersConfig bean populated from application.yml circuit-breakers.* properties */
  @Singleton
  @ConfigurationProperties("circuit-breakers")
  public BreakersConfig breakersConfig() {
    return new BreakersConfig();
  }

  /** Creates QueuesConfig bean populated from application.yml queues.* properties */
  @Singleton
  @ConfigurationProperties("queues")
  public QueuesConfig queuesConfig() {
    return new QueuesConfig();
  }

  /** Creates IdentityConfig bean populated from application.yml identity.* properties */
  @Singleton
  @ConfigurationProperties("identity")
  public IdentityConfig identityConfig() {
    return new IdentityConfig();
  }

  /** Creates GatewayPolicyConfig bean populated from application.yml gateway.* properties */
  @Singleton
  @ConfigurationProperties("gateway")
  public GatewayPolicyConfig gatewayPolicyConfig() {
    return new GatewayPolicyConfig();
  }

  @Singleton
  @ConfigurationProperties("webhooks")
  public WebhookConfig webhookConfig() {
    return new WebhookConfig();
  }

  @Singleton
  @ConfigurationProperties("conversations")
  public ConversationConfig conversationConfig() {
    return new ConversationConfig();
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Singleton
  public RateLimiter rateLimiter(Clock clock) {
    return new RateLimiter(clock);
  }

  @Singleton
  public CircuitBreakerRegistry circuitBreakerRegistry(BreakersConfig config, Clock clock) {
    return new CircuitBreakerRegistry(config.toMap(), clock);
  }

  @Singleton
  public CapabilityPolicy capabilityPolicy(GatewayPolicyConfig config) {
    return new CapabilityPolicy(config.getAllowlist(), config.getDenylist());
  }

  /** Collects every provider's capabilities, then freezes the registry. */
  @Singleton
  public CapabilityRegistry capabilityRegistry(List<CapabilityProvider> providers) {
    CapabilityRegistry registry = new CapabilityRegistry();
    providers.forEach(provider -> provider.register(registry));
    registry.freeze();
    return registry;
  }

  /** Fails startup if the agent tier is more permissive than the REST tier. */
  @Singleton
  public CapabilityGateway capabilityGateway(
      CapabilityRegistry registry,
      CapabilityPolicy policy,
      RateLimiter rateLimiter,
      RateLimitingConfig rateLimiting,
      CircuitBreakerRegistry breakers) {
    rateLimiting.validate();
    return new CapabilityGateway(registry, policy, rateLimiter, rateLimiting.getAgent(), breakers);
  }

  /** Shared connection pool; per-delivery timeouts are applied on derived clients. */
  @Singleton
  public OkHttpClient okHttpClient(WebhookConfig config) {
    return new OkHttpClient.Builder()
        .callTimeout(config.getTimeout())
        .followRedirects(false)
        .build();
  }
}
