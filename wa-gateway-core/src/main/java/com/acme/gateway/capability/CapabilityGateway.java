package com.acme.gateway.capability;

import com.acme.gateway.error.ErrorMapper;
import com.acme.gateway.error.GatewayException;
import com.acme.gateway.ratelimit.RateLimitConfig;
import com.acme.gateway.ratelimit.RateLimitDecision;
import com.acme.gateway.ratelimit.RateLimiter;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single choke point between callers and domain capabilities.
 *
 * <p>The agent path ({@link #invoke}) runs: policy check, argument validation, agent-tier rate
 * limit, circuit breaker, handler. Denied names, whether denylisted, never allowlisted or not
 * registered, all yield the same {@code DENIED} result and touch nothing else.
 *
 * <p>The trusted path ({@link #execute}) is used by the REST adapter, which does its own
 * rate limiting and has no allowlist. It shares validation and breakers with the agent path so
 * both produce identical effects for the same action.
 */
public class CapabilityGateway {
  private static final Logger LOG = LoggerFactory.getLogger(CapabilityGateway.class);

  static final String ANONYMOUS = "anonymous";
  private static final int MAX_LOGGED_NAME = 64;

  private final CapabilityRegistry registry;
  private final CapabilityPolicy policy;
  private final RateLimiter rateLimiter;
  private final RateLimitConfig agentTier;
  private final CircuitBreakerRegistry breakers;

  public CapabilityGateway(
      CapabilityRegistry registry,
      CapabilityPolicy policy,
      RateLimiter rateLimiter,
      RateLimitConfig agentTier,
      CircuitBreakerRegistry breakers) {
    this.registry = registry;
    this.policy = policy;
    this.rateLimiter = rateLimiter;
    this.agentTier = agentTier;
    this.breakers = breakers;
  }

  public ToolResult invoke(String action, Map<String, Object> args, String identity) {
    String caller = identity == null || identity.isBlank() ? ANONYMOUS : identity;
    PolicyDecision decision = policy.decide(action);
    Optional<Capability> capability =
        decision.isDenied() ? Optional.empty() : registry.find(action);
    if (capability.isEmpty()) {
      LOG.warn(
          "Capability denied action={} decision={} identity={}",
          printable(action),
          decision.isDenied() ? decision : "UNREGISTERED",
          caller);
      return ToolResult.failed(GatewayException.denied().toError());
    }

    Capability cap = capability.get();
    try {
      Map<String, Object> valid = cap.schema().validate(args);
      RateLimitDecision admission = rateLimiter.admit(caller, agentTier);
      if (admission.rejected()) {
        throw GatewayException.rateLimited(admission.retryAfterSeconds());
      }
      return ToolResult.ok(guarded(cap, valid));
    } catch (RuntimeException e) {
      LOG.debug("Capability {} failed for identity={}: {}", cap.name(), caller, e.toString());
      return ToolResult.failed(ErrorMapper.map(e));
    }
  }

  /**
   * Runs a registered capability without the allowlist or agent rate limit.
   *
   * @throws GatewayException with {@code NOT_FOUND} if no capability has that name, or with the
   *     failure's own code
   */
  public Object execute(String action, Map<String, Object> args) {
    Capability cap =
        registry.find(action).orElseThrow(() -> GatewayException.notFound("Capability"));
    return guarded(cap, cap.schema().validate(args));
  }

  /** Capabilities an agent may see: allowed by policy and registered. */
  public List<Capability> listTools() {
    return registry.all().stream()
        .filter(c -> policy.decide(c.name()) == PolicyDecision.ALLOWED)
        .toList();
  }

  private Object guarded(Capability cap, Map<String, Object> valid) {
    if (cap.dependency() == null) {
      return cap.handler().invoke(valid);
    }
    return breakers.get(cap.dependency()).execute(() -> cap.handler().invoke(valid));
  }

  private static String printable(String action) {
    if (action == null) {
      return "<null>";
    }
    String cut = action.length() > MAX_LOGGED_NAME ? action.substring(0, MAX_LOGGED_NAME) : action;
    return cut.replaceAll("\\p{Cntrl}", "?");
  }
}
