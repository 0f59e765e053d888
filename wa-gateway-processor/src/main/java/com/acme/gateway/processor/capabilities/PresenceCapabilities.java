package com.acme.gateway.processor.capabilities;

import com.acme.gateway.capability.Capability;
import com.acme.gateway.capability.CapabilityRegistry;
import com.acme.gateway.capability.ParamSchema;
import com.acme.gateway.processor.presence.PresenceService;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * {@code set_typing} is agent-visible; {@code update_presence} changes the account's own
 * presence and is registered for REST only.
 */
@Singleton
public class PresenceCapabilities implements CapabilityProvider {

  public static final String SET_TYPING = "set_typing";
  public static final String UPDATE_PRESENCE = "update_presence";

  private static final long DEFAULT_TYPING_MS = 3000;
  private static final long MAX_TYPING_MS = 60_000;

  private final PresenceService presence;

  public PresenceCapabilities(PresenceService presence) {
    this.presence = presence;
  }

  @Override
  public void register(CapabilityRegistry registry) {
    registry.register(
        new Capability(
            SET_TYPING,
            "Show typing indicator in a WhatsApp chat",
            CircuitBreakerRegistry.WHATSAPP,
            ParamSchema.builder()
                .sessionId()
                .jid("jid", "Chat JID to show typing in")
                .integer("duration", 0, MAX_TYPING_MS, "Duration in ms (default 3000)")
                .build(),
            this::typing));
    registry.register(
        new Capability(
            UPDATE_PRESENCE,
            "Set the account's own presence",
            CircuitBreakerRegistry.WHATSAPP,
            ParamSchema.builder()
                .sessionId()
                .oneOf("presence", Set.of("available", "unavailable"), true, "New presence")
                .build(),
            this::update));
  }

  private Object typing(Map<String, Object> args) {
    long duration = args.containsKey("duration") ? (Long) args.get("duration") : DEFAULT_TYPING_MS;
    String jid = (String) args.get("jid");
    presence.showTyping((String) args.get("sessionId"), jid, Duration.ofMillis(duration));
    return Map.of("jid", jid, "typing", true, "duration", duration);
  }

  private Object update(Map<String, Object> args) {
    String value = (String) args.get("presence");
    presence.updatePresence((String) args.get("sessionId"), value);
    return Map.of("presence", value, "updated", true);
  }
}
