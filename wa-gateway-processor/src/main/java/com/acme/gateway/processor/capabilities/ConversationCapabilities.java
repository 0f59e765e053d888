package com.acme.gateway.processor.capabilities;

import com.acme.gateway.capability.Capability;
import com.acme.gateway.capability.CapabilityRegistry;
import com.acme.gateway.capability.ParamSchema;
import com.acme.gateway.processor.conversation.ConversationStateService;
import com.acme.gateway.processor.conversation.StateUpdate;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import jakarta.inject.Singleton;
import java.util.Map;
import java.util.Set;

/** Agent working memory: read, merge-update, append history, clear. */
@Singleton
public class ConversationCapabilities implements CapabilityProvider {

  public static final String GET_STATE = "get_conversation_state";
  public static final String UPDATE_STATE = "update_conversation_state";
  public static final String ADD_TO_HISTORY = "add_to_history";
  public static final String CLEAR_STATE = "clear_conversation_state";

  private static final int MAX_MAP_ENTRIES = 100;
  private static final long MAX_TTL_MINUTES = 43_200;

  private final ConversationStateService states;

  public ConversationCapabilities(ConversationStateService states) {
    this.states = states;
  }

  @Override
  public void register(CapabilityRegistry registry) {
    registry.register(
        new Capability(
            GET_STATE,
            "Get the stored conversation state for a chat",
            CircuitBreakerRegistry.DATABASE,
            chat().build(),
            args -> states.get(session(args), jid(args))));
    registry.register(
        new Capability(
            UPDATE_STATE,
            "Merge context and metadata into the conversation state for a chat",
            CircuitBreakerRegistry.DATABASE,
            chat()
                .object("context", MAX_MAP_ENTRIES, "Context keys to merge")
                .object("metadata", MAX_MAP_ENTRIES, "Metadata keys to merge")
                .identifier("agentId", false, "Agent owning this conversation")
                .integer("ttlMinutes", 1, MAX_TTL_MINUTES, "Expire the state after this many minutes")
                .build(),
            this::update));
    registry.register(
        new Capability(
            ADD_TO_HISTORY,
            "Append a message to the conversation history",
            CircuitBreakerRegistry.DATABASE,
            chat()
                .oneOf("role", Set.of("user", "assistant", "system"), true, "Message author role")
                .text("content", true, "Message content")
                .build(),
            args ->
                states.addToHistory(
                    session(args),
                    jid(args),
                    (String) args.get("role"),
                    (String) args.get("content"))));
    registry.register(
        new Capability(
            CLEAR_STATE,
            "Delete the conversation state for a chat",
            CircuitBreakerRegistry.DATABASE,
            chat().build(),
            args -> Map.of("cleared", states.clear(session(args), jid(args)))));
  }

  @SuppressWarnings("unchecked")
  private Object update(Map<String, Object> args) {
    StateUpdate update =
        new StateUpdate(
            (Map<String, Object>) args.get("context"),
            null,
            (Map<String, Object>) args.get("metadata"),
            (String) args.get("agentId"),
            (Long) args.get("ttlMinutes"));
    return states.update(session(args), jid(args), update);
  }

  private static ParamSchema.Builder chat() {
    return ParamSchema.builder().sessionId().jid("jid", "Chat JID");
  }

  private static String session(Map<String, Object> args) {
    return (String) args.get("sessionId");
  }

  private static String jid(Map<String, Object> args) {
    return (String) args.get("jid");
  }
}
