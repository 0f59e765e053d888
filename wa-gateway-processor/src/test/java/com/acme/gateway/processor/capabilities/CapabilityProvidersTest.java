package com.acme.gateway.processor.capabilities;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.gateway.capability.Capability;
import com.acme.gateway.capability.CapabilityGateway;
import com.acme.gateway.capability.CapabilityPolicy;
import com.acme.gateway.capability.CapabilityRegistry;
import com.acme.gateway.capability.PolicyDecision;
import com.acme.gateway.capability.ToolResult;
import com.acme.gateway.config.GatewayPolicyConfig;
import com.acme.gateway.error.ErrorCode;
import com.acme.gateway.processor.conversation.ConversationStateService;
import com.acme.gateway.processor.directory.DirectoryService;
import com.acme.gateway.processor.messaging.MessagingService;
import com.acme.gateway.processor.presence.PresenceService;
import com.acme.gateway.ratelimit.RateLimitConfig;
import com.acme.gateway.ratelimit.RateLimiter;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import com.acme.gateway.spi.SentMessage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("Capability providers")
class CapabilityProvidersTest {

  private static final String TO = "4915112345678@s.whatsapp.net";

  @Mock private MessagingService messaging;
  @Mock private DirectoryService directory;
  @Mock private PresenceService presence;
  @Mock private ConversationStateService conversations;

  private CapabilityRegistry registry;
  private CapabilityPolicy policy;
  private CapabilityGateway gateway;

  @BeforeEach
  void setup() {
    registry = new CapabilityRegistry();
    List.of(
            new MessagingCapabilities(messaging),
            new DirectoryCapabilities(directory),
            new PresenceCapabilities(presence),
            new ConversationCapabilities(conversations))
        .forEach(p -> p.register(registry));
    registry.freeze();
    GatewayPolicyConfig config = new GatewayPolicyConfig();
    policy = new CapabilityPolicy(config.getAllowlist(), config.getDenylist());
    gateway =
        new CapabilityGateway(
            registry,
            policy,
            new RateLimiter(Clock.systemUTC()),
            RateLimitConfig.agentDefaults(),
            new CircuitBreakerRegistry(CircuitBreakerRegistry.defaultConfigs(), Clock.systemUTC()));
  }

  @Test
  @DisplayName("every allowlisted name is registered")
  void testAllowlistFullyRegistered() {
    assertThat(policy.getAllowed())
        .allSatisfy(name -> assertThat(registry.find(name)).as(name).isPresent());
  }

  @Test
  @DisplayName("no denylisted name is registered")
  void testDenylistNotRegistered() {
    assertThat(registry.all())
        .extracting(Capability::name)
        .doesNotContainAnyElementsOf(policy.getDenied());
  }

  @Test
  @DisplayName("update_presence is registered but hidden from agents")
  void testUpdatePresenceHidden() {
    assertThat(registry.find(PresenceCapabilities.UPDATE_PRESENCE)).isPresent();
    assertThat(policy.decide(PresenceCapabilities.UPDATE_PRESENCE))
        .isEqualTo(PolicyDecision.DENIED_UNKNOWN);
    assertThat(gateway.listTools())
        .extracting(Capability::name)
        .doesNotContain(PresenceCapabilities.UPDATE_PRESENCE)
        .contains(MessagingCapabilities.SEND_TEXT, PresenceCapabilities.SET_TYPING);
  }

  @Test
  @DisplayName("reply_message requires quotedMessageId")
  void testReplyRequiresQuote() {
    ToolResult result =
        gateway.invoke(
            MessagingCapabilities.REPLY,
            Map.of("sessionId", "main", "to", TO, "text", "hi"),
            "agent-1");

    assertThat(result.error().code()).isEqualTo(ErrorCode.VALIDATION_ERROR);
    assertThat(result.error().message()).isEqualTo("quotedMessageId required");
    verifyNoInteractions(messaging);
  }

  @Test
  @DisplayName("send_text_message returns the sent message summary")
  void testSendResult() {
    when(messaging.sendText("main", TO, "hi", null))
        .thenReturn(new SentMessage("m-1", "main", TO, Instant.parse("2024-01-01T00:00:00Z")));

    ToolResult result =
        gateway.invoke(
            MessagingCapabilities.SEND_TEXT,
            Map.of("sessionId", "main", "to", TO, "text", "hi"),
            "agent-1");

    assertThat(result.success()).isTrue();
    assertThat(result.data())
        .isEqualTo(Map.of("messageId", "m-1", "to", TO, "timestamp", "2024-01-01T00:00:00Z"));
  }

  @Test
  @DisplayName("set_typing defaults to three seconds")
  void testTypingDefault() {
    ToolResult result =
        gateway.invoke(
            PresenceCapabilities.SET_TYPING, Map.of("sessionId", "main", "jid", TO), "agent-1");

    assertThat(result.success()).isTrue();
    verify(presence).showTyping("main", TO, Duration.ofMillis(3000));
  }
}
