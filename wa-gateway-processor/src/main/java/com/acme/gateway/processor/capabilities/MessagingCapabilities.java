package com.acme.gateway.processor.capabilities;

import com.acme.gateway.capability.Capability;
import com.acme.gateway.capability.CapabilityRegistry;
import com.acme.gateway.capability.ParamSchema;
import com.acme.gateway.processor.messaging.MessagingService;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import com.acme.gateway.spi.SentMessage;
import jakarta.inject.Singleton;
import java.util.LinkedHashMap;
import java.util.Map;

@Singleton
public class MessagingCapabilities implements CapabilityProvider {

  public static final String SEND_TEXT = "send_text_message";
  public static final String REPLY = "reply_message";

  public static final ParamSchema SEND_SCHEMA =
      ParamSchema.builder()
          .sessionId()
          .jid("to", "Recipient JID (phone@s.whatsapp.net or group@g.us)")
          .text("text", true, "Message text content")
          .identifier("quotedMessageId", false, "ID of the message to reply to")
          .build();

  static final ParamSchema REPLY_SCHEMA =
      ParamSchema.builder()
          .sessionId()
          .jid("to", "Chat JID where the reply will be sent")
          .text("text", true, "Reply text content")
          .identifier("quotedMessageId", true, "ID of the message to reply to")
          .build();

  private final MessagingService messaging;

  public MessagingCapabilities(MessagingService messaging) {
    this.messaging = messaging;
  }

  @Override
  public void register(CapabilityRegistry registry) {
    registry.register(
        new Capability(
            SEND_TEXT,
            "Send a text message to a WhatsApp contact or group",
            CircuitBreakerRegistry.WHATSAPP,
            SEND_SCHEMA,
            this::send));
    registry.register(
        new Capability(
            REPLY,
            "Reply to a specific message in a WhatsApp conversation",
            CircuitBreakerRegistry.WHATSAPP,
            REPLY_SCHEMA,
            this::send));
  }

  private Object send(Map<String, Object> args) {
    String to = (String) args.get("to");
    String quoted = (String) args.get("quotedMessageId");
    SentMessage sent =
        messaging.sendText((String) args.get("sessionId"), to, (String) args.get("text"), quoted);

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("messageId", sent.messageId());
    result.put("to", to);
    if (quoted != null) {
      result.put("quotedMessageId", quoted);
    }
    result.put("timestamp", sent.timestamp().toString());
    return result;
  }
}
