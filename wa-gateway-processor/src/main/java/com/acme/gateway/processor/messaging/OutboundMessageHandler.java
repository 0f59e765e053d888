package com.acme.gateway.processor.messaging;

import com.acme.gateway.queue.Job;
import com.acme.gateway.queue.JobHandler;
import com.acme.gateway.queue.JobPayload.OutboundMessage;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import com.acme.gateway.spi.SentMessage;
import jakarta.inject.Singleton;
import java.util.Map;

/** Worker side of the outgoing queue: one send per attempt, behind the messaging breaker. */
@Singleton
public class OutboundMessageHandler implements JobHandler<OutboundMessage> {

  private final MessagingService messaging;
  private final CircuitBreakerRegistry breakers;

  public OutboundMessageHandler(MessagingService messaging, CircuitBreakerRegistry breakers) {
    this.messaging = messaging;
    this.breakers = breakers;
  }

  @Override
  public Object handle(Job<OutboundMessage> job) {
    OutboundMessage msg = job.getPayload();
    SentMessage sent =
        breakers
            .get(CircuitBreakerRegistry.WHATSAPP)
            .execute(
                () ->
                    messaging.sendText(
                        msg.sessionId(), msg.to(), msg.text(), msg.quotedMessageId()));
    return Map.of("messageId", sent.messageId(), "timestamp", sent.timestamp().toString());
  }
}
