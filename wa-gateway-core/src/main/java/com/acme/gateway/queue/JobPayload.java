package com.acme.gateway.queue;

import java.time.Duration;
import java.util.Map;

/** The finite set of asynchronous work this gateway produces. */
public sealed interface JobPayload {

  /** Type tag recorded on the job and in queue events. */
  String type();

  /** Text message to send through a session. */
  record OutboundMessage(String sessionId, String to, String text, String quotedMessageId)
      implements JobPayload {
    @Override
    public String type() {
      return "send";
    }
  }

  /** Signed POST of one event envelope to one registered webhook. */
  record WebhookDelivery(
      String webhookId, String url, String secret, Map<String, Object> envelope, Duration timeout)
      implements JobPayload {
    @Override
    public String type() {
      return "deliver";
    }

    @Override
    public String toString() {
      return "WebhookDelivery[webhookId=" + webhookId + ", url=" + url + "]";
    }
  }
}
