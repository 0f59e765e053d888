package com.acme.gateway.processor.messaging;

import com.acme.gateway.events.EventNames;
import com.acme.gateway.processor.session.SessionAccess;
import com.acme.gateway.spi.EventSink;
import com.acme.gateway.spi.SentMessage;
import jakarta.inject.Singleton;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Sends text through a connected session and emits {@code message.sent} once per send. */
@Slf4j
@Singleton
@RequiredArgsConstructor
public class MessagingService {

  private final SessionAccess sessions;
  private final EventSink events;

  public SentMessage sendText(String sessionId, String to, String text, String quotedMessageId) {
    SentMessage sent =
        sessions.requireConnected(sessionId).sendText(sessionId, to, text, quotedMessageId);
    log.debug("Message sent sessionId={} messageId={}", sessionId, sent.messageId());

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("sessionId", sessionId);
    payload.put("messageId", sent.messageId());
    payload.put("to", to);
    if (quotedMessageId != null) {
      payload.put("quotedMessageId", quotedMessageId);
    }
    payload.put("timestamp", sent.timestamp().toString());
    events.emit(EventNames.MESSAGE_SENT, payload);
    return sent;
  }
}
