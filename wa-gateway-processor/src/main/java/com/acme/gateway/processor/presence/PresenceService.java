package com.acme.gateway.processor.presence;

import com.acme.gateway.events.EventNames;
import com.acme.gateway.processor.session.SessionAccess;
import com.acme.gateway.spi.EventSink;
import com.acme.gateway.spi.MessagingTransport;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Typing indicators and own-presence updates. */
@Singleton
public class PresenceService {
  private static final Logger LOG = LoggerFactory.getLogger(PresenceService.class);

  public static final String COMPOSING = "composing";
  public static final String PAUSED = "paused";

  private final SessionAccess sessions;
  private final EventSink events;
  private final TaskScheduler scheduler;

  public PresenceService(
      SessionAccess sessions,
      EventSink events,
      @Named(TaskExecutors.SCHEDULED) TaskScheduler scheduler) {
    this.sessions = sessions;
    this.events = events;
    this.scheduler = scheduler;
  }

  /** Shows "typing" in {@code jid} and clears it again after {@code duration}. */
  public void showTyping(String sessionId, String jid, Duration duration) {
    MessagingTransport transport = sessions.requireConnected(sessionId);
    transport.sendPresence(sessionId, jid, COMPOSING);
    emit(sessionId, jid, COMPOSING);
    scheduler.schedule(duration, () -> pause(transport, sessionId, jid));
  }

  public void updatePresence(String sessionId, String presence) {
    sessions.requireConnected(sessionId).sendPresence(sessionId, null, presence);
    emit(sessionId, null, presence);
  }

  private void pause(MessagingTransport transport, String sessionId, String jid) {
    try {
      transport.sendPresence(sessionId, jid, PAUSED);
    } catch (RuntimeException e) {
      LOG.warn("Failed to clear typing indicator sessionId={}: {}", sessionId, e.getMessage());
    }
  }

  private void emit(String sessionId, String jid, String presence) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("sessionId", sessionId);
    if (jid != null) {
      payload.put("jid", jid);
    }
    payload.put("presence", presence);
    events.emit(EventNames.PRESENCE_UPDATED, payload);
  }
}
