package com.acme.gateway.processor.transport;

import com.acme.gateway.spi.ContactProfile;
import com.acme.gateway.spi.GroupMetadata;
import com.acme.gateway.spi.MessagingTransport;
import com.acme.gateway.spi.SentMessage;
import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Fallback used when no protocol client is deployed: knows no sessions, so every session-bound
 * capability reports {@code NOT_FOUND}.
 */
@Slf4j
@Singleton
@Secondary
public class OfflineMessagingTransport implements MessagingTransport {

  public OfflineMessagingTransport() {
    log.warn("No messaging transport configured; all sessions will report as not found");
  }

  @Override
  public boolean isKnownSession(String sessionId) {
    return false;
  }

  @Override
  public boolean isConnected(String sessionId) {
    return false;
  }

  @Override
  public SentMessage sendText(String sessionId, String to, String text, String quotedMessageId) {
    throw new IllegalStateException("No session " + sessionId);
  }

  @Override
  public Optional<ContactProfile> fetchProfile(String sessionId, String jid) {
    return Optional.empty();
  }

  @Override
  public Optional<GroupMetadata> fetchGroupMetadata(String sessionId, String groupJid) {
    return Optional.empty();
  }

  @Override
  public void sendPresence(String sessionId, String jid, String presence) {
    throw new IllegalStateException("No session " + sessionId);
  }
}
