package com.acme.gateway.spi;

import java.util.Optional;

/**
 * Connection to the messaging network, one socket per tenant session. Implementations throw
 * {@link com.acme.gateway.core.TransientException} for failures worth retrying.
 */
public interface MessagingTransport {

  boolean isKnownSession(String sessionId);

  boolean isConnected(String sessionId);

  SentMessage sendText(String sessionId, String to, String text, String quotedMessageId);

  Optional<ContactProfile> fetchProfile(String sessionId, String jid);

  Optional<GroupMetadata> fetchGroupMetadata(String sessionId, String groupJid);

  /**
   * @param presence one of {@code composing}, {@code recording}, {@code paused}, {@code
   *     available}, {@code unavailable}
   */
  void sendPresence(String sessionId, String jid, String presence);
}
