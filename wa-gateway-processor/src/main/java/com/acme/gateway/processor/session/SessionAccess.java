package com.acme.gateway.processor.session;

import com.acme.gateway.error.GatewayException;
import com.acme.gateway.spi.MessagingTransport;
import jakarta.inject.Singleton;

/** Session preconditions shared by every capability that touches the messaging network. */
@Singleton
public class SessionAccess {

  private final MessagingTransport transport;

  public SessionAccess(MessagingTransport transport) {
    this.transport = transport;
  }

  /**
   * @throws GatewayException {@code NOT_FOUND} for an unknown session, {@code TRANSIENT} for a
   *     known session that is currently disconnected
   */
  public MessagingTransport requireConnected(String sessionId) {
    if (!transport.isKnownSession(sessionId)) {
      throw GatewayException.notFound("Session");
    }
    if (!transport.isConnected(sessionId)) {
      throw GatewayException.unavailable("Session not connected");
    }
    return transport;
  }

  public void requireKnown(String sessionId) {
    if (!transport.isKnownSession(sessionId)) {
      throw GatewayException.notFound("Session");
    }
  }
}
