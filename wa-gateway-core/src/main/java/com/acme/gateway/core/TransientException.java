package com.acme.gateway.core;

/**
 * Failure of a downstream dependency that may succeed when retried (socket not connected,
 * timeout, webhook endpoint returning 5xx). Maps to {@code TRANSIENT} at the gateway boundary.
 */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
