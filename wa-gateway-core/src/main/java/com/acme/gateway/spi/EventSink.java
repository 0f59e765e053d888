package com.acme.gateway.spi;

import java.util.Map;

/**
 * Publish-style sink for domain events and queue lifecycle telemetry. Domain capabilities emit
 * exactly one event per successful action; the gateway itself never emits domain events.
 */
@FunctionalInterface
public interface EventSink {
  void emit(String eventName, Map<String, Object> payload);
}
