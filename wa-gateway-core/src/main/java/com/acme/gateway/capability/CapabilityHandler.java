package com.acme.gateway.capability;

import java.util.Map;

/** Domain action behind a capability; receives arguments that already passed validation. */
@FunctionalInterface
public interface CapabilityHandler {
  Object invoke(Map<String, Object> args);
}
