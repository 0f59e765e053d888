package com.acme.gateway.processor.capabilities;

import com.acme.gateway.capability.CapabilityRegistry;

/** Contributes capabilities to the registry once, before it is frozen. */
public interface CapabilityProvider {
  void register(CapabilityRegistry registry);
}
