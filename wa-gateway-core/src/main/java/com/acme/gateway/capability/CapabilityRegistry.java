package com.acme.gateway.capability;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry for capabilities - maps action names to their handlers. Filled once at startup and
 * then frozen; lookups after {@link #freeze()} need no locking.
 */
public class CapabilityRegistry {
  private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

  private final Map<String, Capability> capabilities = new LinkedHashMap<>();
  private volatile boolean frozen;

  /**
   * @throws IllegalStateException if the registry is frozen or the name is already taken
   */
  public synchronized void register(Capability capability) {
    if (frozen) {
      throw new IllegalStateException(
          "Capability registry is frozen, cannot register: " + capability.name());
    }
    if (capabilities.containsKey(capability.name())) {
      String error = "Capability already registered: " + capability.name();
      log.error(error);
      throw new IllegalStateException(error);
    }
    log.info("Registering capability: {}", capability.name());
    capabilities.put(capability.name(), capability);
  }

  public synchronized void freeze() {
    frozen = true;
    log.info("Capability registry frozen with {} capabilities", capabilities.size());
  }

  public boolean isFrozen() {
    return frozen;
  }

  public Optional<Capability> find(String name) {
    synchronized (this) {
      return Optional.ofNullable(capabilities.get(name));
    }
  }

  public synchronized Collection<Capability> all() {
    return List.copyOf(capabilities.values());
  }
}
