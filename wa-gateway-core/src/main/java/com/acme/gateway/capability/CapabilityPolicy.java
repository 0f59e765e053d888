package com.acme.gateway.capability;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Allowlist and denylist for agent-originated actions. The two sets are configured
 * independently; a name in both is denied.
 */
public class CapabilityPolicy {
  private static final Logger LOG = LoggerFactory.getLogger(CapabilityPolicy.class);

  private final Set<String> allowed;
  private final Set<String> denied;

  public CapabilityPolicy(Collection<String> allowlist, Collection<String> denylist) {
    this.allowed = Set.copyOf(new HashSet<>(allowlist));
    this.denied = Set.copyOf(new HashSet<>(denylist));
    Set<String> overlap = new HashSet<>(allowed);
    overlap.retainAll(denied);
    if (!overlap.isEmpty()) {
      LOG.warn("Capabilities present in both allowlist and denylist will be denied: {}", overlap);
    }
  }

  public PolicyDecision decide(String action) {
    if (action == null || action.isBlank()) {
      return PolicyDecision.DENIED_UNKNOWN;
    }
    if (denied.contains(action)) {
      return PolicyDecision.DENIED_EXPLICIT;
    }
    return allowed.contains(action) ? PolicyDecision.ALLOWED : PolicyDecision.DENIED_UNKNOWN;
  }

  public Set<String> getAllowed() {
    return allowed;
  }

  public Set<String> getDenied() {
    return denied;
  }
}
