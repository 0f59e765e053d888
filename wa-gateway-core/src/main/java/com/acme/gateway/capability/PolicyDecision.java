package com.acme.gateway.capability;

public enum PolicyDecision {
  ALLOWED,
  /** Name absent from the allowlist; looks exactly like a name that does not exist. */
  DENIED_UNKNOWN,
  /** Name present in the denylist. Returned to callers in the same shape as DENIED_UNKNOWN. */
  DENIED_EXPLICIT;

  public boolean isDenied() {
    return this != ALLOWED;
  }
}
