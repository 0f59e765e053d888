package com.acme.gateway.resilience;

public enum CircuitState {
  /** Calls pass through; consecutive failures are counted. */
  CLOSED,
  /** Calls are rejected without touching the dependency. */
  OPEN,
  /** A bounded number of trial calls probe whether the dependency recovered. */
  HALF_OPEN
}
