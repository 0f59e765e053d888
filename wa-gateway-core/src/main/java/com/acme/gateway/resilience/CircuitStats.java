package com.acme.gateway.resilience;

import java.time.Instant;

/** Point-in-time view of a breaker for monitoring endpoints. */
public record CircuitStats(
    String name, CircuitState state, int failures, int successes, Instant lastFailureAt) {}
