package com.acme.gateway.resilience;

import java.time.Duration;

/** Thresholds for one circuit breaker. Pure POJO - no framework dependencies. */
public class CircuitBreakerConfig {

  private int failureThreshold = 5;
  private Duration resetTimeout = Duration.ofSeconds(30);
  private int halfOpenRequests = 1;

  public CircuitBreakerConfig() {}

  public CircuitBreakerConfig(int failureThreshold, Duration resetTimeout, int halfOpenRequests) {
    this.failureThreshold = failureThreshold;
    this.resetTimeout = resetTimeout;
    this.halfOpenRequests = halfOpenRequests;
  }

  public int getFailureThreshold() {
    return failureThreshold;
  }

  public void setFailureThreshold(int failureThreshold) {
    this.failureThreshold = failureThreshold;
  }

  public Duration getResetTimeout() {
    return resetTimeout;
  }

  public void setResetTimeout(Duration resetTimeout) {
    this.resetTimeout = resetTimeout;
  }

  public int getHalfOpenRequests() {
    return halfOpenRequests;
  }

  public void setHalfOpenRequests(int halfOpenRequests) {
    this.halfOpenRequests = halfOpenRequests;
  }

  void validate(String name) {
    if (failureThreshold < 1 || halfOpenRequests < 1) {
      throw new IllegalStateException(
          "Circuit breaker " + name + " needs failureThreshold and halfOpenRequests >= 1");
    }
    if (resetTimeout == null || resetTimeout.isNegative()) {
      throw new IllegalStateException("Circuit breaker " + name + " needs a resetTimeout >= 0");
    }
  }

  @Override
  public String toString() {
    return "failureThreshold="
        + failureThreshold
        + ", resetTimeout="
        + resetTimeout
        + ", halfOpenRequests="
        + halfOpenRequests;
  }
}
