package com.acme.gateway.ratelimit;

/**
 * Outcome of one admission check. Remaining values let callers self-throttle; {@code
 * retryAfterSeconds} is zero when admitted.
 */
public record RateLimitDecision(
    boolean admitted,
    int limit,
    int remaining,
    int burstLimit,
    int burstRemaining,
    long resetEpochSecond,
    long retryAfterSeconds) {

  public boolean rejected() {
    return !admitted;
  }
}
