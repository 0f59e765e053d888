package com.acme.gateway.resilience;

import com.acme.gateway.error.GatewayException;
import java.time.Clock;
import java.time.Instant;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Three-state failure isolator for a single downstream dependency.
 *
 * <p>State is guarded by the instance monitor; the protected call itself runs outside the lock so
 * a slow dependency does not serialize callers. Caller-side errors ({@link GatewayException} with a
 * non-retryable code, e.g. an unknown session) prove the dependency answered and are recorded as
 * successes.
 */
public class CircuitBreaker {
  private static final Logger LOG = LoggerFactory.getLogger(CircuitBreaker.class);

  private final String name;
  private final CircuitBreakerConfig config;
  private final Clock clock;

  private CircuitState state = CircuitState.CLOSED;
  private int failures;
  private int successes;
  private int trialPermits;
  private Instant lastFailureAt;

  public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
    config.validate(name);
    this.name = name;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Run {@code call} if the breaker admits it.
   *
   * @throws CircuitOpenException when open (or half-open with all trial permits taken); {@code
   *     call} is not invoked
   */
  public <T> T execute(Supplier<T> call) {
    acquirePermission();
    T result;
    try {
      result = call.get();
    } catch (RuntimeException e) {
      if (isCallerError(e)) {
        onSuccess();
      } else {
        onFailure();
      }
      throw e;
    }
    onSuccess();
    return result;
  }

  public void run(Runnable call) {
    execute(
        () -> {
          call.run();
          return null;
        });
  }

  private synchronized void acquirePermission() {
    if (state == CircuitState.OPEN) {
      if (clock.instant().isBefore(lastFailureAt.plus(config.getResetTimeout()))) {
        throw new CircuitOpenException(name);
      }
      transitionTo(CircuitState.HALF_OPEN);
    }
    if (state == CircuitState.HALF_OPEN) {
      if (trialPermits >= config.getHalfOpenRequests()) {
        throw new CircuitOpenException(name);
      }
      trialPermits++;
    }
  }

  private synchronized void onSuccess() {
    if (state == CircuitState.HALF_OPEN) {
      successes++;
      if (successes >= config.getHalfOpenRequests()) {
        transitionTo(CircuitState.CLOSED);
      }
    } else {
      failures = 0;
    }
  }

  private synchronized void onFailure() {
    lastFailureAt = clock.instant();
    if (state == CircuitState.HALF_OPEN) {
      transitionTo(CircuitState.OPEN);
      return;
    }
    failures++;
    if (state == CircuitState.CLOSED && failures >= config.getFailureThreshold()) {
      transitionTo(CircuitState.OPEN);
    }
  }

  private void transitionTo(CircuitState newState) {
    CircuitState previous = state;
    state = newState;
    failures = 0;
    successes = 0;
    trialPermits = 0;
    LOG.warn("Circuit breaker state change breaker={} from={} to={}", name, previous, newState);
  }

  private static boolean isCallerError(RuntimeException e) {
    return e instanceof GatewayException ge
        && !(ge instanceof CircuitOpenException)
        && !ge.getCode().isRetryable();
  }

  public synchronized CircuitState getState() {
    return state;
  }

  public synchronized CircuitStats getStats() {
    return new CircuitStats(name, state, failures, successes, lastFailureAt);
  }

  /** Force the breaker closed (admin operation). */
  public synchronized void reset() {
    transitionTo(CircuitState.CLOSED);
  }

  public String getName() {
    return name;
  }

  public CircuitBreakerConfig getConfig() {
    return config;
  }
}
