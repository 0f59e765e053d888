package com.acme.gateway.resilience;

import static org.assertj.core.api.Assertions.*;

import com.acme.gateway.MutableClock;
import com.acme.gateway.core.TransientException;
import com.acme.gateway.error.ErrorCode;
import com.acme.gateway.error.GatewayException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CircuitBreaker Tests")
class CircuitBreakerTest {

  private MutableClock clock;
  private CircuitBreaker breaker;
  private final AtomicInteger calls = new AtomicInteger();

  private final Supplier<String> failing =
      () -> {
        calls.incrementAndGet();
        throw new TransientException("downstream timeout");
      };
  private final Supplier<String> healthy =
      () -> {
        calls.incrementAndGet();
        return "ok";
      };

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    breaker =
        new CircuitBreaker("whatsapp", new CircuitBreakerConfig(3, Duration.ofSeconds(30), 2), clock);
  }

  private void trip() {
    for (int i = 0; i < 3; i++) {
      assertThatThrownBy(() -> breaker.execute(failing)).isInstanceOf(TransientException.class);
    }
  }

  @Nested
  @DisplayName("CLOSED state")
  class ClosedTests {

    @Test
    @DisplayName("opens after failureThreshold consecutive failures")
    void testOpensAtThreshold() {
      trip();

      assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
      assertThat(breaker.getStats().lastFailureAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("a success resets the consecutive failure count")
    void testSuccessResetsFailures() {
      assertThatThrownBy(() -> breaker.execute(failing)).isInstanceOf(TransientException.class);
      assertThatThrownBy(() -> breaker.execute(failing)).isInstanceOf(TransientException.class);
      breaker.execute(healthy);
      assertThatThrownBy(() -> breaker.execute(failing)).isInstanceOf(TransientException.class);

      assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
      assertThat(breaker.getStats().failures()).isEqualTo(1);
    }

    @Test
    @DisplayName("caller errors count as successes and never trip the breaker")
    void testCallerErrorsDoNotTrip() {
      for (int i = 0; i < 5; i++) {
        assertThatThrownBy(
                () ->
                    breaker.execute(
                        () -> {
                          throw GatewayException.notFound("Session");
                        }))
            .isInstanceOf(GatewayException.class);
      }

      assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
      assertThat(breaker.getStats().failures()).isZero();
    }
  }

  @Nested
  @DisplayName("OPEN state")
  class OpenTests {

    @Test
    @DisplayName("rejects without invoking the call until resetTimeout elapses")
    void testRejectsWhileOpen() {
      trip();
      calls.set(0);
      clock.advance(Duration.ofSeconds(29));

      assertThatThrownBy(() -> breaker.execute(healthy))
          .isInstanceOfSatisfying(
              CircuitOpenException.class,
              e -> assertThat(e.getCode()).isEqualTo(ErrorCode.CIRCUIT_OPEN));
      assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("admits a trial call once resetTimeout has elapsed")
    void testHalfOpenAfterTimeout() {
      trip();
      clock.advance(Duration.ofSeconds(30));

      assertThat(breaker.execute(healthy)).isEqualTo("ok");
      assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
    }
  }

  @Nested
  @DisplayName("HALF_OPEN state")
  class HalfOpenTests {

    @Test
    @DisplayName("closes after halfOpenRequests successes")
    void testClosesAfterTrials() {
      trip();
      clock.advance(Duration.ofSeconds(30));

      breaker.execute(healthy);
      breaker.execute(healthy);

      assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("any failure reopens and restarts the timeout")
    void testFailureReopens() {
      trip();
      clock.advance(Duration.ofSeconds(30));

      assertThatThrownBy(() -> breaker.execute(failing)).isInstanceOf(TransientException.class);

      assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
      clock.advance(Duration.ofSeconds(10));
      assertThatThrownBy(() -> breaker.execute(healthy)).isInstanceOf(CircuitOpenException.class);
    }

    @Test
    @DisplayName("admits at most halfOpenRequests concurrent trials")
    void testTrialPermitsBounded() throws Exception {
      trip();
      clock.advance(Duration.ofSeconds(30));
      CountDownLatch release = new CountDownLatch(1);
      CountDownLatch started = new CountDownLatch(2);
      Supplier<String> slow =
          () -> {
            started.countDown();
            try {
              release.await();
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            return "ok";
          };
      Thread first = new Thread(() -> breaker.execute(slow));
      Thread second = new Thread(() -> breaker.execute(slow));
      first.start();
      second.start();
      started.await();

      assertThatThrownBy(() -> breaker.execute(healthy)).isInstanceOf(CircuitOpenException.class);

      release.countDown();
      first.join();
      second.join();
      assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }
  }

  @Test
  @DisplayName("reset - forces the breaker closed")
  void testReset() {
    trip();

    breaker.reset();

    assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    assertThat(breaker.execute(healthy)).isEqualTo("ok");
  }

  @Test
  @DisplayName("invalid configuration is rejected at construction")
  void testInvalidConfig() {
    assertThatThrownBy(
            () -> new CircuitBreaker("bad", new CircuitBreakerConfig(0, Duration.ZERO, 1), clock))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("bad");
  }
}
