package com.acme.gateway.config;

import static org.assertj.core.api.Assertions.*;

import com.acme.gateway.ratelimit.RateLimitConfig;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RateLimitingConfig Tests")
class RateLimitingConfigTest {

  @Test
  @DisplayName("defaults validate")
  void testDefaultsValidate() {
    RateLimitingConfig config = new RateLimitingConfig();

    assertThatCode(config::validate).doesNotThrowAnyException();
    assertThat(config.getRest().getName()).isEqualTo("rest");
    assertThat(config.getAgent().getName()).isEqualTo("agent");
  }

  @Test
  @DisplayName("agent tier more permissive than REST fails validation")
  void testAgentMorePermissive() {
    RateLimitingConfig config = new RateLimitingConfig();
    config.setAgent(
        new RateLimitConfig("whatever", 1000, Duration.ofSeconds(60), 5, Duration.ofSeconds(1)));

    assertThatThrownBy(config::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("must not be more permissive");
  }

  @Test
  @DisplayName("setters force the tier names so counters never collide")
  void testSettersForceNames() {
    RateLimitingConfig config = new RateLimitingConfig();
    config.setRest(new RateLimitConfig());
    config.setAgent(new RateLimitConfig());

    assertThat(config.getRest().getName()).isEqualTo("rest");
    assertThat(config.getAgent().getName()).isEqualTo("agent");
  }

  @Test
  @DisplayName("per-key limit replaces the sustained REST limit for that key only")
  void testKeyLimits() {
    RateLimitingConfig config = new RateLimitingConfig();
    config.setKeyLimits(Map.of("partner", 1000));

    assertThat(config.restFor("partner").getLimit()).isEqualTo(1000);
    assertThat(config.restFor("partner").getBurstLimit()).isEqualTo(config.getRest().getBurstLimit());
    assertThat(config.restFor("partner").getName()).isEqualTo("rest");
    assertThat(config.restFor("someone-else")).isSameAs(config.getRest());
    assertThat(config.restFor(null)).isSameAs(config.getRest());
  }

  @Test
  @DisplayName("non-positive key limit fails validation")
  void testBadKeyLimit() {
    RateLimitingConfig config = new RateLimitingConfig();
    config.setKeyLimits(Map.of("partner", 0));

    assertThatThrownBy(config::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("partner");
  }

  @Test
  @DisplayName("key limit below the agent tier fails validation")
  void testKeyLimitBelowAgentTier() {
    RateLimitingConfig config = new RateLimitingConfig();
    config.setKeyLimits(Map.of("partner", 10));

    assertThatThrownBy(config::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("partner")
        .hasMessageContaining("below the agent limit");
  }

  @Test
  @DisplayName("key limit equal to the agent tier is accepted")
  void testKeyLimitEqualToAgentTier() {
    RateLimitingConfig config = new RateLimitingConfig();
    config.setKeyLimits(Map.of("partner", config.getAgent().getLimit()));

    assertThatCode(config::validate).doesNotThrowAnyException();
    assertThat(config.getAgent().isNoMorePermissiveThan(config.restFor("partner"))).isTrue();
  }
}
