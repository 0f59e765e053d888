package com.acme.gateway.capability;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CapabilityRegistry Tests")
class CapabilityRegistryTest {

  private CapabilityRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new CapabilityRegistry();
  }

  private static Capability capability(String name) {
    return new Capability(name, "test", null, ParamSchema.builder().build(), args -> name);
  }

  @Test
  @DisplayName("register - duplicate name is rejected")
  void testDuplicate() {
    registry.register(capability("send_text_message"));

    assertThatThrownBy(() -> registry.register(capability("send_text_message")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("already registered: send_text_message");
  }

  @Test
  @DisplayName("register - rejected once frozen")
  void testFrozen() {
    registry.register(capability("a"));
    registry.freeze();

    assertThat(registry.isFrozen()).isTrue();
    assertThatThrownBy(() -> registry.register(capability("b")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("frozen");
    assertThat(registry.find("a")).isPresent();
    assertThat(registry.find("b")).isEmpty();
  }

  @Test
  @DisplayName("all - preserves registration order")
  void testOrder() {
    registry.register(capability("b"));
    registry.register(capability("a"));

    assertThat(registry.all()).extracting(Capability::name).containsExactly("b", "a");
  }
}
