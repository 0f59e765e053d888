package com.acme.gateway.core;

import static org.assertj.core.api.Assertions.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JsonsTest {

  @Test
  @DisplayName("instants are written as ISO-8601 strings")
  void testInstantsAsIso() {
    Map<String, Object> envelope = new LinkedHashMap<>();
    envelope.put("event", "message.sent");
    envelope.put("timestamp", Instant.parse("2024-01-01T00:00:00Z"));

    assertThat(Jsons.toJson(envelope))
        .isEqualTo("{\"event\":\"message.sent\",\"timestamp\":\"2024-01-01T00:00:00Z\"}");
  }

  @Test
  @DisplayName("unserializable values fail with IllegalStateException")
  void testUnserializable() {
    Object selfReferencing = new Object() {
      @SuppressWarnings("unused")
      public Object getSelf() {
        return this;
      }
    };

    assertThatThrownBy(() -> Jsons.toJson(selfReferencing))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageStartingWith("Unable to serialize");
  }
}
