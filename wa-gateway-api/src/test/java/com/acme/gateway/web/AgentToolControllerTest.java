package com.acme.gateway.web;

import static com.acme.gateway.web.ApiTestSupport.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.gateway.events.EventNames;
import com.acme.gateway.spi.MessagingTransport;
import com.acme.gateway.spi.SentMessage;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@MicronautTest
@DisplayName("Agent tool adapter")
class AgentToolControllerTest {

  private static final String TO = "4915112345678@s.whatsapp.net";

  @Inject
  @Client("/")
  HttpClient client;

  @Inject MessagingTransport transport;
  @Inject CapturedEvents events;

  @MockBean(MessagingTransport.class)
  MessagingTransport transport() {
    return mock(MessagingTransport.class);
  }

  @BeforeEach
  void setUp() {
    events.clear();
  }

  private void connectedSession() {
    when(transport.isKnownSession("main")).thenReturn(true);
    when(transport.isConnected("main")).thenReturn(true);
    when(transport.sendText(eq("main"), eq(TO), anyString(), any()))
        .thenAnswer(
            inv -> new SentMessage("m-" + System.nanoTime(), "main", TO, Instant.now()));
  }

  @Test
  @DisplayName("GET /agent/tools lists allowlisted capabilities with their parameters")
  @SuppressWarnings("unchecked")
  void testListTools() {
    HttpResponse<Map> response = exchange(client, as(newCaller(), HttpRequest.GET("/agent/tools")));

    assertThat(response.getStatus()).isEqualTo(HttpStatus.OK);
    List<Map<String, Object>> tools = (List<Map<String, Object>>) body(response).get("data");
    assertThat(tools)
        .extracting(t -> t.get("name"))
        .contains("send_text_message", "set_typing", "get_conversation_state")
        .doesNotContain("update_presence", "delete_session");
    Map<String, Object> send =
        tools.stream().filter(t -> "send_text_message".equals(t.get("name"))).findFirst().orElseThrow();
    assertThat((List<Map<String, Object>>) send.get("parameters"))
        .extracting(p -> p.get("name"))
        .containsExactly("sessionId", "to", "text", "quotedMessageId");
  }

  @Test
  @DisplayName("denylisted, unknown and REST-only names get identical 403 responses and no events")
  void testDenialUniform() {
    String caller = newCaller();
    Map<String, Object> args = Map.of("sessionId", "main");

    HttpResponse<Map> denylisted =
        exchange(client, as(caller, HttpRequest.POST("/agent/tools/delete_session", args)));
    HttpResponse<Map> unknown =
        exchange(client, as(caller, HttpRequest.POST("/agent/tools/rm_rf", args)));
    HttpResponse<Map> restOnly =
        exchange(
            client,
            as(caller, HttpRequest.POST("/agent/tools/update_presence", Map.of("sessionId", "main", "presence", "available"))));

    for (HttpResponse<Map> r : List.of(denylisted, unknown, restOnly)) {
      assertThat(r.getStatus()).isEqualTo(HttpStatus.FORBIDDEN);
      assertThat(body(r)).containsEntry("success", false).doesNotContainKey("data");
      assertThat(error(r)).containsEntry("code", "DENIED");
    }
    assertThat(error(unknown)).isEqualTo(error(denylisted)).isEqualTo(error(restOnly));
    assertThat(events.all()).isEmpty();
    verifyNoInteractions(transport);
  }

  @Test
  @DisplayName("successful tool call returns data and emits exactly one event")
  void testInvoke() {
    connectedSession();

    HttpResponse<Map> response =
        exchange(
            client,
            as(
                newCaller(),
                HttpRequest.POST(
                    "/agent/tools/send_text_message",
                    Map.of("sessionId", "main", "to", TO, "text", "hello"))));

    assertThat(response.getStatus()).isEqualTo(HttpStatus.OK);
    assertThat(data(response)).containsKey("messageId").containsEntry("to", TO);
    assertThat(events.names()).containsExactly(EventNames.MESSAGE_SENT);
  }

  @Test
  @DisplayName("validation errors are 400 and nothing is sent")
  void testValidation() {
    HttpResponse<Map> response =
        exchange(
            client,
            as(
                newCaller(),
                HttpRequest.POST(
                    "/agent/tools/send_text_message",
                    Map.of("sessionId", "main", "to", "not-a-jid", "text", "hello"))));

    assertThat(response.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(error(response)).containsEntry("code", "VALIDATION_ERROR");
    verify(transport, never()).sendText(any(), any(), any(), any());
  }

  @Test
  @DisplayName("agent tier allows five calls per second per caller, then 429 with Retry-After")
  void testAgentBurst() {
    connectedSession();
    String caller = newCaller();
    Map<String, Object> args = Map.of("sessionId", "main", "to", TO, "text", "hi");

    for (int i = 0; i < 5; i++) {
      assertThat(
              exchange(client, as(caller, HttpRequest.POST("/agent/tools/send_text_message", args)))
                  .getStatus())
          .isEqualTo(HttpStatus.OK);
    }
    HttpResponse<Map> limited =
        exchange(client, as(caller, HttpRequest.POST("/agent/tools/send_text_message", args)));

    assertThat(limited.getStatus()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
    assertThat(limited.getHeaders().get("Retry-After")).isEqualTo("1");
    assertThat(error(limited)).containsEntry("code", "RATE_LIMITED").containsEntry("retryAfter", 1);
    assertThat(events.names()).hasSize(5);
  }
}
