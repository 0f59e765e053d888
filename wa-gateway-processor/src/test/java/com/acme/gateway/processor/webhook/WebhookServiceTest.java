package com.acme.gateway.processor.webhook;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.gateway.config.QueuesConfig;
import com.acme.gateway.config.WebhookConfig;
import com.acme.gateway.error.ErrorCode;
import com.acme.gateway.error.GatewayException;
import com.acme.gateway.processor.TestClock;
import com.acme.gateway.processor.queue.QueueManager;
import com.acme.gateway.queue.JobPayload.WebhookDelivery;
import com.acme.gateway.queue.JobPriority;
import com.acme.gateway.queue.JobQueue;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import com.acme.gateway.spi.AuditSink;
import com.acme.gateway.webhook.Webhook;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("WebhookService Tests")
class WebhookServiceTest {

  @Mock private QueueManager queues;
  @Mock private JobQueue<WebhookDelivery> webhookQueue;
  @Mock private AuditSink audit;

  private final TestClock clock = new TestClock();
  private InMemoryWebhookRegistry registry;
  private CircuitBreakerRegistry breakers;
  private WebhookConfig config;
  private WebhookService service;

  @BeforeEach
  void setup() {
    registry = new InMemoryWebhookRegistry();
    breakers = new CircuitBreakerRegistry(CircuitBreakerRegistry.defaultConfigs(), clock);
    config = new WebhookConfig();
    service =
        new WebhookService(registry, queues, audit, breakers, config, new QueuesConfig(), clock);
  }

  private static WebhookRequest request(String name, String url, List<String> events) {
    return new WebhookRequest(name, url, events, null, null, null, null);
  }

  @Nested
  @DisplayName("create")
  class CreateTests {

    @Test
    @DisplayName("applies defaults, generates a secret and audits")
    void testCreateDefaults() {
      Webhook w = service.create(request("crm", "https://example.org/hook", null), "key:ops");

      assertThat(w.secret()).startsWith("whsec_");
      assertThat(w.active()).isTrue();
      assertThat(w.maxAttempts()).isEqualTo(3);
      assertThat(w.timeout()).isEqualTo(Duration.ofSeconds(10));
      assertThat(registry.find(w.id())).contains(w);
      verify(audit).success(eq("webhook.created"), eq("key:ops"), anyMap());
    }

    @Test
    @DisplayName("rejects non-http URLs")
    void testRejectsBadUrl() {
      assertValidation(() -> service.create(request("crm", "ftp://example.org", null), "a"));
      assertValidation(() -> service.create(request("crm", "/relative/path", null), "a"));
      assertThat(registry.count()).isZero();
    }

    @Test
    @DisplayName("rejects unsupported events")
    void testRejectsUnknownEvent() {
      assertThatThrownBy(
              () ->
                  service.create(
                      request("crm", "https://example.org", List.of("session.deleted")), "a"))
          .hasMessage("Unsupported event: session.deleted");
    }

    @Test
    @DisplayName("rejects out-of-range maxAttempts and timeout")
    void testRejectsRanges() {
      assertValidation(
          () ->
              service.create(
                  new WebhookRequest("crm", "https://example.org", null, null, 11, null, null),
                  "a"));
      assertValidation(
          () ->
              service.create(
                  new WebhookRequest("crm", "https://example.org", null, null, null, 500L, null),
                  "a"));
    }

    @Test
    @DisplayName("enforces the webhook limit")
    void testLimit() {
      config.setMaxWebhooks(1);
      service.create(request("one", "https://example.org/1", null), "a");

      assertThatThrownBy(() -> service.create(request("two", "https://example.org/2", null), "a"))
          .hasMessage("Webhook limit reached");
    }

    private void assertValidation(Runnable call) {
      assertThatThrownBy(call::run)
          .isInstanceOfSatisfying(
              GatewayException.class,
              e -> assertThat(e.getCode()).isEqualTo(ErrorCode.VALIDATION_ERROR));
    }
  }

  @Test
  @DisplayName("update - partial update keeps secret and unspecified fields")
  void testUpdate() {
    Webhook created = service.create(request("crm", "https://example.org/hook", null), "a");
    clock.advance(Duration.ofMinutes(1));

    Webhook updated =
        service.update(
            created.id(), new WebhookRequest(null, null, null, null, null, null, false), "a");

    assertThat(updated.active()).isFalse();
    assertThat(updated.name()).isEqualTo("crm");
    assertThat(updated.secret()).isEqualTo(created.secret());
    assertThat(updated.updatedAt()).isAfter(created.updatedAt());
  }

  @Test
  @DisplayName("delete - removes the webhook and its breaker; unknown id is NOT_FOUND")
  void testDelete() {
    Webhook created = service.create(request("crm", "https://example.org/hook", null), "a");
    breakers.get(CircuitBreakerRegistry.WEBHOOK, created.id());

    service.delete(created.id(), "a");

    assertThat(registry.find(created.id())).isEmpty();
    assertThat(breakers.find("webhook:" + created.id())).isEmpty();
    assertThatThrownBy(() -> service.delete(created.id(), "a"))
        .isInstanceOf(GatewayException.class)
        .hasMessage("Webhook not found");
  }

  @Test
  @DisplayName("dispatch - one delivery per matching active webhook")
  @SuppressWarnings("unchecked")
  void testDispatch() {
    when(queues.webhooks()).thenReturn(webhookQueue);
    Webhook all = service.create(request("all", "https://example.org/all", null), "a");
    service.create(request("received", "https://example.org/r", List.of("message.received")), "a");
    Webhook off = service.create(request("off", "https://example.org/off", null), "a");
    service.update(off.id(), new WebhookRequest(null, null, null, null, null, null, false), "a");

    int count = service.dispatch("message.sent", "main", Map.of("messageId", "m-1"));

    assertThat(count).isEqualTo(1);
    ArgumentCaptor<WebhookDelivery> captor = ArgumentCaptor.forClass(WebhookDelivery.class);
    verify(webhookQueue).enqueue(captor.capture(), eq(JobPriority.NORMAL), eq(3));
    WebhookDelivery delivery = captor.getValue();
    assertThat(delivery.webhookId()).isEqualTo(all.id());
    assertThat(delivery.secret()).isEqualTo(all.secret());
    assertThat(delivery.envelope())
        .containsEntry("event", "message.sent")
        .containsEntry("sessionId", "main")
        .containsEntry("data", Map.of("messageId", "m-1"))
        .containsKeys("id", "timestamp");
  }
}
