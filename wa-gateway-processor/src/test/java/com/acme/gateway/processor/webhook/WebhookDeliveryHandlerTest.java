package com.acme.gateway.processor.webhook;

import static org.assertj.core.api.Assertions.*;

import com.acme.gateway.config.WebhookConfig;
import com.acme.gateway.processor.RecordingEventSink;
import com.acme.gateway.processor.TestClock;
import com.acme.gateway.queue.Job;
import com.acme.gateway.queue.JobPayload.WebhookDelivery;
import com.acme.gateway.queue.JobPriority;
import com.acme.gateway.queue.JobQueue;
import com.acme.gateway.queue.JobStatus;
import com.acme.gateway.queue.QueueConfig;
import com.acme.gateway.resilience.CircuitBreakerConfig;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import com.acme.gateway.resilience.CircuitState;
import com.acme.gateway.webhook.Webhook;
import com.acme.gateway.webhook.WebhookSigner;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WebhookDeliveryHandler Tests")
class WebhookDeliveryHandlerTest {

  private static final String SECRET = "whsec_test";

  private MockWebServer server;
  private InMemoryWebhookRegistry registry;
  private CircuitBreakerRegistry breakers;
  private JobQueue<WebhookDelivery> queue;
  private final TestClock clock = new TestClock();
  private final RecordingEventSink events = new RecordingEventSink();
  private Webhook webhook;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();

    registry = new InMemoryWebhookRegistry();
    breakers =
        new CircuitBreakerRegistry(
            Map.of("webhook", new CircuitBreakerConfig(2, Duration.ofSeconds(30), 1)), clock);
    WebhookDeliveryHandler handler =
        new WebhookDeliveryHandler(
            new OkHttpClient(), registry, breakers, new WebhookConfig(), clock);
    queue =
        new JobQueue<>(
            new QueueConfig(QueueConfig.WEBHOOK, 1, 3, Duration.ofSeconds(5)), handler, events, clock);

    webhook =
        registry.save(
            new Webhook(
                "wh-1",
                "crm",
                server.url("/hook").toString(),
                SECRET,
                List.of(),
                List.of(),
                true,
                3,
                Duration.ofSeconds(2),
                clock.instant(),
                clock.instant()));
  }

  @AfterEach
  void tearDown() throws Exception {
    queue.stop();
    server.shutdown();
  }

  private String enqueue() {
    Map<String, Object> envelope = new LinkedHashMap<>();
    envelope.put("id", "evt-1");
    envelope.put("event", "message.sent");
    envelope.put("sessionId", "main");
    envelope.put("data", Map.of("messageId", "m-1"));
    return queue.enqueue(
        new WebhookDelivery(webhook.id(), webhook.url(), SECRET, envelope, webhook.timeout()),
        JobPriority.NORMAL,
        webhook.maxAttempts());
  }

  @Test
  @DisplayName("posts a signed JSON envelope with identifying headers")
  void testSignedPost() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(204));

    String jobId = enqueue();
    queue.drain();

    RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
    assertThat(request).isNotNull();
    String body = request.getBody().readUtf8();
    assertThat(request.getMethod()).isEqualTo("POST");
    assertThat(request.getHeader("User-Agent")).isEqualTo("WhatsApp-Gateway-Webhook/1.0");
    assertThat(request.getHeader(WebhookSigner.ID_HEADER)).isEqualTo("wh-1");
    assertThat(request.getHeader(WebhookSigner.EVENT_HEADER)).isEqualTo("message.sent");
    assertThat(request.getHeader(WebhookSigner.SIGNATURE_HEADER))
        .isEqualTo(WebhookSigner.sign(body, SECRET));
    assertThat(body).contains("\"event\":\"message.sent\"").contains("\"messageId\":\"m-1\"");

    assertThat(queue.getJob(jobId)).get().extracting(Job::getStatus).isEqualTo(JobStatus.COMPLETED);
    assertThat(registry.stats("wh-1").deliveryCount()).isEqualTo(1);
    assertThat(registry.stats("wh-1").lastDeliveryStatus()).isEqualTo("success");
  }

  @Test
  @DisplayName("non-2xx responses are retried with backoff and then succeed")
  void testRetryThenSuccess() {
    server.enqueue(new MockResponse().setResponseCode(500));
    server.enqueue(new MockResponse().setResponseCode(200));

    String jobId = enqueue();
    queue.drain();
    assertThat(queue.getJob(jobId)).get().extracting(Job::getLastError).isEqualTo("HTTP 500");
    assertThat(registry.stats("wh-1").failureCount()).isEqualTo(1);

    clock.advance(Duration.ofSeconds(5));
    queue.drain();

    Job<WebhookDelivery> job = queue.getJob(jobId).orElseThrow();
    assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.getAttempts()).isEqualTo(2);
    assertThat(server.getRequestCount()).isEqualTo(2);
  }

  @Test
  @DisplayName("repeated failures open the endpoint breaker; later attempts do not hit the endpoint")
  void testBreakerPerEndpoint() {
    server.enqueue(new MockResponse().setResponseCode(503));
    server.enqueue(new MockResponse().setResponseCode(503));

    String jobId = enqueue();
    queue.drain();
    clock.advance(Duration.ofSeconds(5));
    queue.drain();
    clock.advance(Duration.ofSeconds(10));
    queue.drain();

    assertThat(breakers.get("webhook", "wh-1").getState()).isEqualTo(CircuitState.OPEN);
    assertThat(breakers.get("webhook").getState()).isEqualTo(CircuitState.CLOSED);
    assertThat(server.getRequestCount()).isEqualTo(2);
    Job<WebhookDelivery> job = queue.getJob(jobId).orElseThrow();
    assertThat(job.getStatus()).isEqualTo(JobStatus.DEAD);
    assertThat(job.getLastError()).isEqualTo("Service temporarily unavailable");
  }

  @Test
  @DisplayName("deliveries for a deleted webhook are skipped without a request")
  void testDeletedWebhookSkipped() {
    String jobId = enqueue();
    registry.delete("wh-1");

    queue.drain();

    assertThat(server.getRequestCount()).isZero();
    assertThat(queue.getJob(jobId)).get().extracting(Job::getStatus).isEqualTo(JobStatus.COMPLETED);
  }
}
