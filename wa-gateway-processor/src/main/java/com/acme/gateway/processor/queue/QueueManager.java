package com.acme.gateway.processor.queue;

import com.acme.gateway.config.QueuesConfig;
import com.acme.gateway.error.GatewayException;
import com.acme.gateway.processor.messaging.OutboundMessageHandler;
import com.acme.gateway.processor.webhook.WebhookDeliveryHandler;
import com.acme.gateway.queue.JobPayload.OutboundMessage;
import com.acme.gateway.queue.JobPayload.WebhookDelivery;
import com.acme.gateway.queue.JobQueue;
import com.acme.gateway.queue.QueueStats;
import com.acme.gateway.spi.EventSink;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Owns the outgoing-message and webhook-delivery queues and their worker lifecycle. */
@Slf4j
@Singleton
public class QueueManager implements AutoCloseable {

  private final QueuesConfig config;
  private final JobQueue<OutboundMessage> outgoing;
  private final JobQueue<WebhookDelivery> webhooks;

  public QueueManager(
      QueuesConfig config,
      OutboundMessageHandler outboundHandler,
      WebhookDeliveryHandler webhookHandler,
      EventSink events,
      Clock clock) {
    this.config = config;
    this.outgoing = new JobQueue<>(config.getOutgoing(), outboundHandler, events, clock);
    this.webhooks = new JobQueue<>(config.getWebhook(), webhookHandler, events, clock);
  }

  @PostConstruct
  public void start() {
    if (!config.isAutoStart()) {
      log.info("Queue auto-start disabled; workers not started");
      return;
    }
    outgoing.start();
    webhooks.start();
  }

  public JobQueue<OutboundMessage> outgoing() {
    return outgoing;
  }

  public JobQueue<WebhookDelivery> webhooks() {
    return webhooks;
  }

  /**
   * @throws GatewayException {@code NOT_FOUND} for an unknown queue name
   */
  public JobQueue<?> byName(String name) {
    if (outgoing.getName().equals(name)) {
      return outgoing;
    }
    if (webhooks.getName().equals(name)) {
      return webhooks;
    }
    throw GatewayException.notFound("Queue");
  }

  public List<QueueStats> stats() {
    return List.of(outgoing.getStats(), webhooks.getStats());
  }

  /** Drops completed jobs from both queues; returns how many were removed. */
  public int clearCompleted() {
    return outgoing.clearCompleted() + webhooks.clearCompleted();
  }

  @Override
  @PreDestroy
  public void close() {
    log.info("Shutting down queues");
    outgoing.stop();
    webhooks.stop();
  }
}
