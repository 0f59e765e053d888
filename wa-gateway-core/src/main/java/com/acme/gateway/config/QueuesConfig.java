package com.acme.gateway.config;

import com.acme.gateway.queue.QueueConfig;

/** Per-queue worker settings. Pure POJO - no framework dependencies. */
public class QueuesConfig {

  private QueueConfig outgoing = QueueConfig.outgoingDefaults();
  private QueueConfig webhook = QueueConfig.webhookDefaults();
  private boolean autoStart = true;

  public QueueConfig getOutgoing() {
    return outgoing;
  }

  public void setOutgoing(QueueConfig outgoing) {
    outgoing.setName(QueueConfig.OUTGOING);
    this.outgoing = outgoing;
  }

  public QueueConfig getWebhook() {
    return webhook;
  }

  public void setWebhook(QueueConfig webhook) {
    webhook.setName(QueueConfig.WEBHOOK);
    this.webhook = webhook;
  }

  /** Start workers when the application context starts. */
  public boolean isAutoStart() {
    return autoStart;
  }

  public void setAutoStart(boolean autoStart) {
    this.autoStart = autoStart;
  }
}
