package com.acme.gateway.queue;

import java.time.Duration;

/** Worker and retry settings for one queue. Pure POJO - no framework dependencies. */
public class QueueConfig {

  public static final String OUTGOING = "outgoing-messages";
  public static final String WEBHOOK = "webhook-delivery";

  private String name = "default";
  private int concurrency = 5;
  private int maxAttempts = 3;
  private Duration retryDelay = Duration.ofSeconds(1);
  private Duration maxRetryDelay = Duration.ofMinutes(5);
  private Duration handlerTimeout = Duration.ofSeconds(30);
  private Duration pollInterval = Duration.ofMillis(100);
  private Duration shutdownGrace = Duration.ofSeconds(5);
  private ShutdownPolicy shutdownPolicy = ShutdownPolicy.DRAIN;

  public QueueConfig() {}

  public QueueConfig(String name, int concurrency, int maxAttempts, Duration retryDelay) {
    this.name = name;
    this.concurrency = concurrency;
    this.maxAttempts = maxAttempts;
    this.retryDelay = retryDelay;
  }

  /** Outbound message sends: 3 attempts, 2s base delay, 10 workers. */
  public static QueueConfig outgoingDefaults() {
    return new QueueConfig(OUTGOING, 10, 3, Duration.ofSeconds(2));
  }

  /** Webhook deliveries: 3 attempts, 5s base delay, 10 workers. */
  public static QueueConfig webhookDefaults() {
    return new QueueConfig(WEBHOOK, 10, 3, Duration.ofSeconds(5));
  }

  /** Delay before retry number {@code attempts}: {@code retryDelay * 2^(attempts-1)}, capped. */
  public Duration backoffFor(int attempts) {
    int exponent = Math.min(Math.max(attempts - 1, 0), 20);
    Duration delay = retryDelay.multipliedBy(1L << exponent);
    return delay.compareTo(maxRetryDelay) > 0 ? maxRetryDelay : delay;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Duration getRetryDelay() {
    return retryDelay;
  }

  public void setRetryDelay(Duration retryDelay) {
    this.retryDelay = retryDelay;
  }

  public Duration getMaxRetryDelay() {
    return maxRetryDelay;
  }

  public void setMaxRetryDelay(Duration maxRetryDelay) {
    this.maxRetryDelay = maxRetryDelay;
  }

  public Duration getHandlerTimeout() {
    return handlerTimeout;
  }

  public void setHandlerTimeout(Duration handlerTimeout) {
    this.handlerTimeout = handlerTimeout;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  public Duration getShutdownGrace() {
    return shutdownGrace;
  }

  public void setShutdownGrace(Duration shutdownGrace) {
    this.shutdownGrace = shutdownGrace;
  }

  public ShutdownPolicy getShutdownPolicy() {
    return shutdownPolicy;
  }

  public void setShutdownPolicy(ShutdownPolicy shutdownPolicy) {
    this.shutdownPolicy = shutdownPolicy;
  }

  @Override
  public String toString() {
    return name
        + "[concurrency="
        + concurrency
        + ", maxAttempts="
        + maxAttempts
        + ", retryDelay="
        + retryDelay
        + ", handlerTimeout="
        + handlerTimeout
        + ", shutdown="
        + shutdownPolicy
        + "]";
  }
}
