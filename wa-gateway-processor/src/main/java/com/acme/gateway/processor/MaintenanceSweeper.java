package com.acme.gateway.processor;

import com.acme.gateway.processor.conversation.ConversationStateService;
import com.acme.gateway.processor.queue.QueueManager;
import com.acme.gateway.ratelimit.RateLimiter;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic memory bounding: idle rate-limit entries, expired conversation state and completed
 * jobs. None of these sweeps affects correctness. Scheduled tasks stop with the application
 * context.
 */
@Singleton
@Requires(property = "maintenance.enabled", notEquals = "false")
public class MaintenanceSweeper {
  private static final Logger LOG = LoggerFactory.getLogger(MaintenanceSweeper.class);

  private final RateLimiter rateLimiter;
  private final ConversationStateService conversations;
  private final QueueManager queues;

  public MaintenanceSweeper(
      RateLimiter rateLimiter, ConversationStateService conversations, QueueManager queues) {
    this.rateLimiter = rateLimiter;
    this.conversations = conversations;
    this.queues = queues;
  }

  @Scheduled(fixedDelay = "${rate-limiting.cleanup-interval:1m}")
  public void evictRateLimitEntries() {
    try {
      int evicted = rateLimiter.evictExpired();
      if (evicted > 0) {
        LOG.debug("Evicted {} idle rate limit entries", evicted);
      }
    } catch (RuntimeException e) {
      LOG.error("Error in rate limit sweep: {}", e.getMessage(), e);
    }
  }

  @Scheduled(fixedDelay = "${conversations.cleanup-interval:5m}")
  public void expireConversations() {
    try {
      conversations.cleanupExpired();
    } catch (RuntimeException e) {
      LOG.error("Error in conversation sweep: {}", e.getMessage(), e);
    }
  }

  @Scheduled(fixedDelay = "${queues.completed-sweep-interval:10m}")
  public void clearCompletedJobs() {
    try {
      int cleared = queues.clearCompleted();
      if (cleared > 0) {
        LOG.info("Cleared {} completed jobs", cleared);
      }
    } catch (RuntimeException e) {
      LOG.error("Error in completed job sweep: {}", e.getMessage(), e);
    }
  }
}
