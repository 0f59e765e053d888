package com.acme.gateway.config;

import java.time.Duration;

/** Conversation state retention. Pure POJO - no framework dependencies. */
public class ConversationConfig {

  private int maxHistory = 100;
  private Duration cleanupInterval = Duration.ofMinutes(5);

  /** Oldest history entries are dropped beyond this size. */
  public int getMaxHistory() {
    return maxHistory;
  }

  public void setMaxHistory(int maxHistory) {
    this.maxHistory = maxHistory;
  }

  public Duration getCleanupInterval() {
    return cleanupInterval;
  }

  public void setCleanupInterval(Duration cleanupInterval) {
    this.cleanupInterval = cleanupInterval;
  }
}
