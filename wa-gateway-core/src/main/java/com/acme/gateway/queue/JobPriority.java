package com.acme.gateway.queue;

/** Scheduling priority; higher weight is dequeued first. */
public enum JobPriority {
  CRITICAL(4),
  HIGH(3),
  NORMAL(2),
  LOW(1);

  private final int weight;

  JobPriority(int weight) {
    this.weight = weight;
  }

  public int weight() {
    return weight;
  }
}
