package com.acme.gateway.queue;

import java.time.Instant;
import lombok.Getter;

/**
 * A unit of asynchronous work. State is changed only by the owning {@link JobQueue} under its
 * lock; callers outside the queue receive copies.
 */
@Getter
public class Job<P extends JobPayload> {

  private final String id;
  private final String type;
  private final P payload;
  private final JobPriority priority;
  private final int maxAttempts;
  private final Instant createdAt;
  private final long sequence;

  private JobStatus status = JobStatus.PENDING;
  private int attempts;
  private Instant processedAt;
  private Instant completedAt;
  private Instant notBefore;
  private String lastError;
  private Object result;

  Job(
      String id,
      P payload,
      JobPriority priority,
      int maxAttempts,
      Instant createdAt,
      long sequence) {
    this.id = id;
    this.type = payload.type();
    this.payload = payload;
    this.priority = priority;
    this.maxAttempts = maxAttempts;
    this.createdAt = createdAt;
    this.sequence = sequence;
    this.notBefore = createdAt;
  }

  private Job(Job<P> other) {
    this(other.id, other.payload, other.priority, other.maxAttempts, other.createdAt, other.sequence);
    this.status = other.status;
    this.attempts = other.attempts;
    this.processedAt = other.processedAt;
    this.completedAt = other.completedAt;
    this.notBefore = other.notBefore;
    this.lastError = other.lastError;
    this.result = other.result;
  }

  Job<P> copy() {
    return new Job<>(this);
  }

  void markProcessing(Instant now) {
    status = JobStatus.PROCESSING;
    processedAt = now;
    attempts++;
  }

  void markCompleted(Instant now, Object handlerResult) {
    status = JobStatus.COMPLETED;
    completedAt = now;
    result = handlerResult;
  }

  void markRetry(String error, Instant eligibleAt) {
    status = JobStatus.PENDING;
    lastError = error;
    notBefore = eligibleAt;
  }

  void markDead(String error) {
    status = JobStatus.DEAD;
    lastError = error;
  }

  void resetForRetry(Instant now) {
    status = JobStatus.PENDING;
    attempts = 0;
    lastError = null;
    notBefore = now;
  }

  boolean isEligible(Instant now) {
    return status == JobStatus.PENDING && !now.isBefore(notBefore);
  }
}
