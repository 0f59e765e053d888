package com.acme.gateway.queue;

/**
 * Job lifecycle: PENDING -> PROCESSING -> COMPLETED | PENDING (retry after backoff) | DEAD. A
 * retried job waits in PENDING until its not-before instant.
 */
public enum JobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  DEAD
}
