package com.acme.gateway.queue;

/**
 * What happens to in-flight work when a queue stops. Pending jobs are held in memory only and are
 * dropped with the process under either policy.
 */
public enum ShutdownPolicy {
  /** Stop selecting new jobs and wait up to the grace period for running handlers. */
  DRAIN,
  /** Interrupt running handlers immediately. */
  ABANDON
}
