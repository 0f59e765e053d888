package com.acme.gateway.queue;

/** Processes one job attempt; any exception counts as a failed attempt. */
@FunctionalInterface
public interface JobHandler<P extends JobPayload> {
  Object handle(Job<P> job) throws Exception;
}
