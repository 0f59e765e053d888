package com.acme.gateway.processor.admin;

import com.acme.gateway.error.GatewayException;
import com.acme.gateway.processor.queue.QueueManager;
import com.acme.gateway.queue.Job;
import com.acme.gateway.queue.JobQueue;
import com.acme.gateway.resilience.CircuitBreaker;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import com.acme.gateway.resilience.CircuitStats;
import com.acme.gateway.spi.AuditSink;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Operator actions on queues and breakers. Every mutation is written to the audit trail. */
@Slf4j
@Singleton
@RequiredArgsConstructor
public class OperationsService {

  private final QueueManager queues;
  private final CircuitBreakerRegistry breakers;
  private final AuditSink audit;

  public List<? extends Job<?>> deadLetters(String queue) {
    return queues.byName(queue).getDeadLetterJobs();
  }

  public Job<?> job(String queue, String jobId) {
    JobQueue<?> q = queues.byName(queue);
    return q.getJob(jobId).orElseThrow(() -> GatewayException.notFound("Job"));
  }

  public void retryDeadLetter(String queue, String jobId, String actor) {
    if (!queues.byName(queue).retryDeadLetter(jobId)) {
      audit.failure("queue.dead_letter.retry", actor, Map.of("queue", queue, "jobId", jobId));
      throw GatewayException.notFound("Dead letter job");
    }
    log.info("Dead letter job requeued queue={} jobId={} by={}", queue, jobId, actor);
    audit.success("queue.dead_letter.retry", actor, Map.of("queue", queue, "jobId", jobId));
  }

  public int clearCompleted(String queue, String actor) {
    int cleared = queues.byName(queue).clearCompleted();
    audit.success("queue.completed.clear", actor, Map.of("queue", queue, "cleared", cleared));
    return cleared;
  }

  public List<CircuitStats> breakerStats() {
    return breakers.stats();
  }

  public CircuitStats resetBreaker(String name, String actor) {
    CircuitBreaker breaker =
        breakers.find(name).orElseThrow(() -> GatewayException.notFound("Circuit breaker"));
    breaker.reset();
    audit.success("circuit_breaker.reset", actor, Map.of("breaker", name));
    return breaker.getStats();
  }
}
