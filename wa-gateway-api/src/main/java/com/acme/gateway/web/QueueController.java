package com.acme.gateway.web;

import com.acme.gateway.processor.admin.OperationsService;
import com.acme.gateway.processor.queue.QueueManager;
import com.acme.gateway.queue.Job;
import com.acme.gateway.queue.QueueStats;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Operator view of the job queues. Payloads are not exposed; they may carry secrets. */
@Controller("/api/queues")
@ExecuteOn(TaskExecutors.BLOCKING)
public class QueueController {

  private final QueueManager queues;
  private final OperationsService operations;
  private final IdentityResolver identities;

  public QueueController(
      QueueManager queues, OperationsService operations, IdentityResolver identities) {
    this.queues = queues;
    this.operations = operations;
    this.identities = identities;
  }

  public record JobView(
      String id,
      String type,
      String priority,
      String status,
      int attempts,
      int maxAttempts,
      Instant createdAt,
      Instant processedAt,
      Instant completedAt,
      Instant notBefore,
      String lastError) {

    static JobView of(Job<?> job) {
      return new JobView(
          job.getId(),
          job.getType(),
          job.getPriority().name(),
          job.getStatus().name(),
          job.getAttempts(),
          job.getMaxAttempts(),
          job.getCreatedAt(),
          job.getProcessedAt(),
          job.getCompletedAt(),
          job.getNotBefore(),
          job.getLastError());
    }
  }

  @Get("/stats")
  public HttpResponse<ApiResponse<List<QueueStats>>> stats() {
    return Responses.ok(queues.stats());
  }

  @Get("/{queue}/dead-letters")
  public HttpResponse<ApiResponse<List<JobView>>> deadLetters(@PathVariable String queue) {
    return Responses.ok(operations.deadLetters(queue).stream().map(JobView::of).toList());
  }

  @Post("/{queue}/dead-letters/{jobId}/retry")
  public HttpResponse<ApiResponse<Map<String, Object>>> retry(
      HttpRequest<?> request, @PathVariable String queue, @PathVariable String jobId) {
    operations.retryDeadLetter(queue, jobId, identities.resolve(request));
    return Responses.ok(Map.of("jobId", jobId, "requeued", true));
  }

  @Get("/{queue}/jobs/{jobId}")
  public HttpResponse<ApiResponse<JobView>> job(
      @PathVariable String queue, @PathVariable String jobId) {
    return Responses.ok(JobView.of(operations.job(queue, jobId)));
  }

  @Delete("/{queue}/completed")
  public HttpResponse<ApiResponse<Map<String, Object>>> clearCompleted(
      HttpRequest<?> request, @PathVariable String queue) {
    int cleared = operations.clearCompleted(queue, identities.resolve(request));
    return Responses.ok(Map.of("cleared", cleared));
  }
}
