package com.acme.gateway.web;

import com.acme.gateway.capability.CapabilityGateway;
import com.acme.gateway.error.GatewayException;
import com.acme.gateway.processor.capabilities.MessagingCapabilities;
import com.acme.gateway.processor.messaging.OutboundMessageDispatcher;
import com.acme.gateway.queue.JobPriority;
import com.acme.gateway.queue.QueueConfig;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

@Controller("/api/messages")
@ExecuteOn(TaskExecutors.BLOCKING)
public class MessageController {

  private final CapabilityGateway gateway;
  private final OutboundMessageDispatcher dispatcher;

  public MessageController(CapabilityGateway gateway, OutboundMessageDispatcher dispatcher) {
    this.gateway = gateway;
    this.dispatcher = dispatcher;
  }

  /** Synchronous send; 201 with the message id once the session accepted it. */
  @Post("/send")
  public HttpResponse<ApiResponse<Object>> send(@Body Map<String, Object> body) {
    return Responses.created(gateway.execute(MessagingCapabilities.SEND_TEXT, body));
  }

  @Post("/reply")
  public HttpResponse<ApiResponse<Object>> reply(@Body Map<String, Object> body) {
    return Responses.created(gateway.execute(MessagingCapabilities.REPLY, body));
  }

  /** Asynchronous send through the outgoing queue; 202 with the job id. */
  @Post("/queue")
  public HttpResponse<ApiResponse<Map<String, Object>>> enqueue(@Body Map<String, Object> body) {
    Map<String, Object> args = new HashMap<>(body);
    JobPriority priority = priority(args.remove("priority"));
    String jobId = dispatcher.enqueue(args, priority);
    return Responses.accepted(
        Map.of("jobId", jobId, "queue", QueueConfig.OUTGOING, "priority", priority.name()));
  }

  private static JobPriority priority(Object value) {
    if (value == null) {
      return JobPriority.NORMAL;
    }
    try {
      return JobPriority.valueOf(String.valueOf(value).toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw GatewayException.validation("priority must be one of critical, high, normal, low");
    }
  }
}
