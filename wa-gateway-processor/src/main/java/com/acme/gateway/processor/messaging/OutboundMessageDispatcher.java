package com.acme.gateway.processor.messaging;

import com.acme.gateway.processor.capabilities.MessagingCapabilities;
import com.acme.gateway.processor.queue.QueueManager;
import com.acme.gateway.processor.session.SessionAccess;
import com.acme.gateway.queue.JobPayload.OutboundMessage;
import com.acme.gateway.queue.JobPriority;
import jakarta.inject.Singleton;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Asynchronous send: validates and enqueues; the {@code message.sent} event is emitted later by
 * the worker that performs the send.
 */
@Slf4j
@Singleton
@RequiredArgsConstructor
public class OutboundMessageDispatcher {

  private final QueueManager queues;
  private final SessionAccess sessions;

  /** Returns the job id. */
  public String enqueue(Map<String, Object> args, JobPriority priority) {
    Map<String, Object> valid = MessagingCapabilities.SEND_SCHEMA.validate(args);
    String sessionId = (String) valid.get("sessionId");
    sessions.requireKnown(sessionId);
    OutboundMessage message =
        new OutboundMessage(
            sessionId,
            (String) valid.get("to"),
            (String) valid.get("text"),
            (String) valid.get("quotedMessageId"));
    String jobId = queues.outgoing().enqueue(message, priority);
    log.info("Message queued sessionId={} jobId={} priority={}", sessionId, jobId, priority);
    return jobId;
  }
}
