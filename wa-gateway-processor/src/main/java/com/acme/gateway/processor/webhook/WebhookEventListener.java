package com.acme.gateway.processor.webhook;

import com.acme.gateway.events.DomainEvent;
import com.acme.gateway.events.EventNames;
import io.micronaut.context.event.ApplicationEventListener;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Forwards webhook-eligible domain events to {@link WebhookService#dispatch}. Runs on the
 * emitting thread, so fan-out failures are logged here rather than surfacing as a failure of
 * the action that emitted the event.
 */
@Slf4j
@Singleton
@RequiredArgsConstructor
public class WebhookEventListener implements ApplicationEventListener<DomainEvent> {

  private final WebhookService webhooks;

  @Override
  public boolean supports(DomainEvent event) {
    return EventNames.WEBHOOK_EVENTS.contains(event.name());
  }

  @Override
  public void onApplicationEvent(DomainEvent event) {
    String sessionId = event.sessionId() != null ? event.sessionId() : "unknown";
    try {
      webhooks.dispatch(event.name(), sessionId, event.payload());
    } catch (RuntimeException e) {
      log.error("Webhook fan-out failed for event={} sessionId={}", event.name(), sessionId, e);
    }
  }
}
