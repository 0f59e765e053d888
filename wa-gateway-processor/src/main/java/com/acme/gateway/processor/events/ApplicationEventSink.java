package com.acme.gateway.processor.events;

import com.acme.gateway.events.DomainEvent;
import com.acme.gateway.spi.EventSink;
import io.micronaut.context.event.ApplicationEventPublisher;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/** Publishes events to in-process listeners (webhook fan-out among them) synchronously. */
@Slf4j
@Singleton
public class ApplicationEventSink implements EventSink {

  private final ApplicationEventPublisher<DomainEvent> publisher;
  private final Clock clock;

  public ApplicationEventSink(ApplicationEventPublisher<DomainEvent> publisher, Clock clock) {
    this.publisher = publisher;
    this.clock = clock;
  }

  @Override
  public void emit(String eventName, Map<String, Object> payload) {
    log.debug("Emitting event {}", eventName);
    publisher.publishEvent(
        new DomainEvent(
            eventName,
            Collections.unmodifiableMap(new LinkedHashMap<>(payload)),
            clock.instant()));
  }
}
