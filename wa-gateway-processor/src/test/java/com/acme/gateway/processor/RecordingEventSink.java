package com.acme.gateway.processor;

import com.acme.gateway.spi.EventSink;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/** Collects emitted events in order. */
public class RecordingEventSink implements EventSink {

  public record Emitted(String name, Map<String, Object> payload) {}

  private final List<Emitted> emitted = new CopyOnWriteArrayList<>();

  @Override
  public void emit(String eventName, Map<String, Object> payload) {
    emitted.add(new Emitted(eventName, payload));
  }

  public List<Emitted> all() {
    return emitted;
  }

  public List<String> names() {
    return emitted.stream().map(Emitted::name).toList();
  }

  public Emitted last() {
    return emitted.get(emitted.size() - 1);
  }
}
