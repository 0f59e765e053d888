package com.acme.gateway.processor.conversation;

import jakarta.inject.Singleton;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Singleton
public class InMemoryConversationStore implements ConversationStore {

  private final Map<String, ConversationState> states = new ConcurrentHashMap<>();

  @Override
  public Optional<ConversationState> find(String key) {
    return Optional.ofNullable(states.get(key));
  }

  @Override
  public ConversationState upsert(String key, UnaryOperator<ConversationState> change) {
    return states.compute(key, (k, current) -> change.apply(current));
  }

  @Override
  public boolean delete(String key) {
    return states.remove(key) != null;
  }

  @Override
  public List<ConversationState> findBySession(String sessionId) {
    return states.values().stream().filter(s -> s.sessionId().equals(sessionId)).toList();
  }

  @Override
  public int deleteExpired(Instant now) {
    int before = states.size();
    states.values().removeIf(s -> s.isExpired(now));
    return before - states.size();
  }
}
