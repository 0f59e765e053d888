package com.acme.gateway.processor.conversation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/** Keyed storage for conversation state. Updates for one key are applied atomically. */
public interface ConversationStore {

  Optional<ConversationState> find(String key);

  /** Applies {@code change} to the current value (null when absent) and stores the result. */
  ConversationState upsert(String key, UnaryOperator<ConversationState> change);

  boolean delete(String key);

  List<ConversationState> findBySession(String sessionId);

  int deleteExpired(Instant now);
}
