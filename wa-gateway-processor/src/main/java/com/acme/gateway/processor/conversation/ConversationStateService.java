package com.acme.gateway.processor.conversation;

import com.acme.gateway.config.ConversationConfig;
import com.acme.gateway.error.GatewayException;
import com.acme.gateway.events.EventNames;
import com.acme.gateway.spi.EventSink;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Conversation state keyed by {@code sessionId:jid}. Context and metadata merge on update,
 * history is appended and trimmed to the newest {@code maxHistory} entries, and the version
 * increases by one per update. Expired states read as absent.
 */
@Slf4j
@Singleton
public class ConversationStateService {

  private final ConversationStore store;
  private final EventSink events;
  private final ConversationConfig config;
  private final Clock clock;

  public ConversationStateService(
      ConversationStore store, EventSink events, ConversationConfig config, Clock clock) {
    this.store = store;
    this.events = events;
    this.config = config;
    this.clock = clock;
  }

  public Optional<ConversationState> find(String sessionId, String jid) {
    String key = ConversationState.key(sessionId, jid);
    Optional<ConversationState> state = store.find(key);
    if (state.isPresent() && state.get().isExpired(clock.instant())) {
      store.delete(key);
      return Optional.empty();
    }
    return state;
  }

  /**
   * @throws GatewayException {@code NOT_FOUND} when no live state exists
   */
  public ConversationState get(String sessionId, String jid) {
    ConversationState state =
        find(sessionId, jid).orElseThrow(() -> GatewayException.notFound("Conversation state"));
    events.emit(EventNames.CONVERSATION_READ, Map.of("sessionId", sessionId, "jid", jid));
    return state;
  }

  public ConversationState update(String sessionId, String jid, StateUpdate update) {
    ConversationState state = apply(sessionId, jid, update);
    log.debug("Conversation state updated sessionId={} version={}", sessionId, state.version());
    events.emit(
        EventNames.CONVERSATION_UPDATED,
        Map.of("sessionId", sessionId, "jid", jid, "version", state.version()));
    return state;
  }

  public ConversationState addToHistory(String sessionId, String jid, String role, String content) {
    return update(
        sessionId, jid, StateUpdate.history(new HistoryEntry(role, content, clock.instant())));
  }

  /** Returns true if a state existed. Emits the cleared event either way. */
  public boolean clear(String sessionId, String jid) {
    boolean existed = store.delete(ConversationState.key(sessionId, jid));
    events.emit(
        EventNames.CONVERSATION_CLEARED,
        Map.of("sessionId", sessionId, "jid", jid, "existed", existed));
    return existed;
  }

  public List<ConversationState> listBySession(String sessionId) {
    Instant now = clock.instant();
    return store.findBySession(sessionId).stream().filter(s -> !s.isExpired(now)).toList();
  }

  public int cleanupExpired() {
    int removed = store.deleteExpired(clock.instant());
    if (removed > 0) {
      log.info("Cleaned up {} expired conversation states", removed);
    }
    return removed;
  }

  private ConversationState apply(String sessionId, String jid, StateUpdate update) {
    Instant now = clock.instant();
    Instant expiresAt =
        update.ttlMinutes() == null ? null : now.plus(Duration.ofMinutes(update.ttlMinutes()));
    return store.upsert(
        ConversationState.key(sessionId, jid),
        current -> {
          ConversationState existing = current == null || current.isExpired(now) ? null : current;
          if (existing == null) {
            return new ConversationState(
                sessionId,
                jid,
                update.agentId(),
                merge(Map.of(), update.context()),
                trim(new ArrayList<>(orEmpty(update.history()))),
                merge(Map.of(), update.metadata()),
                1,
                now,
                now,
                expiresAt);
          }
          List<HistoryEntry> history = new ArrayList<>(existing.history());
          history.addAll(orEmpty(update.history()));
          return new ConversationState(
              sessionId,
              jid,
              update.agentId() != null ? update.agentId() : existing.agentId(),
              merge(existing.context(), update.context()),
              trim(history),
              merge(existing.metadata(), update.metadata()),
              existing.version() + 1,
              existing.createdAt(),
              now,
              expiresAt != null ? expiresAt : existing.expiresAt());
        });
  }

  private static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> patch) {
    Map<String, Object> merged = new LinkedHashMap<>(base);
    if (patch != null) {
      merged.putAll(patch);
    }
    return merged;
  }

  private List<HistoryEntry> trim(List<HistoryEntry> history) {
    int excess = history.size() - config.getMaxHistory();
    return excess > 0 ? List.copyOf(history.subList(excess, history.size())) : List.copyOf(history);
  }

  private static <T> List<T> orEmpty(List<T> list) {
    return list == null ? List.of() : list;
  }
}
