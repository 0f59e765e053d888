package com.acme.gateway.processor.conversation;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Agent working memory for one chat of one session. Immutable; updates produce a new version. */
public record ConversationState(
    String sessionId,
    String jid,
    String agentId,
    Map<String, Object> context,
    List<HistoryEntry> history,
    Map<String, Object> metadata,
    int version,
    Instant createdAt,
    Instant updatedAt,
    Instant expiresAt) {

  public static String key(String sessionId, String jid) {
    return sessionId + ":" + jid;
  }

  public boolean isExpired(Instant now) {
    return expiresAt != null && expiresAt.isBefore(now);
  }
}
