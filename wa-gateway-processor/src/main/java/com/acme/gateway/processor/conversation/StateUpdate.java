package com.acme.gateway.processor.conversation;

import java.util.List;
import java.util.Map;

/**
 * Partial update: null fields leave the stored value unchanged; maps are merged key by key and
 * history is appended.
 */
public record StateUpdate(
    Map<String, Object> context,
    List<HistoryEntry> history,
    Map<String, Object> metadata,
    String agentId,
    Long ttlMinutes) {

  public static StateUpdate history(HistoryEntry entry) {
    return new StateUpdate(null, List.of(entry), null, null, null);
  }
}
