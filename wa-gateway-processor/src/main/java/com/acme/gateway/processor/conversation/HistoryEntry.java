package com.acme.gateway.processor.conversation;

import java.time.Instant;

public record HistoryEntry(String role, String content, Instant timestamp) {}
