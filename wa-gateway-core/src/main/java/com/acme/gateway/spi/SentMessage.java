package com.acme.gateway.spi;

import java.time.Instant;

public record SentMessage(String messageId, String sessionId, String to, Instant timestamp) {}
