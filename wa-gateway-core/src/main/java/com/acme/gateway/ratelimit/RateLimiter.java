package com.acme.gateway.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-identity admission control over a sustained window and a burst window.
 *
 * <p>Entries are keyed by tier name and identity, so the REST and agent tiers keep separate
 * counters for the same caller. Each key is updated inside {@link ConcurrentHashMap#compute},
 * which serializes updates for that key only.
 */
@Slf4j
public class RateLimiter {

  private final Map<String, Entry> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  public RateLimiter(Clock clock) {
    this.clock = clock;
  }

  public RateLimitDecision admit(String identity, RateLimitConfig config) {
    Instant now = clock.instant();
    String key = config.getName() + ":" + identity;
    RateLimitDecision[] decision = new RateLimitDecision[1];
    entries.compute(
        key,
        (k, entry) -> {
          Entry e = entry == null ? new Entry(now, config) : entry;
          if (!now.isBefore(e.windowResetAt)) {
            e.count = 0;
            e.windowResetAt = now.plus(config.getWindow());
          }
          if (!now.isBefore(e.burstStart.plus(config.getBurstWindow()))) {
            e.burstCount = 0;
            e.burstStart = now;
          }
          e.count++;
          e.burstCount++;
          decision[0] = decide(e, config, now);
          return e;
        });

    RateLimitDecision result = decision[0];
    if (result.rejected()) {
      log.warn(
          "Rate limit exceeded tier={} identity={} retryAfter={}s",
          config.getName(),
          identity,
          result.retryAfterSeconds());
    }
    return result;
  }

  private static RateLimitDecision decide(Entry e, RateLimitConfig config, Instant now) {
    int remaining = Math.max(0, config.getLimit() - e.count);
    int burstRemaining = Math.max(0, config.getBurstLimit() - e.burstCount);
    long resetEpochSecond = (e.windowResetAt.toEpochMilli() + 999) / 1000;

    long retryAfter = 0;
    if (e.burstCount > config.getBurstLimit()) {
      retryAfter = 1;
    } else if (e.count > config.getLimit()) {
      long millis = Duration.between(now, e.windowResetAt).toMillis();
      retryAfter = Math.max(1, (millis + 999) / 1000);
    }
    return new RateLimitDecision(
        retryAfter == 0,
        config.getLimit(),
        remaining,
        config.getBurstLimit(),
        burstRemaining,
        resetEpochSecond,
        retryAfter);
  }

  /**
   * Drop entries whose sustained window has ended. A dropped caller starts from a fresh entry on
   * the next request, which is exactly what an elapsed window would give it anyway.
   *
   * @return number of entries removed
   */
  public int evictExpired() {
    Instant now = clock.instant();
    int before = entries.size();
    entries.entrySet().removeIf(en -> !now.isBefore(en.getValue().windowResetAt));
    int removed = before - entries.size();
    if (removed > 0) {
      log.debug("Evicted {} expired rate limit entries", removed);
    }
    return removed;
  }

  public int size() {
    return entries.size();
  }

  private static final class Entry {
    private Instant windowResetAt;
    private int count;
    private Instant burstStart;
    private int burstCount;

    private Entry(Instant now, RateLimitConfig config) {
      this.windowResetAt = now.plus(config.getWindow());
      this.burstStart = now;
    }
  }
}
