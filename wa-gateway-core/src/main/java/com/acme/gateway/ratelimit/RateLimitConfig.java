package com.acme.gateway.ratelimit;

import java.time.Duration;

/**
 * Limits for one adapter tier: a sustained window and a short burst window, both of which must
 * have quota for a request to be admitted. Pure POJO - no framework dependencies.
 */
public class RateLimitConfig {

  private String name = "default";
  private int limit = 100;
  private Duration window = Duration.ofSeconds(60);
  private int burstLimit = 10;
  private Duration burstWindow = Duration.ofSeconds(1);

  public RateLimitConfig() {}

  public RateLimitConfig(
      String name, int limit, Duration window, int burstLimit, Duration burstWindow) {
    this.name = name;
    this.limit = limit;
    this.window = window;
    this.burstLimit = burstLimit;
    this.burstWindow = burstWindow;
  }

  /** REST adapter defaults: 100 per minute, 10 per second. */
  public static RateLimitConfig restDefaults() {
    return new RateLimitConfig("rest", 100, Duration.ofSeconds(60), 10, Duration.ofSeconds(1));
  }

  /** Agent adapter defaults: 30 per minute, 5 per second. */
  public static RateLimitConfig agentDefaults() {
    return new RateLimitConfig("agent", 30, Duration.ofSeconds(60), 5, Duration.ofSeconds(1));
  }

  /** Copy with a per-caller sustained limit, e.g. the limit attached to an API key. */
  public RateLimitConfig withLimit(int overrideLimit) {
    return new RateLimitConfig(name, overrideLimit, window, burstLimit, burstWindow);
  }

  /** True when this tier never admits more than {@code other} over either window. */
  public boolean isNoMorePermissiveThan(RateLimitConfig other) {
    return limit <= other.limit
        && window.compareTo(other.window) >= 0
        && burstLimit <= other.burstLimit
        && burstWindow.compareTo(other.burstWindow) >= 0;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public int getLimit() {
    return limit;
  }

  public void setLimit(int limit) {
    this.limit = limit;
  }

  public Duration getWindow() {
    return window;
  }

  public void setWindow(Duration window) {
    this.window = window;
  }

  public int getBurstLimit() {
    return burstLimit;
  }

  public void setBurstLimit(int burstLimit) {
    this.burstLimit = burstLimit;
  }

  public Duration getBurstWindow() {
    return burstWindow;
  }

  public void setBurstWindow(Duration burstWindow) {
    this.burstWindow = burstWindow;
  }

  @Override
  public String toString() {
    return name
        + "[limit="
        + limit
        + "/"
        + window
        + ", burst="
        + burstLimit
        + "/"
        + burstWindow
        + "]";
  }
}
