package com.ospicorp.anomalyapi.store;

import java.time.Duration;

/** Bounded exponential backoff for transient storage failures. */
public record BackoffPolicy(int maxRetries, Duration initialDelay, Duration maxDelay) {

  public BackoffPolicy {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (initialDelay.isNegative() || maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("delays must satisfy 0 <= initialDelay <= maxDelay");
    }
  }

  public static BackoffPolicy defaults() {
    return new BackoffPolicy(3, Duration.ofMillis(50), Duration.ofSeconds(2));
  }

  /** Delay before retry number {@code retry} (1-based). */
  public Duration delayBefore(int retry) {
    long cap = maxDelay.toMillis();
    long millis = initialDelay.toMillis();
    for (int i = 1; i < retry && millis < cap; i++) {
      millis *= 2;
    }
    return Duration.ofMillis(Math.min(millis, cap));
  }
}
