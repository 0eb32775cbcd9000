package com.polybot.copytrader.polymarket;

import java.time.Duration;

/**
 * Exponential backoff: the delay starts at {@code initialDelay} and doubles after every failed attempt up to
 * {@code maxDelay}.
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, Duration requestTimeout) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (initialDelay == null || initialDelay.isNegative()) {
      initialDelay = Duration.ZERO;
    }
    if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
      maxDelay = initialDelay;
    }
    if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
      requestTimeout = Duration.ofSeconds(10);
    }
  }

  public Duration next(Duration current) {
    Duration doubled = current.multipliedBy(2);
    return doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
  }
}
