package com.polybot.copytrader.domain;

import java.time.Instant;

/**
 * Result of market resolution detection: the market, the outcome that won and the price it settled at.
 */
public record ResolutionEvent(
    String marketId,
    String winningOutcome,
    Instant resolvedAt,
    double resolvedPrice
) {
}
