package com.polybot.copytrader.ledger.model;

import java.time.Instant;

/**
 * Immutable record of a realized close. For hedges {@code outcome} reads {@code "<held> → <bought>"}.
 */
public record ClosedPositionRecord(
    String tokenId,
    String marketId,
    String outcome,
    double size,
    double entryPrice,
    double exitPrice,
    double realizedPnL,
    Instant openedAt,
    Instant closedAt,
    CloseKind kind
) {

  public static final String HEDGE_ARROW = " → ";

  public static String hedgeOutcome(String held, String bought) {
    return held + HEDGE_ARROW + bought;
  }
}
