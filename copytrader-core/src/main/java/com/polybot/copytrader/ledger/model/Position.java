package com.polybot.copytrader.ledger.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Net inventory in a single outcome token.
 *
 * Positive {@code netSize} is long the outcome, negative is short. Instances are immutable; every fill
 * produces a new instance.
 */
public record Position(
    String tokenId,
    String marketId,
    String outcome,
    double netSize,
    double avgEntryPrice,
    Instant openedAt,
    Instant lastUpdate,
    String title,
    String displayName
) {

  public static Position open(String tokenId, String marketId, String outcome, double netSize,
                              double price, Instant now, String title) {
    return new Position(tokenId, marketId, outcome, netSize, price, now, now, title, displayName(title, outcome));
  }

  @JsonIgnore
  public boolean isLong() {
    return netSize > 0;
  }

  public double absSize() {
    return Math.abs(netSize);
  }

  /**
   * Same-direction fill: volume-weighted average entry.
   */
  public Position increase(double signedSize, double price, Instant now) {
    double curAbs = absSize();
    double addAbs = Math.abs(signedSize);
    double newAvg = (curAbs * avgEntryPrice + addAbs * price) / (curAbs + addAbs);
    return new Position(tokenId, marketId, outcome, netSize + signedSize, newAvg, openedAt, now, title, displayName);
  }

  /**
   * Reduction that keeps the direction; average entry is unchanged.
   */
  public Position withNetSize(double remaining, Instant now) {
    return new Position(tokenId, marketId, outcome, remaining, avgEntryPrice, openedAt, now, title, displayName);
  }

  public double unrealizedPnL(double currentPrice) {
    if (isLong()) {
      return (currentPrice - avgEntryPrice) * netSize;
    }
    return (avgEntryPrice - currentPrice) * absSize();
  }

  private static String displayName(String title, String outcome) {
    if (title == null || title.isBlank()) {
      return outcome;
    }
    return title + " [" + outcome + "]";
  }
}
