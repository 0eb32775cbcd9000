package com.polybot.copytrader.domain;

import java.time.Instant;

/**
 * A fill made by the watched wallet, as reported by the Polymarket data-api {@code /activity} feed.
 */
public record ObservedTrade(
    String transactionHash,
    Instant timestamp,
    String marketId,
    String tokenId,
    String outcome,
    TradeSide side,
    double size,
    double price,
    String title,
    String proxyWallet
) {

  public double usdcValue() {
    return size * price;
  }

  public String shortHash() {
    if (transactionHash == null) {
      return "?";
    }
    return transactionHash.length() <= 10 ? transactionHash : transactionHash.substring(0, 10) + "...";
  }

  @Override
  public String toString() {
    return "Trade(tx=%s, %s %s, size=%.2f, price=%.4f, value=$%.2f, time=%s)".formatted(
        shortHash(), side, outcome, size, price, usdcValue(), timestamp);
  }
}
