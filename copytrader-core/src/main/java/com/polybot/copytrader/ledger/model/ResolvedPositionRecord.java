package com.polybot.copytrader.ledger.model;

import java.time.Instant;

public record ResolvedPositionRecord(
    String marketId,
    String tokenId,
    String outcome,
    String winningOutcome,
    double size,
    double entryPrice,
    double resolvedPrice,
    double costBasis,
    double payout,
    double realizedPnL,
    Instant resolvedAt
) {

  public boolean won() {
    return outcome != null && outcome.equals(winningOutcome);
  }

  public boolean sameResolution(String tokenId, String marketId, Instant resolvedAt) {
    return this.tokenId.equals(tokenId)
        && this.marketId.equals(marketId)
        && this.resolvedAt.equals(resolvedAt);
  }
}
