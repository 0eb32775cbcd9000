package com.polybot.copytrader.order;

import com.polybot.copytrader.domain.TradeSide;

/**
 * Limit order mirroring one watched trade at the watched price.
 */
public record CopyOrder(
    String tokenId,
    TradeSide side,
    double price,
    double size,
    String sourceTransactionHash
) {

  public double usdcValue() {
    return size * price;
  }
}
