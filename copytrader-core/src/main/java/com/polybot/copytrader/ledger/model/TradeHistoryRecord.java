package com.polybot.copytrader.ledger.model;

import com.polybot.copytrader.domain.ObservedTrade;
import com.polybot.copytrader.domain.TradeSide;

import java.time.Instant;

/**
 * Raw copy of an accepted fill, used for analytics only.
 */
public record TradeHistoryRecord(
    String transactionHash,
    Instant timestamp,
    String marketId,
    String tokenId,
    String outcome,
    TradeSide side,
    double size,
    double price,
    double copySize,
    double copyValue,
    String title
) {

  public static TradeHistoryRecord of(ObservedTrade trade, double copySize) {
    return new TradeHistoryRecord(
        trade.transactionHash(),
        trade.timestamp(),
        trade.marketId(),
        trade.tokenId(),
        trade.outcome(),
        trade.side(),
        trade.size(),
        trade.price(),
        copySize,
        copySize * trade.price(),
        trade.title()
    );
  }
}
